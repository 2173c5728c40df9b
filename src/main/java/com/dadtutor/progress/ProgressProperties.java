package com.dadtutor.progress;

import com.dadtutor.progress.ProgressModels.StreakPolicy;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component
@Data
@Validated
@ConfigurationProperties(prefix = "progress")
public class ProgressProperties {

    @Min(value = 0, message = "Property progress.recent-limit must not be negative")
    private int recentLimit = 5;

    @NotNull
    private StreakPolicy streakPolicy = StreakPolicy.DEDUPE_BY_DAY;

    /**
     * Zone that defines calendar days for the streak; the system zone when unset.
     */
    private String zone;
}
