package com.dadtutor.taxonomy;

import com.dadtutor.taxonomy.TaxonomyModels.Handlungsbereich;
import com.dadtutor.taxonomy.TaxonomyModels.QualificationArea;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Component
@Data
@Validated
@ConfigurationProperties(prefix = "taxonomy")
public class TaxonomyProperties {

    /**
     * Number of leading characters compared by the truncated-prefix match.
     */
    @Min(value = 1, message = "Property taxonomy.prefix-length must be positive")
    private int prefixLength = 10;

    @Valid
    private Cache cache = new Cache();

    @NotEmpty(message = "Property taxonomy.bq must list at least one subject")
    private List<String> bq = new ArrayList<>();

    @Valid
    private List<HqBlock> hq = new ArrayList<>();

    /**
     * Keyword fallback groups, evaluated in the listed order.
     */
    @Valid
    private List<KeywordBlock> keywords = new ArrayList<>();

    @Data
    public static class Cache {
        /**
         * Approximate upper bound of memoized classifications; 0 disables the cache.
         */
        @Min(0)
        private int maxEntries = 2048;
    }

    @Data
    public static class HqBlock {
        @NotNull
        private Handlungsbereich handlungsbereich;
        private List<String> subjects = new ArrayList<>();
    }

    @Data
    public static class KeywordBlock {
        @NotNull
        private QualificationArea area;
        private Handlungsbereich handlungsbereich;
        private List<String> keywords = new ArrayList<>();
    }
}
