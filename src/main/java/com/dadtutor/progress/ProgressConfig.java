package com.dadtutor.progress;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Slf4j
@Configuration
public class ProgressConfig {

    @Bean
    public ProgressAnalytics progressAnalytics(Clock clock, ProgressProperties properties) {
        ZoneId zone = properties.getZone() == null || properties.getZone().isBlank()
                ? clock.getZone()
                : ZoneId.of(properties.getZone());
        log.info("Progress analytics: streak policy {}, zone {}, recent limit {}",
                properties.getStreakPolicy(), zone, properties.getRecentLimit());
        return new ProgressAnalytics(clock, zone, properties.getStreakPolicy(), properties.getRecentLimit());
    }
}
