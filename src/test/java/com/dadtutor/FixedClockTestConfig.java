package com.dadtutor;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

@TestConfiguration
public class FixedClockTestConfig {
    public static final Instant NOW = Instant.parse("2026-10-17T10:00:00Z");
    public static final ZoneId ZONE = ZoneId.of("Europe/Berlin");

    @Bean
    @Primary
    public Clock fixedClock() {
        return Clock.fixed(NOW, ZONE);
    }
}
