package com.dadtutor.service;

import com.dadtutor.repository.SettingsJdbcRepository;
import com.dadtutor.taxonomy.TaxonomyModels.Specialization;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

@Slf4j
@Service
public class SettingsService {
    static final String DEFAULT_PROFILE = "default";

    private final SettingsJdbcRepository repository;
    private final Clock clock;

    public SettingsService(SettingsJdbcRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public Specialization specialization() {
        return repository.loadSpecialization(DEFAULT_PROFILE)
                .map(Specialization::valueOf)
                .orElse(Specialization.NONE);
    }

    public Specialization updateSpecialization(Specialization specialization) {
        Specialization value = specialization == null ? Specialization.NONE : specialization;
        repository.saveSpecialization(DEFAULT_PROFILE, value.name(), Instant.now(clock));
        log.info("Specialization changed to '{}'", value.label());
        return value;
    }
}
