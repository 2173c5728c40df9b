package com.dadtutor.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public class SettingsJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public SettingsJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<String> loadSpecialization(String profileId) {
        return jdbcTemplate.query(
                "SELECT specialization FROM study_settings WHERE profile_id = ?",
                (rs, n) -> rs.getString(1), profileId).stream().findFirst();
    }

    public void saveSpecialization(String profileId, String specialization, Instant updatedAt) {
        jdbcTemplate.update(
                "MERGE INTO study_settings(profile_id, specialization, updated_at) KEY(profile_id) VALUES (?,?,?)",
                profileId, specialization, updatedAt.toString());
    }
}
