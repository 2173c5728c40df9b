package com.dadtutor.repository;

import com.dadtutor.domain.DomainModels.StudyPlan;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.Optional;

@Repository
public class StudyPlanJdbcRepository {
    private static final String SELECT_PLANS = "SELECT id, exam_id, raw_json, markdown_plan, created_at FROM study_plans";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public StudyPlanJdbcRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    public void upsert(StudyPlan plan) {
        jdbcTemplate.update(
                "MERGE INTO study_plans(id, exam_id, raw_json, markdown_plan, created_at) KEY(exam_id) VALUES (?,?,?,?,?)",
                plan.id(), plan.examId(), toJson(plan), plan.markdownPlan(), plan.createdAt().toString());
    }

    public Optional<StudyPlan> findByExamId(String examId) {
        return jdbcTemplate.query(SELECT_PLANS + " WHERE exam_id = ?", planMapper(), examId).stream().findFirst();
    }

    public Optional<StudyPlan> findLatest() {
        return jdbcTemplate.query(SELECT_PLANS, planMapper()).stream()
                .max(Comparator.comparing(StudyPlan::createdAt));
    }

    // id, exam and timestamps live in their own columns; raw_json carries the plan body
    private RowMapper<StudyPlan> planMapper() {
        return (rs, n) -> {
            StudyPlan body = fromJson(rs.getString(3));
            return new StudyPlan(rs.getString(1), rs.getString(2), body.title(), body.overview(),
                    body.criticalTopics(), body.schedule(), rs.getString(4), Instant.parse(rs.getString(5)));
        };
    }

    private String toJson(StudyPlan plan) {
        try {
            return objectMapper.writeValueAsString(plan);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize study plan", e);
        }
    }

    private StudyPlan fromJson(String json) {
        try {
            return objectMapper.readValue(json, StudyPlan.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored study plan is not readable", e);
        }
    }
}
