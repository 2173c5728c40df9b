package com.dadtutor.repository;

import com.dadtutor.domain.DomainModels.Formula;
import com.dadtutor.domain.DomainModels.StudyGuide;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

@Repository
public class TopicSummaryJdbcRepository {
    private static final String SELECT_GUIDES =
            "SELECT id, topic, subject, summary_markdown, key_concepts, formulas, common_mistakes, created_at, updated_at FROM topic_summaries";
    private static final TypeReference<List<String>> STRINGS = new TypeReference<>() {};
    private static final TypeReference<List<Formula>> FORMULAS = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public TopicSummaryJdbcRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    public void upsert(StudyGuide g) {
        jdbcTemplate.update(
                "MERGE INTO topic_summaries(id, topic, subject, summary_markdown, key_concepts, formulas, common_mistakes, created_at, updated_at) KEY(topic) VALUES (?,?,?,?,?,?,?,?,?)",
                g.id(), g.topic(), g.subject(), g.summaryMarkdown(),
                toJson(g.keyConcepts()), toJson(g.formulas()), toJson(g.commonMistakes()),
                g.createdAt().toString(), g.updatedAt().toString());
    }

    public Optional<StudyGuide> findById(String id) {
        return jdbcTemplate.query(SELECT_GUIDES + " WHERE id = ?", guideMapper(), id).stream().findFirst();
    }

    public Optional<StudyGuide> findByTopic(String topic) {
        return jdbcTemplate.query(SELECT_GUIDES + " WHERE topic = ?", guideMapper(), topic).stream().findFirst();
    }

    public List<StudyGuide> findAll() {
        return jdbcTemplate.query(SELECT_GUIDES, guideMapper()).stream()
                .sorted(Comparator.comparing(StudyGuide::createdAt).reversed())
                .toList();
    }

    private RowMapper<StudyGuide> guideMapper() {
        return (rs, n) -> new StudyGuide(
                rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4),
                fromJson(rs.getString(5), STRINGS), fromJson(rs.getString(6), FORMULAS), fromJson(rs.getString(7), STRINGS),
                Instant.parse(rs.getString(8)), Instant.parse(rs.getString(9)));
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize study guide field", e);
        }
    }

    private <T> List<T> fromJson(String json, TypeReference<List<T>> type) {
        if (json == null || json.isBlank()) return List.of();
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored study guide field is not readable", e);
        }
    }
}
