package com.dadtutor.repository;

import com.dadtutor.domain.DomainModels.ExamPaper;
import com.dadtutor.domain.DomainModels.ExamSolution;
import com.dadtutor.domain.DomainModels.ExamStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

@Repository
public class ExamJdbcRepository {
    private static final String SELECT_EXAMS =
            "SELECT e.id, e.filename, e.status, e.upload_date, e.error_message, s.raw_json " +
                    "FROM exams e LEFT JOIN exam_solutions s ON s.exam_id = e.id";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public ExamJdbcRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    public void insert(ExamPaper exam) {
        jdbcTemplate.update(
                "INSERT INTO exams(id, filename, status, upload_date, error_message) VALUES (?,?,?,?,?)",
                exam.id(), exam.filename(), exam.status().name(), exam.uploadDate().toString(), exam.errorMessage());
    }

    public void updateStatus(String id, ExamStatus status, String errorMessage) {
        jdbcTemplate.update("UPDATE exams SET status = ?, error_message = ? WHERE id = ?", status.name(), errorMessage, id);
    }

    public void saveSolution(String examId, ExamSolution solution, Instant createdAt) {
        jdbcTemplate.update(
                "MERGE INTO exam_solutions(exam_id, raw_json, created_at) KEY(exam_id) VALUES (?,?,?)",
                examId, toJson(solution), createdAt.toString());
    }

    public Optional<ExamPaper> findById(String id) {
        return jdbcTemplate.query(SELECT_EXAMS + " WHERE e.id = ?", (rs, n) -> new ExamPaper(
                rs.getString(1), rs.getString(2), ExamStatus.valueOf(rs.getString(3)),
                Instant.parse(rs.getString(4)), rs.getString(5), fromJson(rs.getString(6))
        ), id).stream().findFirst();
    }

    public List<ExamPaper> findAll() {
        return jdbcTemplate.query(SELECT_EXAMS, (rs, n) -> new ExamPaper(
                        rs.getString(1), rs.getString(2), ExamStatus.valueOf(rs.getString(3)),
                        Instant.parse(rs.getString(4)), rs.getString(5), fromJson(rs.getString(6))
                )).stream()
                .sorted(Comparator.comparing(ExamPaper::uploadDate).reversed())
                .toList();
    }

    private String toJson(ExamSolution solution) {
        try {
            return objectMapper.writeValueAsString(solution);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize exam solution", e);
        }
    }

    private ExamSolution fromJson(String json) {
        if (json == null || json.isBlank()) return null;
        try {
            return objectMapper.readValue(json, ExamSolution.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored exam solution is not readable", e);
        }
    }
}
