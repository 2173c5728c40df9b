package com.dadtutor.repository;

import com.dadtutor.progress.ProgressModels.PracticeSession;
import com.dadtutor.progress.ProgressModels.ProgressCounters;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

@Repository
public class PracticeSessionJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public PracticeSessionJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void save(PracticeSession s) {
        jdbcTemplate.update(
                "INSERT INTO practice_sessions(id, exam_id, exam_name, session_date, total_questions, correct_count, incorrect_count, score_percentage) VALUES (?,?,?,?,?,?,?,?)",
                s.id(), s.examId(), s.examName(), s.sessionDate().toString(),
                s.totalQuestions(), s.correctCount(), s.incorrectCount(), s.scorePercentage());
    }

    /** Oldest session first, the order progress analytics consumes. */
    public List<PracticeSession> findAllAscending() {
        return jdbcTemplate.query(
                "SELECT id, exam_id, exam_name, session_date, total_questions, correct_count, incorrect_count, score_percentage FROM practice_sessions",
                (rs, n) -> new PracticeSession(
                        rs.getString(1), rs.getString(2), rs.getString(3), Instant.parse(rs.getString(4)),
                        rs.getInt(5), rs.getInt(6), rs.getInt(7), rs.getInt(8)
                )).stream()
                .sorted(Comparator.comparing(PracticeSession::sessionDate))
                .toList();
    }

    public ProgressCounters counters() {
        ProgressCounters counters = jdbcTemplate.queryForObject(
                "SELECT COALESCE(SUM(CAST(correct_count AS BIGINT)), 0), COALESCE(SUM(CAST(correct_count AS BIGINT) + incorrect_count), 0) FROM practice_sessions",
                (rs, n) -> new ProgressCounters(rs.getLong(1), rs.getLong(2)));
        return counters == null ? ProgressCounters.none() : counters;
    }
}
