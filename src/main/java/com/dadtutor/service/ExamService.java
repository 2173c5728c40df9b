package com.dadtutor.service;

import com.dadtutor.domain.DomainModels.ExamPaper;
import com.dadtutor.domain.DomainModels.ExamSolution;
import com.dadtutor.domain.DomainModels.ExamStatus;
import com.dadtutor.exception.InvalidStateException;
import com.dadtutor.exception.NotFoundException;
import com.dadtutor.repository.ExamJdbcRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
public class ExamService {
    private final ExamJdbcRepository repository;
    private final Clock clock;

    public ExamService(ExamJdbcRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public ExamPaper register(String filename) {
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("filename is required");
        }
        ExamPaper exam = new ExamPaper(UUID.randomUUID().toString(), filename.trim(), ExamStatus.UPLOADING,
                Instant.now(clock), null, null);
        repository.insert(exam);
        log.info("Registered exam {} ({})", exam.id(), exam.filename());
        return exam;
    }

    @Transactional
    public ExamPaper updateStatus(String id, ExamStatus status, String errorMessage) {
        ExamPaper exam = get(id);
        requireTransition(exam, status);
        String message = status == ExamStatus.FAILED ? errorMessage : null;
        repository.updateStatus(id, status, message);
        if (status == ExamStatus.FAILED) {
            log.warn("Exam {} failed: {}", id, message);
        } else {
            log.info("Exam {} {} -> {}", id, exam.status(), status);
        }
        return exam.withStatus(status, message);
    }

    @Transactional
    public ExamPaper attachSolution(String id, ExamSolution solution) {
        if (solution == null) {
            throw new IllegalArgumentException("solution is required");
        }
        ExamPaper exam = get(id);
        requireTransition(exam, ExamStatus.COMPLETED);
        repository.saveSolution(id, solution, Instant.now(clock));
        repository.updateStatus(id, ExamStatus.COMPLETED, null);
        log.info("Exam {} completed with {} questions (subject '{}')", id, solution.questions().size(), solution.subject());
        return exam.withSolution(solution).withStatus(ExamStatus.COMPLETED, null);
    }

    public ExamPaper get(String id) {
        return repository.findById(id).orElseThrow(() -> new NotFoundException("Exam not found: " + id));
    }

    public List<ExamPaper> list() {
        return repository.findAll();
    }

    private void requireTransition(ExamPaper exam, ExamStatus next) {
        if (!exam.status().canTransitionTo(next)) {
            throw new InvalidStateException("Exam " + exam.id() + " cannot move from " + exam.status().wireValue() + " to " + next.wireValue());
        }
    }
}
