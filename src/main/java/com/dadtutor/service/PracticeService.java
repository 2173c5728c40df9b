package com.dadtutor.service;

import com.dadtutor.exception.ValidationFailedException;
import com.dadtutor.progress.ProgressAnalytics;
import com.dadtutor.progress.ProgressModels.PracticeSession;
import com.dadtutor.progress.ProgressModels.ProgressCounters;
import com.dadtutor.progress.ProgressModels.ProgressSnapshot;
import com.dadtutor.progress.ProgressModels.RecordSessionRequest;
import com.dadtutor.repository.PracticeSessionJdbcRepository;
import com.dadtutor.validation.PracticeSessionValidator;
import com.dadtutor.validation.ValidationError;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
public class PracticeService {
    private final PracticeSessionJdbcRepository repository;
    private final PracticeSessionValidator validator;
    private final ProgressAnalytics progressAnalytics;
    private final Clock clock;

    public PracticeService(PracticeSessionJdbcRepository repository,
                           PracticeSessionValidator validator,
                           ProgressAnalytics progressAnalytics,
                           Clock clock) {
        this.repository = repository;
        this.validator = validator;
        this.progressAnalytics = progressAnalytics;
        this.clock = clock;
    }

    public PracticeSession recordSession(RecordSessionRequest request) {
        List<ValidationError> errors = validator.validate(request);
        if (!errors.isEmpty()) {
            log.warn("Rejected practice session for '{}': {}", request == null ? null : request.examName(), errors);
            throw new ValidationFailedException(errors);
        }

        int total = request.totalQuestions();
        int correct = request.correctCount();
        int score = request.scorePercentage() != null ? request.scorePercentage() : scorePercentage(correct, total);
        Instant date = request.sessionDate() != null ? request.sessionDate() : Instant.now(clock);

        PracticeSession session = new PracticeSession(UUID.randomUUID().toString(), request.examId(), request.examName().trim(),
                date, total, correct, request.incorrectCount(), score);
        repository.save(session);
        log.info("Recorded practice session {} for '{}': {}/{} correct ({}%)", session.id(), session.examName(), correct, total, score);
        return session;
    }

    public ProgressSnapshot summary() {
        ProgressCounters counters = repository.counters();
        return progressAnalytics.summarize(repository.findAllAscending(), counters.questionsMastered(), counters.questionsAttempted());
    }

    static int scorePercentage(int correct, int total) {
        return total > 0 ? (int) Math.round(100.0 * correct / total) : 0;
    }
}
