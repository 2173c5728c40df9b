package com.dadtutor.service;

import com.dadtutor.domain.DomainModels.ExamPaper;
import com.dadtutor.domain.DomainModels.ExamStatus;
import com.dadtutor.domain.DomainModels.StudyPlan;
import com.dadtutor.domain.DomainModels.StudyPlanDay;
import com.dadtutor.exception.InvalidStateException;
import com.dadtutor.exception.NotFoundException;
import com.dadtutor.repository.StudyPlanJdbcRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
public class StudyPlanService {
    private final StudyPlanJdbcRepository repository;
    private final ExamService examService;
    private final Clock clock;

    public StudyPlanService(StudyPlanJdbcRepository repository, ExamService examService, Clock clock) {
        this.repository = repository;
        this.examService = examService;
        this.clock = clock;
    }

    public StudyPlan attach(String examId, AttachPlanRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("study plan is required");
        }
        ExamPaper exam = examService.get(examId);
        if (exam.status() == ExamStatus.FAILED) {
            throw new InvalidStateException("Exam " + examId + " failed, no study plan can be attached");
        }
        for (StudyPlanDay day : request.schedule() == null ? List.<StudyPlanDay>of() : request.schedule()) {
            if (day == null || day.day() < 1 || day.durationMinutes() < 0) {
                throw new IllegalArgumentException("schedule days need a day number >= 1 and a non-negative duration");
            }
        }

        Optional<StudyPlan> existing = repository.findByExamId(examId);
        StudyPlan plan = new StudyPlan(
                existing.map(StudyPlan::id).orElseGet(() -> UUID.randomUUID().toString()),
                examId, request.title(), request.overview(), request.criticalTopics(), request.schedule(),
                request.markdownPlan(), Instant.now(clock));
        repository.upsert(plan);
        log.info("{} study plan for exam {} ({} days)", existing.isPresent() ? "Replaced" : "Stored", examId, plan.schedule().size());
        return plan;
    }

    public StudyPlan forExam(String examId) {
        return repository.findByExamId(examId).orElseThrow(() -> new NotFoundException("Plan not found for exam: " + examId));
    }

    public Optional<StudyPlan> latest() {
        return repository.findLatest();
    }

    /** The scheduled day dated today, otherwise the plan's first day. */
    public Optional<StudyPlanDay> todaysTasks() {
        LocalDate today = LocalDate.now(clock);
        return latest().flatMap(plan -> plan.schedule().stream()
                .filter(d -> today.equals(d.date()))
                .findFirst()
                .or(() -> plan.schedule().stream().findFirst()));
    }

    public record AttachPlanRequest(String title,
                                    String overview,
                                    List<String> criticalTopics,
                                    List<StudyPlanDay> schedule,
                                    String markdownPlan) {}
}
