package com.dadtutor.service;

import com.dadtutor.domain.DomainModels.Difficulty;
import com.dadtutor.domain.DomainModels.ExamPaper;
import com.dadtutor.domain.DomainModels.ExamStats;
import com.dadtutor.domain.DomainModels.ExamStatus;
import com.dadtutor.domain.DomainModels.StudyPlanDay;
import com.dadtutor.progress.ProgressModels.ProgressSnapshot;
import com.dadtutor.taxonomy.TaxonomyModels.Specialization;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

@Service
public class DashboardService {
    private static final Duration WEEK = Duration.ofDays(7);

    private final ExamService examService;
    private final PracticeService practiceService;
    private final SettingsService settingsService;
    private final StudyPlanService studyPlanService;
    private final Clock clock;

    public DashboardService(ExamService examService,
                            PracticeService practiceService,
                            SettingsService settingsService,
                            StudyPlanService studyPlanService,
                            Clock clock) {
        this.examService = examService;
        this.practiceService = practiceService;
        this.settingsService = settingsService;
        this.studyPlanService = studyPlanService;
        this.clock = clock;
    }

    public Dashboard dashboard() {
        return new Dashboard(practiceService.summary(), stats(examService.list()), settingsService.specialization(),
                studyPlanService.todaysTasks().orElse(null));
    }

    ExamStats stats(List<ExamPaper> exams) {
        Instant weekAgo = Instant.now(clock).minus(WEEK);
        List<ExamPaper> solved = exams.stream()
                .filter(e -> e.status() == ExamStatus.COMPLETED && e.solution() != null)
                .toList();

        Set<String> topics = solved.stream()
                .flatMap(e -> e.solution().topics().stream())
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        int papersThisWeek = (int) exams.stream().filter(e -> e.uploadDate().isAfter(weekAgo)).count();
        int hard = (int) solved.stream().filter(e -> e.solution().difficulty() == Difficulty.HARD).count();

        return new ExamStats(exams.size(), solved.size(), papersThisWeek, topics.size(), hard);
    }

    public record Dashboard(ProgressSnapshot progress, ExamStats stats, Specialization specialization, StudyPlanDay todaysTasks) {}
}
