package com.dadtutor;

import com.dadtutor.domain.DomainModels.ExamStatus;
import com.dadtutor.domain.DomainModels.StudyPlanDay;
import com.dadtutor.exception.InvalidStateException;
import com.dadtutor.exception.NotFoundException;
import com.dadtutor.service.DashboardService;
import com.dadtutor.service.ExamService;
import com.dadtutor.service.StudyPlanService;
import com.dadtutor.service.StudyPlanService.AttachPlanRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Import(FixedClockTestConfig.class)
class StudyPlanServiceTest {
    private static final LocalDate TODAY = LocalDate.of(2026, 10, 17);

    @Autowired
    private StudyPlanService studyPlanService;
    @Autowired
    private ExamService examService;
    @Autowired
    private DashboardService dashboardService;
    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void cleanUp() {
        TableCleaner.clear(jdbcTemplate);
    }

    @Test
    void storesAndReplacesPlanPerExam() {
        var exam = examService.register("ntg.pdf");
        var first = studyPlanService.attach(exam.id(), plan("NTG Woche 1",
                new StudyPlanDay(1, TODAY, "Ohmsches Gesetz", List.of("Aufgaben 1-3"), 45)));
        var second = studyPlanService.attach(exam.id(), plan("NTG Woche 1 (neu)",
                new StudyPlanDay(1, TODAY, "Drehstrom", List.of("Aufgabe 4", "Formeln wiederholen"), 60),
                new StudyPlanDay(2, TODAY.plusDays(1), "Leistung", List.of(), 30)));

        assertEquals(first.id(), second.id());
        var stored = studyPlanService.forExam(exam.id());
        assertEquals("NTG Woche 1 (neu)", stored.title());
        assertEquals(2, stored.schedule().size());
        assertEquals(TODAY.plusDays(1), stored.schedule().get(1).date());
        assertEquals(List.of("Drehstrom"), stored.criticalTopics());
        assertEquals("# Plan", stored.markdownPlan());
        assertEquals(FixedClockTestConfig.NOW, stored.createdAt());
    }

    @Test
    void rejectsUnknownFailedOrMalformedInput() {
        assertThrows(NotFoundException.class, () -> studyPlanService.attach("missing", plan("x")));
        assertThrows(NotFoundException.class, () -> studyPlanService.forExam("missing"));

        var failed = examService.register("broken.pdf");
        examService.updateStatus(failed.id(), ExamStatus.FAILED, "unreadable");
        assertThrows(InvalidStateException.class, () -> studyPlanService.attach(failed.id(), plan("x")));

        var exam = examService.register("ok.pdf");
        assertThrows(IllegalArgumentException.class, () -> studyPlanService.attach(exam.id(), null));
        assertThrows(IllegalArgumentException.class,
                () -> studyPlanService.attach(exam.id(), plan("x", new StudyPlanDay(0, TODAY, "f", List.of(), 10))));
    }

    @Test
    void todaysTasksPreferTheDayDatedToday() {
        assertTrue(studyPlanService.todaysTasks().isEmpty());

        var exam = examService.register("ntg.pdf");
        studyPlanService.attach(exam.id(), plan("Plan",
                new StudyPlanDay(1, TODAY.minusDays(1), "Gestern", List.of(), 30),
                new StudyPlanDay(2, TODAY, "Heute", List.of("Aufgabe 5"), 40)));

        assertEquals("Heute", studyPlanService.todaysTasks().orElseThrow().focus());
        assertEquals("Heute", dashboardService.dashboard().todaysTasks().focus());
    }

    @Test
    void todaysTasksFallBackToFirstDay() {
        var exam = examService.register("ntg.pdf");
        studyPlanService.attach(exam.id(), plan("Plan",
                new StudyPlanDay(1, null, "Start", List.of("Lesen"), 20),
                new StudyPlanDay(2, null, "Vertiefen", List.of(), 20)));

        assertEquals(1, studyPlanService.todaysTasks().orElseThrow().day());
        assertEquals("Start", dashboardService.dashboard().todaysTasks().focus());
    }

    private static AttachPlanRequest plan(String title, StudyPlanDay... days) {
        List<String> focus = days.length == 0 ? List.of() : List.of(days[0].focus());
        return new AttachPlanRequest(title, "Overview", focus, List.of(days), "# Plan");
    }
}
