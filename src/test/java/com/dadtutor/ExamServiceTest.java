package com.dadtutor;

import com.dadtutor.domain.DomainModels.Difficulty;
import com.dadtutor.domain.DomainModels.ExamSolution;
import com.dadtutor.domain.DomainModels.ExamStatus;
import com.dadtutor.domain.DomainModels.QuestionAnalysis;
import com.dadtutor.exception.InvalidStateException;
import com.dadtutor.exception.NotFoundException;
import com.dadtutor.service.ExamService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Import(FixedClockTestConfig.class)
class ExamServiceTest {
    @Autowired
    private ExamService examService;
    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void cleanUp() {
        TableCleaner.clear(jdbcTemplate);
    }

    @Test
    void registersUploadingExam() {
        var exam = examService.register(" ntg_2023.pdf ");
        assertEquals("ntg_2023.pdf", exam.filename());
        assertEquals(ExamStatus.UPLOADING, exam.status());
        assertEquals(FixedClockTestConfig.NOW, exam.uploadDate());
        assertEquals(exam, examService.get(exam.id()));
    }

    @Test
    void rejectsBlankFilename() {
        assertThrows(IllegalArgumentException.class, () -> examService.register(" "));
    }

    @Test
    void storesSolutionAndCompletes() {
        var exam = examService.register("kosten.pdf");
        examService.updateStatus(exam.id(), ExamStatus.PROCESSING, null);

        var solution = new ExamSolution("Betriebliches Kostenwesen", "2022", Difficulty.HARD, List.of("Kostenrechnung"),
                List.of(new QuestionAnalysis("1a", "Berechnen Sie ...", "42 EUR", "Weil ...", "Deckungsbeitrag")), "Summary");
        examService.attachSolution(exam.id(), solution);

        var stored = examService.get(exam.id());
        assertEquals(ExamStatus.COMPLETED, stored.status());
        assertEquals(solution, stored.solution());
        assertEquals("Betriebliches Kostenwesen", stored.subject());
    }

    @Test
    void completedIsTerminal() {
        var exam = examService.register("a.pdf");
        examService.attachSolution(exam.id(), new ExamSolution("Personalführung", null, null, null, null, null));

        assertThrows(InvalidStateException.class, () -> examService.updateStatus(exam.id(), ExamStatus.PROCESSING, null));
        assertThrows(InvalidStateException.class,
                () -> examService.attachSolution(exam.id(), new ExamSolution("x", null, null, null, null, null)));
    }

    @Test
    void failedExamKeepsMessageUntilRetried() {
        var exam = examService.register("broken.pdf");
        examService.updateStatus(exam.id(), ExamStatus.FAILED, "OCR timeout");
        assertEquals("OCR timeout", examService.get(exam.id()).errorMessage());

        examService.updateStatus(exam.id(), ExamStatus.PROCESSING, "ignored");
        var retried = examService.get(exam.id());
        assertEquals(ExamStatus.PROCESSING, retried.status());
        assertNull(retried.errorMessage());
    }

    @Test
    void unknownExamIsNotFound() {
        assertThrows(NotFoundException.class, () -> examService.get("missing"));
        assertThrows(NotFoundException.class, () -> examService.updateStatus("missing", ExamStatus.PROCESSING, null));
    }

    @Test
    void transitionTable() {
        assertTrue(ExamStatus.UPLOADING.canTransitionTo(ExamStatus.PROCESSING));
        assertTrue(ExamStatus.FAILED.canTransitionTo(ExamStatus.PROCESSING));
        assertFalse(ExamStatus.FAILED.canTransitionTo(ExamStatus.COMPLETED));
        assertFalse(ExamStatus.PROCESSING.canTransitionTo(ExamStatus.UPLOADING));
        for (ExamStatus next : ExamStatus.values()) {
            assertFalse(ExamStatus.COMPLETED.canTransitionTo(next));
        }
    }
}
