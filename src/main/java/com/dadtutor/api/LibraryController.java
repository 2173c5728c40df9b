package com.dadtutor.api;

import com.dadtutor.domain.DomainModels.ExamPaper;
import com.dadtutor.domain.DomainModels.QuestionAnalysis;
import com.dadtutor.domain.DomainModels.StudyGuide;
import com.dadtutor.grouping.GroupingModels.GroupedView;
import com.dadtutor.service.LibraryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/library")
public class LibraryController {
    private final LibraryService libraryService;

    public LibraryController(LibraryService libraryService) {
        this.libraryService = libraryService;
    }

    @GetMapping("/exams")
    public ResponseEntity<GroupedView<ExamPaper>> exams(@RequestParam(required = false) String search) {
        return ResponseEntity.ok(libraryService.groupExams(search));
    }

    @GetMapping("/guides")
    public ResponseEntity<GroupedView<StudyGuide>> guides() {
        return ResponseEntity.ok(libraryService.groupStudyGuides());
    }

    @GetMapping("/exams/{examId}/questions")
    public ResponseEntity<GroupedView<QuestionAnalysis>> questions(@PathVariable String examId) {
        return ResponseEntity.ok(libraryService.groupQuestions(examId));
    }
}
