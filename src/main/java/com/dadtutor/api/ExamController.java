package com.dadtutor.api;

import com.dadtutor.domain.DomainModels.ExamPaper;
import com.dadtutor.domain.DomainModels.ExamSolution;
import com.dadtutor.domain.DomainModels.ExamStatus;
import com.dadtutor.service.ExamService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/exams")
public class ExamController {
    private final ExamService examService;

    public ExamController(ExamService examService) {
        this.examService = examService;
    }

    @PostMapping
    public ResponseEntity<ExamPaper> register(@RequestBody RegisterExamRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(examService.register(request == null ? null : request.filename()));
    }

    @GetMapping
    public ResponseEntity<List<ExamPaper>> list() {
        return ResponseEntity.ok(examService.list());
    }

    @GetMapping("/{id}")
    public ResponseEntity<ExamPaper> get(@PathVariable String id) {
        return ResponseEntity.ok(examService.get(id));
    }

    @PutMapping("/{id}/status")
    public ResponseEntity<ExamPaper> updateStatus(@PathVariable String id, @RequestBody StatusUpdateRequest request) {
        if (request == null || request.status() == null) {
            throw new IllegalArgumentException("status is required");
        }
        return ResponseEntity.ok(examService.updateStatus(id, request.status(), request.errorMessage()));
    }

    @PutMapping("/{id}/solution")
    public ResponseEntity<ExamPaper> attachSolution(@PathVariable String id, @RequestBody ExamSolution solution) {
        return ResponseEntity.ok(examService.attachSolution(id, solution));
    }

    public record RegisterExamRequest(String filename) {}

    public record StatusUpdateRequest(ExamStatus status, String errorMessage) {}
}
