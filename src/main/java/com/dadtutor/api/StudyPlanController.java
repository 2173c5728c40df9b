package com.dadtutor.api;

import com.dadtutor.domain.DomainModels.StudyPlan;
import com.dadtutor.exception.NotFoundException;
import com.dadtutor.service.StudyPlanService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/plans")
public class StudyPlanController {
    private final StudyPlanService studyPlanService;

    public StudyPlanController(StudyPlanService studyPlanService) {
        this.studyPlanService = studyPlanService;
    }

    @GetMapping("/latest")
    public ResponseEntity<StudyPlan> latest() {
        return ResponseEntity.ok(studyPlanService.latest().orElseThrow(() -> new NotFoundException("No study plan stored yet")));
    }

    @GetMapping("/{examId}")
    public ResponseEntity<StudyPlan> forExam(@PathVariable String examId) {
        return ResponseEntity.ok(studyPlanService.forExam(examId));
    }

    @PutMapping("/{examId}")
    public ResponseEntity<StudyPlan> attach(@PathVariable String examId, @RequestBody StudyPlanService.AttachPlanRequest request) {
        return ResponseEntity.ok(studyPlanService.attach(examId, request));
    }
}
