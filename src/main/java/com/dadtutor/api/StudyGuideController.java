package com.dadtutor.api;

import com.dadtutor.domain.DomainModels.StudyGuide;
import com.dadtutor.service.StudyGuideService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/guides")
public class StudyGuideController {
    private final StudyGuideService studyGuideService;

    public StudyGuideController(StudyGuideService studyGuideService) {
        this.studyGuideService = studyGuideService;
    }

    @PostMapping
    public ResponseEntity<StudyGuide> save(@RequestBody StudyGuideService.SaveGuideRequest request) {
        return ResponseEntity.ok(studyGuideService.save(request));
    }

    @GetMapping
    public ResponseEntity<List<StudyGuide>> list() {
        return ResponseEntity.ok(studyGuideService.list());
    }

    @GetMapping("/topics")
    public ResponseEntity<List<String>> availableTopics() {
        return ResponseEntity.ok(studyGuideService.availableTopics());
    }

    @GetMapping("/{id}")
    public ResponseEntity<StudyGuide> get(@PathVariable String id) {
        return ResponseEntity.ok(studyGuideService.get(id));
    }
}
