package com.dadtutor.api;

import com.dadtutor.progress.ProgressModels.PracticeSession;
import com.dadtutor.progress.ProgressModels.ProgressSnapshot;
import com.dadtutor.progress.ProgressModels.RecordSessionRequest;
import com.dadtutor.service.DashboardService;
import com.dadtutor.service.PracticeService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api")
public class ProgressController {
    private final PracticeService practiceService;
    private final DashboardService dashboardService;

    public ProgressController(PracticeService practiceService, DashboardService dashboardService) {
        this.practiceService = practiceService;
        this.dashboardService = dashboardService;
    }

    @PostMapping("/progress/sessions")
    public ResponseEntity<PracticeSession> recordSession(@RequestBody RecordSessionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(practiceService.recordSession(request));
    }

    @GetMapping("/progress/summary")
    public ResponseEntity<ProgressSnapshot> summary() {
        return ResponseEntity.ok(practiceService.summary());
    }

    @GetMapping("/dashboard")
    public ResponseEntity<DashboardService.Dashboard> dashboard() {
        return ResponseEntity.ok(dashboardService.dashboard());
    }
}
