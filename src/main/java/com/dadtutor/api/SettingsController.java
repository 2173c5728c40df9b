package com.dadtutor.api;

import com.dadtutor.service.SettingsService;
import com.dadtutor.taxonomy.TaxonomyModels.Specialization;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/settings")
public class SettingsController {
    private final SettingsService settingsService;

    public SettingsController(SettingsService settingsService) {
        this.settingsService = settingsService;
    }

    @GetMapping("/specialization")
    public ResponseEntity<SpecializationBody> specialization() {
        return ResponseEntity.ok(new SpecializationBody(settingsService.specialization().label()));
    }

    @PutMapping("/specialization")
    public ResponseEntity<SpecializationBody> updateSpecialization(@RequestBody SpecializationBody request) {
        Specialization updated = settingsService.updateSpecialization(Specialization.fromLabel(request == null ? null : request.specialization()));
        return ResponseEntity.ok(new SpecializationBody(updated.label()));
    }

    public record SpecializationBody(String specialization) {}
}
