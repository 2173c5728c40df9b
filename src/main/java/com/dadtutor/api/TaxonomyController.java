package com.dadtutor.api;

import com.dadtutor.taxonomy.TaxonomyClassifier;
import com.dadtutor.taxonomy.TaxonomyModels.TaxonomyCatalog;
import com.dadtutor.taxonomy.TaxonomyModels.TaxonomyCoordinate;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/taxonomy")
public class TaxonomyController {
    private final TaxonomyClassifier classifier;

    public TaxonomyController(TaxonomyClassifier classifier) {
        this.classifier = classifier;
    }

    @PostMapping("/classify")
    public ResponseEntity<TaxonomyCoordinate> classify(@RequestBody ClassifyRequest request) {
        return ResponseEntity.ok(classifier.classify(request == null ? null : request.text()));
    }

    @PostMapping("/classify/batch")
    public ResponseEntity<List<Classification>> classifyBatch(@RequestBody List<String> texts) {
        List<Classification> out = (texts == null ? List.<String>of() : texts).stream()
                .map(t -> new Classification(t, classifier.classify(t)))
                .toList();
        return ResponseEntity.ok(out);
    }

    @GetMapping("/catalog")
    public ResponseEntity<TaxonomyCatalog> catalog() {
        return ResponseEntity.ok(classifier.catalog());
    }

    public record ClassifyRequest(String text) {}

    public record Classification(String text, TaxonomyCoordinate coordinate) {}
}
