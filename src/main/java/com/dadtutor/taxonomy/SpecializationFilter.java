package com.dadtutor.taxonomy;

import com.dadtutor.taxonomy.TaxonomyModels.Specialization;
import com.dadtutor.taxonomy.TaxonomyModels.TaxonomyCoordinate;
import org.springframework.stereotype.Component;

/**
 * Narrows the HQ-Technik bucket to the user's Schwerpunkt. Never moves an item between
 * buckets; every coordinate other than HQ-Technik passes.
 */
@Component
public class SpecializationFilter {

    public boolean shouldInclude(TaxonomyCoordinate coordinate, String rawSubjectText, Specialization specialization) {
        if (coordinate == null || !coordinate.isHqTechnik()) return true;
        if (specialization == null || specialization.vetoKeyword() == null) return true;
        return !TaxonomyClassifier.canonicalize(rawSubjectText).contains(specialization.vetoKeyword());
    }
}
