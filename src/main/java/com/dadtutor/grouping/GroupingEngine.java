package com.dadtutor.grouping;

import com.dadtutor.grouping.GroupingModels.HqGroups;
import com.dadtutor.grouping.GroupingModels.TaxonomyGrouping;
import com.dadtutor.taxonomy.ClassifiableItem;
import com.dadtutor.taxonomy.SpecializationFilter;
import com.dadtutor.taxonomy.TaxonomyClassifier;
import com.dadtutor.taxonomy.TaxonomyModels.Handlungsbereich;
import com.dadtutor.taxonomy.TaxonomyModels.Specialization;
import com.dadtutor.taxonomy.TaxonomyModels.TaxonomyCoordinate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Stable partition of classifiable items into the taxonomy buckets. Each item that survives
 * the specialization filter lands in exactly one bucket, in input order.
 */
@Component
public class GroupingEngine {
    private final TaxonomyClassifier classifier;
    private final SpecializationFilter specializationFilter;

    public GroupingEngine(TaxonomyClassifier classifier, SpecializationFilter specializationFilter) {
        this.classifier = classifier;
        this.specializationFilter = specializationFilter;
    }

    public <T extends ClassifiableItem> TaxonomyGrouping<T> group(List<T> items, Specialization specialization) {
        if (items == null || items.isEmpty()) return TaxonomyGrouping.empty();

        List<T> bq = new ArrayList<>();
        List<T> sonstige = new ArrayList<>();
        Map<Handlungsbereich, List<T>> hq = new EnumMap<>(Handlungsbereich.class);
        for (Handlungsbereich h : Handlungsbereich.values()) {
            hq.put(h, new ArrayList<>());
        }

        for (T item : items) {
            if (item == null) continue;
            String text = item.classificationText();
            TaxonomyCoordinate coordinate = classifier.classify(text);
            if (!specializationFilter.shouldInclude(coordinate, text, specialization)) continue;

            switch (coordinate.area()) {
                case BQ -> bq.add(item);
                case HQ -> hq.get(coordinate.handlungsbereich()).add(item);
                case SONSTIGE -> sonstige.add(item);
            }
        }

        return new TaxonomyGrouping<>(bq,
                new HqGroups<>(hq.get(Handlungsbereich.TECHNIK),
                        hq.get(Handlungsbereich.ORGANISATION),
                        hq.get(Handlungsbereich.FUEHRUNG_UND_PERSONAL)),
                sonstige);
    }
}
