package com.dadtutor.grouping;

import com.dadtutor.CatalogFixtures;
import com.dadtutor.grouping.GroupingModels.GroupVisibility;
import com.dadtutor.grouping.GroupingModels.TaxonomyGrouping;
import com.dadtutor.taxonomy.ClassifiableItem;
import com.dadtutor.taxonomy.SpecializationFilter;
import com.dadtutor.taxonomy.TaxonomyClassifier;
import com.dadtutor.taxonomy.TaxonomyModels.Handlungsbereich;
import com.dadtutor.taxonomy.TaxonomyModels.Specialization;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GroupingEngineTest {
    private final TaxonomyClassifier classifier = new TaxonomyClassifier(CatalogFixtures.ihkElektrotechnik());
    private final SpecializationFilter filter = new SpecializationFilter();
    private final GroupingEngine engine = new GroupingEngine(classifier, filter);

    private final List<Item> items = List.of(
            new Item("1", "Rechtsbewusstes Handeln", null),
            new Item("2", "Automatisierungstechnik Grundlagen", null),
            new Item("3", null, "Personalführung"),
            new Item("4", "Infrastruktursysteme", null),
            new Item("5", "Quantencomputing für Anfänger", null),
            new Item("6", "Betriebliches Kostenwesen", null),
            new Item("7", null, null),
            new Item("8", "Physik", "Personalführung"),
            new Item("9", "Elektrotechnik", null),
            new Item("10", "Qualitätsmanagement", null)
    );

    @Test
    void partitionsIntoBucketsPreservingInputOrder() {
        TaxonomyGrouping<Item> grouping = engine.group(items, Specialization.NONE);

        assertEquals(List.of("1", "8"), ids(grouping.bq()));
        assertEquals(List.of("2", "4", "9"), ids(grouping.hq().technik()));
        assertEquals(List.of("6"), ids(grouping.hq().organisation()));
        assertEquals(List.of("3", "10"), ids(grouping.hq().fuehrungUndPersonal()));
        assertEquals(List.of("5", "7"), ids(grouping.sonstige()));
        assertEquals(items.size(), grouping.total());
    }

    @Test
    void subjectTakesPrecedenceOverTopic() {
        TaxonomyGrouping<Item> grouping = engine.group(List.of(new Item("8", "Physik", "Personalführung")), Specialization.NONE);
        assertEquals(1, grouping.bq().size());
        assertTrue(grouping.hq().fuehrungUndPersonal().isEmpty());
    }

    @Test
    void specializationOnlyRemovesVetoedTechnikItems() {
        TaxonomyGrouping<Item> infra = engine.group(items, Specialization.INFRASTRUKTURSYSTEME_UND_BETRIEBSTECHNIK);
        assertEquals(List.of("4", "9"), ids(infra.hq().technik()));
        assertEquals(items.size() - 1, infra.total());

        TaxonomyGrouping<Item> automation = engine.group(items, Specialization.AUTOMATISIERUNGS_UND_INFORMATIONSTECHNIK);
        assertEquals(List.of("2", "9"), ids(automation.hq().technik()));
        assertEquals(List.of("1", "8"), ids(automation.bq()));
    }

    @Test
    void bucketsAreDisjointAndExhaustiveForEverySpecialization() {
        for (Specialization specialization : Specialization.values()) {
            TaxonomyGrouping<Item> grouping = engine.group(items, specialization);
            long expected = items.stream()
                    .filter(i -> filter.shouldInclude(classifier.classify(i.classificationText()), i.classificationText(), specialization))
                    .count();

            List<Item> union = new ArrayList<>(grouping.bq());
            for (Handlungsbereich h : Handlungsbereich.values()) {
                union.addAll(grouping.hq().get(h));
            }
            union.addAll(grouping.sonstige());

            assertEquals(expected, grouping.total());
            assertEquals(expected, union.size());
            Set<Item> distinct = new HashSet<>(union);
            assertEquals(union.size(), distinct.size());
        }
    }

    @Test
    void toleratesNullAndEmptyInput() {
        assertEquals(0, engine.group(null, Specialization.NONE).total());
        assertEquals(0, engine.group(List.of(), Specialization.NONE).total());

        List<Item> withNull = Arrays.asList(new Item("a", "Physik", null), null);
        assertEquals(1, engine.group(withNull, Specialization.NONE).total());
    }

    @Test
    void defaultVisibilityCollapsesOnlySonstige() {
        GroupVisibility visibility = GroupVisibility.defaults();
        assertTrue(visibility.expanded().get("BQ"));
        assertTrue(visibility.expanded().get("HQ"));
        assertTrue(visibility.expanded().get("HQ/Technik"));
        assertTrue(visibility.expanded().get("HQ/Organisation"));
        assertTrue(visibility.expanded().get("HQ/Führung und Personal"));
        assertFalse(visibility.expanded().get("Sonstige"));
    }

    private List<String> ids(List<Item> bucket) {
        return bucket.stream().map(Item::id).toList();
    }

    record Item(String id, String subject, String topic) implements ClassifiableItem {}
}
