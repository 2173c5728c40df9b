package com.dadtutor.grouping;

import com.dadtutor.taxonomy.TaxonomyModels.Handlungsbereich;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class GroupingModels {

    public record TaxonomyGrouping<T>(@JsonProperty("BQ") List<T> bq,
                                      @JsonProperty("HQ") HqGroups<T> hq,
                                      @JsonProperty("Sonstige") List<T> sonstige) {
        public TaxonomyGrouping {
            bq = List.copyOf(bq);
            sonstige = List.copyOf(sonstige);
        }

        public static <T> TaxonomyGrouping<T> empty() {
            return new TaxonomyGrouping<>(List.of(), new HqGroups<>(List.of(), List.of(), List.of()), List.of());
        }

        public int total() {
            return bq.size() + hq.total() + sonstige.size();
        }
    }

    public record HqGroups<T>(@JsonProperty("Technik") List<T> technik,
                              @JsonProperty("Organisation") List<T> organisation,
                              @JsonProperty("Führung und Personal") List<T> fuehrungUndPersonal) {
        public HqGroups {
            technik = List.copyOf(technik);
            organisation = List.copyOf(organisation);
            fuehrungUndPersonal = List.copyOf(fuehrungUndPersonal);
        }

        public List<T> get(Handlungsbereich handlungsbereich) {
            return switch (handlungsbereich) {
                case TECHNIK -> technik;
                case ORGANISATION -> organisation;
                case FUEHRUNG_UND_PERSONAL -> fuehrungUndPersonal;
            };
        }

        public int total() {
            return technik.size() + organisation.size() + fuehrungUndPersonal.size();
        }
    }

    /**
     * Initial expand/collapse state for the grouped views. Owned by the caller; grouping
     * never depends on it.
     */
    public record GroupVisibility(Map<String, Boolean> expanded) {
        public static GroupVisibility defaults() {
            Map<String, Boolean> expanded = new LinkedHashMap<>();
            expanded.put("BQ", true);
            expanded.put("HQ", true);
            for (Handlungsbereich h : Handlungsbereich.values()) {
                expanded.put("HQ/" + h.label(), true);
            }
            expanded.put("Sonstige", false);
            return new GroupVisibility(Map.copyOf(expanded));
        }
    }

    public record GroupedView<T>(TaxonomyGrouping<T> groups, GroupVisibility visibility, int total) {}
}
