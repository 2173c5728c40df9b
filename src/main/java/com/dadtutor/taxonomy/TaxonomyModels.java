package com.dadtutor.taxonomy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public class TaxonomyModels {

    public enum QualificationArea {
        BQ("BQ"),
        HQ("HQ"),
        SONSTIGE("Sonstige");

        private final String label;

        QualificationArea(String label) {
            this.label = label;
        }

        @JsonValue
        public String label() {
            return label;
        }
    }

    /** HQ action domains, in the order the classifier visits them. */
    public enum Handlungsbereich {
        TECHNIK("Technik"),
        ORGANISATION("Organisation"),
        FUEHRUNG_UND_PERSONAL("Führung und Personal");

        private final String label;

        Handlungsbereich(String label) {
            this.label = label;
        }

        @JsonValue
        public String label() {
            return label;
        }

        @JsonCreator
        public static Handlungsbereich fromLabel(String value) {
            return Arrays.stream(values())
                    .filter(h -> h.label.equalsIgnoreCase(value) || h.name().equalsIgnoreCase(value))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown Handlungsbereich: " + value));
        }
    }

    public enum Specialization {
        INFRASTRUKTURSYSTEME_UND_BETRIEBSTECHNIK("Infrastruktursysteme und Betriebstechnik", "automatisierung"),
        AUTOMATISIERUNGS_UND_INFORMATIONSTECHNIK("Automatisierungs- und Informationstechnik", "infrastruktur"),
        NONE("None", null);

        private final String label;
        private final String vetoKeyword;

        Specialization(String label, String vetoKeyword) {
            this.label = label;
            this.vetoKeyword = vetoKeyword;
        }

        @JsonValue
        public String label() {
            return label;
        }

        /** Keyword that excludes an HQ-Technik item for this branch, or null. */
        public String vetoKeyword() {
            return vetoKeyword;
        }

        @JsonCreator
        public static Specialization fromLabel(String value) {
            if (value == null || value.isBlank()) return NONE;
            String trimmed = value.trim();
            return Arrays.stream(values())
                    .filter(s -> s.label.equalsIgnoreCase(trimmed) || s.name().equalsIgnoreCase(trimmed))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown specialization: " + value));
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record TaxonomyCoordinate(QualificationArea area, Handlungsbereich handlungsbereich) {
        private static final TaxonomyCoordinate BQ = new TaxonomyCoordinate(QualificationArea.BQ, null);
        private static final TaxonomyCoordinate SONSTIGE = new TaxonomyCoordinate(QualificationArea.SONSTIGE, null);

        public TaxonomyCoordinate {
            Objects.requireNonNull(area, "area");
            if ((area == QualificationArea.HQ) != (handlungsbereich != null)) {
                throw new IllegalArgumentException("handlungsbereich must be set exactly for HQ coordinates: " + area + "/" + handlungsbereich);
            }
        }

        public static TaxonomyCoordinate bq() {
            return BQ;
        }

        public static TaxonomyCoordinate hq(Handlungsbereich handlungsbereich) {
            return new TaxonomyCoordinate(QualificationArea.HQ, Objects.requireNonNull(handlungsbereich, "handlungsbereich"));
        }

        public static TaxonomyCoordinate sonstige() {
            return SONSTIGE;
        }

        @JsonIgnore
        public boolean isHqTechnik() {
            return area == QualificationArea.HQ && handlungsbereich == Handlungsbereich.TECHNIK;
        }
    }

    public record KeywordGroup(TaxonomyCoordinate coordinate, List<String> keywords) {
        public KeywordGroup {
            Objects.requireNonNull(coordinate, "coordinate");
            keywords = keywords == null ? List.of() : List.copyOf(keywords);
        }
    }

    /**
     * Immutable snapshot of the qualification structure. HQ subjects are held per
     * Handlungsbereich in enum order regardless of the order they were supplied in.
     */
    public record TaxonomyCatalog(List<String> bqSubjects,
                                  Map<Handlungsbereich, List<String>> hqSubjects,
                                  List<KeywordGroup> keywordGroups,
                                  int prefixLength) {
        public TaxonomyCatalog {
            if (prefixLength <= 0) {
                throw new IllegalArgumentException("prefixLength must be positive, was " + prefixLength);
            }
            bqSubjects = bqSubjects == null ? List.of() : List.copyOf(bqSubjects);
            EnumMap<Handlungsbereich, List<String>> hq = new EnumMap<>(Handlungsbereich.class);
            for (Handlungsbereich h : Handlungsbereich.values()) {
                List<String> subjects = hqSubjects == null ? null : hqSubjects.get(h);
                hq.put(h, subjects == null ? List.of() : List.copyOf(subjects));
            }
            hqSubjects = Collections.unmodifiableMap(hq);
            keywordGroups = keywordGroups == null ? List.of() : List.copyOf(keywordGroups);
        }

        public int subjectCount() {
            return bqSubjects.size() + hqSubjects.values().stream().mapToInt(List::size).sum();
        }
    }
}
