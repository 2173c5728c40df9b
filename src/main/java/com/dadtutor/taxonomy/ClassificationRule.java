package com.dadtutor.taxonomy;

import com.dadtutor.taxonomy.TaxonomyModels.TaxonomyCoordinate;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * One row of the classifier's decision table. Rules see canonical (lower-cased, non-null) text.
 */
public record ClassificationRule(String name, RuleKind kind, Predicate<String> predicate, TaxonomyCoordinate coordinate) {

    public enum RuleKind { CATALOG_PREFIX, KEYWORD }

    public ClassificationRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(predicate, "predicate");
        Objects.requireNonNull(coordinate, "coordinate");
    }

    public boolean matches(String canonicalText) {
        return predicate.test(canonicalText);
    }

    /**
     * Symmetric truncated-prefix containment against a catalog subject. Blank input never
     * matches, an empty prefix would be contained in every subject.
     */
    public static ClassificationRule catalogPrefix(String subject, TaxonomyCoordinate coordinate, int prefixLength) {
        String canonicalSubject = subject.toLowerCase(Locale.ROOT);
        String subjectPrefix = truncate(canonicalSubject, prefixLength);
        // Blank text is excluded on purpose: its empty prefix is contained in every subject and
        // would file it under the first BQ subject. It falls through to Sonstige instead.
        Predicate<String> predicate = text -> !text.isBlank()
                && (text.contains(subjectPrefix) || canonicalSubject.contains(truncate(text, prefixLength)));
        return new ClassificationRule("catalog:" + subject, RuleKind.CATALOG_PREFIX, predicate, coordinate);
    }

    public static ClassificationRule keywords(List<String> keywords, TaxonomyCoordinate coordinate) {
        List<String> canonical = keywords.stream()
                .filter(Objects::nonNull)
                .map(k -> k.toLowerCase(Locale.ROOT))
                .filter(k -> !k.isEmpty())
                .toList();
        Predicate<String> predicate = text -> canonical.stream().anyMatch(text::contains);
        return new ClassificationRule("keywords:" + String.join(",", canonical), RuleKind.KEYWORD, predicate, coordinate);
    }

    static String truncate(String value, int length) {
        return value.length() <= length ? value : value.substring(0, length);
    }
}
