package com.dadtutor.taxonomy;

import com.dadtutor.taxonomy.TaxonomyModels.Handlungsbereich;
import com.dadtutor.taxonomy.TaxonomyModels.KeywordGroup;
import com.dadtutor.taxonomy.TaxonomyModels.TaxonomyCatalog;
import com.dadtutor.taxonomy.TaxonomyModels.TaxonomyCoordinate;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps free-text subject or topic strings onto the qualification taxonomy.
 *
 * <p>The catalog is compiled into an ordered rule list: BQ subjects, then HQ subjects per
 * Handlungsbereich, then the keyword groups. The first matching rule decides; no match
 * yields {@code Sonstige}. Classification is total and depends only on the catalog, so
 * results are memoized per canonical input in a cache of approximately bounded size.
 */
@Slf4j
public class TaxonomyClassifier {
    private final TaxonomyCatalog catalog;
    private final List<ClassificationRule> rules;
    private final int cacheMaxEntries;
    private final Map<String, TaxonomyCoordinate> cache = new ConcurrentHashMap<>();

    public TaxonomyClassifier(TaxonomyCatalog catalog) {
        this(catalog, 0);
    }

    public TaxonomyClassifier(TaxonomyCatalog catalog, int cacheMaxEntries) {
        this.catalog = catalog;
        this.rules = compile(catalog);
        this.cacheMaxEntries = Math.max(cacheMaxEntries, 0);
    }

    public TaxonomyCoordinate classify(String text) {
        String canonical = canonicalize(text);
        if (cacheMaxEntries == 0) return evaluate(canonical);

        TaxonomyCoordinate cached = cache.get(canonical);
        if (cached != null) return cached;

        TaxonomyCoordinate coordinate = evaluate(canonical);
        // size check and insert are not atomic, so concurrent callers may overshoot the bound slightly
        if (cache.size() < cacheMaxEntries) {
            cache.putIfAbsent(canonical, coordinate);
        } else {
            log.debug("Classification cache full ({} entries), not caching '{}'", cacheMaxEntries, canonical);
        }
        return coordinate;
    }

    public List<ClassificationRule> rules() {
        return rules;
    }

    public TaxonomyCatalog catalog() {
        return catalog;
    }

    int cachedEntries() {
        return cache.size();
    }

    public static String canonicalize(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }

    private TaxonomyCoordinate evaluate(String canonical) {
        for (ClassificationRule rule : rules) {
            if (rule.matches(canonical)) return rule.coordinate();
        }
        return TaxonomyCoordinate.sonstige();
    }

    private static List<ClassificationRule> compile(TaxonomyCatalog catalog) {
        List<ClassificationRule> out = new ArrayList<>();
        for (String subject : catalog.bqSubjects()) {
            out.add(ClassificationRule.catalogPrefix(subject, TaxonomyCoordinate.bq(), catalog.prefixLength()));
        }
        for (Handlungsbereich h : Handlungsbereich.values()) {
            TaxonomyCoordinate coordinate = TaxonomyCoordinate.hq(h);
            for (String subject : catalog.hqSubjects().get(h)) {
                out.add(ClassificationRule.catalogPrefix(subject, coordinate, catalog.prefixLength()));
            }
        }
        for (KeywordGroup group : catalog.keywordGroups()) {
            out.add(ClassificationRule.keywords(group.keywords(), group.coordinate()));
        }
        return List.copyOf(out);
    }
}
