package com.dadtutor.taxonomy;

import com.dadtutor.taxonomy.TaxonomyModels.Handlungsbereich;
import com.dadtutor.taxonomy.TaxonomyModels.KeywordGroup;
import com.dadtutor.taxonomy.TaxonomyModels.QualificationArea;
import com.dadtutor.taxonomy.TaxonomyModels.TaxonomyCatalog;
import com.dadtutor.taxonomy.TaxonomyModels.TaxonomyCoordinate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Configuration
public class TaxonomyConfig {

    @Bean
    public TaxonomyCatalog taxonomyCatalog(TaxonomyProperties properties) {
        TaxonomyCatalog catalog = toCatalog(properties);
        log.info("Taxonomy catalog loaded: {} BQ subjects, {} HQ subjects, {} keyword groups, prefix length {}",
                catalog.bqSubjects().size(), catalog.subjectCount() - catalog.bqSubjects().size(),
                catalog.keywordGroups().size(), catalog.prefixLength());
        return catalog;
    }

    @Bean
    public TaxonomyClassifier taxonomyClassifier(TaxonomyCatalog catalog, TaxonomyProperties properties) {
        return new TaxonomyClassifier(catalog, properties.getCache().getMaxEntries());
    }

    static TaxonomyCatalog toCatalog(TaxonomyProperties properties) {
        requireSubjects(properties.getBq(), "taxonomy.bq");

        Map<Handlungsbereich, List<String>> hq = new EnumMap<>(Handlungsbereich.class);
        for (TaxonomyProperties.HqBlock block : properties.getHq()) {
            if (block.getHandlungsbereich() == null) {
                throw new IllegalStateException("taxonomy.hq entry without handlungsbereich");
            }
            requireSubjects(block.getSubjects(), "taxonomy.hq." + block.getHandlungsbereich());
            hq.computeIfAbsent(block.getHandlungsbereich(), h -> new ArrayList<>()).addAll(block.getSubjects());
        }

        List<KeywordGroup> groups = new ArrayList<>();
        for (TaxonomyProperties.KeywordBlock block : properties.getKeywords()) {
            groups.add(new KeywordGroup(coordinateOf(block), block.getKeywords()));
        }

        try {
            return new TaxonomyCatalog(properties.getBq(), hq, groups, properties.getPrefixLength());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid taxonomy configuration: " + e.getMessage(), e);
        }
    }

    private static TaxonomyCoordinate coordinateOf(TaxonomyProperties.KeywordBlock block) {
        QualificationArea area = block.getArea();
        if (area == null) {
            throw new IllegalStateException("taxonomy.keywords: group " + block.getKeywords() + " has no area");
        }
        if (area == QualificationArea.HQ) {
            if (block.getHandlungsbereich() == null) {
                throw new IllegalStateException("taxonomy.keywords: HQ group " + block.getKeywords() + " needs a handlungsbereich");
            }
            return TaxonomyCoordinate.hq(block.getHandlungsbereich());
        }
        if (block.getHandlungsbereich() != null) {
            throw new IllegalStateException("taxonomy.keywords: only HQ groups may name a handlungsbereich, got " + area);
        }
        if (area == QualificationArea.SONSTIGE) {
            throw new IllegalStateException("taxonomy.keywords: Sonstige is the fallback and cannot have keywords");
        }
        return TaxonomyCoordinate.bq();
    }

    private static void requireSubjects(List<String> subjects, String property) {
        if (subjects == null) return;
        for (String subject : subjects) {
            if (subject == null || subject.isBlank()) {
                throw new IllegalStateException(property + " contains a blank subject name");
            }
        }
    }
}
