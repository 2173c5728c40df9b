package com.dadtutor.taxonomy;

import com.dadtutor.taxonomy.TaxonomyModels.Handlungsbereich;
import com.dadtutor.taxonomy.TaxonomyModels.QualificationArea;
import com.dadtutor.taxonomy.TaxonomyModels.TaxonomyCatalog;
import com.dadtutor.taxonomy.TaxonomyModels.TaxonomyCoordinate;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaxonomyConfigTest {

    @Test
    void buildsCatalogInHandlungsbereichOrder() {
        TaxonomyProperties properties = properties();
        properties.getHq().add(hq(Handlungsbereich.FUEHRUNG_UND_PERSONAL, "Personalführung"));
        properties.getHq().add(hq(Handlungsbereich.TECHNIK, "Automatisierungs- und Informationstechnik"));
        properties.getKeywords().add(keywords(QualificationArea.HQ, Handlungsbereich.TECHNIK, "elektro"));

        TaxonomyCatalog catalog = TaxonomyConfig.toCatalog(properties);

        assertEquals(List.of(Handlungsbereich.TECHNIK, Handlungsbereich.ORGANISATION, Handlungsbereich.FUEHRUNG_UND_PERSONAL),
                List.copyOf(catalog.hqSubjects().keySet()));
        assertEquals(List.of(), catalog.hqSubjects().get(Handlungsbereich.ORGANISATION));
        assertEquals(TaxonomyCoordinate.hq(Handlungsbereich.TECHNIK), catalog.keywordGroups().get(0).coordinate());
        assertEquals(10, catalog.prefixLength());
    }

    @Test
    void rejectsHqKeywordGroupWithoutHandlungsbereich() {
        TaxonomyProperties properties = properties();
        properties.getKeywords().add(keywords(QualificationArea.HQ, null, "technik"));
        assertThrows(IllegalStateException.class, () -> TaxonomyConfig.toCatalog(properties));
    }

    @Test
    void rejectsBqKeywordGroupWithHandlungsbereich() {
        TaxonomyProperties properties = properties();
        properties.getKeywords().add(keywords(QualificationArea.BQ, Handlungsbereich.ORGANISATION, "recht"));
        assertThrows(IllegalStateException.class, () -> TaxonomyConfig.toCatalog(properties));
    }

    @Test
    void rejectsBlankSubjectsAndNonPositivePrefix() {
        TaxonomyProperties blank = properties();
        blank.getHq().add(hq(Handlungsbereich.ORGANISATION, " "));
        assertThrows(IllegalStateException.class, () -> TaxonomyConfig.toCatalog(blank));

        TaxonomyProperties zeroPrefix = properties();
        zeroPrefix.setPrefixLength(0);
        assertThrows(IllegalStateException.class, () -> TaxonomyConfig.toCatalog(zeroPrefix));
    }

    private TaxonomyProperties properties() {
        TaxonomyProperties properties = new TaxonomyProperties();
        properties.getBq().add("Rechtsbewusstes Handeln");
        return properties;
    }

    private TaxonomyProperties.HqBlock hq(Handlungsbereich handlungsbereich, String... subjects) {
        TaxonomyProperties.HqBlock block = new TaxonomyProperties.HqBlock();
        block.setHandlungsbereich(handlungsbereich);
        block.setSubjects(List.of(subjects));
        return block;
    }

    private TaxonomyProperties.KeywordBlock keywords(QualificationArea area, Handlungsbereich handlungsbereich, String... keywords) {
        TaxonomyProperties.KeywordBlock block = new TaxonomyProperties.KeywordBlock();
        block.setArea(area);
        block.setHandlungsbereich(handlungsbereich);
        block.setKeywords(List.of(keywords));
        return block;
    }
}
