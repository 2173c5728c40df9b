package com.dadtutor;

import com.dadtutor.taxonomy.TaxonomyClassifier;
import com.dadtutor.taxonomy.TaxonomyModels.Handlungsbereich;
import com.dadtutor.taxonomy.TaxonomyModels.TaxonomyCatalog;
import com.dadtutor.taxonomy.TaxonomyModels.TaxonomyCoordinate;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class TaxonomyConfigurationTest {
    @Autowired
    private TaxonomyCatalog catalog;
    @Autowired
    private TaxonomyClassifier classifier;

    @Test
    void loadsCatalogFromApplicationConfig() {
        assertEquals(5, catalog.bqSubjects().size());
        assertEquals(2, catalog.hqSubjects().get(Handlungsbereich.TECHNIK).size());
        assertEquals(3, catalog.hqSubjects().get(Handlungsbereich.ORGANISATION).size());
        assertEquals(3, catalog.hqSubjects().get(Handlungsbereich.FUEHRUNG_UND_PERSONAL).size());
        assertEquals(4, catalog.keywordGroups().size());
        assertEquals(10, catalog.prefixLength());
    }

    @Test
    void configuredClassifierMatchesDocumentedExamples() {
        assertEquals(TaxonomyCoordinate.bq(), classifier.classify("Rechtsbewusstes Handeln"));
        assertEquals(TaxonomyCoordinate.hq(Handlungsbereich.TECHNIK), classifier.classify("Infrastruktursysteme und Betriebstechnik"));
        assertEquals(TaxonomyCoordinate.hq(Handlungsbereich.ORGANISATION), classifier.classify("Kostenrechnung"));
        assertEquals(TaxonomyCoordinate.hq(Handlungsbereich.FUEHRUNG_UND_PERSONAL), classifier.classify("Personalführung"));
        assertEquals(TaxonomyCoordinate.sonstige(), classifier.classify("Lineare Algebra"));
        assertEquals(TaxonomyCoordinate.sonstige(), classifier.classify(""));
    }
}
