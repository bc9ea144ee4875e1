package com.openforge.docrouter.routing;

import com.openforge.docrouter.domain.AssetType;
import com.openforge.docrouter.domain.ClassificationPattern;
import com.openforge.docrouter.domain.EpisodicRecord;
import com.openforge.docrouter.domain.ExperienceSource;
import com.openforge.docrouter.knowledge.procedural.ClassificationProperties;
import com.openforge.docrouter.memory.SimilarExperience;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DocumentClassifierTest {

    static final ClassificationProperties PROPERTIES = new ClassificationProperties(
            "uncategorized", 0.30,
            0.10, List.of("report", "statement", "summary"),
            0.05, List.of(".pdf", ".doc", ".docx", ".xls", ".xlsx"),
            0.05, List.of("quarterly", "monthly", "annual", "report", "statement", "financial", "compliance"),
            10, 0.10,
            Map.of("private_credit", List.of("loan_documents", "borrower_financials", "covenant_compliance")),
            List.of("financial_statements", "legal_documents", "unknown"),
            List.of());

    static final List<String> CREDIT = List.of("loan_documents", "borrower_financials", "covenant_compliance");

    private final DocumentClassifier classifier = new DocumentClassifier(PROPERTIES, AssetIdentifierTest.EXPERIENCE);

    static ClassificationPattern pattern(String category, String regex, double weight) {
        return ClassificationPattern.builder()
                .assetType(AssetType.PRIVATE_CREDIT)
                .category(category)
                .pattern(regex)
                .weight(weight)
                .build();
    }

    @Test
    void filenameAbbreviationResolvesLoanDocuments() {
        List<ClassificationPattern> patterns = List.of(
                pattern("loan_documents", "trm", 0.6),
                pattern("borrower_financials", "financials?", 0.7));

        CategoryMatch match = classifier.classify(AssetType.PRIVATE_CREDIT, "RLV_TRM_i3_TD.pdf", "i3 loan docs",
                "attached find the loan documents for the i3 deal", CREDIT, patterns, ClassificationSignals.none());

        assertEquals("loan_documents", match.category());
        assertFalse(match.fallback());
        assertEquals(0.65, match.confidence(), 1e-9);
    }

    @Test
    void nothingMatchingFallsBack() {
        CategoryMatch match = classifier.classify(AssetType.PRIVATE_CREDIT, "scan0001.png", "fyi", "",
                CREDIT, List.of(pattern("loan_documents", "credit agreement", 0.8)), ClassificationSignals.none());

        assertTrue(match.fallback());
        assertEquals("uncategorized", match.category());
        assertEquals(0.30, match.confidence(), 1e-9);
    }

    @Test
    void tiesGoToTheEarlierAllowedCategory() {
        List<ClassificationPattern> patterns = List.of(
                pattern("covenant_compliance", "certificate", 0.5),
                pattern("borrower_financials", "certificate", 0.5));

        CategoryMatch match = classifier.classify(AssetType.PRIVATE_CREDIT, "certificate.png", "", "",
                CREDIT, patterns, ClassificationSignals.none());

        assertEquals("borrower_financials", match.category());
    }

    @Test
    void businessRulesAdjustAndClip() {
        List<ClassificationPattern> patterns = List.of(pattern("borrower_financials", "financial", 0.5));

        CategoryMatch plain = classifier.classify(AssetType.PRIVATE_CREDIT, "financials.png", "", "",
                CREDIT, patterns, ClassificationSignals.none());
        CategoryMatch adjusted = classifier.classify(AssetType.PRIVATE_CREDIT, "financial_report.pdf",
                "Quarterly financials Q3", "", CREDIT, patterns, new ClassificationSignals(true, List.of()));

        assertEquals(0.50, plain.confidence(), 1e-9);
        // 0.5 + report 0.10 + .pdf 0.05 + subject 0.05 + trusted 0.10
        assertEquals(0.80, adjusted.confidence(), 1e-9);

        List<ClassificationPattern> strong = List.of(
                pattern("borrower_financials", "financial", 0.9),
                pattern("borrower_financials", "report", 0.9));
        CategoryMatch clipped = classifier.classify(AssetType.PRIVATE_CREDIT, "financial_report.pdf",
                "Quarterly financials Q3", "", CREDIT, strong, new ClassificationSignals(true, List.of()));
        assertEquals(1.0, clipped.confidence(), 1e-9);
    }

    @Test
    void invalidPatternIsSkipped() {
        List<ClassificationPattern> patterns = List.of(
                pattern("covenant_compliance", "([unclosed", 0.9),
                pattern("loan_documents", "term sheet", 0.6));

        CategoryMatch match = classifier.classify(AssetType.PRIVATE_CREDIT, "term sheet.docx", "", "",
                CREDIT, patterns, ClassificationSignals.none());

        assertEquals("loan_documents", match.category());
        assertEquals(0.65, match.confidence(), 1e-9);
    }

    @Test
    void patternsForOtherCategoriesAreIgnored() {
        CategoryMatch match = classifier.classify(AssetType.PRIVATE_CREDIT, "rent roll.png", "", "",
                CREDIT, List.of(pattern("rent_roll", "rent roll", 0.8)), ClassificationSignals.none());

        assertTrue(match.fallback());
    }

    @Test
    void humanCorrectionsHintTheirCategory() {
        EpisodicRecord correction = EpisodicRecord.builder()
                .filename("misc.png")
                .predictedCategory("covenant_compliance")
                .source(ExperienceSource.HUMAN_CORRECTION)
                .confidence(1.0)
                .build();

        CategoryMatch match = classifier.classify(AssetType.PRIVATE_CREDIT, "misc.png", "", "", CREDIT, List.of(),
                new ClassificationSignals(false, List.of(new SimilarExperience(correction, 1.0))));

        assertFalse(match.fallback());
        assertEquals("covenant_compliance", match.category());
        assertEquals(0.40, match.confidence(), 1e-9);
    }
}
