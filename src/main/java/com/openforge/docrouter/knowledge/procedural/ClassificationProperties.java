package com.openforge.docrouter.knowledge.procedural;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;
import java.util.Map;

/**
 * Document classification settings.
 *
 * categories       - allowed categories per asset type value (e.g. private_credit)
 * pattern-weights  - explicit specificity weight per pattern text; patterns
 *                    without an entry fall back to min(length / 20, 1.0)
 */
@ConfigurationProperties(prefix = "docrouter.classification")
public record ClassificationProperties(
        @DefaultValue("uncategorized") String fallbackCategory,
        @DefaultValue("0.30")          double fallbackConfidence,
        @DefaultValue("0.10")          double professionalKeywordBonus,
        @DefaultValue({"report", "statement", "summary"})
        List<String> professionalKeywords,
        @DefaultValue("0.05")          double documentExtensionBonus,
        @DefaultValue({".pdf", ".doc", ".docx"})
        List<String> documentExtensions,
        @DefaultValue("0.05")          double subjectKeywordBonus,
        @DefaultValue({"urgent", "important", "quarterly", "monthly"})
        List<String> subjectKeywords,
        @DefaultValue("10")            int    subjectMinLength,
        @DefaultValue("0.10")          double trustedSenderBonus,
        Map<String, List<String>> categories,
        @DefaultValue({"financial_statements", "legal_documents", "tax_documents", "insurance", "correspondence", "unknown"})
        List<String> defaultCategories,
        List<PatternWeight> patternWeights
) {

    public record PatternWeight(String pattern, double weight) {}

    public Map<String, List<String>> categories() {
        return categories == null ? Map.of() : categories;
    }

    public List<PatternWeight> patternWeights() {
        return patternWeights == null ? List.of() : patternWeights;
    }
}
