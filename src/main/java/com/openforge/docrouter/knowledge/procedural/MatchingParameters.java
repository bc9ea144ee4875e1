package com.openforge.docrouter.knowledge.procedural;

import java.util.List;
import java.util.Map;

/**
 * Effective identification parameters: configured defaults with any stored
 * matching rule of the same name applied on top.
 */
public record MatchingParameters(
        double senderConfidence,
        double senderTrustFloor,
        double exactMatch,
        double allWordsMatch,
        double substringMatch,
        double fuzzyMatch,
        double fuzzyThreshold,
        int    fuzzyMinLength,
        double extraMatchBonus,
        double maxBonus,
        double dilutionRatio,
        double dilutionPenalty,
        double relevancePenalty,
        double minConfidence,
        List<String> relevanceKeywords
) {

    public static MatchingParameters defaults(MatchingProperties p) {
        return from(p, Map.of());
    }

    public static MatchingParameters from(MatchingProperties p, Map<String, Double> rules) {
        return new MatchingParameters(
                rules.getOrDefault("matching.sender-confidence", p.senderConfidence()),
                rules.getOrDefault("matching.sender-trust-floor", p.senderTrustFloor()),
                rules.getOrDefault("matching.exact", p.exactMatch()),
                rules.getOrDefault("matching.all-words", p.allWordsMatch()),
                rules.getOrDefault("matching.substring", p.substringMatch()),
                rules.getOrDefault("matching.fuzzy", p.fuzzyMatch()),
                rules.getOrDefault("matching.fuzzy-threshold", p.fuzzyThreshold()),
                rules.getOrDefault("matching.fuzzy-min-length", (double) p.fuzzyMinLength()).intValue(),
                rules.getOrDefault("matching.extra-match-bonus", p.extraMatchBonus()),
                rules.getOrDefault("matching.max-bonus", p.maxBonus()),
                rules.getOrDefault("matching.dilution-ratio", p.dilutionRatio()),
                rules.getOrDefault("matching.dilution-penalty", p.dilutionPenalty()),
                rules.getOrDefault("matching.relevance-penalty", p.relevancePenalty()),
                rules.getOrDefault("matching.min-confidence", p.minConfidence()),
                p.relevanceKeywords() == null ? List.of() : p.relevanceKeywords());
    }
}
