package com.openforge.docrouter.knowledge.procedural;

import com.openforge.docrouter.domain.AssetType;
import com.openforge.docrouter.domain.ClassificationPattern;
import com.openforge.docrouter.domain.ConfidenceTier;
import com.openforge.docrouter.domain.MatchingRule;
import com.openforge.docrouter.knowledge.DeduplicationGate;
import com.openforge.docrouter.knowledge.IngestResult;
import com.openforge.docrouter.repository.ClassificationPatternRepository;
import com.openforge.docrouter.repository.MatchingRuleRepository;
import com.openforge.docrouter.routing.RoutingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Procedural knowledge: classification patterns and the numeric rules that
 * drive matching and routing.
 *
 * Reads are direct repository scans; writes go through the gate.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProceduralStore {

    private final ClassificationPatternStore      patternStore;
    private final MatchingRuleStore               ruleStore;
    private final ClassificationPatternRepository patternRepository;
    private final MatchingRuleRepository          ruleRepository;
    private final DeduplicationGate               gate;
    private final MatchingProperties              matchingProperties;
    private final ClassificationProperties        classificationProperties;
    private final RoutingProperties               routingProperties;

    // ── Patterns ─────────────────────────────────────────────────────────────

    public List<ClassificationPattern> patternsFor(AssetType assetType) {
        if (assetType == null) return List.of();
        return patternRepository.findByAssetType(assetType);
    }

    /**
     * Store a pattern. A null weight is looked up in the configured weight
     * table, falling back to the length heuristic.
     */
    public IngestResult ingestPattern(AssetType assetType, String category, String pattern,
                                      Double weight, ConfidenceTier tier) {
        double effective = weight != null ? weight : weightFor(pattern);
        return gate.ingest(patternStore, ClassificationPattern.builder()
                .assetType(assetType)
                .category(category)
                .pattern(pattern)
                .weight(effective)
                .confidenceTier(tier == null ? ConfidenceTier.MEDIUM : tier)
                .build());
    }

    public double weightFor(String pattern) {
        if (pattern == null || pattern.isBlank()) return 0.0;
        String normalized = pattern.strip().toLowerCase(Locale.ROOT);
        return classificationProperties.patternWeights().stream()
                .filter(w -> w.pattern() != null && w.pattern().strip().toLowerCase(Locale.ROOT).equals(normalized))
                .map(ClassificationProperties.PatternWeight::weight)
                .findFirst()
                .orElseGet(() -> Math.min(pattern.length() / 20.0, 1.0));
    }

    // ── Rules ────────────────────────────────────────────────────────────────

    public IngestResult ingestRule(String name, double value, String description, ConfidenceTier tier) {
        return gate.ingest(ruleStore, MatchingRule.builder()
                .ruleName(name)
                .value(value)
                .description(description)
                .confidenceTier(tier == null ? ConfidenceTier.HIGH : tier)
                .build());
    }

    public Map<String, Double> storedRules() {
        return ruleRepository.findAll().stream()
                .collect(Collectors.toMap(MatchingRule::getRuleName, MatchingRule::getValue, (a, b) -> b));
    }

    public MatchingParameters matchingParameters() {
        return MatchingParameters.from(matchingProperties, storedRules());
    }

    public RoutingThresholds routingThresholds() {
        Map<String, Double> rules = storedRules();
        return new RoutingThresholds(
                rules.getOrDefault("routing.high", routingProperties.highThreshold()),
                rules.getOrDefault("routing.medium", routingProperties.mediumThreshold()),
                rules.getOrDefault("routing.low", routingProperties.lowThreshold()),
                rules.getOrDefault("routing.asset-weight", routingProperties.assetWeight()));
    }

    /** The rules seeded at bootstrap: every configured threshold and matching parameter by name. */
    public Map<String, Double> configuredRules() {
        MatchingProperties m = matchingProperties;
        Map<String, Double> rules = new LinkedHashMap<>();
        rules.put("routing.high", routingProperties.highThreshold());
        rules.put("routing.medium", routingProperties.mediumThreshold());
        rules.put("routing.low", routingProperties.lowThreshold());
        rules.put("routing.asset-weight", routingProperties.assetWeight());
        rules.put("matching.sender-confidence", m.senderConfidence());
        rules.put("matching.sender-trust-floor", m.senderTrustFloor());
        rules.put("matching.exact", m.exactMatch());
        rules.put("matching.all-words", m.allWordsMatch());
        rules.put("matching.substring", m.substringMatch());
        rules.put("matching.fuzzy", m.fuzzyMatch());
        rules.put("matching.fuzzy-threshold", m.fuzzyThreshold());
        rules.put("matching.fuzzy-min-length", (double) m.fuzzyMinLength());
        rules.put("matching.extra-match-bonus", m.extraMatchBonus());
        rules.put("matching.max-bonus", m.maxBonus());
        rules.put("matching.dilution-ratio", m.dilutionRatio());
        rules.put("matching.dilution-penalty", m.dilutionPenalty());
        rules.put("matching.relevance-penalty", m.relevancePenalty());
        rules.put("matching.min-confidence", m.minConfidence());
        return rules;
    }
}
