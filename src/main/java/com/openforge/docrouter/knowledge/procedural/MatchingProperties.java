package com.openforge.docrouter.knowledge.procedural;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * Asset identification defaults. Seeded into the procedural store as
 * matching rules at bootstrap; stored rules override these values.
 *
 * relevance-keywords - generic deal vocabulary ("loan", "fund", "deal"…).
 *                      Deliberately a separate list from asset identifiers:
 *                      an identifier that is also a relevance keyword is
 *                      penalised rather than rewarded.
 */
@ConfigurationProperties(prefix = "docrouter.matching")
public record MatchingProperties(
        @DefaultValue("0.95") double senderConfidence,
        @DefaultValue("0.5")  double senderTrustFloor,
        @DefaultValue("0.95") double exactMatch,
        @DefaultValue("0.85") double allWordsMatch,
        @DefaultValue("0.75") double substringMatch,
        @DefaultValue("0.65") double fuzzyMatch,
        @DefaultValue("0.8")  double fuzzyThreshold,
        @DefaultValue("4")    int    fuzzyMinLength,
        @DefaultValue("0.10") double extraMatchBonus,
        @DefaultValue("0.30") double maxBonus,
        @DefaultValue("5.0")  double dilutionRatio,
        @DefaultValue("0.05") double dilutionPenalty,
        @DefaultValue("0.10") double relevancePenalty,
        @DefaultValue("0.5")  double minConfidence,
        @DefaultValue({"deal", "fund", "loan", "credit", "property", "portfolio", "investment", "asset", "capital"})
        List<String> relevanceKeywords
) {}
