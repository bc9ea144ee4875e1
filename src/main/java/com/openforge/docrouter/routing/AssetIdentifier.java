package com.openforge.docrouter.routing;

import com.openforge.docrouter.domain.AssetProfile;
import com.openforge.docrouter.domain.EpisodicRecord;
import com.openforge.docrouter.domain.SenderMapping;
import com.openforge.docrouter.knowledge.contact.SenderMappingStore;
import com.openforge.docrouter.knowledge.procedural.MatchingParameters;
import com.openforge.docrouter.memory.ExperienceProperties;
import com.openforge.docrouter.memory.SimilarExperience;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Scores every known asset against one attachment and returns all that
 * qualify, best first.
 *
 * Per asset:
 *   seed       sender mapping with trust at or above the floor
 *   best       strongest identifier tier (exact > all words > substring > fuzzy)
 *   bonus      per additional matching identifier, capped
 *   penalties  filename dilution, identifiers that are generic relevance keywords
 *   experience Σ over sources of max(weight × similarity) for episodes of this asset
 *
 *   score = clip(max(seed, best) + bonus − penalties + experience)
 *
 * Pure function of its inputs: no store access, safe to call from any worker.
 */
@Slf4j
@Component
public class AssetIdentifier {

    private final ExperienceProperties experience;

    public AssetIdentifier(ExperienceProperties experience) {
        this.experience = experience;
    }

    public List<AssetCandidate> identify(IdentificationContext context,
                                         List<AssetProfile> assets,
                                         Map<String, SenderMapping> senderMap,
                                         MatchingParameters params,
                                         List<SimilarExperience> experiences) {
        if (assets == null || assets.isEmpty()) {
            log.debug("[Identify] Empty asset catalog, nothing to match");
            return List.of();
        }

        String rawAll = (context.subject() + " " + context.body() + " " + context.filename()).toLowerCase(Locale.ROOT);
        TextView all     = new TextView(rawAll);
        TextView content = new TextView((context.subject() + " " + context.body()).toLowerCase(Locale.ROOT));
        int stemLength   = TextMatching.stem(context.filename()).length();

        Set<String> seededAssets = sendersAssets(context.senderAddress(), senderMap, params);
        Set<String> relevance = new LinkedHashSet<>();
        for (String keyword : params.relevanceKeywords()) relevance.add(keyword.strip().toLowerCase(Locale.ROOT));

        List<AssetCandidate> candidates = new ArrayList<>();
        for (AssetProfile asset : assets) {
            List<String> rationale = new ArrayList<>();

            double seed = 0.0;
            if (seededAssets.contains(asset.getAssetId())) {
                seed = params.senderConfidence();
                rationale.add("sender mapping %.2f".formatted(seed));
            }

            double best = 0.0;
            String bestIdentifier = null;
            int extraMatches = 0;
            int genericMatches = 0;
            for (String identifier : identifiersOf(asset)) {
                double tier = tier(identifier, all, params);
                if (tier <= 0.0) continue;
                boolean generic = relevance.contains(identifier);
                if (generic) {
                    genericMatches++;
                    rationale.add("'%s' is a generic keyword".formatted(identifier));
                }
                if (tier > best) {
                    if (bestIdentifier != null && !relevance.contains(bestIdentifier)) extraMatches++;
                    best = tier;
                    bestIdentifier = identifier;
                } else if (!generic) {
                    extraMatches++;
                }
                rationale.add("'%s' matched at %.2f".formatted(identifier, tier));
            }

            double bonus = Math.min(extraMatches * params.extraMatchBonus(), params.maxBonus());
            double penalty = genericMatches * params.relevancePenalty();
            if (bestIdentifier != null
                    && tier(bestIdentifier, content, params) <= 0.0
                    && (double) stemLength / bestIdentifier.length() > params.dilutionRatio()) {
                penalty += params.dilutionPenalty();
                rationale.add("filename-only match diluted (-%.2f)".formatted(params.dilutionPenalty()));
            }
            if (bonus > 0) rationale.add("extra identifiers +%.2f".formatted(bonus));

            double boost = experienceBoost(asset.getAssetId(), experiences);
            if (boost > 0) rationale.add("similar past episodes +%.2f".formatted(boost));

            double base = Math.max(seed, best);
            if (base <= 0.0 && boost <= 0.0) continue;

            double score = TextMatching.clip(base + bonus - penalty + boost);
            if (score < params.minConfidence()) {
                log.debug("[Identify] {} scored {} below minimum {}", asset.getAssetId(), score, params.minConfidence());
                continue;
            }
            candidates.add(new AssetCandidate(asset.getAssetId(), asset.getDealName(), asset.getAssetType(),
                    score, List.copyOf(rationale)));
        }

        candidates.sort(Comparator.comparingDouble(AssetCandidate::confidence).reversed()
                .thenComparing(AssetCandidate::assetId));
        log.debug("[Identify] {} → {}", context.filename(), candidates);
        return candidates;
    }

    // ── Identifier tiers ─────────────────────────────────────────────────────

    double tier(String identifier, TextView text, MatchingParameters params) {
        String normalized = TextMatching.normalize(identifier);
        if (normalized.isEmpty()) return 0.0;

        if (TextMatching.containsPhrase(text.normalized, normalized)) return params.exactMatch();

        String[] words = normalized.split(" ");
        int present = 0;
        for (String word : words) {
            if (text.tokens.contains(word)) present++;
        }
        if (words.length > 1 && present == words.length) return params.allWordsMatch();

        if (text.raw.contains(identifier.toLowerCase(Locale.ROOT))) return params.substringMatch();

        if (words.length > 1 && present >= Math.ceil(words.length * 0.7)) return params.fuzzyMatch();
        if (normalized.length() >= params.fuzzyMinLength() && fuzzyMatch(words, text.tokenList, params.fuzzyThreshold())) {
            return params.fuzzyMatch();
        }
        return 0.0;
    }

    private static boolean fuzzyMatch(String[] words, List<String> tokens, double threshold) {
        String target = String.join(" ", words);
        int width = words.length;
        for (int i = 0; i + width <= tokens.size(); i++) {
            String window = String.join(" ", tokens.subList(i, i + width));
            if (TextMatching.similarityRatio(target, window) >= threshold) return true;
        }
        return false;
    }

    // ── Other signals ────────────────────────────────────────────────────────

    private static Set<String> sendersAssets(String sender, Map<String, SenderMapping> senderMap, MatchingParameters params) {
        String key = SenderMappingStore.normalizeAddress(sender);
        if (key == null || senderMap == null) return Set.of();
        SenderMapping mapping = senderMap.get(key);
        if (mapping == null || mapping.getTrustScore() < params.senderTrustFloor()) return Set.of();
        return new LinkedHashSet<>(mapping.getAssetIds());
    }

    private double experienceBoost(String assetId, List<SimilarExperience> experiences) {
        if (experiences == null || experiences.isEmpty()) return 0.0;
        double human = 0.0;
        double auto = 0.0;
        for (SimilarExperience hit : experiences) {
            EpisodicRecord record = hit.record();
            if (!assetId.equals(record.getAssetId())) continue;
            if (record.isCorrection()) {
                human = Math.max(human, experience.humanWeight() * hit.similarity());
            } else {
                auto = Math.max(auto, experience.autoWeight() * hit.similarity());
            }
        }
        return human + auto;
    }

    private static List<String> identifiersOf(AssetProfile asset) {
        Set<String> all = new LinkedHashSet<>();
        for (String identifier : asset.getIdentifiers()) {
            if (identifier != null && !identifier.isBlank()) all.add(identifier.strip().toLowerCase(Locale.ROOT));
        }
        if (asset.getDealName() != null && !asset.getDealName().isBlank()) {
            all.add(asset.getDealName().strip().toLowerCase(Locale.ROOT));
        }
        return new ArrayList<>(all);
    }

    /** Lowercased text in the three shapes the tiers need. */
    static final class TextView {
        final String raw;
        final String normalized;
        final List<String> tokenList;
        final Set<String> tokens;

        TextView(String raw) {
            this.raw        = raw;
            this.normalized = TextMatching.normalize(raw);
            this.tokenList  = TextMatching.tokens(raw);
            this.tokens     = new HashSet<>(tokenList);
        }
    }
}
