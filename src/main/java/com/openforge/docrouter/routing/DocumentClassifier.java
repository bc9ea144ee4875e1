package com.openforge.docrouter.routing;

import com.openforge.docrouter.domain.AssetType;
import com.openforge.docrouter.domain.ClassificationPattern;
import com.openforge.docrouter.domain.EpisodicRecord;
import com.openforge.docrouter.knowledge.procedural.ClassificationProperties;
import com.openforge.docrouter.memory.ExperienceProperties;
import com.openforge.docrouter.memory.SimilarExperience;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Picks the document category for an attachment of a known asset type.
 *
 * Score per allowed category = min(Σ weight of matching patterns + experience hint, 1.0).
 * The best category wins (ties go to the earlier category in the allowed
 * list); with nothing firing the fallback category is used. Business-rule
 * adjustments are added on top and the result is clipped to [0,1].
 */
@Slf4j
@Component
public class DocumentClassifier {

    private final ClassificationProperties properties;
    private final ExperienceProperties     experience;

    /** Compiled patterns by source text; empty for expressions that do not compile. */
    private final Map<String, Optional<Pattern>> compiled = new ConcurrentHashMap<>();

    public DocumentClassifier(ClassificationProperties properties, ExperienceProperties experience) {
        this.properties = properties;
        this.experience = experience;
    }

    public CategoryMatch classify(AssetType assetType,
                                  String filename,
                                  String subject,
                                  String body,
                                  List<String> allowedCategories,
                                  List<ClassificationPattern> patterns,
                                  ClassificationSignals signals) {
        String name = filename == null ? "" : filename;
        String subj = subject == null ? "" : subject;
        String text = (name + " " + subj + " " + (body == null ? "" : body)).toLowerCase(Locale.ROOT);
        ClassificationSignals context = signals == null ? ClassificationSignals.none() : signals;

        List<String> rationale = new ArrayList<>();
        Map<String, Double> scores = new LinkedHashMap<>();
        for (String category : allowedCategories) scores.put(category, 0.0);

        if (patterns != null) {
            for (ClassificationPattern p : patterns) {
                if (!scores.containsKey(p.getCategory())) continue;
                Optional<Pattern> regex = compile(p.getPattern());
                if (regex.isEmpty() || !regex.get().matcher(text).find()) continue;
                scores.merge(p.getCategory(), p.getWeight(), Double::sum);
                rationale.add("pattern '%s' → %s +%.2f".formatted(p.getPattern(), p.getCategory(), p.getWeight()));
            }
        }

        Map<String, Double> hints = experienceHints(context.experiences());
        hints.forEach((category, hint) -> {
            if (scores.containsKey(category)) {
                scores.merge(category, hint, Double::sum);
                rationale.add("similar episodes → %s +%.2f".formatted(category, hint));
            }
        });

        String best = null;
        double bestScore = 0.0;
        for (Map.Entry<String, Double> e : scores.entrySet()) {
            double capped = Math.min(e.getValue(), 1.0);
            if (capped > bestScore) {
                best = e.getKey();
                bestScore = capped;
            }
        }

        boolean fallback = best == null;
        if (fallback) {
            best = properties.fallbackCategory();
            bestScore = properties.fallbackConfidence();
            rationale.add("no pattern matched, fallback %s at %.2f".formatted(best, bestScore));
        }

        double adjusted = bestScore + adjustments(name, subj, context.trustedSender(), rationale);
        double confidence = TextMatching.clip(adjusted);

        log.debug("[Classify] {} ({}) → {} {}", name, assetType, best, confidence);
        return new CategoryMatch(best, confidence, fallback, List.copyOf(rationale));
    }

    // ── Adjustments ──────────────────────────────────────────────────────────

    private double adjustments(String filename, String subject, boolean trustedSender, List<String> rationale) {
        String lowerName = filename.toLowerCase(Locale.ROOT);
        String lowerSubject = subject.toLowerCase(Locale.ROOT);
        double total = 0.0;

        for (String keyword : properties.professionalKeywords()) {
            if (lowerName.contains(keyword.toLowerCase(Locale.ROOT))) {
                total += properties.professionalKeywordBonus();
                rationale.add("professional keyword '%s' in filename +%.2f".formatted(keyword, properties.professionalKeywordBonus()));
                break;
            }
        }
        for (String extension : properties.documentExtensions()) {
            if (lowerName.endsWith(extension.toLowerCase(Locale.ROOT))) {
                total += properties.documentExtensionBonus();
                rationale.add("document format %s +%.2f".formatted(extension, properties.documentExtensionBonus()));
                break;
            }
        }
        if (subject.length() > properties.subjectMinLength()) {
            for (String keyword : properties.subjectKeywords()) {
                if (lowerSubject.contains(keyword.toLowerCase(Locale.ROOT))) {
                    total += properties.subjectKeywordBonus();
                    rationale.add("subject keyword '%s' +%.2f".formatted(keyword, properties.subjectKeywordBonus()));
                    break;
                }
            }
        }
        if (trustedSender) {
            total += properties.trustedSenderBonus();
            rationale.add("trusted sender +%.2f".formatted(properties.trustedSenderBonus()));
        }
        return total;
    }

    /** Per category: strongest human hint plus strongest automatic hint. */
    private Map<String, Double> experienceHints(List<SimilarExperience> experiences) {
        Map<String, Double> human = new HashMap<>();
        Map<String, Double> auto = new HashMap<>();
        for (SimilarExperience hit : experiences) {
            EpisodicRecord record = hit.record();
            if (record.getPredictedCategory() == null) continue;
            if (record.isCorrection()) {
                human.merge(record.getPredictedCategory(), experience.humanWeight() * hit.similarity(), Math::max);
            } else {
                auto.merge(record.getPredictedCategory(), experience.autoWeight() * hit.similarity(), Math::max);
            }
        }
        Map<String, Double> hints = new LinkedHashMap<>(human);
        auto.forEach((category, value) -> hints.merge(category, value, Double::sum));
        return hints;
    }

    private Optional<Pattern> compile(String source) {
        return compiled.computeIfAbsent(source, s -> {
            try {
                return Optional.of(Pattern.compile(s, Pattern.CASE_INSENSITIVE));
            } catch (PatternSyntaxException e) {
                log.warn("[Classify] Skipping invalid pattern '{}': {}", s, e.getDescription());
                return Optional.empty();
            }
        });
    }
}
