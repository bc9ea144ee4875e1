package com.openforge.docrouter.knowledge.procedural;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.docrouter.domain.ClassificationPattern;
import com.openforge.docrouter.domain.ConflictType;
import com.openforge.docrouter.domain.FactKind;
import com.openforge.docrouter.knowledge.ConflictFinding;
import com.openforge.docrouter.knowledge.Fingerprints;
import com.openforge.docrouter.knowledge.JpaKnowledgeStore;
import com.openforge.docrouter.knowledge.KnowledgeValidationException;
import com.openforge.docrouter.repository.ClassificationPatternRepository;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Classification patterns keyed by asset type + pattern text. The same
 * pattern voting for two categories of one asset type is a contradiction;
 * a changed weight is a refinement.
 */
@Component
public class ClassificationPatternStore extends JpaKnowledgeStore<ClassificationPattern> {

    public ClassificationPatternStore(ClassificationPatternRepository repository, ObjectMapper objectMapper) {
        super(repository, objectMapper, ClassificationPattern.class);
    }

    @Override
    public FactKind kind() {
        return FactKind.CLASSIFICATION_PATTERN;
    }

    @Override
    public void validate(ClassificationPattern candidate) {
        require(candidate.getAssetType(), "asset_type");
        candidate.setCategory(require(candidate.getCategory(), "category").toLowerCase(Locale.ROOT));
        String pattern = require(candidate.getPattern(), "pattern");
        try {
            Pattern.compile(pattern, Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException e) {
            throw new KnowledgeValidationException("pattern '%s' is not a valid expression: %s"
                    .formatted(pattern, e.getDescription()));
        }
        candidate.setPattern(pattern);
        requireUnit(candidate.getWeight(), "weight");
        if (candidate.getWeight() == 0.0) {
            throw new KnowledgeValidationException("weight must be positive");
        }
        require(candidate.getConfidenceTier(), "confidence");
    }

    @Override
    public String identityKey(ClassificationPattern candidate) {
        return candidate.getAssetType().value() + "|" + candidate.getPattern().strip().toLowerCase(Locale.ROOT);
    }

    @Override
    public String fingerprint(ClassificationPattern fact) {
        return Fingerprints.of(fact.getAssetType(), fact.getCategory(), fact.getPattern(), fact.getWeight());
    }

    @Override
    public List<ConflictFinding> detectConflicts(ClassificationPattern existing, ClassificationPattern candidate) {
        if (!existing.getCategory().equals(candidate.getCategory())) {
            return List.of(ConflictFinding.of(ConflictType.RULE_CONTRADICTION, "category",
                    existing.getCategory(), candidate.getCategory()));
        }
        return List.of();
    }

    @Override
    public void applyCandidate(ClassificationPattern existing, ClassificationPattern candidate) {
        existing.setCategory(candidate.getCategory());
        existing.setWeight(candidate.getWeight());
        existing.setConfidenceTier(candidate.getConfidenceTier());
    }

    @Override
    public boolean merge(ClassificationPattern existing, ClassificationPattern candidate) {
        if (Double.compare(existing.getWeight(), candidate.getWeight()) == 0) return false;
        existing.setWeight(candidate.getWeight());
        return true;
    }
}
