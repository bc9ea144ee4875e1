package com.openforge.docrouter.knowledge.procedural;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.docrouter.domain.ConflictType;
import com.openforge.docrouter.domain.FactKind;
import com.openforge.docrouter.domain.MatchingRule;
import com.openforge.docrouter.knowledge.ConflictFinding;
import com.openforge.docrouter.knowledge.Fingerprints;
import com.openforge.docrouter.knowledge.JpaKnowledgeStore;
import com.openforge.docrouter.knowledge.KnowledgeValidationException;
import com.openforge.docrouter.repository.MatchingRuleRepository;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/** Named numeric parameters. A different value under the same name contradicts the stored rule. */
@Component
public class MatchingRuleStore extends JpaKnowledgeStore<MatchingRule> {

    public MatchingRuleStore(MatchingRuleRepository repository, ObjectMapper objectMapper) {
        super(repository, objectMapper, MatchingRule.class);
    }

    @Override
    public FactKind kind() {
        return FactKind.MATCHING_RULE;
    }

    @Override
    public void validate(MatchingRule candidate) {
        candidate.setRuleName(require(candidate.getRuleName(), "rule_name").toLowerCase(Locale.ROOT));
        if (Double.isNaN(candidate.getValue()) || Double.isInfinite(candidate.getValue())) {
            throw new KnowledgeValidationException("rule " + candidate.getRuleName() + " has no numeric value");
        }
        require(candidate.getConfidenceTier(), "confidence");
    }

    @Override
    public String identityKey(MatchingRule candidate) {
        return candidate.getRuleName().strip().toLowerCase(Locale.ROOT);
    }

    @Override
    public String fingerprint(MatchingRule fact) {
        return Fingerprints.of(fact.getRuleName(), fact.getValue(), fact.getDescription());
    }

    @Override
    public List<ConflictFinding> detectConflicts(MatchingRule existing, MatchingRule candidate) {
        if (Double.compare(existing.getValue(), candidate.getValue()) != 0) {
            return List.of(ConflictFinding.of(ConflictType.RULE_CONTRADICTION, existing.getRuleName(),
                    existing.getValue(), candidate.getValue()));
        }
        return List.of();
    }

    @Override
    public void applyCandidate(MatchingRule existing, MatchingRule candidate) {
        existing.setValue(candidate.getValue());
        existing.setDescription(candidate.getDescription());
        existing.setConfidenceTier(candidate.getConfidenceTier());
    }

    @Override
    public boolean merge(MatchingRule existing, MatchingRule candidate) {
        if (candidate.getDescription() == null || Objects.equals(existing.getDescription(), candidate.getDescription())) {
            return false;
        }
        existing.setDescription(candidate.getDescription());
        return true;
    }
}
