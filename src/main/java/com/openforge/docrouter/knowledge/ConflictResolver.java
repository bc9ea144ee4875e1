package com.openforge.docrouter.knowledge;

import com.openforge.docrouter.domain.ConfidenceTier;
import com.openforge.docrouter.domain.ResolutionAction;
import org.springframework.stereotype.Component;

/**
 * Decides what happens when a candidate contradicts a stored fact.
 *
 *   candidate rank > existing rank + margin → UPDATE
 *   existing rank  > candidate rank         → REJECT
 *   otherwise                               → HUMAN_REVIEW
 *
 * With the default margin of 1 a candidate exactly one tier above the stored
 * fact is not enough to overwrite it and goes to a human.
 */
@Component
public class ConflictResolver {

    private final int margin;

    public ConflictResolver(KnowledgeProperties properties) {
        this.margin = properties.confidenceMargin();
    }

    public ResolutionAction decide(ConfidenceTier existing, ConfidenceTier candidate) {
        return decide(existing.rank(), candidate.rank(), margin);
    }

    public static ResolutionAction decide(int existingRank, int candidateRank, int margin) {
        if (candidateRank > existingRank + margin) return ResolutionAction.UPDATE;
        if (existingRank > candidateRank) return ResolutionAction.REJECT;
        return ResolutionAction.HUMAN_REVIEW;
    }
}
