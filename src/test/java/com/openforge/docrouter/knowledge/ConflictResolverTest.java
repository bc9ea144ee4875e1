package com.openforge.docrouter.knowledge;

import com.openforge.docrouter.domain.ConfidenceTier;
import com.openforge.docrouter.domain.ResolutionAction;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConflictResolverTest {

    private final ConflictResolver resolver =
            new ConflictResolver(new KnowledgeProperties(1, 64, false, "classpath:knowledge/"));

    @Test
    void equalTiersAlwaysGoToHumanReview() {
        for (ConfidenceTier tier : ConfidenceTier.values()) {
            assertEquals(ResolutionAction.HUMAN_REVIEW, resolver.decide(tier, tier), tier.name());
        }
    }

    @Test
    void candidateMustBeatExistingByMoreThanTheMargin() {
        assertEquals(ResolutionAction.UPDATE, resolver.decide(ConfidenceTier.LOW, ConfidenceTier.HIGH));
        assertEquals(ResolutionAction.UPDATE, resolver.decide(ConfidenceTier.EXPERIMENTAL, ConfidenceTier.MEDIUM));
        assertEquals(ResolutionAction.HUMAN_REVIEW, resolver.decide(ConfidenceTier.MEDIUM, ConfidenceTier.HIGH));
    }

    @Test
    void weakerCandidateIsRejected() {
        assertEquals(ResolutionAction.REJECT, resolver.decide(ConfidenceTier.HIGH, ConfidenceTier.LOW));
        assertEquals(ResolutionAction.REJECT, resolver.decide(ConfidenceTier.MEDIUM, ConfidenceTier.LOW));
    }

    @Test
    void decisionDependsOnlyOnRanksAndMargin() {
        for (int existing = 1; existing <= 4; existing++) {
            for (int candidate = 1; candidate <= 4; candidate++) {
                ResolutionAction first = ConflictResolver.decide(existing, candidate, 1);
                assertEquals(first, ConflictResolver.decide(existing, candidate, 1));
            }
        }
        assertEquals(ResolutionAction.UPDATE, ConflictResolver.decide(2, 3, 0));
        assertEquals(ResolutionAction.HUMAN_REVIEW, ConflictResolver.decide(2, 3, 1));
    }
}
