package com.openforge.docrouter.knowledge.semantic;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.docrouter.domain.FactKind;
import com.openforge.docrouter.domain.FeedbackRecord;
import com.openforge.docrouter.knowledge.ConflictFinding;
import com.openforge.docrouter.knowledge.Fingerprints;
import com.openforge.docrouter.knowledge.JpaKnowledgeStore;
import com.openforge.docrouter.repository.FeedbackRecordRepository;
import org.springframework.stereotype.Component;

import java.util.List;

/** Human corrections. Append-only, so the only gate check is the fingerprint. */
@Component
public class FeedbackRecordStore extends JpaKnowledgeStore<FeedbackRecord> {

    public FeedbackRecordStore(FeedbackRecordRepository repository, ObjectMapper objectMapper) {
        super(repository, objectMapper, FeedbackRecord.class);
    }

    @Override
    public FactKind kind() {
        return FactKind.FEEDBACK;
    }

    @Override
    public void validate(FeedbackRecord candidate) {
        candidate.setFilename(require(candidate.getFilename(), "filename"));
        candidate.setCorrectedCategory(require(candidate.getCorrectedCategory(), "corrected_category"));
        require(candidate.getConfidenceTier(), "confidence");
    }

    @Override
    public String identityKey(FeedbackRecord candidate) {
        return null;
    }

    @Override
    public String fingerprint(FeedbackRecord fact) {
        return Fingerprints.of(fact.getFilename(), fact.getEmailSubject(), fact.getCorrectedCategory(),
                fact.getCorrectedAssetId(), fact.getOriginalPrediction(), fact.getCorrectedBy());
    }

    @Override
    public List<ConflictFinding> detectConflicts(FeedbackRecord existing, FeedbackRecord candidate) {
        return List.of();
    }

    @Override
    public void applyCandidate(FeedbackRecord existing, FeedbackRecord candidate) {
        // append-only facts never collide on an identity key
    }
}
