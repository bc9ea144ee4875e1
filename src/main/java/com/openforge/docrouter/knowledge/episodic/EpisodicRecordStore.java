package com.openforge.docrouter.knowledge.episodic;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.docrouter.domain.EpisodicRecord;
import com.openforge.docrouter.domain.FactKind;
import com.openforge.docrouter.knowledge.ConflictFinding;
import com.openforge.docrouter.knowledge.Fingerprints;
import com.openforge.docrouter.knowledge.JpaKnowledgeStore;
import com.openforge.docrouter.repository.EpisodicRecordRepository;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;

@Component
public class EpisodicRecordStore extends JpaKnowledgeStore<EpisodicRecord> {

    public EpisodicRecordStore(EpisodicRecordRepository repository, ObjectMapper objectMapper) {
        super(repository, objectMapper, EpisodicRecord.class);
    }

    @Override
    public FactKind kind() {
        return FactKind.EPISODE;
    }

    @Override
    public void validate(EpisodicRecord candidate) {
        candidate.setFilename(require(candidate.getFilename(), "filename"));
        candidate.setPredictedCategory(require(candidate.getPredictedCategory(), "predicted_category"));
        require(candidate.getSource(), "source");
        requireUnit(candidate.getConfidence(), "confidence");
        if (candidate.getOccurredAt() == null) {
            candidate.setOccurredAt(LocalDateTime.now());
        }
    }

    @Override
    public String identityKey(EpisodicRecord candidate) {
        return null;
    }

    /** Timestamp excluded: replaying the same decision is a duplicate, not a new episode. */
    @Override
    public String fingerprint(EpisodicRecord fact) {
        return Fingerprints.of(fact.getFilename(), fact.getSubjectExcerpt(), fact.getPredictedCategory(),
                fact.getAssetId(), fact.getAssetType(), String.format(Locale.ROOT, "%.4f", fact.getConfidence()), fact.getSource());
    }

    @Override
    public List<ConflictFinding> detectConflicts(EpisodicRecord existing, EpisodicRecord candidate) {
        return List.of();
    }

    @Override
    public void applyCandidate(EpisodicRecord existing, EpisodicRecord candidate) {
        // append-only facts never collide on an identity key
    }
}
