package com.openforge.docrouter.routing;

import com.openforge.docrouter.domain.AssetProfile;
import com.openforge.docrouter.domain.AssetType;
import com.openforge.docrouter.domain.EpisodicRecord;
import com.openforge.docrouter.domain.ExperienceSource;
import com.openforge.docrouter.domain.FeedbackRecord;
import com.openforge.docrouter.knowledge.IngestResult;
import com.openforge.docrouter.knowledge.KnowledgeValidationException;
import com.openforge.docrouter.knowledge.contact.ContactStore;
import com.openforge.docrouter.knowledge.episodic.EpisodicStore;
import com.openforge.docrouter.knowledge.semantic.SemanticStore;
import com.openforge.docrouter.routing.dto.FeedbackReceipt;
import com.openforge.docrouter.routing.dto.FeedbackRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * Records a human correction.
 *
 * Three writes, each through the gate: a feedback fact, a human-correction
 * episode (which later lifts similar attachments towards the corrected asset
 * and category), and a learned sender association when both sender and
 * asset are known.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeedbackService {

    static final int EXCERPT_LENGTH = 500;

    private final SemanticStore semanticStore;
    private final EpisodicStore episodicStore;
    private final ContactStore  contactStore;

    public FeedbackReceipt recordFeedback(FeedbackRequest request) {
        if (request.filename() == null || request.filename().isBlank()) {
            throw new KnowledgeValidationException("feedback requires a filename");
        }
        if (request.correctedCategory() == null || request.correctedCategory().isBlank()) {
            throw new KnowledgeValidationException("feedback requires a corrected category");
        }

        try {
            AssetType assetType = null;
            String assetId = blankToNull(request.correctedAssetId());
            if (assetId != null) {
                AssetProfile asset = semanticStore.findAsset(assetId)
                        .orElseThrow(() -> new KnowledgeValidationException("unknown asset: " + request.correctedAssetId()));
                assetId = asset.getAssetId();
                assetType = asset.getAssetType();
            }
            String correctedBy = request.correctedBy() == null || request.correctedBy().isBlank()
                    ? "reviewer" : request.correctedBy();

            IngestResult feedback = semanticStore.ingestFeedback(FeedbackRecord.builder()
                    .filename(request.filename())
                    .emailSubject(excerpt(request.subject()))
                    .bodyExcerpt(excerpt(request.body()))
                    .correctedCategory(request.correctedCategory())
                    .correctedAssetId(assetId)
                    .assetType(assetType)
                    .originalPrediction(request.originalPrediction())
                    .correctedBy(correctedBy)
                    .build());

            IngestResult episode = episodicStore.append(EpisodicRecord.builder()
                    .filename(request.filename())
                    .subjectExcerpt(excerpt(request.subject()))
                    .bodyExcerpt(excerpt(request.body()))
                    .predictedCategory(request.correctedCategory())
                    .assetId(assetId)
                    .assetType(assetType)
                    .confidence(1.0)
                    .source(ExperienceSource.HUMAN_CORRECTION)
                    .occurredAt(LocalDateTime.now())
                    .build());

            boolean learned = false;
            if (assetId != null && request.sender() != null && !request.sender().isBlank()) {
                contactStore.learnAssociation(request.sender(), assetId);
                learned = true;
            }

            log.info("[Feedback] {} corrected to {}/{} by {} (feedback {}, episode {})",
                    request.filename(), assetId, request.correctedCategory(), correctedBy,
                    feedback.outcome(), episode.outcome());
            return new FeedbackReceipt(feedback.factId(), feedback.outcome(),
                    episode.factId(), episode.outcome(), learned);
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("feedback for " + request.filename() + " could not be stored", e);
        }
    }

    static String excerpt(String text) {
        if (text == null) return null;
        return text.length() <= EXCERPT_LENGTH ? text : text.substring(0, EXCERPT_LENGTH);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }
}
