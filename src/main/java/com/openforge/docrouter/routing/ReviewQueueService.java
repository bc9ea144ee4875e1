package com.openforge.docrouter.routing;

import com.openforge.docrouter.domain.AssetProfile;
import com.openforge.docrouter.domain.ReviewItem;
import com.openforge.docrouter.domain.ReviewOutcome;
import com.openforge.docrouter.domain.ReviewStatus;
import com.openforge.docrouter.knowledge.KnowledgeValidationException;
import com.openforge.docrouter.knowledge.semantic.SemanticStore;
import com.openforge.docrouter.routing.dto.FeedbackReceipt;
import com.openforge.docrouter.routing.dto.FeedbackRequest;
import com.openforge.docrouter.routing.dto.ReviewResolutionRequest;
import com.openforge.docrouter.repository.ReviewItemRepository;
import com.openforge.docrouter.websocket.EventType;
import com.openforge.docrouter.websocket.RoutingEventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Human review task queue.
 *
 * Items move PENDING → RESOLVED exactly once; the entity's version column
 * turns a second concurrent resolution into a 409. Every resolution is fed
 * back as a human correction, including discards. The state change and the
 * correction commit together: an item whose feedback fails stays PENDING.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReviewQueueService {

    /** Category recorded for corrections where the reviewer threw the document away. */
    public static final String DISCARDED_CATEGORY = "discarded";

    private final ReviewItemRepository  repository;
    private final SemanticStore         semanticStore;
    private final FeedbackService       feedbackService;
    private final DocumentSink          documentSink;
    private final RoutingProperties     routingProperties;
    private final RoutingEventPublisher eventPublisher;

    public ReviewItem enqueue(ReviewItem item) {
        ReviewItem saved = repository.save(item);
        log.info("[Review] Queued {} at {} ({}, confidence {})",
                saved.getFilename(), saved.getLocation(), saved.getReason(), saved.getConfidence());
        eventPublisher.publish(EventType.REVIEW_QUEUED, String.valueOf(saved.getId()),
                Map.of("reason", saved.getReason(), "location", saved.getLocation()));
        return saved;
    }

    public List<ReviewItem> pending() {
        return repository.findByStatusOrderByCreateTimeAsc(ReviewStatus.PENDING);
    }

    @Transactional
    public ReviewItem resolve(Long id, ReviewResolutionRequest request) {
        ReviewItem item = repository.findById(id)
                .orElseThrow(() -> new NoSuchElementException("review item not found: " + id));
        if (item.getStatus() == ReviewStatus.RESOLVED) {
            throw new IllegalStateException("review item " + id + " is already resolved (" + item.getOutcome() + ")");
        }

        boolean stored = request.outcome() == ReviewOutcome.STORED;
        if (stored && (isBlank(request.category()) || isBlank(request.assetId()))) {
            throw new KnowledgeValidationException("storing a review item requires both category and asset id");
        }
        String assetId = null;
        if (stored) {
            assetId = semanticStore.findAsset(request.assetId())
                    .map(AssetProfile::getAssetId)
                    .orElseThrow(() -> new KnowledgeValidationException("unknown asset: " + request.assetId()));
        }
        String resolvedBy = isBlank(request.resolvedBy()) ? "reviewer" : request.resolvedBy();

        item.setStatus(ReviewStatus.RESOLVED);
        item.setOutcome(request.outcome());
        item.setResolvedCategory(stored ? request.category() : null);
        item.setResolvedAssetId(assetId);
        item.setResolvedBy(resolvedBy);
        item.setResolvedAt(LocalDateTime.now());
        ReviewItem saved;
        try {
            saved = repository.saveAndFlush(item);
        } catch (OptimisticLockingFailureException e) {
            throw new IllegalStateException("review item " + id + " was resolved concurrently", e);
        }

        FeedbackReceipt receipt = feedbackService.recordFeedback(new FeedbackRequest(
                item.getFilename(),
                item.getSenderAddress(),
                item.getEmailSubject(),
                item.getBodyExcerpt(),
                stored ? request.category() : DISCARDED_CATEGORY,
                assetId,
                item.getPredictedCategory(),
                resolvedBy));

        if (stored) {
            documentSink.relocate(item.getLocation(), item.getFilename(), assetId + "/" + request.category());
        } else {
            documentSink.discard(item.getLocation(), item.getFilename());
        }

        log.info("[Review] Item {} resolved as {} by {} (episode {})",
                id, request.outcome(), resolvedBy, receipt.episodeId());
        eventPublisher.publish(EventType.REVIEW_RESOLVED, String.valueOf(id), Map.of(
                "outcome", request.outcome(),
                "location", stored ? assetId + "/" + request.category() : routingProperties.reviewRoot()));
        return saved;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
