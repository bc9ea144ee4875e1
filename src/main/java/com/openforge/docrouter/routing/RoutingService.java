package com.openforge.docrouter.routing;

import com.openforge.docrouter.domain.AssetProfile;
import com.openforge.docrouter.domain.EpisodicRecord;
import com.openforge.docrouter.domain.ExperienceSource;
import com.openforge.docrouter.domain.FileTypeRule;
import com.openforge.docrouter.domain.ReviewItem;
import com.openforge.docrouter.domain.ReviewReason;
import com.openforge.docrouter.domain.SecurityLevel;
import com.openforge.docrouter.domain.SenderMapping;
import com.openforge.docrouter.knowledge.contact.ContactStore;
import com.openforge.docrouter.knowledge.episodic.EpisodicStore;
import com.openforge.docrouter.knowledge.procedural.ClassificationProperties;
import com.openforge.docrouter.knowledge.procedural.MatchingParameters;
import com.openforge.docrouter.knowledge.procedural.ProceduralStore;
import com.openforge.docrouter.knowledge.procedural.RoutingThresholds;
import com.openforge.docrouter.knowledge.semantic.SemanticStore;
import com.openforge.docrouter.memory.ExperienceRecall;
import com.openforge.docrouter.memory.ExperienceRecallService;
import com.openforge.docrouter.routing.dto.Attachment;
import com.openforge.docrouter.routing.dto.EmailMessage;
import com.openforge.docrouter.websocket.EventType;
import com.openforge.docrouter.websocket.RoutingEventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

/**
 * classify_attachment: the full decision for one attachment.
 *
 * Pipeline:
 *   1. file-type rule and security scan (failures go straight to review)
 *   2. similarity recall (bounded, may degrade)
 *   3. asset identification, then category classification for the best asset
 *   4. blended confidence → band
 *   5. writes: document sink or review queue, automatic episode, file-type outcome
 *
 * Steps 1-4 only read. Nothing is written until the decision is complete, and
 * an interrupted worker stops before step 5, so a cancelled classification
 * leaves every store untouched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoutingService {

    private final SemanticStore            semanticStore;
    private final ProceduralStore          proceduralStore;
    private final ContactStore             contactStore;
    private final EpisodicStore            episodicStore;
    private final ExperienceRecallService  recallService;
    private final AssetIdentifier          assetIdentifier;
    private final DocumentClassifier       documentClassifier;
    private final ReviewQueueService       reviewQueue;
    private final DocumentSink             documentSink;
    private final SecurityScanner          securityScanner;
    private final RoutingProperties        routingProperties;
    private final ClassificationProperties classificationProperties;
    private final RoutingEventPublisher    eventPublisher;

    public RoutingDecision classifyAttachment(EmailMessage email, Attachment attachment) {
        return classifyAttachment(email, attachment, () -> true);
    }

    /**
     * @param commitPermit asked once, after the decision is made and before the
     *                     first write; false abandons the attachment untouched
     * @throws CancellationException when interrupted or refused the permit
     */
    public RoutingDecision classifyAttachment(EmailMessage email, Attachment attachment, BooleanSupplier commitPermit) {
        try {
            RoutingDecision decision = decide(email, attachment);
            checkCancelled(attachment);
            if (!commitPermit.getAsBoolean()) {
                throw new CancellationException("routing of " + attachment.filename() + " was abandoned");
            }
            RoutingDecision committed = commit(email, attachment, decision);
            eventPublisher.publish(EventType.ROUTING_DECISION, attachment.filename(), committed);
            return committed;
        } catch (DataAccessException e) {
            log.error("[Route] Storage failure while routing {}: {}", attachment.filename(), e.getMessage());
            throw new StorageUnavailableException("knowledge store unavailable while routing " + attachment.filename(), e);
        }
    }

    // ── Decision (read only) ─────────────────────────────────────────────────

    RoutingDecision decide(EmailMessage email, Attachment attachment) {
        String filename = attachment.filename();
        List<String> rationale = new ArrayList<>();

        Optional<FileTypeRule> rule = semanticStore.checkFileType(filename);
        if (rule.isPresent() && (!rule.get().isAllowed() || rule.get().getSecurityLevel() == SecurityLevel.DANGEROUS)) {
            rationale.add("file type %s is not allowed (%s)".formatted(rule.get().getExtension(), rule.get().getSecurityLevel()));
            return unscored(filename, ReviewReason.INVALID_FILE_TYPE, rationale);
        }
        if (rule.isEmpty()) {
            rationale.add("no file-type rule for " + filename + ", processing anyway");
        }

        SecurityScanner.ScanResult scan = securityScanner.scan(attachment);
        if (!scan.clean()) {
            rationale.add("security scan flagged " + scan.threat());
            return unscored(filename, ReviewReason.QUARANTINED, rationale);
        }

        checkCancelled(attachment);

        IdentificationContext context = new IdentificationContext(email.sender(), email.subject(), email.body(), filename);
        ExperienceRecall recall = recallService.recall(context.recallQuery());
        if (recall.degraded()) rationale.add(recall.note());

        MatchingParameters params = proceduralStore.matchingParameters();
        RoutingThresholds thresholds = proceduralStore.routingThresholds();
        Map<String, SenderMapping> senders = contactStore.senderMap();
        List<AssetProfile> assets = semanticStore.allAssets();

        List<AssetCandidate> candidates = assetIdentifier.identify(context, assets, senders, params, recall.experiences());
        boolean trustedSender = contactStore.find(email.sender())
                .map(m -> m.getTrustScore() >= params.senderTrustFloor())
                .orElse(false);
        ClassificationSignals signals = new ClassificationSignals(trustedSender, recall.experiences());

        if (candidates.isEmpty()) {
            CategoryMatch category = documentClassifier.classify(null, filename, email.subject(), email.body(),
                    classificationProperties.defaultCategories(), List.of(), signals);
            rationale.add("no asset matched");
            rationale.addAll(category.rationale());
            String location = routingProperties.reviewRoot() + "/" + ReviewReason.NO_ASSET_MATCH.bucket();
            return new RoutingDecision(filename, RoutingStatus.PENDING_REVIEW, RoutingBand.VERY_LOW,
                    null, null, category.category(), 0.0, category.confidence(), 0.0,
                    false, ReviewReason.NO_ASSET_MATCH, location, null, recall.degraded(),
                    List.of(), List.copyOf(rationale));
        }

        AssetCandidate best = candidates.get(0);
        rationale.addAll(best.rationale());
        CategoryMatch category = documentClassifier.classify(best.assetType(), filename, email.subject(), email.body(),
                semanticStore.allowedCategories(best.assetType()),
                proceduralStore.patternsFor(best.assetType()), signals);
        rationale.addAll(category.rationale());

        double confidence = thresholds.blend(best.confidence(), category.confidence());
        RoutingBand band = RoutingBand.of(confidence, thresholds);
        rationale.add("blended %.3f → %s".formatted(confidence, band));

        String assetRoot = best.assetId();
        return switch (band) {
            case HIGH, MEDIUM -> new RoutingDecision(filename, RoutingStatus.STORED, band,
                    best.assetId(), best.assetType(), category.category(), best.confidence(), category.confidence(),
                    confidence, band == RoutingBand.MEDIUM, null, assetRoot + "/" + category.category(), null,
                    recall.degraded(), candidates, List.copyOf(rationale));
            case LOW -> new RoutingDecision(filename, RoutingStatus.PENDING_REVIEW, band,
                    best.assetId(), best.assetType(), category.category(), best.confidence(), category.confidence(),
                    confidence, false, ReviewReason.LOW_CONFIDENCE, assetRoot + "/" + routingProperties.needsReviewFolder(),
                    null, recall.degraded(), candidates, List.copyOf(rationale));
            case VERY_LOW -> new RoutingDecision(filename, RoutingStatus.PENDING_REVIEW, band,
                    best.assetId(), best.assetType(), category.category(), best.confidence(), category.confidence(),
                    confidence, false, ReviewReason.VERY_LOW_CONFIDENCE,
                    routingProperties.reviewRoot() + "/" + ReviewReason.VERY_LOW_CONFIDENCE.bucket(),
                    null, recall.degraded(), candidates, List.copyOf(rationale));
        };
    }

    private RoutingDecision unscored(String filename, ReviewReason reason, List<String> rationale) {
        return new RoutingDecision(filename, RoutingStatus.PENDING_REVIEW, RoutingBand.VERY_LOW,
                null, null, classificationProperties.fallbackCategory(), 0.0, 0.0, 0.0, false, reason,
                routingProperties.reviewRoot() + "/" + reason.bucket(), null, false,
                List.of(), List.copyOf(rationale));
    }

    // ── Commit ───────────────────────────────────────────────────────────────

    private RoutingDecision commit(EmailMessage email, Attachment attachment, RoutingDecision decision) {
        documentSink.store(decision.location(), attachment);

        Long reviewItemId = null;
        if (decision.status() == RoutingStatus.PENDING_REVIEW) {
            ReviewItem item = reviewQueue.enqueue(ReviewItem.builder()
                    .reason(decision.reviewReason())
                    .location(decision.location())
                    .assetId(decision.assetId())
                    .assetType(decision.assetType())
                    .predictedCategory(decision.category())
                    .confidence(decision.confidence())
                    .filename(decision.filename())
                    .senderAddress(email.sender())
                    .emailSubject(FeedbackService.excerpt(email.subject()))
                    .bodyExcerpt(FeedbackService.excerpt(email.body()))
                    .rationale(String.join("\n", decision.rationale()))
                    .build());
            reviewItemId = item.getId();
        }

        episodicStore.append(EpisodicRecord.builder()
                .filename(decision.filename())
                .subjectExcerpt(FeedbackService.excerpt(email.subject()))
                .bodyExcerpt(FeedbackService.excerpt(email.body()))
                .predictedCategory(decision.category())
                .assetId(decision.assetId())
                .assetType(decision.assetType())
                .confidence(decision.confidence())
                .source(ExperienceSource.AUTO)
                .occurredAt(LocalDateTime.now())
                .build());

        if (decision.status() == RoutingStatus.STORED) {
            semanticStore.recordFileTypeOutcome(decision.filename(), true);
        } else if (decision.reviewReason() == ReviewReason.QUARANTINED) {
            semanticStore.recordFileTypeOutcome(decision.filename(), false);
        }
        if (decision.assetId() != null && contactStore.find(email.sender()).isPresent()) {
            contactStore.recordInteraction(email.sender());
        }

        log.info("[Route] {} → {} ({} {}, confidence {})", decision.filename(), decision.location(),
                decision.band(), decision.status(), "%.3f".formatted(decision.confidence()));
        return new RoutingDecision(decision.filename(), decision.status(), decision.band(), decision.assetId(),
                decision.assetType(), decision.category(), decision.assetConfidence(), decision.categoryConfidence(),
                decision.confidence(), decision.requiresConfirmation(), decision.reviewReason(), decision.location(),
                reviewItemId, decision.degraded(), decision.candidates(), decision.rationale());
    }

    private static void checkCancelled(Attachment attachment) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("routing of " + attachment.filename() + " was cancelled");
        }
    }
}
