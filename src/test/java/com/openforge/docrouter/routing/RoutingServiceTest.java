package com.openforge.docrouter.routing;

import com.openforge.docrouter.domain.ReviewItem;
import com.openforge.docrouter.domain.ReviewOutcome;
import com.openforge.docrouter.domain.ReviewReason;
import com.openforge.docrouter.domain.ReviewStatus;
import com.openforge.docrouter.knowledge.KnowledgeValidationException;
import com.openforge.docrouter.knowledge.bootstrap.KnowledgeBootstrapService;
import com.openforge.docrouter.knowledge.contact.ContactStore;
import com.openforge.docrouter.routing.dto.Attachment;
import com.openforge.docrouter.routing.dto.EmailMessage;
import com.openforge.docrouter.routing.dto.EmailRoutingResult;
import com.openforge.docrouter.routing.dto.FeedbackReceipt;
import com.openforge.docrouter.routing.dto.FeedbackRequest;
import com.openforge.docrouter.routing.dto.ReviewResolutionRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties =
        "spring.datasource.url=jdbc:h2:mem:routing;MODE=MySQL;DB_CLOSE_DELAY=-1;DATABASE_TO_LOWER=TRUE")
@ActiveProfiles("test")
class RoutingServiceTest {

    @Autowired private KnowledgeBootstrapService bootstrapService;
    @Autowired private RoutingService            routingService;
    @Autowired private EmailProcessingService    emailProcessing;
    @Autowired private FeedbackService           feedbackService;
    @Autowired private ReviewQueueService        reviewQueue;
    @Autowired private ContactStore              contactStore;

    @BeforeEach
    void loadKnowledge() {
        bootstrapService.bootstrap();
    }

    private static Attachment attachment(String filename) {
        return new Attachment(filename, "content".getBytes(StandardCharsets.UTF_8));
    }

    private RoutingDecision route(String sender, String subject, String body, String filename) {
        Attachment file = attachment(filename);
        return routingService.classifyAttachment(new EmailMessage(sender, subject, body, List.of(file)), file);
    }

    @Test
    void loanDocsForI3AreStoredUnderTheAsset() {
        RoutingDecision decision = route("unknown@lender.test", "i3 loan docs",
                "attached find the loan documents for the i3 deal", "RLV_TRM_i3_TD.pdf");

        assertEquals(RoutingStatus.STORED, decision.status());
        assertEquals(RoutingBand.HIGH, decision.band());
        assertEquals("I3", decision.assetId());
        assertEquals("loan_documents", decision.category());
        assertTrue(decision.assetConfidence() > 0.6);
        assertEquals("I3/loan_documents", decision.location());
        assertFalse(decision.requiresConfirmation());
        assertNull(decision.reviewItemId());
    }

    @Test
    void mediumConfidenceIsStoredButFlaggedForConfirmation() {
        RoutingDecision decision = route("analyst@nowhere.test", "northwind board deck", "", "nw_board_deck.pdf");

        assertEquals(RoutingBand.MEDIUM, decision.band());
        assertEquals(RoutingStatus.STORED, decision.status());
        assertTrue(decision.requiresConfirmation());
        assertEquals("NORTHWIND", decision.assetId());
        assertEquals("board_materials", decision.category());
        assertEquals(0.79, decision.confidence(), 1e-9);
        assertEquals("NORTHWIND/board_materials", decision.location());
        assertNull(decision.reviewItemId());
    }

    @Test
    void lowConfidenceGoesToTheAssetsNeedsReviewFolder() {
        RoutingDecision decision = route("analyst@nowhere.test", "misc scans", "", "nwhq_misc.pdf");

        assertEquals(RoutingBand.LOW, decision.band());
        assertEquals(RoutingStatus.PENDING_REVIEW, decision.status());
        assertEquals(ReviewReason.LOW_CONFIDENCE, decision.reviewReason());
        assertEquals("NORTHWIND", decision.assetId());
        assertEquals(0.59, decision.confidence(), 1e-9);
        assertEquals("NORTHWIND/needs_review", decision.location());
        assertFalse(decision.requiresConfirmation());
        assertNotNull(decision.reviewItemId());
        assertTrue(reviewQueue.pending().stream().anyMatch(i -> i.getId().equals(decision.reviewItemId())));
    }

    @Test
    void disallowedFileTypeGoesToReview() {
        RoutingDecision decision = route("agency@i3verticals-lender.com", "i3 installer", "", "setup.exe");

        assertEquals(RoutingStatus.PENDING_REVIEW, decision.status());
        assertEquals(ReviewReason.INVALID_FILE_TYPE, decision.reviewReason());
        assertEquals("to_be_reviewed/invalid_file_type", decision.location());
        assertNull(decision.assetId());
        assertNotNull(decision.reviewItemId());
        assertTrue(reviewQueue.pending().stream().anyMatch(i -> i.getId().equals(decision.reviewItemId())));
    }

    @Test
    void unknownAssetGoesToTheNoMatchBucket() {
        RoutingDecision decision = route("someone@elsewhere.test", "hello there", "see attached", "scan_0042.pdf");

        assertEquals(RoutingStatus.PENDING_REVIEW, decision.status());
        assertEquals(ReviewReason.NO_ASSET_MATCH, decision.reviewReason());
        assertEquals("to_be_reviewed/no_asset_match", decision.location());
        assertTrue(decision.candidates().isEmpty());
    }

    @Test
    void feedbackRaisesConfidenceForSimilarAttachments() {
        String subject = "gridline site photos";
        String filename = "gridline_site_photos_march.pdf";

        RoutingDecision before = route("field@contractor.test", subject, "", filename);
        assertEquals("GRIDLINE", before.assetId());

        FeedbackReceipt receipt = feedbackService.recordFeedback(new FeedbackRequest(filename, "field@contractor.test",
                subject, "", "operations_reports", "GRIDLINE", before.category(), "analyst"));
        assertNotNull(receipt.episodeId());
        assertTrue(receipt.senderLearned());

        RoutingDecision after = route("field@contractor.test", subject, "", filename);

        assertEquals("GRIDLINE", after.assetId());
        assertEquals("operations_reports", after.category());
        assertTrue(after.categoryConfidence() > before.categoryConfidence());
        assertTrue(after.confidence() > before.confidence());
        assertTrue(contactStore.find("field@contractor.test").orElseThrow().getAssetIds().contains("GRIDLINE"));
    }

    @Test
    void feedbackForUnknownAssetIsRejected() {
        assertThrows(KnowledgeValidationException.class, () -> feedbackService.recordFeedback(new FeedbackRequest(
                "x.pdf", null, null, null, "loan_documents", "NO-SUCH-ASSET", null, null)));
    }

    @Test
    void reviewItemResolvesExactlyOnce() {
        RoutingDecision decision = route("ops@nowhere.test", "macro", "", "payload.docm");
        Long itemId = decision.reviewItemId();
        assertNotNull(itemId);

        assertThrows(KnowledgeValidationException.class, () -> reviewQueue.resolve(itemId,
                new ReviewResolutionRequest(ReviewOutcome.STORED, "loan_documents", null, "analyst")));

        ReviewItem resolved = reviewQueue.resolve(itemId,
                new ReviewResolutionRequest(ReviewOutcome.DISCARDED, null, null, "analyst"));

        assertEquals(ReviewStatus.RESOLVED, resolved.getStatus());
        assertEquals(ReviewOutcome.DISCARDED, resolved.getOutcome());
        assertTrue(reviewQueue.pending().stream().noneMatch(i -> i.getId().equals(itemId)));
        assertThrows(IllegalStateException.class, () -> reviewQueue.resolve(itemId,
                new ReviewResolutionRequest(ReviewOutcome.DISCARDED, null, null, "analyst")));
        assertThrows(NoSuchElementException.class, () -> reviewQueue.resolve(Long.MAX_VALUE,
                new ReviewResolutionRequest(ReviewOutcome.DISCARDED, null, null, "analyst")));
    }

    @Test
    void storeResolutionWithUnknownAssetLeavesItemPending() {
        RoutingDecision decision = route("ops@nowhere.test", "macro again", "", "payload_two.docm");
        Long itemId = decision.reviewItemId();
        assertNotNull(itemId);

        KnowledgeValidationException e = assertThrows(KnowledgeValidationException.class, () -> reviewQueue.resolve(
                itemId, new ReviewResolutionRequest(ReviewOutcome.STORED, "loan_documents", "TYPO-ASSET", "analyst")));
        assertTrue(e.getMessage().contains("TYPO-ASSET"));
        assertTrue(reviewQueue.pending().stream().anyMatch(i -> i.getId().equals(itemId)));

        ReviewItem resolved = reviewQueue.resolve(itemId,
                new ReviewResolutionRequest(ReviewOutcome.STORED, "loan_documents", "i3", "analyst"));

        assertEquals(ReviewStatus.RESOLVED, resolved.getStatus());
        assertEquals(ReviewOutcome.STORED, resolved.getOutcome());
        assertEquals("I3", resolved.getResolvedAssetId());
    }

    @Test
    void emailAttachmentsAreRoutedIndependently() {
        EmailMessage email = new EmailMessage("pm@harborpointplaza.com", "Harbor Point rent roll",
                "monthly rent roll attached", List.of(attachment("hpp_rent_roll_may.xlsx"), attachment("tool.exe")));

        EmailRoutingResult result = emailProcessing.processEmail(email);

        assertEquals(2, result.decisions().size());
        assertTrue(result.failures().isEmpty());
        RoutingDecision rentRoll = result.decisions().stream()
                .filter(d -> d.filename().equals("hpp_rent_roll_may.xlsx")).findFirst().orElseThrow();
        assertEquals("HARBOR-POINT", rentRoll.assetId());
        assertEquals("rent_roll", rentRoll.category());
        assertEquals(RoutingStatus.STORED, rentRoll.status());
        RoutingDecision tool = result.decisions().stream()
                .filter(d -> d.filename().equals("tool.exe")).findFirst().orElseThrow();
        assertEquals(ReviewReason.INVALID_FILE_TYPE, tool.reviewReason());
    }
}
