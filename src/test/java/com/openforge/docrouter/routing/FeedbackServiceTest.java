package com.openforge.docrouter.routing;

import com.openforge.docrouter.domain.AssetProfile;
import com.openforge.docrouter.domain.AssetType;
import com.openforge.docrouter.domain.EpisodicRecord;
import com.openforge.docrouter.domain.ExperienceSource;
import com.openforge.docrouter.domain.FeedbackRecord;
import com.openforge.docrouter.knowledge.IngestOutcome;
import com.openforge.docrouter.knowledge.IngestResult;
import com.openforge.docrouter.knowledge.KnowledgeValidationException;
import com.openforge.docrouter.knowledge.contact.ContactStore;
import com.openforge.docrouter.knowledge.episodic.EpisodicStore;
import com.openforge.docrouter.knowledge.semantic.SemanticStore;
import com.openforge.docrouter.routing.dto.FeedbackReceipt;
import com.openforge.docrouter.routing.dto.FeedbackRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FeedbackServiceTest {

    private SemanticStore   semanticStore;
    private EpisodicStore   episodicStore;
    private ContactStore    contactStore;
    private FeedbackService service;

    @BeforeEach
    void setUp() {
        semanticStore = mock(SemanticStore.class);
        episodicStore = mock(EpisodicStore.class);
        contactStore  = mock(ContactStore.class);
        service = new FeedbackService(semanticStore, episodicStore, contactStore);

        when(semanticStore.findAsset("i3")).thenReturn(Optional.of(AssetProfile.builder()
                .assetId("I3").dealName("I3 Verticals").assetType(AssetType.PRIVATE_CREDIT)
                .identifiers(List.of("i3")).build()));
        when(semanticStore.ingestFeedback(any())).thenReturn(IngestResult.of(IngestOutcome.INSERTED, 11L, "new fact"));
        when(episodicStore.append(any())).thenReturn(IngestResult.of(IngestOutcome.INSERTED, 22L, "new fact"));
    }

    @Test
    void correctionIsRecordedAsHumanEpisode() {
        FeedbackReceipt receipt = service.recordFeedback(new FeedbackRequest("RLV_TRM_i3_TD.pdf",
                "agent@lender.test", "i3 loan docs", "body", "loan_documents", "i3", "uncategorized", "analyst"));

        assertEquals(11L, receipt.feedbackId());
        assertEquals(22L, receipt.episodeId());
        assertTrue(receipt.senderLearned());

        ArgumentCaptor<EpisodicRecord> episode = ArgumentCaptor.forClass(EpisodicRecord.class);
        verify(episodicStore).append(episode.capture());
        assertEquals(ExperienceSource.HUMAN_CORRECTION, episode.getValue().getSource());
        assertEquals("I3", episode.getValue().getAssetId());
        assertEquals(AssetType.PRIVATE_CREDIT, episode.getValue().getAssetType());
        assertEquals(1.0, episode.getValue().getConfidence());

        ArgumentCaptor<FeedbackRecord> feedback = ArgumentCaptor.forClass(FeedbackRecord.class);
        verify(semanticStore).ingestFeedback(feedback.capture());
        assertEquals("uncategorized", feedback.getValue().getOriginalPrediction());
        verify(contactStore).learnAssociation("agent@lender.test", "I3");
    }

    @Test
    void categoryOnlyCorrectionLearnsNoSender() {
        FeedbackReceipt receipt = service.recordFeedback(new FeedbackRequest("notes.pdf",
                "agent@lender.test", null, null, "correspondence", null, null, null));

        assertFalse(receipt.senderLearned());
        verify(contactStore, never()).learnAssociation(anyString(), anyString());
    }

    @Test
    void missingCategoryMutatesNothing() {
        assertThrows(KnowledgeValidationException.class, () -> service.recordFeedback(
                new FeedbackRequest("notes.pdf", null, null, null, " ", null, null, null)));

        verify(semanticStore, never()).ingestFeedback(any());
        verify(episodicStore, never()).append(any());
    }

    @Test
    void storageFailureIsReportedAsUnavailable() {
        when(semanticStore.ingestFeedback(any())).thenThrow(new DataAccessResourceFailureException("db down"));

        assertThrows(StorageUnavailableException.class, () -> service.recordFeedback(new FeedbackRequest(
                "notes.pdf", null, null, null, "correspondence", null, null, null)));
    }

    @Test
    void longExcerptsAreTruncated() {
        assertEquals(FeedbackService.EXCERPT_LENGTH, FeedbackService.excerpt("x".repeat(2_000)).length());
        assertNull(FeedbackService.excerpt(null));
    }
}
