package com.openforge.docrouter.knowledge;

import com.openforge.docrouter.domain.AssetProfile;
import com.openforge.docrouter.domain.AssetType;
import com.openforge.docrouter.domain.ConfidenceTier;
import com.openforge.docrouter.domain.ConflictRecord;
import com.openforge.docrouter.domain.ConflictResolution;
import com.openforge.docrouter.domain.ConflictSeverity;
import com.openforge.docrouter.domain.ConflictType;
import com.openforge.docrouter.domain.FactKind;
import com.openforge.docrouter.domain.FileTypeRule;
import com.openforge.docrouter.domain.SecurityLevel;
import com.openforge.docrouter.domain.SenderMapping;
import com.openforge.docrouter.knowledge.contact.ContactStore;
import com.openforge.docrouter.knowledge.semantic.SemanticStore;
import com.openforge.docrouter.repository.AuditEntryRepository;
import com.openforge.docrouter.repository.ConflictRecordRepository;
import com.openforge.docrouter.repository.FileTypeRuleRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties =
        "spring.datasource.url=jdbc:h2:mem:gate;MODE=MySQL;DB_CLOSE_DELAY=-1;DATABASE_TO_LOWER=TRUE")
@ActiveProfiles("test")
class DeduplicationGateTest {

    @Autowired private SemanticStore            semanticStore;
    @Autowired private ContactStore             contactStore;
    @Autowired private ConflictReviewService    conflictReview;
    @Autowired private ConflictRecordRepository conflicts;
    @Autowired private FileTypeRuleRepository   fileTypes;
    @Autowired private AuditEntryRepository     audit;

    private static FileTypeRule rule(String extension, boolean allowed, ConfidenceTier tier) {
        return FileTypeRule.builder()
                .extension(extension)
                .allowed(allowed)
                .securityLevel(SecurityLevel.SAFE)
                .confidenceTier(tier)
                .build();
    }

    @Test
    void identicalContentIsStoredOnce() {
        IngestResult first = semanticStore.ingestFileType(rule(".gt1", true, ConfidenceTier.HIGH));
        long count = fileTypes.count();

        IngestResult second = semanticStore.ingestFileType(rule("GT1", true, ConfidenceTier.HIGH));

        assertEquals(IngestOutcome.INSERTED, first.outcome());
        assertEquals(IngestOutcome.DUPLICATE, second.outcome());
        assertEquals(first.factId(), second.factId());
        assertEquals(count, fileTypes.count());
        assertTrue(second.conflictIds().isEmpty());
    }

    @Test
    void strongerContradictingRuleReplacesWeakerOne() {
        semanticStore.ingestFileType(rule(".pdf", false, ConfidenceTier.LOW));

        IngestResult result = semanticStore.ingestFileType(rule(".pdf", true, ConfidenceTier.HIGH));

        assertEquals(IngestOutcome.UPDATED, result.outcome());
        assertEquals(1, result.conflictIds().size());
        ConflictRecord record = conflicts.findById(result.conflictIds().get(0)).orElseThrow();
        assertEquals(ConflictType.FILE_PERMISSION_MISMATCH, record.getConflictType());
        assertEquals(ConflictSeverity.HIGH, record.getSeverity());
        assertEquals(ConflictResolution.UPDATED, record.getResolution());
        assertNotNull(record.getExistingSnapshot());

        FileTypeRule stored = fileTypes.findByIdentityKey(".pdf").orElseThrow();
        assertTrue(stored.isAllowed());
        assertEquals(ConfidenceTier.HIGH, stored.getConfidenceTier());
        assertEquals(List.of("INSERT", "CONFLICT_UPDATE"),
                audit.findByFactKindAndFactIdOrderByIdAsc(FactKind.FILE_TYPE_RULE, stored.getId()).stream()
                        .map(e -> e.getAction()).toList());
    }

    @Test
    void weakerContradictingRuleIsRejected() {
        semanticStore.ingestFileType(rule(".gt2", true, ConfidenceTier.HIGH));

        IngestResult result = semanticStore.ingestFileType(rule(".gt2", false, ConfidenceTier.LOW));

        assertEquals(IngestOutcome.REJECTED, result.outcome());
        assertEquals(ConflictResolution.REJECTED,
                conflicts.findById(result.conflictIds().get(0)).orElseThrow().getResolution());
        assertTrue(fileTypes.findByIdentityKey(".gt2").orElseThrow().isAllowed());
    }

    @Test
    void equallyTrustedContradictionWaitsForHumanAndResolvesOnce() {
        semanticStore.ingestFileType(rule(".gt3", true, ConfidenceTier.MEDIUM));
        FileTypeRule candidate = rule(".gt3", false, ConfidenceTier.MEDIUM);
        candidate.setSecurityLevel(SecurityLevel.RESTRICTED);

        IngestResult result = semanticStore.ingestFileType(candidate);

        assertEquals(IngestOutcome.QUEUED_FOR_REVIEW, result.outcome());
        assertEquals(2, result.conflictIds().size());
        assertTrue(fileTypes.findByIdentityKey(".gt3").orElseThrow().isAllowed());
        List<Long> pendingIds = conflictReview.getPendingConflicts().stream().map(ConflictRecord::getId).toList();
        assertTrue(pendingIds.containsAll(result.conflictIds()));

        Long conflictId = result.conflictIds().get(0);
        List<ConflictRecord> settled = conflictReview.resolveConflict(conflictId, ConflictResolution.UPDATED, "analyst");

        assertEquals(2, settled.size());
        assertTrue(settled.stream().allMatch(c -> c.getResolution() == ConflictResolution.UPDATED));
        FileTypeRule stored = fileTypes.findByIdentityKey(".gt3").orElseThrow();
        assertFalse(stored.isAllowed());
        assertEquals(SecurityLevel.RESTRICTED, stored.getSecurityLevel());

        assertThrows(IllegalStateException.class,
                () -> conflictReview.resolveConflict(conflictId, ConflictResolution.REJECTED, "analyst"));
    }

    @Test
    void pendingIsNotAValidResolution() {
        assertThrows(KnowledgeValidationException.class,
                () -> conflictReview.resolveConflict(1L, ConflictResolution.PENDING, "analyst"));
    }

    @Test
    void invalidCandidatesChangeNothing() {
        long before = fileTypes.count();

        assertThrows(KnowledgeValidationException.class,
                () -> semanticStore.ingestFileType(rule(" ", true, ConfidenceTier.HIGH)));
        assertEquals(before, fileTypes.count());
    }

    @Test
    void assetIdentifiersMustStayDisjoint() {
        semanticStore.ingestAsset(AssetProfile.builder()
                .assetId("GATE-A").dealName("Gate Alpha").assetType(AssetType.PRIVATE_EQUITY)
                .identifiers(new ArrayList<>(List.of("gate alpha", "galpha")))
                .build());

        KnowledgeValidationException e = assertThrows(KnowledgeValidationException.class,
                () -> semanticStore.ingestAsset(AssetProfile.builder()
                        .assetId("GATE-B").dealName("Gate Beta").assetType(AssetType.PRIVATE_EQUITY)
                        .identifiers(new ArrayList<>(List.of("gate beta", "GAlpha")))
                        .build()));
        assertTrue(e.getMessage().contains("galpha"));
        assertTrue(semanticStore.findAsset("GATE-B").isEmpty());
    }

    @Test
    void dealNameCountsAsOwnedIdentifier() {
        semanticStore.ingestAsset(AssetProfile.builder()
                .assetId("GATE-C").dealName("Gate Gamma").assetType(AssetType.PRIVATE_EQUITY)
                .identifiers(new ArrayList<>(List.of("ggamma")))
                .build());
        semanticStore.ingestAsset(AssetProfile.builder()
                .assetId("GATE-D").dealName("Gate Delta").assetType(AssetType.PRIVATE_EQUITY)
                .identifiers(new ArrayList<>(List.of("gdelta")))
                .build());

        assertThrows(KnowledgeValidationException.class,
                () -> semanticStore.ingestAsset(AssetProfile.builder()
                        .assetId("GATE-E").dealName("Gate Epsilon").assetType(AssetType.PRIVATE_EQUITY)
                        .identifiers(new ArrayList<>(List.of("gate gamma")))
                        .build()));
        assertThrows(KnowledgeValidationException.class,
                () -> semanticStore.ingestAsset(AssetProfile.builder()
                        .assetId("GATE-D").dealName("GGamma").assetType(AssetType.PRIVATE_EQUITY)
                        .identifiers(new ArrayList<>(List.of("gdelta")))
                        .build()));
        assertEquals("Gate Delta", semanticStore.findAsset("GATE-D").orElseThrow().getDealName());
        assertTrue(semanticStore.findAsset("GATE-E").isEmpty());
    }

    @Test
    void concurrentAssetsCannotClaimTheSameIdentifier() throws Exception {
        int rounds = 20;
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < rounds; round++) {
                String shared = "zeta" + round;
                CountDownLatch start = new CountDownLatch(1);
                List<Future<IngestResult>> futures = new ArrayList<>();
                for (String prefix : List.of("RACE-A", "RACE-B")) {
                    String assetId = prefix + round;
                    futures.add(pool.submit(() -> {
                        start.await();
                        return semanticStore.ingestAsset(AssetProfile.builder()
                                .assetId(assetId).dealName(assetId + " deal").assetType(AssetType.PRIVATE_EQUITY)
                                .identifiers(new ArrayList<>(List.of(shared)))
                                .build());
                    }));
                }
                start.countDown();

                int inserted = 0;
                int refused = 0;
                for (Future<IngestResult> f : futures) {
                    try {
                        assertEquals(IngestOutcome.INSERTED, f.get(10, TimeUnit.SECONDS).outcome());
                        inserted++;
                    } catch (ExecutionException e) {
                        assertInstanceOf(KnowledgeValidationException.class, e.getCause());
                        refused++;
                    }
                }
                assertEquals(1, inserted, "round " + round);
                assertEquals(1, refused, "round " + round);
                long owners = semanticStore.allAssets().stream()
                        .filter(a -> a.getIdentifiers().contains(shared))
                        .count();
                assertEquals(1, owners, "round " + round);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void senderRefinementMergesWithoutConflict() {
        contactStore.ingest(SenderMapping.builder()
                .senderAddress("merge@gate.test").assetIds(new ArrayList<>(List.of("A1"))).trustScore(0.9).build());

        IngestResult result = contactStore.ingest(SenderMapping.builder()
                .senderAddress("Merge <MERGE@gate.test>").assetIds(new ArrayList<>(List.of("A2"))).trustScore(0.5).build());

        assertEquals(IngestOutcome.UPDATED, result.outcome());
        assertTrue(result.conflictIds().isEmpty());
        SenderMapping stored = contactStore.find("merge@gate.test").orElseThrow();
        assertEquals(List.of("A1", "A2"), stored.getAssetIds());
        assertEquals(0.9, stored.getTrustScore(), 1e-9);
    }

    @Test
    void concurrentLearningKeepsEveryAssociation() throws Exception {
        int workers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < workers; i++) {
                String assetId = "ASSET-" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    contactStore.learnAssociation("race@gate.test", assetId);
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        SenderMapping stored = contactStore.find("race@gate.test").orElseThrow();
        assertEquals(workers, stored.getAssetIds().size());
        for (int i = 0; i < workers; i++) {
            assertTrue(stored.getAssetIds().contains("ASSET-" + i));
        }
    }
}
