package com.openforge.docrouter.knowledge;

import com.openforge.docrouter.domain.*;
import com.openforge.docrouter.repository.ConflictRecordRepository;
import com.openforge.docrouter.websocket.EventType;
import com.openforge.docrouter.websocket.RoutingEventPublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * The single write path into every knowledge partition.
 *
 * Protocol for {@link #ingest}:
 *   1. validate the candidate (outside any lock; failure mutates nothing),
 *      then take the lock and run the store's cross-fact consistency check
 *   2. same fingerprint already stored        → DUPLICATE, existing id
 *   3. no identity key, or key not yet stored → INSERTED
 *   4. key collision without contradiction    → merged, UPDATED
 *   5. key collision with contradictions      → ConflictRecord per finding,
 *      then UPDATE / REJECT / HUMAN_REVIEW as the resolver decides
 *
 * Steps 2-5 run under a lock striped on partition:kind:key and inside one
 * transaction that commits before the lock is released, so readers never
 * see a half-resolved conflict and two workers learning the same fact
 * cannot lose each other's update. The {@code @Version} column on every
 * entity backs this up across JVMs.
 */
@Slf4j
@Service
public class DeduplicationGate {

    private final TransactionTemplate      tx;
    private final ConflictResolver         resolver;
    private final ConflictRecordRepository conflictRepository;
    private final AuditTrail               auditTrail;
    private final KnowledgeStoreRegistry   registry;
    private final RoutingEventPublisher    publisher;
    private final ReentrantLock[]          stripes;

    public DeduplicationGate(PlatformTransactionManager transactionManager,
                             ConflictResolver resolver,
                             ConflictRecordRepository conflictRepository,
                             AuditTrail auditTrail,
                             KnowledgeStoreRegistry registry,
                             RoutingEventPublisher publisher,
                             KnowledgeProperties properties) {
        this.tx                 = new TransactionTemplate(transactionManager);
        this.resolver           = resolver;
        this.conflictRepository = conflictRepository;
        this.auditTrail         = auditTrail;
        this.registry           = registry;
        this.publisher          = publisher;
        this.stripes            = new ReentrantLock[Math.max(1, properties.lockStripes())];
        for (int i = 0; i < stripes.length; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    // ── Ingest ───────────────────────────────────────────────────────────────

    public <F extends BaseEntity & KnowledgeFact> IngestResult ingest(KnowledgeStore<F> store, F candidate) {
        if (candidate == null) {
            throw new KnowledgeValidationException(store.kind() + " candidate is required");
        }
        store.validate(candidate);

        String key = store.identityKey(candidate);
        String fingerprint = store.fingerprint(candidate);
        candidate.setIdentityKey(key);
        candidate.setFingerprint(fingerprint);

        ReentrantLock lock = lockFor(store, key != null ? key : fingerprint);
        lock.lock();
        IngestResult result;
        try {
            store.checkConsistency(candidate);
            result = tx.execute(status -> doIngest(store, candidate, key, fingerprint));
        } finally {
            lock.unlock();
        }

        log.debug("[Gate] {} {} key={} → {} id={}",
                store.partition(), store.kind(), key, result.outcome(), result.factId());
        if (!result.conflictIds().isEmpty()) {
            publisher.publish(EventType.CONFLICT_DETECTED, store.kind() + ":" + key,
                    Map.of("outcome", result.outcome(), "conflict_ids", result.conflictIds()));
        }
        return result;
    }

    private <F extends BaseEntity & KnowledgeFact> IngestResult doIngest(KnowledgeStore<F> store,
                                                                        F candidate,
                                                                        String key,
                                                                        String fingerprint) {
        Optional<F> duplicate = store.findByFingerprint(fingerprint);
        if (duplicate.isPresent()) {
            return IngestResult.of(IngestOutcome.DUPLICATE, duplicate.get().getId(), "identical content already stored");
        }

        Optional<F> collision = key == null ? Optional.empty() : store.findByIdentityKey(key);
        if (collision.isEmpty()) {
            F saved = store.save(candidate);
            auditTrail.record(store, saved, "INSERT", "new " + store.kind() + " fact");
            return IngestResult.of(IngestOutcome.INSERTED, saved.getId(), "new fact");
        }

        F existing = collision.get();
        List<ConflictFinding> findings = store.detectConflicts(existing, candidate);
        if (findings.isEmpty()) {
            if (!store.merge(existing, candidate)) {
                return IngestResult.of(IngestOutcome.DUPLICATE, existing.getId(), "no new information for key");
            }
            existing.setFingerprint(store.fingerprint(existing));
            F saved = store.save(existing);
            auditTrail.record(store, saved, "MERGE", "non-contradicting refinement merged");
            return IngestResult.of(IngestOutcome.UPDATED, saved.getId(), "merged");
        }

        return resolveFindings(store, existing, candidate, findings);
    }

    private <F extends BaseEntity & KnowledgeFact> IngestResult resolveFindings(KnowledgeStore<F> store,
                                                                               F existing,
                                                                               F candidate,
                                                                               List<ConflictFinding> findings) {
        ConfidenceTier existingTier  = existing.getConfidenceTier();
        ConfidenceTier candidateTier = candidate.getConfidenceTier();
        ResolutionAction action = resolver.decide(existingTier, candidateTier);

        String ingestRef         = UUID.randomUUID().toString();
        String existingSnapshot  = store.snapshot(existing);
        String candidateSnapshot = store.snapshot(candidate);
        ConflictResolution state = switch (action) {
            case UPDATE       -> ConflictResolution.UPDATED;
            case REJECT       -> ConflictResolution.REJECTED;
            case HUMAN_REVIEW -> ConflictResolution.PENDING;
        };

        List<Long> conflictIds = new ArrayList<>(findings.size());
        for (ConflictFinding finding : findings) {
            ConflictRecord record = conflictRepository.save(ConflictRecord.builder()
                    .conflictType(finding.type())
                    .severity(finding.type().severity())
                    .partition(store.partition())
                    .factKind(store.kind())
                    .identityKey(existing.getIdentityKey())
                    .existingFactId(existing.getId())
                    .existingConfidence(existingTier)
                    .candidateConfidence(candidateTier)
                    .existingSnapshot(existingSnapshot)
                    .candidateSnapshot(candidateSnapshot)
                    .detail(finding.detail())
                    .action(action)
                    .resolution(state)
                    .ingestRef(ingestRef)
                    .resolvedBy(action == ResolutionAction.HUMAN_REVIEW ? null : "resolver")
                    .resolvedAt(action == ResolutionAction.HUMAN_REVIEW ? null : LocalDateTime.now())
                    .build());
            conflictIds.add(record.getId());
        }

        String rationale = "%s vs %s on %s: %s".formatted(
                candidateTier, existingTier, describe(findings), action);
        log.warn("[Gate] Conflict on {} key={} ({}) → {}",
                store.kind(), existing.getIdentityKey(), describe(findings), action);

        return switch (action) {
            case UPDATE -> {
                store.applyCandidate(existing, candidate);
                existing.setFingerprint(store.fingerprint(existing));
                F saved = store.save(existing);
                auditTrail.record(store, saved, "CONFLICT_UPDATE", rationale);
                yield new IngestResult(IngestOutcome.UPDATED, saved.getId(), conflictIds, rationale);
            }
            case REJECT -> new IngestResult(IngestOutcome.REJECTED, existing.getId(), conflictIds, rationale);
            case HUMAN_REVIEW -> new IngestResult(IngestOutcome.QUEUED_FOR_REVIEW, existing.getId(), conflictIds, rationale);
        };
    }

    // ── Refine ───────────────────────────────────────────────────────────────

    /**
     * Apply a statistics-only change (counters, trust score) to the fact
     * stored under {@code key}, under the same key lock as {@link #ingest}.
     *
     * @return the updated fact, or empty if nothing is stored under the key
     */
    public <F extends BaseEntity & KnowledgeFact> Optional<F> refine(KnowledgeStore<F> store,
                                                                    String key,
                                                                    String rationale,
                                                                    Consumer<F> change) {
        ReentrantLock lock = lockFor(store, key);
        lock.lock();
        try {
            return tx.execute(status -> store.findByIdentityKey(key).map(fact -> {
                change.accept(fact);
                fact.setFingerprint(store.fingerprint(fact));
                F saved = store.save(fact);
                auditTrail.record(store, saved, "REFINE", rationale);
                return saved;
            }));
        } finally {
            lock.unlock();
        }
    }

    // ── Human resolution ─────────────────────────────────────────────────────

    /**
     * Settle a pending conflict. Every record written by the same ingest is
     * settled together; UPDATED applies the stored candidate snapshot onto the
     * current fact, REJECTED keeps the fact as it is.
     *
     * @throws NoSuchElementException if the conflict does not exist
     * @throws IllegalStateException  if it is no longer pending
     */
    public List<ConflictRecord> resolveConflict(Long conflictId, ConflictResolution decision, String resolvedBy) {
        if (decision == null || decision == ConflictResolution.PENDING) {
            throw new KnowledgeValidationException("resolution must be UPDATED or REJECTED");
        }
        ConflictRecord head = conflictRepository.findById(conflictId)
                .orElseThrow(() -> new NoSuchElementException("Conflict not found: " + conflictId));
        return resolveWith(registry.get(head.getFactKind()), head, decision, resolvedBy);
    }

    private <F extends BaseEntity & KnowledgeFact> List<ConflictRecord> resolveWith(KnowledgeStore<F> store,
                                                                                   ConflictRecord head,
                                                                                   ConflictResolution decision,
                                                                                   String resolvedBy) {
        ReentrantLock lock = lockFor(store, head.getIdentityKey());
        lock.lock();
        List<ConflictRecord> settled;
        try {
            if (decision == ConflictResolution.UPDATED) {
                store.checkConsistency(store.restore(head.getCandidateSnapshot()));
            }
            settled = tx.execute(status -> {
                List<ConflictRecord> group = conflictRepository.findByIngestRef(head.getIngestRef());
                for (ConflictRecord record : group) {
                    if (record.getResolution() != ConflictResolution.PENDING) {
                        throw new IllegalStateException(
                                "Conflict %d is already %s".formatted(record.getId(), record.getResolution()));
                    }
                }
                if (decision == ConflictResolution.UPDATED) {
                    F existing = store.findById(head.getExistingFactId())
                            .orElseThrow(() -> new NoSuchElementException(
                                    "Fact %s #%d no longer exists".formatted(head.getFactKind(), head.getExistingFactId())));
                    F candidate = store.restore(head.getCandidateSnapshot());
                    store.applyCandidate(existing, candidate);
                    existing.setFingerprint(store.fingerprint(existing));
                    F saved = store.save(existing);
                    auditTrail.record(store, saved, "RESOLVED_UPDATE",
                            "conflict %d resolved by %s".formatted(head.getId(), resolvedBy));
                }
                LocalDateTime now = LocalDateTime.now();
                for (ConflictRecord record : group) {
                    record.setResolution(decision);
                    record.setResolvedBy(resolvedBy);
                    record.setResolvedAt(now);
                }
                return conflictRepository.saveAll(group);
            });
        } finally {
            lock.unlock();
        }
        log.info("[Gate] Conflict group {} on {} key={} resolved {} by {}",
                head.getIngestRef(), head.getFactKind(), head.getIdentityKey(), decision, resolvedBy);
        publisher.publish(EventType.CONFLICT_RESOLVED, String.valueOf(head.getId()),
                Map.of("resolution", decision, "fact_kind", head.getFactKind()));
        return settled;
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private ReentrantLock lockFor(KnowledgeStore<?> store, String key) {
        String lockKey = store.partition() + ":" + store.kind() + ":" + store.lockScope(key);
        return stripes[Math.floorMod(lockKey.hashCode(), stripes.length)];
    }

    private static String describe(List<ConflictFinding> findings) {
        return findings.stream().map(f -> f.type().name()).distinct().reduce((a, b) -> a + "," + b).orElse("");
    }
}
