package com.openforge.docrouter.knowledge;

import com.openforge.docrouter.domain.BaseEntity;
import com.openforge.docrouter.domain.FactKind;
import com.openforge.docrouter.domain.KnowledgeFact;
import com.openforge.docrouter.domain.KnowledgePartition;

import java.util.List;
import java.util.Optional;

/**
 * Storage contract shared by every knowledge partition.
 *
 * Implementations describe their fact type (identity, fingerprint,
 * contradictions, merge rules); {@link DeduplicationGate} owns the write
 * protocol and is the only caller of {@link #save}.
 */
public interface KnowledgeStore<F extends BaseEntity & KnowledgeFact> {

    FactKind kind();

    default KnowledgePartition partition() {
        return kind().partition();
    }

    /** @throws KnowledgeValidationException when required fields are missing or malformed */
    void validate(F candidate);

    /**
     * Checks that depend on other stored facts. Runs under the gate's lock,
     * before its transaction starts.
     *
     * @throws KnowledgeValidationException when the candidate clashes with another fact
     */
    default void checkConsistency(F candidate) {
    }

    /**
     * Lock key for writes under {@code identityKey}. Stores whose facts
     * constrain each other return a single key so all their writes serialise.
     */
    default String lockScope(String identityKey) {
        return identityKey;
    }

    /** Unique key inside this store, or {@code null} for append-only facts. */
    String identityKey(F candidate);

    /** SHA-256 over the normalized content fields. */
    String fingerprint(F fact);

    Optional<F> findById(Long id);

    Optional<F> findByFingerprint(String fingerprint);

    Optional<F> findByIdentityKey(String identityKey);

    F save(F fact);

    /** Contradictions between a stored fact and a candidate sharing its identity key. */
    List<ConflictFinding> detectConflicts(F existing, F candidate);

    /** Overwrite the content of {@code existing} with the candidate's (conflict won). */
    void applyCandidate(F existing, F candidate);

    /**
     * Fold non-contradicting information from the candidate into the existing fact.
     *
     * @return true if anything changed
     */
    boolean merge(F existing, F candidate);

    String snapshot(F fact);

    F restore(String snapshot);

    long count();
}
