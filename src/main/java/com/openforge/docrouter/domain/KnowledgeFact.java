package com.openforge.docrouter.domain;

/**
 * Common shape of everything written through the deduplication gate.
 *
 * identityKey  - unique per store; null for append-only facts (episodes, feedback)
 * fingerprint  - SHA-256 of the normalized content fields, used for exact-duplicate detection
 */
public interface KnowledgeFact {

    Long getId();

    String getIdentityKey();

    void setIdentityKey(String identityKey);

    String getFingerprint();

    void setFingerprint(String fingerprint);

    ConfidenceTier getConfidenceTier();
}
