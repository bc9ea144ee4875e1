package com.openforge.docrouter.domain;

/**
 * The four knowledge partitions.
 *
 * SEMANTIC    - facts: asset profiles, file-type rules, human feedback
 * PROCEDURAL  - stable rules: classification patterns, thresholds, matching parameters
 * EPISODIC    - append-only log of past decisions and corrections
 * CONTACT     - sender → asset trust mappings
 */
public enum KnowledgePartition {
    SEMANTIC,
    PROCEDURAL,
    EPISODIC,
    CONTACT
}
