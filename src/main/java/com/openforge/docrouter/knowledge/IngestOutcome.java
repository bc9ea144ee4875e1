package com.openforge.docrouter.knowledge;

public enum IngestOutcome {
    /** New fact stored. */
    INSERTED,
    /** Existing fact overwritten (conflict won) or merged with non-contradicting data. */
    UPDATED,
    /** Same content already stored; the existing id is returned. */
    DUPLICATE,
    /** Conflict lost against a higher-confidence fact; nothing changed. */
    REJECTED,
    /** Conflict between equally trusted facts; pending a human decision. */
    QUEUED_FOR_REVIEW
}
