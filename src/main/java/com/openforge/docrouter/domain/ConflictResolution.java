package com.openforge.docrouter.domain;

/**
 * Current state of a conflict record. PENDING only ever follows a
 * HUMAN_REVIEW action; a human moves it to UPDATED or REJECTED.
 */
public enum ConflictResolution {
    PENDING,
    UPDATED,
    REJECTED
}
