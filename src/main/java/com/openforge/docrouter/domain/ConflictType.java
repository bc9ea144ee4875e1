package com.openforge.docrouter.domain;

/**
 * Contradictions the gate can detect between a stored fact and a candidate
 * sharing its identity key. Severity is fixed per type.
 */
public enum ConflictType {

    ASSET_TYPE_MISMATCH(ConflictSeverity.HIGH),
    FILE_PERMISSION_MISMATCH(ConflictSeverity.HIGH),
    SECURITY_LEVEL_MISMATCH(ConflictSeverity.MEDIUM),
    SENDER_ORGANIZATION_MISMATCH(ConflictSeverity.MEDIUM),
    RULE_CONTRADICTION(ConflictSeverity.HIGH);

    private final ConflictSeverity severity;

    ConflictType(ConflictSeverity severity) {
        this.severity = severity;
    }

    public ConflictSeverity severity() {
        return severity;
    }
}
