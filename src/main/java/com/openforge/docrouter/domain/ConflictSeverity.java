package com.openforge.docrouter.domain;

public enum ConflictSeverity {
    HIGH,
    MEDIUM
}
