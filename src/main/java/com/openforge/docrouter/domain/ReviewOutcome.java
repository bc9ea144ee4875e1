package com.openforge.docrouter.domain;

public enum ReviewOutcome {
    STORED,
    DISCARDED
}
