package com.openforge.docrouter.domain;

public enum ReviewStatus {
    PENDING,
    RESOLVED
}
