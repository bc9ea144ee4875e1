package com.openforge.docrouter.domain;

/** What the resolver decided when a conflict was detected. */
public enum ResolutionAction {
    UPDATE,
    REJECT,
    HUMAN_REVIEW
}
