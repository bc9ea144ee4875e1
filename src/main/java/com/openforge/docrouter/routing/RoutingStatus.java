package com.openforge.docrouter.routing;

/** Terminal state of one attachment after routing. */
public enum RoutingStatus {
    STORED,
    PENDING_REVIEW
}
