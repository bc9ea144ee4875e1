package com.openforge.docrouter.websocket;

/** Everything the router broadcasts on the routing topic. */
public enum EventType {

    /** An attachment was classified. payload = RoutingDecision. */
    ROUTING_DECISION,

    /** An attachment was parked for human review. payload = review item id + reason. */
    REVIEW_QUEUED,

    /** A reviewer stored or discarded a parked attachment. */
    REVIEW_RESOLVED,

    /** The gate wrote conflict records. payload = conflict ids + outcome. */
    CONFLICT_DETECTED,

    /** A human settled a pending conflict. */
    CONFLICT_RESOLVED,

    /** Seed collections were loaded (or found already loaded). payload = per-collection status. */
    BOOTSTRAP_COMPLETED
}
