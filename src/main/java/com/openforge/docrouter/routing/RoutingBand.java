package com.openforge.docrouter.routing;

import com.openforge.docrouter.knowledge.procedural.RoutingThresholds;

/**
 * Confidence bands of the routing state machine.
 *
 * HIGH      stored, no approval needed
 * MEDIUM    stored, flagged for confirmation
 * LOW       parked in the matched asset's needs_review bucket
 * VERY_LOW  general review queue
 */
public enum RoutingBand {
    HIGH,
    MEDIUM,
    LOW,
    VERY_LOW;

    /** Every boundary is inclusive: a score equal to a threshold belongs to that band. */
    public static RoutingBand of(double score, RoutingThresholds thresholds) {
        if (score >= thresholds.high())   return HIGH;
        if (score >= thresholds.medium()) return MEDIUM;
        if (score >= thresholds.low())    return LOW;
        return VERY_LOW;
    }
}
