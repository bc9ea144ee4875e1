package com.openforge.docrouter.routing.dto;

import com.openforge.docrouter.routing.RoutingDecision;

import java.util.List;

/**
 * Per-attachment outcomes for one email. An attachment appears in exactly one
 * of the two lists.
 */
public record EmailRoutingResult(
        List<RoutingDecision> decisions,
        List<AttachmentFailure> failures
) {

    public record AttachmentFailure(String filename, String error) {}
}
