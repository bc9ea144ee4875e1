package com.openforge.docrouter.routing;

import com.openforge.docrouter.domain.AssetType;
import com.openforge.docrouter.domain.ReviewReason;

import java.util.List;

/**
 * Outcome of classifying one attachment. Always carries a confidence and a
 * rationale, including for attachments that were never scored (rejected file
 * type, quarantine) and when similarity recall was degraded.
 *
 * @param location      where the document now lives, e.g. "i3/loan_documents"
 *                      or "to_be_reviewed/no_asset_match"
 * @param reviewItemId  id of the queued review item, null when stored
 * @param requiresConfirmation true for the MEDIUM band
 */
public record RoutingDecision(
        String filename,
        RoutingStatus status,
        RoutingBand band,
        String assetId,
        AssetType assetType,
        String category,
        double assetConfidence,
        double categoryConfidence,
        double confidence,
        boolean requiresConfirmation,
        ReviewReason reviewReason,
        String location,
        Long reviewItemId,
        boolean degraded,
        List<AssetCandidate> candidates,
        List<String> rationale
) {}
