package com.openforge.docrouter.routing;

import com.openforge.docrouter.domain.AssetType;

import java.util.List;

/** One asset the attachment may belong to, with the trace of how it was scored. */
public record AssetCandidate(
        String assetId,
        String dealName,
        AssetType assetType,
        double confidence,
        List<String> rationale
) {}
