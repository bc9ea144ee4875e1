package com.openforge.docrouter.routing.dto;

import com.openforge.docrouter.domain.ReviewOutcome;
import jakarta.validation.constraints.NotNull;

/** STORED needs both category and asset id; DISCARDED ignores them. */
public record ReviewResolutionRequest(
        @NotNull ReviewOutcome outcome,
        String category,
        String assetId,
        String resolvedBy
) {}
