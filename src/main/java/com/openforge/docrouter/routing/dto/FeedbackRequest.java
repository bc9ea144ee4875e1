package com.openforge.docrouter.routing.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * A human correction of one routing decision.
 *
 * correctedAssetId may be null when the document does not belong to any
 * tracked asset.
 */
public record FeedbackRequest(
        @NotBlank String filename,
        String sender,
        String subject,
        String body,
        @NotBlank String correctedCategory,
        String correctedAssetId,
        String originalPrediction,
        String correctedBy
) {}
