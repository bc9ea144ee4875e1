package com.openforge.docrouter.domain;

import java.util.Locale;

/**
 * Why an attachment is waiting for a human. The general queue is
 * partitioned by {@link #bucket()}; LOW_CONFIDENCE items that do have a
 * matched asset sit in that asset's own needs_review bucket instead.
 */
public enum ReviewReason {
    LOW_CONFIDENCE,
    VERY_LOW_CONFIDENCE,
    NO_ASSET_MATCH,
    INVALID_FILE_TYPE,
    QUARANTINED;

    public String bucket() {
        return name().toLowerCase(Locale.ROOT);
    }
}
