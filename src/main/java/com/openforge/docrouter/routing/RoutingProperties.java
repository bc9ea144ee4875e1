package com.openforge.docrouter.routing;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Routing bands and worker pool sizing.
 *
 * docrouter:
 *   routing:
 *     high-threshold: 0.85        # stored automatically
 *     medium-threshold: 0.65      # stored, flagged for confirmation
 *     low-threshold: 0.40         # asset's needs_review bucket
 *     asset-weight: 0.6
 *     max-concurrent-emails: 5
 *     max-concurrent-attachments: 3
 *     email-timeout-seconds: 300
 */
@ConfigurationProperties(prefix = "docrouter.routing")
public record RoutingProperties(
        @DefaultValue("0.85")           double highThreshold,
        @DefaultValue("0.65")           double mediumThreshold,
        @DefaultValue("0.40")           double lowThreshold,
        @DefaultValue("0.6")            double assetWeight,
        @DefaultValue("5")              int    maxConcurrentEmails,
        @DefaultValue("3")              int    maxConcurrentAttachments,
        @DefaultValue("300")            int    emailTimeoutSeconds,
        @DefaultValue("to_be_reviewed") String reviewRoot,
        @DefaultValue("needs_review")   String needsReviewFolder
) {}
