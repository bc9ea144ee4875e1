package com.openforge.docrouter.knowledge.procedural;

/**
 * Routing bands. All checks are "score ≥ threshold".
 *
 * @param assetWeight share of the asset confidence in the overall score;
 *                    the category confidence gets the rest
 */
public record RoutingThresholds(double high, double medium, double low, double assetWeight) {

    public RoutingThresholds {
        if (!(high >= medium && medium >= low)) {
            throw new IllegalArgumentException(
                    "routing thresholds must satisfy high >= medium >= low, got %s/%s/%s".formatted(high, medium, low));
        }
        if (assetWeight < 0.0 || assetWeight > 1.0) {
            throw new IllegalArgumentException("asset weight must be within [0,1], was " + assetWeight);
        }
    }

    public double blend(double assetConfidence, double categoryConfidence) {
        return assetWeight * assetConfidence + (1.0 - assetWeight) * categoryConfidence;
    }
}
