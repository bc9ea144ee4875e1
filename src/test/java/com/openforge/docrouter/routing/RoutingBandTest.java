package com.openforge.docrouter.routing;

import com.openforge.docrouter.knowledge.procedural.RoutingThresholds;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RoutingBandTest {

    private final RoutingThresholds thresholds = new RoutingThresholds(0.85, 0.65, 0.40, 0.6);

    @Test
    void boundariesAreInclusive() {
        assertEquals(RoutingBand.HIGH, RoutingBand.of(0.85, thresholds));
        assertEquals(RoutingBand.MEDIUM, RoutingBand.of(0.65, thresholds));
        assertEquals(RoutingBand.LOW, RoutingBand.of(0.40, thresholds));
        assertEquals(RoutingBand.VERY_LOW, RoutingBand.of(0.3999, thresholds));
    }

    @Test
    void blendWeighsAssetAgainstCategory() {
        assertEquals(0.6 * 0.9 + 0.4 * 0.5, thresholds.blend(0.9, 0.5), 1e-12);
    }

    @Test
    void misorderedThresholdsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new RoutingThresholds(0.4, 0.65, 0.85, 0.6));
        assertThrows(IllegalArgumentException.class, () -> new RoutingThresholds(0.85, 0.65, 0.40, 1.5));
    }
}
