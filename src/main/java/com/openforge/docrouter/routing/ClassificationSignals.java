package com.openforge.docrouter.routing;

import com.openforge.docrouter.memory.SimilarExperience;

import java.util.List;

/** Context beyond the text that nudges category confidence. */
public record ClassificationSignals(boolean trustedSender, List<SimilarExperience> experiences) {

    public ClassificationSignals {
        experiences = experiences == null ? List.of() : experiences;
    }

    public static ClassificationSignals none() {
        return new ClassificationSignals(false, List.of());
    }
}
