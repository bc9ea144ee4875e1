package com.openforge.docrouter.memory;

import java.util.List;

/**
 * Outcome of one similarity recall.
 *
 * @param degraded true when the lookup timed out, failed or the circuit was
 *                 open; scoring then proceeds without experience signals
 * @param note     short reason for the degradation, null otherwise
 */
public record ExperienceRecall(List<SimilarExperience> experiences, boolean degraded, String note) {

    public static final String UNAVAILABLE = "similarity_unavailable";

    public static ExperienceRecall none() {
        return new ExperienceRecall(List.of(), false, null);
    }

    public static ExperienceRecall degraded(String reason) {
        return new ExperienceRecall(List.of(), true, UNAVAILABLE + ": " + reason);
    }
}
