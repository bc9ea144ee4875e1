package com.openforge.docrouter.domain;

/** Who produced an episodic record. */
public enum ExperienceSource {
    AUTO,
    HUMAN_CORRECTION
}
