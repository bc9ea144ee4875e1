package com.openforge.docrouter.memory;

import com.openforge.docrouter.domain.EpisodicRecord;

/** A past episode and how similar it is to the current attachment, in [0,1]. */
public record SimilarExperience(EpisodicRecord record, double similarity) {}
