package com.openforge.docrouter.memory;

import com.openforge.docrouter.domain.EpisodicRecord;

import java.util.List;

/**
 * Nearest-neighbour search over past routing experience. Implementations may
 * block on I/O; callers bound them with a timeout.
 */
public interface SimilarityLookup {

    /** Up to {@code topK} records most similar to the query, best first. */
    List<SimilarExperience> findSimilar(String queryText, int topK);

    /** Make a newly stored record searchable. */
    void index(EpisodicRecord record);
}
