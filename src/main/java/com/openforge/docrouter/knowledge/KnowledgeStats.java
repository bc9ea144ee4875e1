package com.openforge.docrouter.knowledge;

import java.util.Map;

/**
 * @param collections fact count per collection (asset_profiles, file_type_rules, …)
 * @param partitions  fact count per knowledge partition
 */
public record KnowledgeStats(
        Map<String, Long> collections,
        Map<String, Long> partitions,
        long pendingConflicts,
        long pendingReviews,
        Map<String, Integer> bootstrapped
) {}
