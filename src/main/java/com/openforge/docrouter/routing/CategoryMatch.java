package com.openforge.docrouter.routing;

import java.util.List;

/**
 * Chosen document category.
 *
 * @param fallback true when no pattern or experience hint fired
 */
public record CategoryMatch(String category, double confidence, boolean fallback, List<String> rationale) {}
