package com.openforge.docrouter.knowledge;

import com.openforge.docrouter.domain.ConflictResolution;
import jakarta.validation.constraints.NotNull;

/** UPDATED applies the stored candidate; REJECTED keeps the existing fact. */
public record ConflictResolutionRequest(@NotNull ConflictResolution resolution, String resolvedBy) {}
