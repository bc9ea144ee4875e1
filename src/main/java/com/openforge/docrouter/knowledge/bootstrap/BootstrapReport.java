package com.openforge.docrouter.knowledge.bootstrap;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record BootstrapReport(List<CollectionReport> collections) {

    /**
     * @param loaded   items accepted (inserted, merged or already present) on this run,
     *                 or the count recorded by the run that did the loading
     * @param rejected items that failed validation or lost a conflict
     */
    public record CollectionReport(String collection, BootstrapStatus status, int loaded, int rejected) {}

    public boolean alreadyLoaded() {
        return collections.stream().allMatch(c -> c.status() == BootstrapStatus.ALREADY_LOADED);
    }

    @JsonProperty("status")
    public BootstrapStatus status() {
        return alreadyLoaded() ? BootstrapStatus.ALREADY_LOADED : BootstrapStatus.LOADED;
    }
}
