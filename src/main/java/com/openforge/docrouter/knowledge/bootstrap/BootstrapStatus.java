package com.openforge.docrouter.knowledge.bootstrap;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum BootstrapStatus {
    LOADED,
    ALREADY_LOADED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
