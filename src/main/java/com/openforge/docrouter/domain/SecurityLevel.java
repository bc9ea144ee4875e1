package com.openforge.docrouter.domain;

import java.util.Locale;

public enum SecurityLevel {
    SAFE,
    RESTRICTED,
    DANGEROUS;

    public static SecurityLevel fromValue(String raw) {
        if (raw == null || raw.isBlank()) return null;
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
