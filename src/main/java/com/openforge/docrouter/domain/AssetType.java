package com.openforge.docrouter.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Private-market asset types. The wire value is the lower snake-case name
 * used in bootstrap files and configuration keys.
 */
public enum AssetType {

    COMMERCIAL_REAL_ESTATE,
    PRIVATE_CREDIT,
    PRIVATE_EQUITY,
    INFRASTRUCTURE;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Lenient parse: accepts "private_credit", "PRIVATE-CREDIT", "private credit". */
    public static Optional<AssetType> fromValue(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        return Arrays.stream(values()).filter(t -> t.name().equals(normalized)).findFirst();
    }
}
