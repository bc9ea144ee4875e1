package com.openforge.docrouter.knowledge;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/** Content fingerprints: SHA-256 over trimmed, lowercased, order-normalized fields. */
public final class Fingerprints {

    private Fingerprints() {}

    public static String of(Object... parts) {
        StringBuilder sb = new StringBuilder();
        for (Object part : parts) {
            sb.append(normalize(part)).append('\u001f');
        }
        return sha256(sb.toString());
    }

    static String normalize(Object part) {
        if (part == null) return "";
        if (part instanceof Collection<?> c) {
            return c.stream().map(Fingerprints::normalize).sorted().collect(Collectors.joining(","));
        }
        if (part instanceof Map<?, ?> m) {
            Map<String, String> sorted = new TreeMap<>();
            m.forEach((k, v) -> sorted.put(normalize(k), normalize(v)));
            return sorted.toString();
        }
        return part.toString().strip().toLowerCase(Locale.ROOT);
    }

    public static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
