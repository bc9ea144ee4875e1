package com.openforge.docrouter.routing;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/** Lowercasing, tokenising and edit-distance helpers shared by the scorers. */
final class TextMatching {

    private TextMatching() {}

    /** Lowercase, every run of non-alphanumerics collapsed to one space. */
    static String normalize(String text) {
        if (text == null) return "";
        return text.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", " ").strip();
    }

    static List<String> tokens(String text) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) return List.of();
        return Arrays.asList(normalized.split(" "));
    }

    /** True when {@code phrase} occurs in {@code normalizedText} on token boundaries. */
    static boolean containsPhrase(String normalizedText, String phrase) {
        String p = normalize(phrase);
        if (p.isEmpty()) return false;
        return (" " + normalizedText + " ").contains(" " + p + " ");
    }

    /** 1 − distance / longer length; 1.0 for equal strings. */
    static double similarityRatio(String a, String b) {
        int longer = Math.max(a.length(), b.length());
        if (longer == 0) return 1.0;
        return 1.0 - (double) levenshtein(a, b) / longer;
    }

    static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current  = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) previous[j] = j;
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    static double clip(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    static String stem(String filename) {
        if (filename == null) return "";
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(0, dot) : filename;
    }
}
