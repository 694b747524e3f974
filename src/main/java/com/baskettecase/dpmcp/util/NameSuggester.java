package com.baskettecase.dpmcp.util;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * "Did you mean?" suggestions for misspelled view and table names.
 *
 * Similarity is {@code 1 - editDistance / longerLength}, compared case-insensitively.
 */
public final class NameSuggester {

    public static final int DEFAULT_LIMIT = 3;
    static final double MIN_SIMILARITY = 0.4;

    private NameSuggester() {
    }

    public static List<String> suggest(String name, Collection<String> candidates) {
        return suggest(name, candidates, DEFAULT_LIMIT);
    }

    public static List<String> suggest(String name, Collection<String> candidates, int limit) {
        if (name == null || name.isBlank() || candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        String target = name.toLowerCase(Locale.ROOT);
        return candidates.stream()
                .distinct()
                .filter(candidate -> !candidate.equalsIgnoreCase(name))
                .map(candidate -> new Scored(candidate, similarity(target, candidate.toLowerCase(Locale.ROOT))))
                .filter(scored -> scored.score() >= MIN_SIMILARITY)
                .sorted(Comparator.comparingDouble(Scored::score).reversed().thenComparing(Scored::name))
                .limit(limit)
                .map(Scored::name)
                .collect(Collectors.toList());
    }

    static double similarity(String a, String b) {
        int longer = Math.max(a.length(), b.length());
        return longer == 0 ? 1.0 : 1.0 - (double) editDistance(a, b) / longer;
    }

    static int editDistance(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int substitution = previous[j - 1] + (a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1);
                current[j] = Math.min(substitution, Math.min(previous[j], current[j - 1]) + 1);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    private record Scored(String name, double score) {
    }
}
