package com.tool.invocation.schema;

import java.util.Collection;
import java.util.Locale;
import java.util.Optional;

/**
 * Finds the closest known name for a mistyped tool or argument name using
 * Levenshtein similarity over normalized tokens.
 */
public final class NameSuggester {

    /** Minimum similarity for a suggestion to be offered. */
    public static final double DEFAULT_CUTOFF = 0.6;

    private NameSuggester() {
        // utility class
    }

    public static Optional<String> suggest(String requested, Collection<String> options) {
        return suggest(requested, options, DEFAULT_CUTOFF);
    }

    /**
     * Returns the option most similar to {@code requested}, if its similarity reaches {@code cutoff}.
     * Ties are broken by the natural order of the option names.
     */
    public static Optional<String> suggest(String requested, Collection<String> options, double cutoff) {
        if (requested == null || requested.isBlank() || options == null || options.isEmpty()) {
            return Optional.empty();
        }
        String normalizedRequest = normalize(requested);
        String best = null;
        double bestScore = -1.0;
        for (String option : options) {
            if (option == null || option.isBlank()) {
                continue;
            }
            double score = similarity(normalizedRequest, normalize(option));
            if (score > bestScore || (score == bestScore && best != null && option.compareTo(best) < 0)) {
                best = option;
                bestScore = score;
            }
        }
        return bestScore >= cutoff ? Optional.ofNullable(best) : Optional.empty();
    }

    static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
    }

    /**
     * 1 - (edit distance / longer length).
     */
    static double similarity(String s1, String s2) {
        if (s1.equals(s2)) {
            return 1.0;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        int distance = editDistance(s1, s2);
        return 1.0 - ((double) distance / Math.max(s1.length(), s2.length()));
    }

    /**
     * Levenshtein distance kept in a single row of costs; {@code diagonal} holds the cost of the
     * previous row's left neighbor.
     */
    static int editDistance(String a, String b) {
        int[] costs = new int[b.length() + 1];
        for (int j = 0; j < costs.length; j++) {
            costs[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            int diagonal = costs[0];
            costs[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int above = costs[j];
                int substitution = diagonal + (a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1);
                costs[j] = Math.min(substitution, Math.min(above, costs[j - 1]) + 1);
                diagonal = above;
            }
        }
        return costs[b.length()];
    }
}
