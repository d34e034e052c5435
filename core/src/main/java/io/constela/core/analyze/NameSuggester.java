package io.constela.core.analyze;

import java.util.Collection;
import java.util.Optional;

/** "Did you mean" lookup over a set of declared names. */
public final class NameSuggester {

    private NameSuggester() {
        // utility class
    }

    /**
     * Returns the closest candidate by edit distance if it is within {@code maxDistance}; otherwise
     * the first candidate that starts with {@code name} (so {@code incr} finds {@code increment}).
     */
    public static Optional<String> closest(String name, Collection<String> candidates, int maxDistance) {
        if (name == null || name.isEmpty() || candidates.isEmpty()) {
            return Optional.empty();
        }
        String best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (String candidate : candidates) {
            if (candidate.equals(name)) {
                continue;
            }
            int distance = levenshtein(name, candidate);
            if (distance < bestDistance) {
                best = candidate;
                bestDistance = distance;
            }
        }
        if (best != null && bestDistance <= maxDistance) {
            return Optional.of(best);
        }
        for (String candidate : candidates) {
            if (!candidate.equals(name) && candidate.startsWith(name)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /** Formats the suggestion text attached to errors. */
    public static String didYouMean(String candidate) {
        return "Did you mean '" + candidate + "'?";
    }

    static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
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
}
