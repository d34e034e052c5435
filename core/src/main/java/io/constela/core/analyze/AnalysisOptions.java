package io.constela.core.analyze;

/**
 * Tuning knobs for diagnostics produced by {@link Analyzer}.
 *
 * <p>
 * Immutable and thread-safe.
 *
 * @param maxSuggestionDistance largest edit distance for a "Did you mean" hint
 *                              (default: 2)
 * @param includeAvailableNames whether reference errors list the declared
 *                              names in {@code context.availableNames}
 *                              (default: true)
 */
public record AnalysisOptions(int maxSuggestionDistance, boolean includeAvailableNames) {

    /** Default options: distance 2, available names included. */
    public static final AnalysisOptions DEFAULT = new AnalysisOptions(2, true);

    public AnalysisOptions {
        if (maxSuggestionDistance < 0) {
            throw new IllegalArgumentException(
                    "maxSuggestionDistance must not be negative, got: " + maxSuggestionDistance);
        }
    }
}
