package io.constela.core.engine;

import io.constela.core.analyze.AnalysisOptions;

/**
 * Compiler configuration.
 *
 * @param maxSuggestionDistance edit distance up to which "Did you mean" hints are offered; with
 *                              0 only prefix matches are suggested
 * @param includeAvailableNames whether reference errors list the names that were in scope
 * @param validateSchema        whether raw documents are checked against the program schema before
 *                              parsing
 * @param checkAccessibility    whether successful compiles report accessibility warnings
 */
public record CompilerOptions(
        int maxSuggestionDistance,
        boolean includeAvailableNames,
        boolean validateSchema,
        boolean checkAccessibility) {

    /** Distance 2, available names listed, schema validation and accessibility checks on. */
    public static final CompilerOptions DEFAULT = builder().build();

    public CompilerOptions {
        if (maxSuggestionDistance < 0) {
            throw new IllegalArgumentException(
                    "maxSuggestionDistance must be >= 0, got: " + maxSuggestionDistance);
        }
    }

    public AnalysisOptions analysisOptions() {
        return new AnalysisOptions(maxSuggestionDistance, includeAvailableNames);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link CompilerOptions}. */
    public static final class Builder {
        private int maxSuggestionDistance = AnalysisOptions.DEFAULT.maxSuggestionDistance();
        private boolean includeAvailableNames = AnalysisOptions.DEFAULT.includeAvailableNames();
        private boolean validateSchema = true;
        private boolean checkAccessibility = true;

        private Builder() {}

        public Builder maxSuggestionDistance(int maxSuggestionDistance) {
            this.maxSuggestionDistance = maxSuggestionDistance;
            return this;
        }

        public Builder includeAvailableNames(boolean includeAvailableNames) {
            this.includeAvailableNames = includeAvailableNames;
            return this;
        }

        public Builder validateSchema(boolean validateSchema) {
            this.validateSchema = validateSchema;
            return this;
        }

        public Builder checkAccessibility(boolean checkAccessibility) {
            this.checkAccessibility = checkAccessibility;
            return this;
        }

        public CompilerOptions build() {
            return new CompilerOptions(maxSuggestionDistance, includeAvailableNames, validateSchema, checkAccessibility);
        }
    }
}
