package io.constela.cli.config;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration for the {@code constela} command line.
 *
 * <p>Use {@link #builder()} to construct instances; every field has a default.
 *
 * @param outputDir             directory receiving compiled output; null writes next to the input
 * @param outputPretty          pretty-print the compiled JSON (default true)
 * @param renderHtml            also render the program to {@code <name>.html} (default false)
 * @param stateOverrides        state values replacing initials during rendering
 * @param maxSuggestionDistance edit distance for "Did you mean" hints (default 2)
 * @param loggingFormat         json or text (default text)
 * @param loggingLevel          root log level (default INFO)
 */
public record CliConfig(
        String outputDir,
        boolean outputPretty,
        boolean renderHtml,
        Map<String, JsonNode> stateOverrides,
        int maxSuggestionDistance,
        String loggingFormat,
        String loggingLevel) {

    public CliConfig {
        stateOverrides = stateOverrides == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(stateOverrides));
    }

    /** Creates a new builder with defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Returns a builder seeded with this configuration's values. */
    public Builder toBuilder() {
        return new Builder()
                .outputDir(outputDir)
                .outputPretty(outputPretty)
                .renderHtml(renderHtml)
                .stateOverrides(stateOverrides)
                .maxSuggestionDistance(maxSuggestionDistance)
                .loggingFormat(loggingFormat)
                .loggingLevel(loggingLevel);
    }

    /** Builder for {@link CliConfig}. */
    public static final class Builder {
        private String outputDir;
        private boolean outputPretty = true;
        private boolean renderHtml;
        private Map<String, JsonNode> stateOverrides = Map.of();
        private int maxSuggestionDistance = 2;
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        private Builder() {}

        public Builder outputDir(String outputDir) {
            this.outputDir = outputDir;
            return this;
        }

        public Builder outputPretty(boolean outputPretty) {
            this.outputPretty = outputPretty;
            return this;
        }

        public Builder renderHtml(boolean renderHtml) {
            this.renderHtml = renderHtml;
            return this;
        }

        public Builder stateOverrides(Map<String, JsonNode> stateOverrides) {
            this.stateOverrides = stateOverrides;
            return this;
        }

        public Builder maxSuggestionDistance(int maxSuggestionDistance) {
            this.maxSuggestionDistance = maxSuggestionDistance;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public CliConfig build() {
            if (maxSuggestionDistance < 0) {
                throw new ConfigLoadException(
                        "compiler.max-suggestion-distance must be >= 0, got: " + maxSuggestionDistance);
            }
            if (!"json".equalsIgnoreCase(loggingFormat) && !"text".equalsIgnoreCase(loggingFormat)) {
                throw new ConfigLoadException("logging.format must be 'json' or 'text', got: " + loggingFormat);
            }
            return new CliConfig(
                    outputDir,
                    outputPretty,
                    renderHtml,
                    stateOverrides,
                    maxSuggestionDistance,
                    loggingFormat,
                    loggingLevel);
        }
    }
}
