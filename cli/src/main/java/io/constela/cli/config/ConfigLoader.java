package io.constela.cli.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link CliConfig} from an optional YAML file with an environment variable overlay.
 *
 * <p>YAML layout:
 *
 * <pre>
 * output:
 *   dir: build/constela
 *   pretty: true
 * render:
 *   html: true
 *   state-overrides:
 *     count: 5
 * compiler:
 *   max-suggestion-distance: 2
 * logging:
 *   format: text
 *   level: INFO
 * </pre>
 *
 * <p>Environment variables take precedence over YAML values. A variable counts as set only when it
 * is defined and its trimmed value is non-empty.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from the given file, or defaults when {@code configPath} is null, with
     * overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static CliConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration with overrides from the supplied lookup function. The lookup returns null
     * for undefined variables.
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static CliConfig load(Path configPath, Function<String, String> envLookup) {
        if (configPath == null) {
            return mapToConfig(YAML_MAPPER.createObjectNode(), envLookup);
        }
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root == null || root.isMissingNode() ? YAML_MAPPER.createObjectNode() : root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (RuntimeException e) {
            throw new ConfigLoadException("Failed to load configuration from: " + configPath, e);
        }
    }

    private static CliConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        CliConfig.Builder builder = CliConfig.builder();

        // --- YAML mapping ---

        JsonNode output = root.path("output");
        if (output.has("dir")) builder.outputDir(output.get("dir").asText());
        if (output.has("pretty")) builder.outputPretty(output.get("pretty").asBoolean());

        JsonNode render = root.path("render");
        if (render.has("html")) builder.renderHtml(render.get("html").asBoolean());
        JsonNode overrides = render.path("state-overrides");
        if (overrides.isObject()) {
            Map<String, JsonNode> values = new LinkedHashMap<>();
            overrides.fields().forEachRemaining(e -> values.put(e.getKey(), e.getValue()));
            builder.stateOverrides(values);
        } else if (!overrides.isMissingNode()) {
            throw new ConfigLoadException("render.state-overrides must be a mapping");
        }

        JsonNode compiler = root.path("compiler");
        if (compiler.has("max-suggestion-distance"))
            builder.maxSuggestionDistance(compiler.get("max-suggestion-distance").asInt());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        // --- Environment variable overlay ---

        envString(envLookup, "CONSTELA_OUTPUT_DIR", builder::outputDir);
        envBool(envLookup, "CONSTELA_OUTPUT_PRETTY", builder::outputPretty);
        envBool(envLookup, "CONSTELA_RENDER_HTML", builder::renderHtml);
        envString(envLookup, "CONSTELA_LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "CONSTELA_LOG_LEVEL", builder::loggingLevel);
        envInt(envLookup, "CONSTELA_MAX_SUGGESTION_DISTANCE", builder::maxSuggestionDistance);

        return builder.build();
    }

    // --- Env var helpers ---

    /** Returns {@code true} if the env var is defined and non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got: " + value, e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }
}
