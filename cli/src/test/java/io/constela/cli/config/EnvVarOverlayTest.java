package io.constela.cli.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Environment variables take precedence over YAML values. */
@DisplayName("Environment variable overlay")
class EnvVarOverlayTest {

    private static final Path FULL = Path.of("src/test/resources/config/full-config.yaml");

    @Test
    @DisplayName("env vars override YAML")
    void envOverridesYaml() {
        Map<String, String> env = Map.of(
                "CONSTELA_OUTPUT_DIR", "dist",
                "CONSTELA_OUTPUT_PRETTY", "true",
                "CONSTELA_RENDER_HTML", "false",
                "CONSTELA_LOG_FORMAT", "text",
                "CONSTELA_LOG_LEVEL", "WARN",
                "CONSTELA_MAX_SUGGESTION_DISTANCE", "1");

        CliConfig config = ConfigLoader.load(FULL, env::get);

        assertThat(config.outputDir()).isEqualTo("dist");
        assertThat(config.outputPretty()).isTrue();
        assertThat(config.renderHtml()).isFalse();
        assertThat(config.loggingFormat()).isEqualTo("text");
        assertThat(config.loggingLevel()).isEqualTo("WARN");
        assertThat(config.maxSuggestionDistance()).isEqualTo(1);
    }

    @Test
    @DisplayName("env vars apply without a config file")
    void envWithoutFile() {
        CliConfig config = ConfigLoader.load(null, Map.of("CONSTELA_RENDER_HTML", "true")::get);

        assertThat(config.renderHtml()).isTrue();
    }

    @Test
    @DisplayName("blank env vars are ignored")
    void blankIgnored() {
        CliConfig config = ConfigLoader.load(FULL, Map.of("CONSTELA_OUTPUT_DIR", "   ")::get);

        assertThat(config.outputDir()).isEqualTo("build/pages");
    }

    @Test
    @DisplayName("values are trimmed")
    void trimmed() {
        CliConfig config = ConfigLoader.load(null, Map.of("CONSTELA_LOG_LEVEL", "  ERROR ")::get);

        assertThat(config.loggingLevel()).isEqualTo("ERROR");
    }

    @Test
    @DisplayName("non-integer distance is rejected")
    void badInteger() {
        assertThatThrownBy(() -> ConfigLoader.load(null, Map.of("CONSTELA_MAX_SUGGESTION_DISTANCE", "two")::get))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessage("CONSTELA_MAX_SUGGESTION_DISTANCE must be an integer, got: two");
    }

    @Test
    @DisplayName("negative distance is rejected")
    void negativeDistance() {
        assertThatThrownBy(() -> ConfigLoader.load(null, Map.of("CONSTELA_MAX_SUGGESTION_DISTANCE", "-1")::get))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("must be >= 0");
    }
}
