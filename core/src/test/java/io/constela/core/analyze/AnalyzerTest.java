package io.constela.core.analyze;

import static io.constela.core.testkit.Programs.EMPTY_VIEW;
import static io.constela.core.testkit.Programs.errors;
import static io.constela.core.testkit.Programs.parse;
import static io.constela.core.testkit.Programs.program;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import io.constela.core.error.ConstelaError;
import io.constela.core.error.ErrorCode;
import io.constela.core.model.Program;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Analyzer")
class AnalyzerTest {

    private static final String COUNTER_STATE = "{\"count\": {\"type\": \"number\", \"initial\": 0}}";
    private static final String INCREMENT = """
            [{"name": "increment", "steps": [{"do": "update", "target": "count", "operation": "increment"}]}]
            """;

    @Test
    @DisplayName("a valid counter program succeeds with its collected context")
    void validProgramSucceeds() {
        Program program = parse(program(COUNTER_STATE, INCREMENT, """
                {"kind": "element", "tag": "button",
                 "props": {"onClick": {"event": "click", "action": "increment"}},
                 "children": [{"kind": "text", "value": {"expr": "state", "name": "count"}}]}
                """));

        AnalyzeResult result = new Analyzer().analyze(program);

        assertThat(result.isOk()).isTrue();
        AnalyzeResult.Success success = (AnalyzeResult.Success) result;
        assertThat(success.program()).isSameAs(program);
        assertThat(success.context().stateNames()).containsExactly("count");
        assertThat(success.context().actionNames()).containsExactly("increment");
    }

    @Test
    @DisplayName("unsupported version is reported at /version")
    void unsupportedVersion() {
        String json = program(COUNTER_STATE, "[]", EMPTY_VIEW).replace("\"1.0\"", "\"2.0\"");

        assertThat(errors(json)).singleElement().satisfies(e -> {
            assertThat(e.code()).isEqualTo(ErrorCode.UNSUPPORTED_VERSION);
            assertThat(e.path()).isEqualTo("/version");
            assertThat(e.message()).isEqualTo("Unsupported version: '2.0'. Supported versions: 1.0");
        });
    }

    @Test
    @DisplayName("errors from every section are accumulated in check order")
    void errorsAccumulate() {
        String json = program(COUNTER_STATE, """
                [{"name": "go", "steps": [{"do": "set", "target": "missing", "value": {"expr": "lit", "value": 1}}]},
                 {"name": "go", "steps": []}]
                """, """
                {"kind": "text", "value": {"expr": "state", "name": "cnt"}}
                """, "\"lifecycle\": {\"onMount\": \"load\"}");

        assertThat(errors(json)).extracting(ConstelaError::code, ConstelaError::path).containsExactly(
                tuple(ErrorCode.DUPLICATE_ACTION, "/actions/1/name"),
                tuple(ErrorCode.UNDEFINED_STATE, "/actions/0/steps/0/target"),
                tuple(ErrorCode.UNDEFINED_ACTION, "/lifecycle/onMount"),
                tuple(ErrorCode.UNDEFINED_STATE, "/view/value"));
    }

    @Test
    @DisplayName("a name duplicated three times is reported once")
    void duplicateReportedOnce() {
        String json = program("{}", """
                [{"name": "a", "steps": []}, {"name": "a", "steps": []}, {"name": "a", "steps": []}]
                """, EMPTY_VIEW);

        assertThat(errors(json)).singleElement().satisfies(e -> {
            assertThat(e.code()).isEqualTo(ErrorCode.DUPLICATE_ACTION);
            assertThat(e.message()).isEqualTo("Duplicate action name: 'a' is already defined");
        });
    }

    @Nested
    @DisplayName("Route")
    class Route {

        @Test
        @DisplayName("title and meta may read route params")
        void metadataReadsParams() {
            String json = program("{}", "[]", EMPTY_VIEW, """
                    "route": {"path": "/users/:id",
                              "title": {"expr": "concat", "items": [{"expr": "lit", "value": "User "},
                                                                    {"expr": "route", "name": "id"}]},
                              "meta": {"description": {"expr": "route", "name": "slug"}}}
                    """);

            assertThat(errors(json)).singleElement().satisfies(e -> {
                assertThat(e.code()).isEqualTo(ErrorCode.UNDEFINED_ROUTE_PARAM);
                assertThat(e.path()).isEqualTo("/route/meta/description");
            });
        }
    }

    @Nested
    @DisplayName("Data sources")
    class DataSources {

        @Test
        @DisplayName("each source type requires its location field")
        void requiredFields() {
            String json = program("{}", "[]", EMPTY_VIEW, """
                    "data": {"posts": {"type": "glob"}, "config": {"type": "file", "path": "site.json"},
                             "feed": {"type": "rss"}}
                    """);

            assertThat(errors(json)).extracting(ConstelaError::path, ConstelaError::message).containsExactly(
                    tuple(
                            "/data/posts", "Invalid data source 'posts': glob data source requires 'pattern'"),
                    tuple(
                            "/data/feed", "Invalid data source 'feed': unknown type 'rss'; expected glob, file or api"));
        }
    }

    @Nested
    @DisplayName("Options")
    class Options {

        @Test
        @DisplayName("availableNames can be switched off")
        void availableNamesDisabled() {
            Program program = parse(program(COUNTER_STATE, "[]", """
                    {"kind": "text", "value": {"expr": "state", "name": "cont"}}
                    """));

            AnalyzeResult result = new Analyzer(new AnalysisOptions(2, false)).analyze(program);

            ConstelaError error = ((AnalyzeResult.Failure) result).errors().get(0);
            assertThat(error.context()).doesNotContainKey("availableNames");
            assertThat(error.suggestion()).isEqualTo("Did you mean 'count'?");
        }

        @Test
        @DisplayName("suggestion distance zero still finds prefix matches")
        void distanceZero() {
            Program program = parse(program(COUNTER_STATE, "[]", """
                    {"kind": "text", "value": {"expr": "state", "name": "cou"}}
                    """));

            AnalyzeResult result = new Analyzer(new AnalysisOptions(0, true)).analyze(program);

            List<ConstelaError> errors = ((AnalyzeResult.Failure) result).errors();
            assertThat(errors.get(0).suggestion()).isEqualTo("Did you mean 'count'?");
        }

        @Test
        @DisplayName("negative distance is rejected")
        void negativeDistance() {
            assertThatThrownBy(() -> new AnalysisOptions(-1, true))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("must not be negative");
        }
    }

    @Test
    @DisplayName("failure results require at least one error")
    void failureRequiresErrors() {
        assertThatThrownBy(() -> new AnalyzeResult.Failure(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
