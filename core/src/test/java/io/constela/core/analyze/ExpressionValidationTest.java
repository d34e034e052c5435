package io.constela.core.analyze;

import static io.constela.core.testkit.Programs.errors;
import static io.constela.core.testkit.Programs.program;
import static org.assertj.core.api.Assertions.assertThat;

import io.constela.core.error.ConstelaError;
import io.constela.core.error.ErrorCode;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** Name resolution inside expressions, exercised through text nodes of the page view. */
@DisplayName("Expression validation")
class ExpressionValidationTest {

    private static final String STATE = "{\"count\": {\"type\": \"number\", \"initial\": 0}}";

    private static List<ConstelaError> textErrors(String expr) {
        return textErrors(expr, "");
    }

    private static List<ConstelaError> textErrors(String expr, String extra) {
        return errors(program(STATE, "[]", "{\"kind\": \"text\", \"value\": " + expr + "}", extra));
    }

    @Nested
    @DisplayName("State and variables")
    class StateAndVars {

        @Test
        @DisplayName("undefined state in a binary expression is reported at /left")
        void undefinedStateInBinary() {
            List<ConstelaError> errors = textErrors("""
                    {"expr": "bin", "op": "+", "left": {"expr": "state", "name": "counter"},
                     "right": {"expr": "lit", "value": 1}}
                    """);

            assertThat(errors).singleElement().satisfies(e -> {
                assertThat(e.code()).isEqualTo(ErrorCode.UNDEFINED_STATE);
                assertThat(e.path()).isEqualTo("/view/value/left");
                assertThat(e.suggestion()).isEqualTo("Did you mean 'count'?");
            });
        }

        @ParameterizedTest(name = "{0} undefined references")
        @ValueSource(ints = {1, 3, 7})
        @DisplayName("each independent undefined state reference is its own error")
        void oneErrorPerUndefinedReference(int count) {
            String items = IntStream.range(0, count)
                    .mapToObj(i -> "{\"expr\": \"state\", \"name\": \"missing" + i + "\"}")
                    .collect(Collectors.joining(", "));

            List<ConstelaError> errors = textErrors("{\"expr\": \"concat\", \"items\": [" + items + "]}");

            assertThat(errors).hasSize(count).allSatisfy(e -> assertThat(e.code()).isEqualTo(ErrorCode.UNDEFINED_STATE));
            assertThat(errors).extracting(ConstelaError::path)
                    .containsExactlyElementsOf(IntStream.range(0, count)
                            .mapToObj(i -> "/view/value/items/" + i)
                            .collect(Collectors.toList()));
        }

        @Test
        @DisplayName("var outside any loop reports UNDEFINED_VAR")
        void varOutsideLoop() {
            List<ConstelaError> errors = textErrors("{\"expr\": \"var\", \"name\": \"item\"}");

            assertThat(errors).singleElement().satisfies(e -> {
                assertThat(e.code()).isEqualTo(ErrorCode.UNDEFINED_VAR);
                assertThat(e.message()).isEqualTo("Undefined variable reference: 'item' is not defined in scope");
            });
        }

        @Test
        @DisplayName("lambda params are in scope inside the lambda body only")
        void lambdaParamScope() {
            List<ConstelaError> errors = textErrors("""
                    {"expr": "call", "target": {"expr": "lit", "value": [1, 2]}, "method": "map",
                     "args": [{"expr": "lambda", "param": "x", "index": "i",
                               "body": {"expr": "bin", "op": "+", "left": {"expr": "var", "name": "x"},
                                        "right": {"expr": "var", "name": "i"}}},
                              {"expr": "var", "name": "x"}]}
                    """);

            assertThat(errors).singleElement()
                    .extracting(ConstelaError::path)
                    .isEqualTo("/view/value/args/1");
        }

        @Test
        @DisplayName("nested paths cover cond, get, index, concat and array")
        void nestedPaths() {
            List<ConstelaError> errors = textErrors("""
                    {"expr": "cond",
                     "if": {"expr": "not", "operand": {"expr": "state", "name": "a"}},
                     "then": {"expr": "get", "base": {"expr": "state", "name": "b"}, "path": "x"},
                     "else": {"expr": "concat", "items": [
                        {"expr": "index", "base": {"expr": "state", "name": "c"}, "key": {"expr": "lit", "value": 0}},
                        {"expr": "array", "elements": [{"expr": "state", "name": "d"}]}]}}
                    """);

            assertThat(errors).extracting(ConstelaError::path).containsExactly(
                    "/view/value/if/operand",
                    "/view/value/then/base",
                    "/view/value/else/items/0/base",
                    "/view/value/else/items/1/elements/0");
        }
    }

    @Nested
    @DisplayName("Declarations that may be absent")
    class Declarations {

        @Test
        @DisplayName("route without a route declaration reports ROUTE_NOT_DEFINED")
        void routeWithoutDeclaration() {
            assertThat(textErrors("{\"expr\": \"route\", \"name\": \"id\"}"))
                    .extracting(ConstelaError::code)
                    .containsExactly(ErrorCode.ROUTE_NOT_DEFINED);
        }

        @Test
        @DisplayName("route param missing from the path pattern reports UNDEFINED_ROUTE_PARAM")
        void routeParamNotInPattern() {
            List<ConstelaError> errors = textErrors(
                    "{\"expr\": \"route\", \"name\": \"slug\"}", "\"route\": {\"path\": \"/posts/:id\"}");

            assertThat(errors).singleElement().satisfies(e -> {
                assertThat(e.code()).isEqualTo(ErrorCode.UNDEFINED_ROUTE_PARAM);
                assertThat(e.message()).isEqualTo("Undefined route param: 'slug' is not defined in route path '/posts/:id'");
                assertThat(e.context().get("availableNames")).isEqualTo(List.of("id"));
            });
        }

        @Test
        @DisplayName("query and path sources are not checked against the pattern")
        void routeQuerySource() {
            assertThat(textErrors(
                            "{\"expr\": \"route\", \"name\": \"page\", \"source\": \"query\"}",
                            "\"route\": {\"path\": \"/posts/:id\"}"))
                    .isEmpty();
        }

        @Test
        @DisplayName("imports: absent declaration versus unknown name")
        void imports() {
            assertThat(textErrors("{\"expr\": \"import\", \"name\": \"nav\"}"))
                    .extracting(ConstelaError::code)
                    .containsExactly(ErrorCode.IMPORTS_NOT_DEFINED);
            assertThat(textErrors("{\"expr\": \"import\", \"name\": \"nav\"}", "\"imports\": {\"navigation\": []}"))
                    .extracting(ConstelaError::code)
                    .containsExactly(ErrorCode.UNDEFINED_IMPORT);
        }

        @Test
        @DisplayName("data: absent declaration versus unknown name")
        void data() {
            assertThat(textErrors("{\"expr\": \"data\", \"name\": \"posts\"}"))
                    .extracting(ConstelaError::code)
                    .containsExactly(ErrorCode.DATA_NOT_DEFINED);
            assertThat(textErrors(
                            "{\"expr\": \"data\", \"name\": \"posts\"}",
                            "\"data\": {\"articles\": {\"type\": \"glob\", \"pattern\": \"*.md\"}}"))
                    .extracting(ConstelaError::code)
                    .containsExactly(ErrorCode.UNDEFINED_DATA);
        }

        @Test
        @DisplayName("ref must name an element ref in the view")
        void refs() {
            String view = """
                    {"kind": "element", "tag": "div", "children": [
                      {"kind": "element", "tag": "input", "ref": "nameInput"},
                      {"kind": "text", "value": {"expr": "ref", "name": "nameInpt"}}]}
                    """;

            List<ConstelaError> errors = errors(program(STATE, "[]", view));

            assertThat(errors).singleElement().satisfies(e -> {
                assertThat(e.code()).isEqualTo(ErrorCode.UNDEFINED_REF);
                assertThat(e.suggestion()).isEqualTo("Did you mean 'nameInput'?");
            });
        }

        @Test
        @DisplayName("validity checks are left to the runtime")
        void validityIsNotChecked() {
            assertThat(textErrors("{\"expr\": \"validity\", \"ref\": \"nowhere\"}")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Styles")
    class Styles {

        private static final String STYLES = """
                "styles": {"button": {"base": "btn", "variants": {"size": {"sm": "btn-sm", "lg": "btn-lg"}}}}
                """;

        @Test
        @DisplayName("unknown style reports UNDEFINED_STYLE")
        void unknownStyle() {
            assertThat(textErrors("{\"expr\": \"style\", \"name\": \"buton\"}", STYLES))
                    .singleElement()
                    .satisfies(e -> {
                        assertThat(e.code()).isEqualTo(ErrorCode.UNDEFINED_STYLE);
                        assertThat(e.suggestion()).isEqualTo("Did you mean 'button'?");
                    });
        }

        @Test
        @DisplayName("unknown variant key reports UNDEFINED_VARIANT at /variants/<key>")
        void unknownVariant() {
            List<ConstelaError> errors = textErrors("""
                    {"expr": "style", "name": "button", "variants": {"color": {"expr": "lit", "value": "red"}}}
                    """, STYLES);

            assertThat(errors).singleElement().satisfies(e -> {
                assertThat(e.code()).isEqualTo(ErrorCode.UNDEFINED_VARIANT);
                assertThat(e.path()).isEqualTo("/view/value/variants/color");
            });
        }

        @Test
        @DisplayName("variant values are validated as expressions")
        void variantValueIsValidated() {
            List<ConstelaError> errors = textErrors("""
                    {"expr": "style", "name": "button", "variants": {"size": {"expr": "state", "name": "size"}}}
                    """, STYLES);

            assertThat(errors).singleElement().satisfies(e -> {
                assertThat(e.code()).isEqualTo(ErrorCode.UNDEFINED_STATE);
                assertThat(e.path()).isEqualTo("/view/value/variants/size");
            });
        }
    }
}
