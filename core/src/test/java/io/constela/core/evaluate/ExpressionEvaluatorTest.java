package io.constela.core.evaluate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.POJONode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.constela.core.compiled.CompiledExpression;
import io.constela.core.error.ExpressionEvalException;
import io.constela.core.model.StylePreset;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("ExpressionEvaluator")
class ExpressionEvaluatorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static JsonNode json(String text) {
        try {
            return MAPPER.readTree(text);
        } catch (Exception e) {
            throw new IllegalArgumentException(text, e);
        }
    }

    private static CompiledExpression lit(Object value) {
        return new CompiledExpression.Lit(MAPPER.valueToTree(value));
    }

    private static CompiledExpression state(String name) {
        return new CompiledExpression.StateRef(name, null);
    }

    private static CompiledExpression var(String name) {
        return new CompiledExpression.VarRef(name, null);
    }

    private static CompiledExpression bin(String op, CompiledExpression left, CompiledExpression right) {
        return new CompiledExpression.Binary(op, left, right);
    }

    private static CompiledExpression call(CompiledExpression target, String method, CompiledExpression... args) {
        return new CompiledExpression.Call(target, method, List.of(args));
    }

    private static final EvaluationContext CTX = new EvaluationContext(
            Map.of(
                    "count", IntNode.valueOf(3),
                    "name", TextNode.valueOf("Ada"),
                    "user", json("{\"profile\": {\"city\": \"Zagreb\"}, \"tags\": [\"a\", \"b\"]}"),
                    "items", json("[1, 2, 3, 4]"),
                    "nothing", NullNode.getInstance(),
                    "born", new POJONode(Instant.parse("1815-12-10T08:30:00Z"))),
            Map.of("row", json("{\"id\": 7}")),
            new RouteContext(Map.of("id", "42"), Map.of("tab", "posts"), "/users/42"),
            Map.of("nav", json("[{\"label\": \"Home\"}]")),
            Map.of("button", new StylePreset(
                    "btn",
                    Map.of("size", Map.of("sm", "btn-sm", "lg", "btn-lg")),
                    Map.of("size", "sm"))));

    private static JsonNode eval(CompiledExpression expr) {
        return ExpressionEvaluator.evaluate(expr, CTX);
    }

    @Nested
    @DisplayName("References")
    class References {

        @Test
        void stateWithPath() {
            assertThat(eval(new CompiledExpression.StateRef("user", "profile.city")).textValue()).isEqualTo("Zagreb");
            assertThat(eval(new CompiledExpression.StateRef("user", "tags.1")).textValue()).isEqualTo("b");
            assertThat(eval(new CompiledExpression.StateRef("nothing", "deep")).isNull()).isTrue();
        }

        @Test
        void unknownStateIsUndefined() {
            assertThat(eval(state("missing")).isMissingNode()).isTrue();
        }

        @Test
        void dottedVarName() {
            assertThat(eval(var("row.id")).intValue()).isEqualTo(7);
            assertThat(eval(new CompiledExpression.VarRef("row", "id")).intValue()).isEqualTo(7);
        }

        @Test
        void routeSources() {
            assertThat(eval(new CompiledExpression.RouteRef("id", null)).textValue()).isEqualTo("42");
            assertThat(eval(new CompiledExpression.RouteRef("tab", "query")).textValue()).isEqualTo("posts");
            assertThat(eval(new CompiledExpression.RouteRef("x", "path")).textValue()).isEqualTo("/users/42");
            assertThat(eval(new CompiledExpression.RouteRef("other", "param")).textValue()).isEmpty();
        }

        @Test
        void routeWithoutContextIsEmptyString() {
            JsonNode value = ExpressionEvaluator.evaluate(
                    new CompiledExpression.RouteRef("id", null), EvaluationContext.ofState(Map.of()));

            assertThat(value.textValue()).isEmpty();
        }

        @Test
        void importsAndData() {
            assertThat(eval(new CompiledExpression.ImportRef("nav", "0.label")).textValue()).isEqualTo("Home");
            assertThat(eval(new CompiledExpression.DataRef("nav", null)).isArray()).isTrue();
            assertThat(eval(new CompiledExpression.ImportRef("missing", null)).isMissingNode()).isTrue();
        }

        @Test
        void domReadsOnTheServer() {
            assertThat(eval(new CompiledExpression.Ref("input")).isNull()).isTrue();
            assertThat(eval(new CompiledExpression.Validity("input", "valid")).booleanValue()).isFalse();
        }

        @Test
        void forbiddenKeysNeverResolve() {
            assertThat(eval(new CompiledExpression.StateRef("user", "__proto__")).isMissingNode()).isTrue();
            assertThat(eval(new CompiledExpression.Get(state("user"), "constructor")).isMissingNode()).isTrue();
            assertThat(eval(new CompiledExpression.Index(state("user"), lit("prototype"))).isMissingNode()).isTrue();
            assertThat(eval(var("row.__proto__")).isMissingNode()).isTrue();
        }

        @Test
        @DisplayName("get through __proto__ is undefined and leaves the base untouched")
        void getThroughPrototypeKey() {
            JsonNode before = CTX.state().get("user").deepCopy();

            assertThat(eval(new CompiledExpression.Get(state("user"), "__proto__.polluted")).isMissingNode())
                    .isTrue();
            assertThat(eval(new CompiledExpression.Get(lit(Map.of()), "__proto__.polluted")).isMissingNode())
                    .isTrue();
            assertThat(CTX.state().get("user")).isEqualTo(before);
        }

        @Test
        @DisplayName("get reads string length and characters like a var path does")
        void getOnStrings() {
            assertThat(eval(new CompiledExpression.Get(lit("abc"), "length")).intValue()).isEqualTo(3);
            assertThat(eval(new CompiledExpression.Get(lit("abc"), "1")).textValue()).isEqualTo("b");
            assertThat(eval(new CompiledExpression.Get(lit("abc"), "7")).isMissingNode()).isTrue();
            assertThat(eval(new CompiledExpression.Get(state("user"), "profile.city.length")).intValue())
                    .isEqualTo(6);
            assertThat(eval(new CompiledExpression.Get(state("count"), "length")).isMissingNode()).isTrue();
        }

        @Test
        void indexIntoStringsArraysAndObjects() {
            assertThat(eval(new CompiledExpression.Index(state("name"), lit(1))).textValue()).isEqualTo("d");
            assertThat(eval(new CompiledExpression.Index(state("items"), lit(0))).intValue()).isEqualTo(1);
            assertThat(eval(new CompiledExpression.Index(state("items"), lit("length"))).intValue()).isEqualTo(4);
            assertThat(eval(new CompiledExpression.Index(state("user"), lit("profile"))).isObject()).isTrue();
        }
    }

    @Nested
    @DisplayName("Operators")
    class Operators {

        @ParameterizedTest
        @CsvSource({"+, 5", "-, 1", "*, 6", "%, 1"})
        void arithmetic(String op, int expected) {
            assertThat(eval(bin(op, lit(3), lit(2))).intValue()).isEqualTo(expected);
        }

        @Test
        void divisionKeepsFraction() {
            assertThat(eval(bin("/", lit(3), lit(2))).doubleValue()).isEqualTo(1.5);
        }

        @Test
        void plusConcatenatesNonNumbers() {
            assertThat(eval(bin("+", lit("n="), state("count"))).textValue()).isEqualTo("n=3");
        }

        @Test
        void comparisonAndEquality() {
            assertThat(eval(bin("<", lit(1), lit(2))).booleanValue()).isTrue();
            assertThat(eval(bin(">=", lit("b"), lit("a"))).booleanValue()).isTrue();
            assertThat(eval(bin("==", lit(1), lit("1"))).booleanValue()).isFalse();
            assertThat(eval(bin("!=", state("nothing"), state("missing"))).booleanValue()).isTrue();
        }

        @Test
        void logicalOperatorsReturnOperands() {
            assertThat(eval(bin("&&", lit(""), lit("x"))).textValue()).isEmpty();
            assertThat(eval(bin("||", lit(0), lit("fallback"))).textValue()).isEqualTo("fallback");
            assertThat(eval(bin("&&", lit(1), state("name"))).textValue()).isEqualTo("Ada");
        }

        @Test
        void logicalOperatorsShortCircuit() {
            CompiledExpression broken = bin("**", lit(1), lit(2));

            assertThat(eval(bin("&&", lit(false), broken)).booleanValue()).isFalse();
            assertThat(eval(bin("||", lit(true), broken)).booleanValue()).isTrue();
        }

        @Test
        void unknownOperatorThrows() {
            assertThatThrownBy(() -> eval(bin("**", lit(1), lit(2))))
                    .isInstanceOf(ExpressionEvalException.class)
                    .hasMessage("Unknown binary operator: **");
        }

        @Test
        void notAndCond() {
            assertThat(eval(new CompiledExpression.Not(lit(0))).booleanValue()).isTrue();
            assertThat(eval(new CompiledExpression.Cond(state("nothing"), lit("yes"), lit("no"))).textValue())
                    .isEqualTo("no");
        }

        @Test
        void concatSkipsNullish() {
            JsonNode value = eval(new CompiledExpression.Concat(
                    List.of(lit("a"), state("nothing"), state("missing"), lit(1), lit(true))));

            assertThat(value.textValue()).isEqualTo("a1true");
        }

        @Test
        void arrayLiteralTurnsUndefinedIntoNull() {
            JsonNode value = eval(new CompiledExpression.ArrayLit(List.of(lit(1), state("missing"))));

            assertThat(value).isEqualTo(json("[1, null]"));
        }
    }

    @Nested
    @DisplayName("Method calls")
    class Calls {

        private CompiledExpression lambda(String param, CompiledExpression body) {
            return new CompiledExpression.Lambda(param, null, body);
        }

        @Test
        void arrayMethodsWithLambdas() {
            CompiledExpression even = lambda("x", bin("==", bin("%", var("x"), lit(2)), lit(0)));

            assertThat(eval(call(state("items"), "filter", even))).isEqualTo(json("[2, 4]"));
            assertThat(eval(call(state("items"), "map", lambda("x", bin("*", var("x"), lit(10))))))
                    .isEqualTo(json("[10, 20, 30, 40]"));
            assertThat(eval(call(state("items"), "find", even)).intValue()).isEqualTo(2);
            assertThat(eval(call(state("items"), "some", even)).booleanValue()).isTrue();
            assertThat(eval(call(state("items"), "every", even)).booleanValue()).isFalse();
        }

        @Test
        void lambdaIndexIsBound() {
            CompiledExpression withIndex = new CompiledExpression.Lambda("x", "i", var("i"));

            assertThat(eval(call(state("items"), "map", withIndex))).isEqualTo(json("[0, 1, 2, 3]"));
        }

        @Test
        void arrayMethodsWithoutCallbacks() {
            assertThat(eval(call(state("items"), "at", lit(-1))).intValue()).isEqualTo(4);
            assertThat(eval(call(state("items"), "slice", lit(1), lit(3)))).isEqualTo(json("[2, 3]"));
            assertThat(eval(call(state("items"), "includes", lit(3))).booleanValue()).isTrue();
            assertThat(eval(call(state("items"), "indexOf", lit(9))).intValue()).isEqualTo(-1);
            assertThat(eval(call(state("items"), "join", lit("-"))).textValue()).isEqualTo("1-2-3-4");
        }

        @Test
        @DisplayName("at() with an index beyond int range is undefined")
        void atOutOfRange() {
            CompiledExpression letters = lit(List.of("x", "y", "z"));

            assertThat(eval(call(letters, "at", lit(4294967296L))).isMissingNode()).isTrue();
            assertThat(eval(call(letters, "at", lit(-4294967296L))).isMissingNode()).isTrue();
            assertThat(eval(call(letters, "at", new CompiledExpression.Lit(DoubleNode.valueOf(Double.POSITIVE_INFINITY))))
                            .isMissingNode())
                    .isTrue();
            assertThat(eval(call(letters, "at", new CompiledExpression.Lit(DoubleNode.valueOf(Double.NEGATIVE_INFINITY))))
                            .isMissingNode())
                    .isTrue();
            assertThat(eval(call(letters, "at", lit(-3))).textValue()).isEqualTo("x");
        }

        @Test
        void stringMethods() {
            assertThat(eval(call(lit("  Hi  "), "trim")).textValue()).isEqualTo("Hi");
            assertThat(eval(call(state("name"), "toUpperCase")).textValue()).isEqualTo("ADA");
            assertThat(eval(call(lit("\u00A0\uFEFF\u2003Hi\u3000\n"), "trim")).textValue()).isEqualTo("Hi");
            assertThat(eval(call(lit("a,b,c"), "split", lit(","))))
                    .isEqualTo(json("[\"a\", \"b\", \"c\"]"));
            assertThat(eval(call(lit("hello"), "slice", lit(-3))).textValue()).isEqualTo("llo");
            assertThat(eval(call(lit("aXbX"), "replace", lit("X"), lit("-"))).textValue()).isEqualTo("a-bX");
            assertThat(eval(call(lit("hello"), "startsWith", lit("he"))).booleanValue()).isTrue();
        }

        @Test
        void methodsOutsideTheWhitelistAreUndefined() {
            assertThat(eval(call(state("items"), "push", lit(5))).isMissingNode()).isTrue();
            assertThat(eval(call(state("name"), "constructor")).isMissingNode()).isTrue();
            assertThat(eval(call(state("count"), "toFixed", lit(2))).isMissingNode()).isTrue();
        }

        @Test
        void mathGlobal() {
            assertThat(eval(call(var("Math"), "max", lit(1), lit(7), lit(3))).intValue()).isEqualTo(7);
            assertThat(eval(call(var("Math"), "round", lit(-2.5))).intValue()).isEqualTo(-2);
            assertThat(eval(call(var("Math"), "round", lit(2.5))).intValue()).isEqualTo(3);
            assertThat(eval(call(var("Math"), "pow", lit(2), lit(10))).intValue()).isEqualTo(1024);
            assertThat(eval(call(var("Math"), "eval", lit(1))).isMissingNode()).isTrue();
        }

        @Test
        void dateGlobalAndInstances() {
            assertThat(eval(call(var("Date"), "parse", lit("2024-01-02"))).longValue()).isEqualTo(1704153600000L);
            assertThat(eval(call(var("Date"), "parse", lit("not a date"))).doubleValue()).isNaN();
            assertThat(eval(call(state("born"), "getFullYear")).intValue()).isEqualTo(1815);
            assertThat(eval(call(state("born"), "getMonth")).intValue()).isEqualTo(11);
            assertThat(eval(call(state("born"), "toISOString")).textValue()).isEqualTo("1815-12-10T08:30:00.000Z");
        }
    }

    @Nested
    @DisplayName("Styles")
    class Styles {

        @Test
        void defaultVariantApplies() {
            assertThat(eval(new CompiledExpression.Style("button", Map.of())).textValue()).isEqualTo("btn btn-sm");
        }

        @Test
        void suppliedVariantWins() {
            assertThat(eval(new CompiledExpression.Style("button", Map.of("size", lit("lg")))).textValue())
                    .isEqualTo("btn btn-lg");
        }

        @Test
        void unknownPresetIsEmpty() {
            assertThat(ExpressionEvaluator.evaluateStyle(new CompiledExpression.Style("nope", Map.of()), CTX))
                    .isEmpty();
        }

        @Test
        void brokenVariantIsSkipped() {
            CompiledExpression broken = bin("**", lit(1), lit(2));

            assertThat(eval(new CompiledExpression.Style("button", Map.of("size", broken))).textValue())
                    .isEqualTo("btn");
        }
    }
}
