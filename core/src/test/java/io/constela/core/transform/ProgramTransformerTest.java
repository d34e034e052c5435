package io.constela.core.transform;

import static io.constela.core.testkit.Programs.EMPTY_VIEW;
import static io.constela.core.testkit.Programs.parse;
import static io.constela.core.testkit.Programs.program;
import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.constela.core.compiled.CompiledExpression;
import io.constela.core.compiled.CompiledNode;
import io.constela.core.compiled.CompiledProgram;
import io.constela.core.compiled.CompiledProgramWriter;
import io.constela.core.compiled.CompiledStep;
import io.constela.core.model.Program;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("ProgramTransformer")
class ProgramTransformerTest {

    @Test
    @DisplayName("actions are keyed by name and keep their steps")
    void actionsKeyedByName() {
        CompiledProgram compiled = ProgramTransformer.transform(parse(program("""
                {"count": {"type": "number", "initial": 0}}
                """, """
                [{"name": "increment", "steps": [{"do": "update", "target": "count", "operation": "increment"}]},
                 {"name": "reset", "steps": [{"do": "set", "target": "count", "value": {"expr": "lit", "value": 0}}]}]
                """, EMPTY_VIEW)));

        assertThat(compiled.version()).isEqualTo("1.0");
        assertThat(compiled.actions()).containsOnlyKeys("increment", "reset");
        assertThat(compiled.actions().get("reset").steps())
                .singleElement()
                .isInstanceOf(CompiledStep.SetStep.class);
        assertThat(compiled.state()).containsOnlyKeys("count");
    }

    @Test
    @DisplayName("absent lifecycle and empty import data are dropped")
    void emptySectionsDropped() {
        CompiledProgram compiled = ProgramTransformer.transform(parse(program("{}", "[]", EMPTY_VIEW)), Map.of());

        assertThat(compiled.lifecycle()).isNull();
        assertThat(compiled.importData()).isNull();
        assertThat(compiled.route()).isNull();
    }

    @Test
    @DisplayName("import data and lifecycle are carried over")
    void importDataAndLifecycle() {
        JsonNode nav = JsonNodeFactory.instance.arrayNode().add("home");
        CompiledProgram compiled = ProgramTransformer.transform(
                parse(program("{}", "[{\"name\": \"init\", \"steps\": []}]", EMPTY_VIEW,
                        "\"lifecycle\": {\"onMount\": \"init\"}")),
                Map.of("nav", nav));

        assertThat(compiled.importData()).containsEntry("nav", nav);
        assertThat(compiled.lifecycle().onMount()).isEqualTo("init");
    }

    @Test
    @DisplayName("route is compiled with its params and metadata")
    void route() {
        CompiledProgram compiled = ProgramTransformer.transform(parse(program("{}", "[]", EMPTY_VIEW, """
                "route": {"path": "/posts/:id", "layout": "blog",
                          "title": {"expr": "route", "name": "id"},
                          "meta": {"og:type": {"expr": "lit", "value": "article"}}}
                """)));

        assertThat(compiled.route().path()).isEqualTo("/posts/:id");
        assertThat(compiled.route().params()).containsExactly("id");
        assertThat(compiled.route().layout()).isEqualTo("blog");
        assertThat(compiled.route().title()).isEqualTo(new CompiledExpression.RouteRef("id", "param"));
        assertThat(compiled.route().meta()).containsOnlyKeys("og:type");
    }

    @Test
    @DisplayName("data references are lowered to import references")
    void dataLoweredToImport() {
        CompiledProgram compiled = ProgramTransformer.transform(parse(program("{}", "[]", """
                {"kind": "text", "value": {"expr": "data", "name": "posts", "path": "0.title"}}
                """, "\"data\": {\"posts\": {\"type\": \"glob\", \"pattern\": \"*.md\"}}")));

        assertThat(((CompiledNode.Text) compiled.view()).value())
                .isEqualTo(new CompiledExpression.ImportRef("posts", "0.title"));
    }

    @Test
    @DisplayName("islands keep their state and have their actions keyed by name")
    void island() {
        CompiledProgram compiled = ProgramTransformer.transform(parse(program("{}", "[]", """
                {"kind": "island", "id": "cart", "strategy": "idle",
                 "state": {"items": {"type": "list", "initial": []}},
                 "actions": [{"name": "clear", "steps": []}],
                 "content": {"kind": "text", "value": {"expr": "state", "name": "items"}}}
                """)));

        assertThat(compiled.view()).isInstanceOfSatisfying(CompiledNode.Island.class, island -> {
            assertThat(island.id()).isEqualTo("cart");
            assertThat(island.state()).containsOnlyKeys("items");
            assertThat(island.actions()).containsOnlyKeys("clear");
        });
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {
        "{\"expr\": \"lit\", \"value\": {\"a\": [1, 2.5, null]}}",
        "{\"expr\": \"state\", \"name\": \"user\", \"path\": \"profile.name\"}",
        "{\"expr\": \"bin\", \"op\": \"+\", \"left\": {\"expr\": \"state\", \"name\": \"count\"},"
                + " \"right\": {\"expr\": \"lit\", \"value\": 1}}",
        "{\"expr\": \"cond\", \"if\": {\"expr\": \"not\", \"operand\": {\"expr\": \"state\", \"name\": \"count\"}},"
                + " \"then\": {\"expr\": \"lit\", \"value\": \"none\"},"
                + " \"else\": {\"expr\": \"concat\", \"items\": [{\"expr\": \"lit\", \"value\": \"n=\"},"
                + " {\"expr\": \"state\", \"name\": \"count\"}]}}",
        "{\"expr\": \"get\", \"base\": {\"expr\": \"state\", \"name\": \"user\"}, \"path\": \"profile.name\"}",
        "{\"expr\": \"index\", \"base\": {\"expr\": \"state\", \"name\": \"items\"},"
                + " \"key\": {\"expr\": \"lit\", \"value\": 0}}",
        "{\"expr\": \"call\", \"target\": {\"expr\": \"state\", \"name\": \"items\"}, \"method\": \"filter\","
                + " \"args\": [{\"expr\": \"lambda\", \"param\": \"x\", \"index\": \"i\","
                + " \"body\": {\"expr\": \"bin\", \"op\": \">\", \"left\": {\"expr\": \"var\", \"name\": \"x\"},"
                + " \"right\": {\"expr\": \"var\", \"name\": \"i\"}}}]}",
        "{\"expr\": \"array\", \"elements\": [{\"expr\": \"lit\", \"value\": 1}, {\"expr\": \"state\", \"name\": \"count\"}]}"
    })
    @DisplayName("expressions without params or data lower to the same shape")
    void pureExpressionsLowerUnchanged(String expression) throws Exception {
        String json = program("""
                {"count": {"type": "number", "initial": 0},
                 "user": {"type": "object", "initial": {}},
                 "items": {"type": "list", "initial": []}}
                """, "[]", "{\"kind\": \"text\", \"value\": " + expression + "}");

        CompiledProgram compiled = ProgramTransformer.transform(parse(json));

        JsonNode lowered = CompiledProgramWriter.toJson(compiled).at("/view/value");
        assertThat(lowered).isEqualTo(new ObjectMapper().readTree(expression));
    }

    @Test
    @DisplayName("state initial values survive lowering unchanged")
    void stateInitialsRoundTrip() {
        Program program = parse(program("""
                {"count": {"type": "number", "initial": 42},
                 "ratio": {"type": "number", "initial": 0.25},
                 "name": {"type": "string", "initial": "Ada"},
                 "open": {"type": "boolean", "initial": false},
                 "tags": {"type": "list", "initial": ["a", {"b": [1, null]}]},
                 "user": {"type": "object", "initial": {"profile": {"city": "Zagreb"}}},
                 "extra": {"type": "any", "initial": null}}
                """, "[]", EMPTY_VIEW));

        CompiledProgram compiled = ProgramTransformer.transform(program);

        assertThat(compiled.state()).containsOnlyKeys(program.state().keySet());
        program.state().forEach((name, field) ->
                assertThat(compiled.state().get(name).initial()).as(name).isEqualTo(field.initial()));
    }
}
