package io.constela.core.transform;

import static io.constela.core.testkit.Programs.parse;
import static io.constela.core.testkit.Programs.program;
import static org.assertj.core.api.Assertions.assertThat;

import io.constela.core.compiled.CompiledNode;
import io.constela.core.compiled.CompiledProgram;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Layout composition")
class LayoutComposerTest {

    private static final String LAYOUT_VIEW = """
            {"kind": "element", "tag": "body", "children": [
              {"kind": "element", "tag": "header", "children": [{"kind": "slot", "name": "title"}]},
              {"kind": "element", "tag": "main", "children": [{"kind": "slot"}]}]}
            """;

    private static CompiledProgram layout(String state, String actions, String view) {
        return ProgramTransformer.transform(parse(program(state, actions, view, "\"type\": \"layout\"")));
    }

    private static CompiledProgram page(String state, String actions, String extra) {
        return ProgramTransformer.transform(parse(program(
                state, actions, "{\"kind\": \"element\", \"tag\": \"article\"}", extra)));
    }

    private static CompiledNode.Element child(CompiledNode node, int index) {
        return (CompiledNode.Element) ((CompiledNode.Element) node).children().get(index);
    }

    @Nested
    @DisplayName("Slots")
    class Slots {

        @Test
        @DisplayName("the default slot receives the page view")
        void defaultSlot() {
            CompiledProgram composed = LayoutComposer.compose(layout("{}", "[]", LAYOUT_VIEW), page("{}", "[]", ""));

            assertThat(child(composed.view(), 1).children())
                    .containsExactly(CompiledNode.Element.of("article"));
        }

        @Test
        @DisplayName("a named slot receives its registered content")
        void namedSlot() {
            CompiledProgram composed = LayoutComposer.compose(
                    layout("{}", "[]", LAYOUT_VIEW),
                    page("{}", "[]", ""),
                    Map.of("title", CompiledNode.Element.of("h1")));

            assertThat(child(composed.view(), 0).children()).containsExactly(CompiledNode.Element.of("h1"));
            assertThat(child(composed.view(), 1).children()).containsExactly(CompiledNode.Element.of("article"));
        }

        @Test
        @DisplayName("a named slot without content falls back to the page view")
        void namedSlotFallback() {
            CompiledProgram composed = LayoutComposer.compose(layout("{}", "[]", LAYOUT_VIEW), page("{}", "[]", ""));

            assertThat(child(composed.view(), 0).children()).containsExactly(CompiledNode.Element.of("article"));
        }

        @Test
        @DisplayName("slots inside conditional branches are filled")
        void slotInBranch() {
            CompiledProgram composed = LayoutComposer.compose(layout("{}", "[]", """
                    {"kind": "if", "condition": {"expr": "lit", "value": true}, "then": {"kind": "slot"}}
                    """), page("{}", "[]", ""));

            assertThat(((CompiledNode.If) composed.view()).then()).isEqualTo(CompiledNode.Element.of("article"));
        }
    }

    @Nested
    @DisplayName("Merging")
    class Merging {

        @Test
        @DisplayName("conflicting layout state and actions are prefixed, the page keeps its names")
        void conflictsPrefixed() {
            CompiledProgram composed = LayoutComposer.compose(
                    layout("""
                            {"open": {"type": "boolean", "initial": false}, "theme": {"type": "string", "initial": "dark"}}
                            """, "[{\"name\": \"toggle\", \"steps\": []}, {\"name\": \"logout\", \"steps\": []}]", LAYOUT_VIEW),
                    page("""
                            {"open": {"type": "number", "initial": 1}}
                            """, "[{\"name\": \"toggle\", \"steps\": []}]", ""));

            assertThat(composed.state()).containsOnlyKeys("open", "theme", "$layout.open");
            assertThat(composed.state().get("open").type()).isEqualTo("number");
            assertThat(composed.state().get("$layout.open").type()).isEqualTo("boolean");
            assertThat(composed.actions()).containsOnlyKeys("toggle", "$layout.toggle", "logout");
            assertThat(composed.actions().get("$layout.toggle").name()).isEqualTo("$layout.toggle");
        }

        @Test
        @DisplayName("route and lifecycle come from the page")
        void pageRoute() {
            CompiledProgram composed = LayoutComposer.compose(
                    layout("{}", "[]", LAYOUT_VIEW),
                    page("{}", "[{\"name\": \"load\", \"steps\": []}]", """
                            "route": {"path": "/posts/:id"},
                            "lifecycle": {"onMount": "load"}
                            """));

            assertThat(composed.route().path()).isEqualTo("/posts/:id");
            assertThat(composed.lifecycle().onMount()).isEqualTo("load");
        }
    }
}
