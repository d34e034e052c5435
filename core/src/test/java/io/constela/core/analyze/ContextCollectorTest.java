package io.constela.core.analyze;

import static io.constela.core.testkit.Programs.parse;
import static io.constela.core.testkit.Programs.program;
import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ContextCollectorTest {

    @Test
    @DisplayName("collects every declared name in declaration order")
    void collectsDeclarations() {
        String json = program("""
                {"b": {"type": "number", "initial": 0}, "a": {"type": "string", "initial": ""}}
                """, """
                [{"name": "save", "steps": []}, {"name": "save", "steps": []}, {"name": "load", "steps": []}]
                """, """
                {"kind": "element", "tag": "form", "ref": "form", "children": [
                  {"kind": "if", "condition": {"expr": "lit", "value": true},
                   "then": {"kind": "element", "tag": "input", "ref": "field"}},
                  {"kind": "component", "name": "Card", "children": [{"kind": "element", "tag": "span", "ref": "inSlot"}]}]}
                """, """
                "route": {"path": "/posts/:year/:slug"},
                "imports": {"nav": []},
                "data": {"posts": {"type": "glob", "pattern": "*.md"}},
                "styles": {"card": {"base": "card"}},
                "components": {"Card": {"view": {"kind": "element", "tag": "div", "ref": "insideCard"}}}
                """);

        AnalysisContext context = ContextCollector.collect(parse(json));

        assertThat(context.stateNames()).containsExactly("b", "a");
        assertThat(context.actionNames()).containsExactly("save", "save", "load");
        assertThat(context.routeParams()).containsExactly("year", "slug");
        assertThat(context.importNames()).containsExactly("nav");
        assertThat(context.dataNames()).containsExactly("posts");
        assertThat(context.styleNames()).containsExactly("card");
        assertThat(context.componentNames()).containsExactly("Card");
        assertThat(context.refNames()).containsExactly("form", "field", "inSlot");
    }

    @Test
    @DisplayName("absent sections collect to empty sets")
    void absentSections() {
        AnalysisContext context = ContextCollector.collect(parse(program("{}", "[]", "{\"kind\": \"slot\"}")));

        assertThat(context.routeParams()).isEmpty();
        assertThat(context.importNames()).isEmpty();
        assertThat(context.dataNames()).isEmpty();
        assertThat(context.refNames()).isEmpty();
        assertThat(context.hasAction("anything")).isFalse();
    }
}
