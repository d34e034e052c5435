package io.constela.core.analyze;

import static io.constela.core.testkit.Programs.EMPTY_VIEW;
import static io.constela.core.testkit.Programs.errors;
import static io.constela.core.testkit.Programs.program;
import static org.assertj.core.api.Assertions.assertThat;

import io.constela.core.error.ConstelaError;
import io.constela.core.error.ErrorCode;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Component validation")
class ComponentValidationTest {

    private static final String BUTTON = """
            "Button": {
              "params": {"label": {"type": "string"}, "variant": {"type": "string", "required": false}},
              "view": {"kind": "element", "tag": "button",
                       "children": [{"kind": "text", "value": {"expr": "param", "name": "label"}}]}
            }
            """;

    @Nested
    @DisplayName("Invocation")
    class Invocation {

        @Test
        @DisplayName("missing required prop reports COMPONENT_PROP_MISSING at /props")
        void missingRequiredProp() {
            String json = program("{}", "[]", """
                    {"kind": "component", "name": "Button", "props": {"variant": {"expr": "lit", "value": "primary"}}}
                    """, "\"components\": {" + BUTTON + "}");

            assertThat(errors(json)).singleElement().satisfies(e -> {
                assertThat(e.code()).isEqualTo(ErrorCode.COMPONENT_PROP_MISSING);
                assertThat(e.path()).isEqualTo("/view/props");
                assertThat(e.message()).isEqualTo("Component 'Button' requires prop 'label'");
            });
        }

        @Test
        @DisplayName("optional params may be omitted")
        void optionalParamOmitted() {
            String json = program("{}", "[]", """
                    {"kind": "component", "name": "Button", "props": {"label": {"expr": "lit", "value": "Go"}}}
                    """, "\"components\": {" + BUTTON + "}");

            assertThat(errors(json)).isEmpty();
        }

        @Test
        @DisplayName("unknown component reports COMPONENT_NOT_FOUND with a suggestion")
        void unknownComponent() {
            String json = program("{}", "[]", """
                    {"kind": "component", "name": "Buton"}
                    """, "\"components\": {" + BUTTON + "}");

            assertThat(errors(json)).singleElement().satisfies(e -> {
                assertThat(e.code()).isEqualTo(ErrorCode.COMPONENT_NOT_FOUND);
                assertThat(e.message()).isEqualTo("Component 'Buton' is not defined in components");
                assertThat(e.suggestion()).isEqualTo("Did you mean 'Button'?");
            });
        }

        @Test
        @DisplayName("param outside a component reports UNDEFINED_PARAM")
        void paramOutsideComponent() {
            String json = program("{}", "[]", """
                    {"kind": "text", "value": {"expr": "param", "name": "label"}}
                    """);

            assertThat(errors(json)).extracting(ConstelaError::code).containsExactly(ErrorCode.UNDEFINED_PARAM);
        }

        @Test
        @DisplayName("unknown param inside a definition is reported under /components")
        void unknownParamInDefinition() {
            String json = program("{}", "[]", EMPTY_VIEW, """
                    "components": {"Card": {"params": {"title": {"type": "string"}},
                      "view": {"kind": "text", "value": {"expr": "param", "name": "titel"}}}}
                    """);

            assertThat(errors(json)).singleElement().satisfies(e -> {
                assertThat(e.code()).isEqualTo(ErrorCode.UNDEFINED_PARAM);
                assertThat(e.path()).isEqualTo("/components/Card/view/value");
                assertThat(e.suggestion()).isEqualTo("Did you mean 'title'?");
            });
        }

        @Test
        @DisplayName("handler props at the call site resolve against the caller's actions")
        void handlerPropUsesCallerScope() {
            String json = program("{}", "[]", EMPTY_VIEW, """
                    "components": {
                      "Accordion": {
                        "params": {"onToggle": {"type": "any", "required": false}},
                        "localState": {"open": {"type": "boolean", "initial": false}},
                        "localActions": [{"name": "toggleOpen", "steps": [
                          {"do": "update", "target": "open", "operation": "toggle"}]}],
                        "view": {"kind": "element", "tag": "section",
                                 "props": {"onClick": {"event": "click", "action": "toggleOpen"}}}
                      },
                      "AccordionWrapper": {
                        "view": {"kind": "component", "name": "Accordion",
                                 "props": {"onToggle": {"event": "click", "action": "toggleOpen"}}}
                      }
                    }
                    """);

            assertThat(errors(json)).singleElement().satisfies(e -> {
                assertThat(e.code()).isEqualTo(ErrorCode.UNDEFINED_ACTION);
                assertThat(e.path()).isEqualTo("/components/AccordionWrapper/view/props/onToggle");
            });
        }
    }

    @Nested
    @DisplayName("Local state and actions")
    class LocalState {

        private String toggle(String steps, String viewExpr) {
            return program("{}", "[]", EMPTY_VIEW, """
                    "components": {"Toggle": {
                      "localState": {"on": {"type": "boolean", "initial": false}},
                      "localActions": [{"name": "flip", "steps": %s}],
                      "view": {"kind": "text", "value": %s}}}
                    """.formatted(steps, viewExpr));
        }

        @Test
        @DisplayName("local state is readable in the component view")
        void localStateReadable() {
            String json = toggle(
                    "[{\"do\": \"update\", \"target\": \"on\", \"operation\": \"toggle\"}]",
                    "{\"expr\": \"state\", \"name\": \"on\"}");

            assertThat(errors(json)).isEmpty();
        }

        @Test
        @DisplayName("fetch inside a local action reports LOCAL_ACTION_INVALID_STEP")
        void fetchNotAllowed() {
            String json = toggle(
                    "[{\"do\": \"fetch\", \"url\": {\"expr\": \"lit\", \"value\": \"/api\"}}]",
                    "{\"expr\": \"lit\", \"value\": \"\"}");

            assertThat(errors(json)).singleElement().satisfies(e -> {
                assertThat(e.code()).isEqualTo(ErrorCode.LOCAL_ACTION_INVALID_STEP);
                assertThat(e.path()).isEqualTo("/components/Toggle/localActions/0/steps/0");
                assertThat(e.message()).isEqualTo(
                        "Step 'fetch' is not allowed in local actions; only set, update, setPath are supported");
            });
        }

        @Test
        @DisplayName("local action targets must be local state")
        void targetMustBeLocal() {
            String json = toggle(
                    "[{\"do\": \"set\", \"target\": \"of\", \"value\": {\"expr\": \"lit\", \"value\": true}}]",
                    "{\"expr\": \"lit\", \"value\": \"\"}");

            assertThat(errors(json)).singleElement().satisfies(e -> {
                assertThat(e.code()).isEqualTo(ErrorCode.UNDEFINED_LOCAL_STATE);
                assertThat(e.path()).isEqualTo("/components/Toggle/localActions/0/steps/0/target");
                assertThat(e.message()).isEqualTo(
                        "Undefined local state reference: 'of' is not defined in localState of component 'Toggle'");
            });
        }
    }

    @Nested
    @DisplayName("Cycles")
    class Cycles {

        @Test
        @DisplayName("mutual recursion is reported once with the cycle path")
        void mutualRecursion() {
            String json = program("{}", "[]", EMPTY_VIEW, """
                    "components": {
                      "A": {"view": {"kind": "element", "tag": "div", "children": [{"kind": "component", "name": "B"}]}},
                      "B": {"view": {"kind": "component", "name": "A"}}
                    }
                    """);

            List<ConstelaError> errors = errors(json);

            assertThat(errors).singleElement().satisfies(e -> {
                assertThat(e.code()).isEqualTo(ErrorCode.COMPONENT_CYCLE);
                assertThat(e.path()).isEqualTo("/components/A");
                assertThat(e.message()).isEqualTo("Circular component reference detected: A -> B -> A");
                assertThat(e.context().get("cycle")).isEqualTo(List.of("A", "B", "A"));
            });
        }

        @Test
        @DisplayName("self reference inside a conditional is a cycle")
        void selfReference() {
            String json = program("{}", "[]", EMPTY_VIEW, """
                    "components": {"Tree": {"view": {"kind": "if", "condition": {"expr": "lit", "value": true},
                      "then": {"kind": "component", "name": "Tree"}}}}
                    """);

            assertThat(errors(json)).extracting(ConstelaError::message)
                    .containsExactly("Circular component reference detected: Tree -> Tree");
        }

        @Test
        @DisplayName("a cycle reached through another component is reported once at the search root")
        void cycleBehindEntryComponent() {
            String json = program("{}", "[]", EMPTY_VIEW, """
                    "components": {
                      "X": {"view": {"kind": "component", "name": "A"}},
                      "A": {"view": {"kind": "component", "name": "B"}},
                      "B": {"view": {"kind": "component", "name": "A"}}
                    }
                    """);

            assertThat(errors(json)).singleElement().satisfies(e -> {
                assertThat(e.path()).isEqualTo("/components/X");
                assertThat(e.context().get("cycle")).isEqualTo(List.of("A", "B", "A"));
            });
        }

        @Test
        @DisplayName("three-component cycle names every member")
        void threeComponentCycle() {
            String json = program("{}", "[]", EMPTY_VIEW, """
                    "components": {
                      "Alpha": {"view": {"kind": "component", "name": "Beta"}},
                      "Beta": {"view": {"kind": "component", "name": "Gamma"}},
                      "Gamma": {"view": {"kind": "component", "name": "Alpha"}}
                    }
                    """);

            assertThat(errors(json)).extracting(ConstelaError::message)
                    .containsExactly("Circular component reference detected: Alpha -> Beta -> Gamma -> Alpha");
        }

        @Test
        @DisplayName("a chain fifty components deep is not a cycle")
        void deepAcyclicChain() {
            StringBuilder components = new StringBuilder("\"components\": {");
            for (int i = 0; i < 50; i++) {
                components.append("\"C").append(i).append("\": {\"view\": {\"kind\": \"component\", \"name\": \"C")
                        .append(i + 1).append("\"}}, ");
            }
            components.append("\"C50\": {\"view\": {\"kind\": \"text\", \"value\": {\"expr\": \"lit\", \"value\": \"end\"}}}}");

            assertThat(errors(program("{}", "[]", EMPTY_VIEW, components.toString())))
                    .extracting(ConstelaError::code)
                    .doesNotContain(ErrorCode.COMPONENT_CYCLE);
        }

        @Test
        @DisplayName("shared leaf components are not cycles")
        void diamondIsNotACycle() {
            String json = program("{}", "[]", EMPTY_VIEW, """
                    "components": {
                      "Page": {"view": {"kind": "element", "tag": "div", "children": [
                        {"kind": "component", "name": "Left"}, {"kind": "component", "name": "Right"}]}},
                      "Left": {"view": {"kind": "component", "name": "Leaf"}},
                      "Right": {"view": {"kind": "component", "name": "Leaf"}},
                      "Leaf": {"view": {"kind": "text", "value": {"expr": "lit", "value": "leaf"}}}
                    }
                    """);

            assertThat(errors(json)).isEmpty();
        }
    }
}
