package io.constela.core.evaluate;

import com.fasterxml.jackson.databind.JsonNode;
import io.constela.core.model.ModelCollections;
import io.constela.core.model.StylePreset;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything an expression can read. Immutable: loop and lambda bodies evaluate against a copy
 * produced by {@link #withLocal(String, JsonNode)}.
 *
 * @param state   current state values by name
 * @param locals  loop variables, lambda params and local state
 * @param route   route information, or null when rendering without a route
 * @param imports import and data values by name
 * @param styles  style presets by name
 */
public record EvaluationContext(
        Map<String, JsonNode> state,
        Map<String, JsonNode> locals,
        RouteContext route,
        Map<String, JsonNode> imports,
        Map<String, StylePreset> styles) {

    public EvaluationContext {
        state = ModelCollections.orderedCopy(state);
        locals = ModelCollections.orderedCopy(locals);
        imports = ModelCollections.orderedCopy(imports);
        styles = ModelCollections.orderedCopy(styles);
    }

    /** A context holding only state values. */
    public static EvaluationContext ofState(Map<String, JsonNode> state) {
        return new EvaluationContext(state, null, null, null, null);
    }

    public EvaluationContext withLocal(String name, JsonNode value) {
        Map<String, JsonNode> copy = new LinkedHashMap<>(locals);
        copy.put(name, value);
        return new EvaluationContext(state, copy, route, imports, styles);
    }

    public EvaluationContext withLocals(Map<String, JsonNode> extra) {
        Map<String, JsonNode> copy = new LinkedHashMap<>(locals);
        copy.putAll(extra);
        return new EvaluationContext(state, copy, route, imports, styles);
    }
}
