package io.constela.core.compiled;

import com.fasterxml.jackson.databind.JsonNode;
import io.constela.core.model.LifecycleHooks;
import io.constela.core.model.ModelCollections;
import io.constela.core.model.StateField;
import java.util.Map;
import java.util.Objects;

/**
 * Output of lowering: every component is inlined, every param substituted and every slot filled.
 * Created once per compile and read-only afterwards.
 *
 * @param version    always {@code "1.0"}
 * @param route      compiled route, or null
 * @param lifecycle  lifecycle hooks, or null when none is declared
 * @param state      state fields with their initial values
 * @param actions    actions keyed by name
 * @param view       root node
 * @param importData resolved import/data values, or null when absent or empty
 */
public record CompiledProgram(
        String version,
        CompiledRoute route,
        LifecycleHooks lifecycle,
        Map<String, StateField> state,
        Map<String, CompiledAction> actions,
        CompiledNode view,
        Map<String, JsonNode> importData) {

    public CompiledProgram {
        Objects.requireNonNull(version, "version must not be null");
        Objects.requireNonNull(view, "view must not be null");
        state = ModelCollections.orderedCopy(state);
        actions = ModelCollections.orderedCopy(actions);
        importData = importData == null || importData.isEmpty() ? null : ModelCollections.orderedCopy(importData);
    }
}
