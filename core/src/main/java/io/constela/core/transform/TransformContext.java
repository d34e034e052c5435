package io.constela.core.transform;

import io.constela.core.compiled.CompiledNode;
import io.constela.core.compiled.CompiledPropValue;
import io.constela.core.model.ComponentDef;
import io.constela.core.model.ModelCollections;
import java.util.List;
import java.util.Map;

/**
 * Lowering environment. A new context is derived for every component expansion; none is ever
 * mutated.
 *
 * @param components      component definitions of the program
 * @param currentParams   compiled props of the component being expanded, empty outside components
 * @param currentChildren compiled slot content of the component being expanded
 * @param insideComponent whether a component is being expanded
 * @param preserveSlots   keep {@code slot} nodes outside components, used when lowering a layout
 */
record TransformContext(
        Map<String, ComponentDef> components,
        Map<String, CompiledPropValue> currentParams,
        List<CompiledNode> currentChildren,
        boolean insideComponent,
        boolean preserveSlots) {

    /** Context for action steps, which never see component params. */
    static final TransformContext EMPTY = new TransformContext(Map.of(), Map.of(), List.of(), false, false);

    TransformContext {
        components = ModelCollections.orderedCopy(components);
        currentParams = ModelCollections.orderedCopy(currentParams);
        currentChildren = ModelCollections.listCopy(currentChildren);
    }

    static TransformContext forProgram(Map<String, ComponentDef> components, boolean preserveSlots) {
        return new TransformContext(components, Map.of(), List.of(), false, preserveSlots);
    }

    /** Context for expanding one component invocation. */
    TransformContext expand(Map<String, CompiledPropValue> params, List<CompiledNode> children) {
        return new TransformContext(components, params, children, true, preserveSlots);
    }
}
