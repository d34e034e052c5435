package io.constela.core.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/** A reusable view fragment, inlined at every invocation site by the transform stage. */
public record ComponentDef(
        Map<String, ParamDef> params,
        Map<String, StateField> localState,
        List<ActionDefinition> localActions,
        ViewNode view) {

    public ComponentDef {
        Objects.requireNonNull(view, "view must not be null");
        params = ModelCollections.orderedCopy(params);
        localState = ModelCollections.orderedCopy(localState);
        localActions = ModelCollections.listCopy(localActions);
    }
}
