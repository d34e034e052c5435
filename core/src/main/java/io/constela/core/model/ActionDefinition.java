package io.constela.core.model;

import java.util.List;
import java.util.Objects;

/** A named, ordered list of steps. */
public record ActionDefinition(String name, List<ActionStep> steps) {

    public ActionDefinition {
        Objects.requireNonNull(name, "name must not be null");
        steps = ModelCollections.listCopy(steps);
    }
}
