package io.constela.core.compiled;

import io.constela.core.model.ModelCollections;
import java.util.List;
import java.util.Objects;

/** A named, lowered step list. */
public record CompiledAction(String name, List<CompiledStep> steps) {

    public CompiledAction {
        Objects.requireNonNull(name, "name must not be null");
        steps = ModelCollections.listCopy(steps);
    }
}
