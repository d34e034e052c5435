package io.constela.core.model;

import java.util.Objects;

/**
 * Component parameter declaration.
 *
 * @param type     declared type
 * @param required whether callers must supply the prop; {@code null} means required
 */
public record ParamDef(String type, Boolean required) {

    public ParamDef {
        Objects.requireNonNull(type, "type must not be null");
    }

    /** Params are required unless explicitly marked {@code required: false}. */
    public boolean isRequired() {
        return !Boolean.FALSE.equals(required);
    }
}
