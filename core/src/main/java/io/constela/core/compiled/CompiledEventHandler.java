package io.constela.core.compiled;

import io.constela.core.model.EventHandler;
import io.constela.core.model.ModelCollections;
import java.util.Map;
import java.util.Objects;

/** Lowered event handler. Either {@code payload} or {@code payloadFields} is set, never both. */
public record CompiledEventHandler(
        String event,
        String action,
        CompiledExpression payload,
        Map<String, CompiledExpression> payloadFields,
        Integer debounce,
        Integer throttle,
        EventHandler.Options options)
        implements CompiledPropValue {

    public CompiledEventHandler {
        Objects.requireNonNull(event, "event must not be null");
        Objects.requireNonNull(action, "action must not be null");
        payloadFields = ModelCollections.orderedCopy(payloadFields);
    }
}
