package io.constela.core.model;

import java.util.Map;
import java.util.Objects;

/**
 * Event binding on an element or component prop: {@code {event, action, payload?}}.
 *
 * <p>The payload is either a single expression ({@link #payload()}) or an object of named
 * expressions ({@link #payloadFields()}); at most one of the two is present.
 *
 * @param event         DOM event name ({@code click}, {@code input}, ...)
 * @param action        name of the action to dispatch
 * @param payload       single payload expression, or null
 * @param payloadFields object payload, empty when absent
 * @param debounce      debounce in ms, or null
 * @param throttle      throttle in ms, or null
 * @param options       intersection observer options, or null
 */
public record EventHandler(
        String event,
        String action,
        Expression payload,
        Map<String, Expression> payloadFields,
        Integer debounce,
        Integer throttle,
        Options options)
        implements PropValue {

    public EventHandler {
        Objects.requireNonNull(event, "event must not be null");
        Objects.requireNonNull(action, "action must not be null");
        payloadFields = ModelCollections.orderedCopy(payloadFields);
    }

    public static EventHandler of(String event, String action) {
        return new EventHandler(event, action, null, null, null, null, null);
    }

    /** Options for {@code intersect} events. */
    public record Options(Double threshold, String rootMargin, Boolean once) {}
}
