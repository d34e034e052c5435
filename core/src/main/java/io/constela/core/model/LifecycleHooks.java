package io.constela.core.model;

/** Page lifecycle hooks; each names an action, or is null. */
public record LifecycleHooks(String onMount, String onUnmount, String onRouteEnter, String onRouteLeave) {

    public static final LifecycleHooks NONE = new LifecycleHooks(null, null, null, null);

    public boolean isEmpty() {
        return onMount == null && onUnmount == null && onRouteEnter == null && onRouteLeave == null;
    }
}
