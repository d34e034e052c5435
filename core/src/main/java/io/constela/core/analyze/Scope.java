package io.constela.core.analyze;

import io.constela.core.model.ActionDefinition;
import io.constela.core.model.ComponentDef;
import io.constela.core.model.ViewNode;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Lexical environment of an expression during analysis. Immutable; nested constructs derive a
 * child scope through {@link #withVars(String...)} or {@link #withIsland(ViewNode.Island)}.
 *
 * @param vars             names bound by enclosing {@code each} and {@code lambda} constructs
 * @param component        the component definition being validated, or null on the page view
 * @param localStateNames  state declared by the enclosing component or island
 * @param localActionNames actions declared by the enclosing component or island
 * @param insideLayout     whether {@code slot} nodes are allowed because the program is a layout
 */
public record Scope(
        Set<String> vars,
        ComponentScope component,
        Set<String> localStateNames,
        Set<String> localActionNames,
        boolean insideLayout) {

    public Scope {
        vars = frozen(vars);
        localStateNames = frozen(localStateNames);
        localActionNames = frozen(localActionNames);
    }

    /** Empty scope for a page or layout view. */
    public static Scope root(boolean insideLayout) {
        return new Scope(Set.of(), null, Set.of(), Set.of(), insideLayout);
    }

    /** Empty scope for the view of the given component definition. */
    public static Scope of(String componentName, ComponentDef def) {
        return new Scope(
                Set.of(),
                new ComponentScope(componentName, def.params().keySet()),
                def.localState().keySet(),
                actionNames(def.localActions()),
                false);
    }

    public boolean insideComponent() {
        return component != null;
    }

    public boolean hasVar(String name) {
        return vars.contains(name);
    }

    /** Returns a child scope with the given names bound; null names are ignored. */
    public Scope withVars(String... names) {
        Set<String> extended = new LinkedHashSet<>(vars);
        for (String name : names) {
            if (name != null) {
                extended.add(name);
            }
        }
        return new Scope(extended, component, localStateNames, localActionNames, insideLayout);
    }

    /** Returns a child scope that also sees the island's own state and actions. */
    public Scope withIsland(ViewNode.Island island) {
        return new Scope(
                vars,
                component,
                union(localStateNames, island.state().keySet()),
                union(localActionNames, actionNames(island.actions())),
                insideLayout);
    }

    private static Set<String> actionNames(List<ActionDefinition> actions) {
        Set<String> names = new LinkedHashSet<>();
        for (ActionDefinition action : actions) {
            names.add(action.name());
        }
        return names;
    }

    private static Set<String> union(Collection<String> a, Collection<String> b) {
        Set<String> merged = new LinkedHashSet<>(a);
        merged.addAll(b);
        return merged;
    }

    private static Set<String> frozen(Set<String> names) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(names));
    }

    /** The component definition whose view is being validated. */
    public record ComponentScope(String name, Set<String> params) {
        public ComponentScope {
            params = frozen(params);
        }
    }
}
