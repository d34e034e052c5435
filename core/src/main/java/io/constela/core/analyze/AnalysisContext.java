package io.constela.core.analyze;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Names declared by one program, built once by {@link ContextCollector} and read-only afterwards.
 *
 * <p>{@code actionNames} is a list in declaration order and keeps duplicates, so that duplicate
 * detection can report them; lookups go through {@link #hasAction(String)}.
 */
public record AnalysisContext(
        Set<String> stateNames,
        List<String> actionNames,
        Set<String> componentNames,
        Set<String> routeParams,
        Set<String> importNames,
        Set<String> dataNames,
        Set<String> refNames,
        Set<String> styleNames) {

    public AnalysisContext {
        stateNames = ordered(stateNames);
        actionNames = List.copyOf(actionNames);
        componentNames = ordered(componentNames);
        routeParams = ordered(routeParams);
        importNames = ordered(importNames);
        dataNames = ordered(dataNames);
        refNames = ordered(refNames);
        styleNames = ordered(styleNames);
    }

    public boolean hasAction(String name) {
        return actionNames.contains(name);
    }

    private static Set<String> ordered(Set<String> names) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(names));
    }
}
