package io.constela.core.analyze;

import io.constela.core.model.ActionDefinition;
import io.constela.core.model.Program;
import io.constela.core.model.ViewNode;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Scans a program once and gathers every declared name into an {@link AnalysisContext}. Cannot
 * fail.
 *
 * <p>Refs are collected from the page view only, including component slot content at call sites,
 * but never from component definitions.
 */
public final class ContextCollector {

    private ContextCollector() {
        // utility class
    }

    public static AnalysisContext collect(Program program) {
        List<String> actionNames = new ArrayList<>();
        for (ActionDefinition action : program.actions()) {
            actionNames.add(action.name());
        }
        Set<String> routeParams = program.route() == null
                ? Set.of()
                : new LinkedHashSet<>(program.route().paramNames());
        Set<String> refNames = new LinkedHashSet<>();
        collectRefs(program.view(), refNames);
        return new AnalysisContext(
                program.state().keySet(),
                actionNames,
                program.components().keySet(),
                routeParams,
                program.imports() == null ? Set.of() : program.imports().keySet(),
                program.data() == null ? Set.of() : program.data().keySet(),
                refNames,
                program.styles().keySet());
    }

    private static void collectRefs(ViewNode node, Set<String> refs) {
        if (node == null) {
            return;
        }
        switch (node.kind()) {
            case ELEMENT -> {
                ViewNode.Element element = (ViewNode.Element) node;
                if (element.ref() != null) {
                    refs.add(element.ref());
                }
                element.children().forEach(child -> collectRefs(child, refs));
            }
            case IF -> {
                ViewNode.If branch = (ViewNode.If) node;
                collectRefs(branch.then(), refs);
                collectRefs(branch.otherwise(), refs);
            }
            case EACH -> collectRefs(((ViewNode.Each) node).body(), refs);
            case COMPONENT -> ((ViewNode.Component) node).children().forEach(child -> collectRefs(child, refs));
            case PORTAL -> ((ViewNode.Portal) node).children().forEach(child -> collectRefs(child, refs));
            case ISLAND -> collectRefs(((ViewNode.Island) node).content(), refs);
            case SUSPENSE -> {
                collectRefs(((ViewNode.Suspense) node).fallback(), refs);
                collectRefs(((ViewNode.Suspense) node).content(), refs);
            }
            case ERROR_BOUNDARY -> {
                collectRefs(((ViewNode.ErrorBoundary) node).fallback(), refs);
                collectRefs(((ViewNode.ErrorBoundary) node).content(), refs);
            }
            case TEXT, MARKDOWN, CODE, SLOT -> {
                // no refs
            }
        }
    }
}
