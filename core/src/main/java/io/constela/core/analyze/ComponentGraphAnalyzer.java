package io.constela.core.analyze;

import io.constela.core.error.ConstelaError;
import io.constela.core.error.ErrorCode;
import io.constela.core.model.ComponentDef;
import io.constela.core.model.ViewNode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Detects cycles in the component reference graph. Inlining a cyclic graph would never
 * terminate, so a cycle is reported as {@link ErrorCode#COMPONENT_CYCLE} at
 * {@code /components/<search root>} with the cycle in {@code context.cycle}.
 *
 * <p>The search starts from every definition in declaration order. A component is marked visited
 * when the search enters it, so a component reached from an earlier root, including every member
 * of a cycle already reported, is not explored again. Each root reports at most one cycle.
 */
final class ComponentGraphAnalyzer {

    private ComponentGraphAnalyzer() {
        // utility class
    }

    static List<ConstelaError> detectCycles(Map<String, ComponentDef> components) {
        List<ConstelaError> errors = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        for (String root : components.keySet()) {
            if (visited.contains(root)) {
                continue;
            }
            List<String> cycle = search(root, components, new ArrayList<>(), visited);
            if (cycle != null) {
                errors.add(ConstelaError.of(
                                ErrorCode.COMPONENT_CYCLE,
                                "Circular component reference detected: " + String.join(" -> ", cycle),
                                "/components/" + root)
                        .withContext("cycle", List.copyOf(cycle)));
            }
        }
        return errors;
    }

    private static List<String> search(
            String name, Map<String, ComponentDef> components, List<String> stack, Set<String> visited) {
        int onStack = stack.indexOf(name);
        if (onStack >= 0) {
            List<String> cycle = new ArrayList<>(stack.subList(onStack, stack.size()));
            cycle.add(name);
            return cycle;
        }
        ComponentDef def = components.get(name);
        if (def == null || !visited.add(name)) {
            return null;
        }
        stack.add(name);
        for (String referenced : references(def.view())) {
            List<String> cycle = search(referenced, components, stack, visited);
            if (cycle != null) {
                return cycle;
            }
        }
        stack.remove(stack.size() - 1);
        return null;
    }

    /** Component names invoked anywhere in {@code view}, in first-seen order. */
    static Set<String> references(ViewNode view) {
        Set<String> names = new LinkedHashSet<>();
        collect(view, names);
        return names;
    }

    private static void collect(ViewNode node, Set<String> names) {
        if (node == null) {
            return;
        }
        switch (node.kind()) {
            case ELEMENT -> ((ViewNode.Element) node).children().forEach(child -> collect(child, names));
            case IF -> {
                collect(((ViewNode.If) node).then(), names);
                collect(((ViewNode.If) node).otherwise(), names);
            }
            case EACH -> collect(((ViewNode.Each) node).body(), names);
            case COMPONENT -> {
                ViewNode.Component invocation = (ViewNode.Component) node;
                names.add(invocation.name());
                invocation.children().forEach(child -> collect(child, names));
            }
            case PORTAL -> ((ViewNode.Portal) node).children().forEach(child -> collect(child, names));
            case ISLAND -> collect(((ViewNode.Island) node).content(), names);
            case SUSPENSE -> {
                collect(((ViewNode.Suspense) node).fallback(), names);
                collect(((ViewNode.Suspense) node).content(), names);
            }
            case ERROR_BOUNDARY -> {
                collect(((ViewNode.ErrorBoundary) node).fallback(), names);
                collect(((ViewNode.ErrorBoundary) node).content(), names);
            }
            case TEXT, MARKDOWN, CODE, SLOT -> {
                // leaves
            }
        }
    }
}
