package io.constela.core.transform;

import com.fasterxml.jackson.databind.JsonNode;
import io.constela.core.compiled.CompiledAction;
import io.constela.core.compiled.CompiledNode;
import io.constela.core.compiled.CompiledProgram;
import io.constela.core.model.Program;
import io.constela.core.model.StateField;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps a compiled page in a compiled layout.
 *
 * <p>The layout's default slot receives the page view. A named slot receives the node registered
 * under its name, falling back to the page view when none is given. Page state and actions keep
 * their names; a layout entry whose name the page already uses is renamed with the
 * {@value #LAYOUT_PREFIX} prefix. Route and lifecycle come from the page, and import data is merged
 * with page values winning.
 */
public final class LayoutComposer {

    private static final Logger LOG = LoggerFactory.getLogger(LayoutComposer.class);

    public static final String LAYOUT_PREFIX = "$layout.";

    private LayoutComposer() {
        // utility class
    }

    public static CompiledProgram compose(CompiledProgram layout, CompiledProgram page) {
        return compose(layout, page, Map.of());
    }

    /**
     * @param namedSlots content for named slots, keyed by slot name; may be empty
     */
    public static CompiledProgram compose(
            CompiledProgram layout, CompiledProgram page, Map<String, CompiledNode> namedSlots) {
        Objects.requireNonNull(layout, "layout must not be null");
        Objects.requireNonNull(page, "page must not be null");
        Map<String, CompiledNode> named = namedSlots == null ? Map.of() : namedSlots;

        CompiledNode view = fill(layout.view(), page.view(), named);

        Map<String, StateField> state = new LinkedHashMap<>(page.state());
        layout.state().forEach((name, field) -> state.put(state.containsKey(name) ? LAYOUT_PREFIX + name : name, field));

        Map<String, CompiledAction> actions = new LinkedHashMap<>(page.actions());
        for (CompiledAction action : layout.actions().values()) {
            if (page.actions().containsKey(action.name())) {
                String renamed = LAYOUT_PREFIX + action.name();
                actions.put(renamed, new CompiledAction(renamed, action.steps()));
            } else {
                actions.put(action.name(), action);
            }
        }

        Map<String, JsonNode> importData = new LinkedHashMap<>();
        if (layout.importData() != null) {
            importData.putAll(layout.importData());
        }
        if (page.importData() != null) {
            importData.putAll(page.importData());
        }

        LOG.debug("Composed layout with page: state={}, actions={}", state.size(), actions.size());
        return new CompiledProgram(
                Program.SUPPORTED_VERSION, page.route(), page.lifecycle(), state, actions, view, importData);
    }

    private static CompiledNode fill(CompiledNode node, CompiledNode page, Map<String, CompiledNode> named) {
        if (node == null) {
            return null;
        }
        return switch (node.kind()) {
            case SLOT -> {
                String name = ((CompiledNode.Slot) node).name();
                CompiledNode content = name == null ? null : named.get(name);
                yield content != null ? content : page;
            }
            case ELEMENT -> {
                CompiledNode.Element element = (CompiledNode.Element) node;
                yield new CompiledNode.Element(
                        element.tag(), element.ref(), element.props(), fillAll(element.children(), page, named));
            }
            case IF -> {
                CompiledNode.If branch = (CompiledNode.If) node;
                yield new CompiledNode.If(
                        branch.condition(), fill(branch.then(), page, named), fill(branch.otherwise(), page, named));
            }
            case EACH -> {
                CompiledNode.Each each = (CompiledNode.Each) node;
                yield new CompiledNode.Each(
                        each.items(), each.as(), each.index(), each.key(), fill(each.body(), page, named));
            }
            case PORTAL -> {
                CompiledNode.Portal portal = (CompiledNode.Portal) node;
                yield new CompiledNode.Portal(portal.target(), fillAll(portal.children(), page, named));
            }
            case LOCAL_STATE -> {
                CompiledNode.LocalState local = (CompiledNode.LocalState) node;
                yield new CompiledNode.LocalState(local.state(), local.actions(), fill(local.child(), page, named));
            }
            case ISLAND -> {
                CompiledNode.Island island = (CompiledNode.Island) node;
                yield new CompiledNode.Island(
                        island.id(),
                        island.strategy(),
                        island.strategyOptions(),
                        fill(island.content(), page, named),
                        island.state(),
                        island.actions());
            }
            case SUSPENSE -> {
                CompiledNode.Suspense suspense = (CompiledNode.Suspense) node;
                yield new CompiledNode.Suspense(
                        suspense.id(), fill(suspense.fallback(), page, named), fill(suspense.content(), page, named));
            }
            case ERROR_BOUNDARY -> {
                CompiledNode.ErrorBoundary boundary = (CompiledNode.ErrorBoundary) node;
                yield new CompiledNode.ErrorBoundary(
                        fill(boundary.fallback(), page, named), fill(boundary.content(), page, named));
            }
            case TEXT, MARKDOWN, CODE -> node;
        };
    }

    private static List<CompiledNode> fillAll(List<CompiledNode> nodes, CompiledNode page, Map<String, CompiledNode> named) {
        List<CompiledNode> filled = new ArrayList<>(nodes.size());
        for (CompiledNode child : nodes) {
            filled.add(fill(child, page, named));
        }
        return filled;
    }
}
