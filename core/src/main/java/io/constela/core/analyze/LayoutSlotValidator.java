package io.constela.core.analyze;

import static io.constela.core.analyze.AnalysisSession.path;

import io.constela.core.error.ConstelaError;
import io.constela.core.error.ErrorCode;
import io.constela.core.model.ViewNode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Slot rules for layout programs. A layout needs at least one slot, at most one unnamed (default)
 * slot, unique slot names, and no slot under an {@code each} body.
 *
 * <p>Slots inside component invocations count as layout slots; slots inside component definitions
 * do not, because those belong to the component.
 */
final class LayoutSlotValidator {

    private LayoutSlotValidator() {}

    private record SlotSite(String name, String path, boolean inLoop) {

        boolean isDefault() {
            return name == null || name.isEmpty();
        }
    }

    static List<ConstelaError> validate(ViewNode view) {
        List<SlotSite> slots = new ArrayList<>();
        collect(view, "/view", false, slots);

        List<ConstelaError> errors = new ArrayList<>();
        if (slots.isEmpty()) {
            errors.add(ConstelaError.of(
                    ErrorCode.LAYOUT_MISSING_SLOT,
                    "Layout must contain at least one slot node for page content",
                    "/view"));
            return errors;
        }
        Set<String> names = new HashSet<>();
        boolean defaultSeen = false;
        for (SlotSite slot : slots) {
            if (slot.inLoop()) {
                errors.add(ConstelaError.of(
                        ErrorCode.SLOT_IN_LOOP,
                        "Slot cannot be placed inside a loop; page content would be repeated",
                        slot.path()));
            } else if (slot.isDefault()) {
                if (defaultSeen) {
                    errors.add(ConstelaError.of(
                            ErrorCode.DUPLICATE_DEFAULT_SLOT,
                            "Layout has more than one default slot",
                            slot.path()));
                }
                defaultSeen = true;
            } else if (!names.add(slot.name())) {
                errors.add(ConstelaError.of(
                        ErrorCode.DUPLICATE_SLOT_NAME,
                        "Duplicate slot name: '" + slot.name() + "' is already used in this layout",
                        slot.path()));
            }
        }
        return errors;
    }

    private static void collect(ViewNode node, String path, boolean inLoop, List<SlotSite> slots) {
        if (node == null) {
            return;
        }
        switch (node.kind()) {
            case SLOT -> slots.add(new SlotSite(((ViewNode.Slot) node).name(), path, inLoop));
            case ELEMENT -> children(((ViewNode.Element) node).children(), path, inLoop, slots);
            case COMPONENT -> children(((ViewNode.Component) node).children(), path, inLoop, slots);
            case PORTAL -> children(((ViewNode.Portal) node).children(), path, inLoop, slots);
            case IF -> {
                ViewNode.If branch = (ViewNode.If) node;
                collect(branch.then(), path(path, "then"), inLoop, slots);
                collect(branch.otherwise(), path(path, "else"), inLoop, slots);
            }
            case EACH -> collect(((ViewNode.Each) node).body(), path(path, "body"), true, slots);
            case ISLAND -> collect(((ViewNode.Island) node).content(), path(path, "content"), inLoop, slots);
            case SUSPENSE -> {
                ViewNode.Suspense suspense = (ViewNode.Suspense) node;
                collect(suspense.fallback(), path(path, "fallback"), inLoop, slots);
                collect(suspense.content(), path(path, "content"), inLoop, slots);
            }
            case ERROR_BOUNDARY -> {
                ViewNode.ErrorBoundary boundary = (ViewNode.ErrorBoundary) node;
                collect(boundary.fallback(), path(path, "fallback"), inLoop, slots);
                collect(boundary.content(), path(path, "content"), inLoop, slots);
            }
            case TEXT, MARKDOWN, CODE -> {
                // leaves
            }
        }
    }

    private static void children(List<ViewNode> children, String path, boolean inLoop, List<SlotSite> slots) {
        for (int i = 0; i < children.size(); i++) {
            collect(children.get(i), path(path, "children", i), inLoop, slots);
        }
    }
}
