package io.constela.core.analyze;

import static io.constela.core.analyze.AnalysisSession.path;

import io.constela.core.error.ConstelaError;
import io.constela.core.error.ErrorCode;
import io.constela.core.model.Expression;
import io.constela.core.model.PropValue;
import io.constela.core.model.ViewNode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Accessibility checks over a program's view. Findings are warnings: they never fail a compile.
 *
 * <p>Only literal prop values are inspected for {@code tabindex} and {@code id}; computed values
 * are not known until runtime. Component definitions are not visited, only the main view.
 */
public final class AccessibilityValidator {

    private static final Pattern HEADING = Pattern.compile("h([1-6])");
    private static final Set<String> FORM_INPUTS = Set.of("input", "textarea", "select");

    private final List<ConstelaError> warnings = new ArrayList<>();
    private final Set<String> seenIds = new HashSet<>();
    private int maxHeadingLevel;

    private AccessibilityValidator() {}

    /** Returns the accessibility warnings for {@code view}, in document order. */
    public static List<ConstelaError> validate(ViewNode view) {
        AccessibilityValidator validator = new AccessibilityValidator();
        validator.walk(view, "/view");
        return List.copyOf(validator.warnings);
    }

    private void walk(ViewNode node, String path) {
        if (node == null) {
            return;
        }
        switch (node.kind()) {
            case ELEMENT -> {
                ViewNode.Element element = (ViewNode.Element) node;
                element(element, path);
                children(element.children(), path);
            }
            case COMPONENT -> children(((ViewNode.Component) node).children(), path);
            case PORTAL -> children(((ViewNode.Portal) node).children(), path);
            case IF -> {
                ViewNode.If branch = (ViewNode.If) node;
                walk(branch.then(), path(path, "then"));
                walk(branch.otherwise(), path(path, "else"));
            }
            case EACH -> walk(((ViewNode.Each) node).body(), path(path, "body"));
            case ISLAND -> walk(((ViewNode.Island) node).content(), path(path, "content"));
            case SUSPENSE -> {
                ViewNode.Suspense suspense = (ViewNode.Suspense) node;
                walk(suspense.fallback(), path(path, "fallback"));
                walk(suspense.content(), path(path, "content"));
            }
            case ERROR_BOUNDARY -> {
                ViewNode.ErrorBoundary boundary = (ViewNode.ErrorBoundary) node;
                walk(boundary.fallback(), path(path, "fallback"));
                walk(boundary.content(), path(path, "content"));
            }
            case TEXT, MARKDOWN, CODE, SLOT -> {
                // nothing to check
            }
        }
    }

    private void children(List<ViewNode> children, String path) {
        for (int i = 0; i < children.size(); i++) {
            walk(children.get(i), path(path, "children", i));
        }
    }

    private void element(ViewNode.Element element, String path) {
        String tag = element.tag();
        Map<String, PropValue> props = element.props();
        boolean ariaLabel = props.containsKey("aria-label");

        if (tag.equals("img") && !props.containsKey("alt")) {
            warn(ErrorCode.A11Y_IMG_NO_ALT, "img element is missing an alt attribute", path);
        }
        if (tag.equals("button") && !ariaLabel && !hasTextChild(element)) {
            warn(ErrorCode.A11Y_BUTTON_NO_LABEL, "button has no text content or aria-label", path);
        }
        if (tag.equals("a") && !ariaLabel && !hasTextChild(element)) {
            warn(ErrorCode.A11Y_ANCHOR_NO_LABEL, "a element has no text content or aria-label", path);
        }
        if (FORM_INPUTS.contains(tag) && !ariaLabel && !props.containsKey("aria-labelledby")) {
            warn(ErrorCode.A11Y_INPUT_NO_LABEL, tag + " element has no aria-label or aria-labelledby", path);
        }

        Matcher heading = HEADING.matcher(tag);
        if (heading.matches()) {
            int level = Integer.parseInt(heading.group(1));
            if (maxHeadingLevel > 0 && level > maxHeadingLevel + 1) {
                warn(ErrorCode.A11Y_HEADING_SKIP,
                        "Heading level skipped: h" + level + " used where h" + (maxHeadingLevel + 1) + " was expected",
                        path);
            }
            maxHeadingLevel = Math.max(maxHeadingLevel, level);
        }

        if (props.get("tabindex") instanceof Expression.Lit tabindex
                && tabindex.value().isNumber()
                && tabindex.value().asDouble() > 0) {
            warn(ErrorCode.A11Y_POSITIVE_TABINDEX,
                    "Positive tabindex " + tabindex.value().asText() + " disrupts the natural tab order",
                    path);
        }
        if (props.get("id") instanceof Expression.Lit id && id.value().isTextual()
                && !seenIds.add(id.value().asText())) {
            warn(ErrorCode.A11Y_DUPLICATE_ID, "Duplicate id: '" + id.value().asText() + "'", path);
        }
    }

    private static boolean hasTextChild(ViewNode.Element element) {
        return element.children().stream().anyMatch(child -> child.kind() == ViewNode.Kind.TEXT);
    }

    private void warn(ErrorCode code, String message, String path) {
        warnings.add(ConstelaError.of(code, message, path));
    }
}
