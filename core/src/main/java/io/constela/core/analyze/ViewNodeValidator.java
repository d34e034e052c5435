package io.constela.core.analyze;

import static io.constela.core.analyze.AnalysisSession.path;

import io.constela.core.error.ConstelaError;
import io.constela.core.error.ErrorCode;
import io.constela.core.model.ComponentDef;
import io.constela.core.model.EventHandler;
import io.constela.core.model.Expression;
import io.constela.core.model.ParamDef;
import io.constela.core.model.PropValue;
import io.constela.core.model.ViewNode;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Walks a view tree, validating expressions in {@link ValidationMode#FULL} mode, event handlers,
 * component invocations and slot placement.
 */
final class ViewNodeValidator {

    private final AnalysisSession session;
    private final ExpressionValidator expressions;

    ViewNodeValidator(AnalysisSession session, ExpressionValidator expressions) {
        this.session = session;
        this.expressions = expressions;
    }

    List<ConstelaError> validate(ViewNode node, String path, Scope scope) {
        List<ConstelaError> errors = new ArrayList<>();
        walk(node, path, scope, errors);
        return errors;
    }

    private void walk(ViewNode node, String path, Scope scope, List<ConstelaError> errors) {
        if (node == null) {
            return;
        }
        switch (node.kind()) {
            case ELEMENT -> {
                ViewNode.Element element = (ViewNode.Element) node;
                props(element.props(), path, scope, errors);
                children(element.children(), path, scope, errors);
            }
            case TEXT -> expr(((ViewNode.Text) node).value(), path(path, "value"), scope, errors);
            case IF -> {
                ViewNode.If branch = (ViewNode.If) node;
                expr(branch.condition(), path(path, "condition"), scope, errors);
                walk(branch.then(), path(path, "then"), scope, errors);
                walk(branch.otherwise(), path(path, "else"), scope, errors);
            }
            case EACH -> {
                ViewNode.Each each = (ViewNode.Each) node;
                expr(each.items(), path(path, "items"), scope, errors);
                Scope body = scope.withVars(each.as(), each.index());
                expr(each.key(), path(path, "key"), body, errors);
                walk(each.body(), path(path, "body"), body, errors);
            }
            case COMPONENT -> validateInvocation((ViewNode.Component) node, path, scope, errors);
            case MARKDOWN -> expr(((ViewNode.Markdown) node).content(), path(path, "content"), scope, errors);
            case CODE -> {
                ViewNode.Code code = (ViewNode.Code) node;
                expr(code.language(), path(path, "language"), scope, errors);
                expr(code.content(), path(path, "content"), scope, errors);
            }
            case SLOT -> {
                if (!scope.insideComponent() && !scope.insideLayout()) {
                    errors.add(ConstelaError.of(
                            ErrorCode.SCHEMA_ERROR,
                            "Slot can only be used inside a component definition or a layout",
                            path));
                }
            }
            case PORTAL -> children(((ViewNode.Portal) node).children(), path, scope, errors);
            case ISLAND -> {
                ViewNode.Island island = (ViewNode.Island) node;
                walk(island.content(), path(path, "content"), scope.withIsland(island), errors);
            }
            case SUSPENSE -> {
                ViewNode.Suspense suspense = (ViewNode.Suspense) node;
                walk(suspense.fallback(), path(path, "fallback"), scope, errors);
                walk(suspense.content(), path(path, "content"), scope, errors);
            }
            case ERROR_BOUNDARY -> {
                ViewNode.ErrorBoundary boundary = (ViewNode.ErrorBoundary) node;
                walk(boundary.fallback(), path(path, "fallback"), scope, errors);
                walk(boundary.content(), path(path, "content"), scope, errors);
            }
        }
    }

    // Props and slot children are evaluated where the component is used, so they keep the caller's scope.
    private void validateInvocation(ViewNode.Component invocation, String path, Scope scope, List<ConstelaError> errors) {
        ComponentDef def = session.component(invocation.name());
        if (def == null) {
            errors.add(session.referenceError(
                    ErrorCode.COMPONENT_NOT_FOUND,
                    "Component '" + invocation.name() + "' is not defined in components",
                    path,
                    invocation.name(),
                    session.context().componentNames()));
        } else {
            for (Map.Entry<String, ParamDef> param : def.params().entrySet()) {
                if (param.getValue().isRequired() && !invocation.props().containsKey(param.getKey())) {
                    errors.add(ConstelaError.of(
                            ErrorCode.COMPONENT_PROP_MISSING,
                            "Component '" + invocation.name() + "' requires prop '" + param.getKey() + "'",
                            path(path, "props")));
                }
            }
        }
        props(invocation.props(), path, scope, errors);
        children(invocation.children(), path, scope, errors);
    }

    private void props(Map<String, PropValue> props, String path, Scope scope, List<ConstelaError> errors) {
        for (Map.Entry<String, PropValue> prop : props.entrySet()) {
            String propPath = path(path, "props", prop.getKey());
            if (prop.getValue() instanceof EventHandler handler) {
                validateHandler(handler, propPath, scope, errors);
            } else {
                expr((Expression) prop.getValue(), propPath, scope, errors);
            }
        }
    }

    private void validateHandler(EventHandler handler, String path, Scope scope, List<ConstelaError> errors) {
        String action = handler.action();
        if (!session.context().hasAction(action) && !scope.localActionNames().contains(action)) {
            Set<String> candidates = new LinkedHashSet<>(session.context().actionNames());
            candidates.addAll(scope.localActionNames());
            errors.add(session.referenceError(
                    ErrorCode.UNDEFINED_ACTION,
                    "Undefined action reference: '" + action + "' is not defined in actions",
                    path,
                    action,
                    candidates));
        }
        if (handler.payload() != null) {
            errors.addAll(expressions.validate(
                    handler.payload(), path(path, "payload"), ValidationMode.EVENT_PAYLOAD, scope));
        }
        for (Map.Entry<String, Expression> field : handler.payloadFields().entrySet()) {
            errors.addAll(expressions.validate(
                    field.getValue(), path(path, "payload", field.getKey()), ValidationMode.EVENT_PAYLOAD, scope));
        }
    }

    private void children(List<ViewNode> children, String path, Scope scope, List<ConstelaError> errors) {
        for (int i = 0; i < children.size(); i++) {
            walk(children.get(i), path(path, "children", i), scope, errors);
        }
    }

    private void expr(Expression expression, String path, Scope scope, List<ConstelaError> errors) {
        if (expression != null) {
            errors.addAll(expressions.validate(expression, path, ValidationMode.FULL, scope));
        }
    }
}
