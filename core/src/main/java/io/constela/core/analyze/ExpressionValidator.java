package io.constela.core.analyze;

import static io.constela.core.analyze.AnalysisSession.path;

import io.constela.core.error.ConstelaError;
import io.constela.core.error.ErrorCode;
import io.constela.core.model.Expression;
import io.constela.core.model.StylePreset;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks every name an expression reads against the declarations of the program. Errors are
 * accumulated over the whole expression tree; nothing is thrown.
 */
final class ExpressionValidator {

    private final AnalysisSession session;

    ExpressionValidator(AnalysisSession session) {
        this.session = session;
    }

    List<ConstelaError> validate(Expression expr, String path, ValidationMode mode, Scope scope) {
        List<ConstelaError> errors = new ArrayList<>();
        walk(expr, path, mode, scope, errors);
        return errors;
    }

    private void walk(Expression expr, String path, ValidationMode mode, Scope scope, List<ConstelaError> errors) {
        if (expr == null) {
            return;
        }
        switch (expr.kind()) {
            case LIT -> {
                // always valid
            }
            case STATE -> checkState(((Expression.StateRef) expr).name(), path, scope, errors);
            case VAR -> {
                if (mode.varTrust() == ValidationMode.VarTrustLevel.LEXICAL) {
                    checkVar(((Expression.VarRef) expr).name(), path, scope, errors);
                }
            }
            case PARAM -> checkParam(((Expression.ParamRef) expr).name(), path, scope, errors);
            case ROUTE -> checkRoute((Expression.RouteRef) expr, path, errors);
            case IMPORT -> checkImport(((Expression.ImportRef) expr).name(), path, errors);
            case DATA -> checkData(((Expression.DataRef) expr).name(), path, errors);
            case REF -> {
                String name = ((Expression.Ref) expr).name();
                if (!session.context().refNames().contains(name)) {
                    errors.add(session.referenceError(
                            ErrorCode.UNDEFINED_REF,
                            "Undefined ref reference: '" + name + "' is not defined in view",
                            path,
                            name,
                            session.context().refNames()));
                }
            }
            case STYLE -> checkStyle((Expression.Style) expr, path, mode, scope, errors);
            case BIN -> {
                Expression.Binary bin = (Expression.Binary) expr;
                walk(bin.left(), path(path, "left"), mode, scope, errors);
                walk(bin.right(), path(path, "right"), mode, scope, errors);
            }
            case NOT -> walk(((Expression.Not) expr).operand(), path(path, "operand"), mode, scope, errors);
            case COND -> {
                Expression.Cond cond = (Expression.Cond) expr;
                walk(cond.condition(), path(path, "if"), mode, scope, errors);
                walk(cond.then(), path(path, "then"), mode, scope, errors);
                walk(cond.otherwise(), path(path, "else"), mode, scope, errors);
            }
            case GET -> walk(((Expression.Get) expr).base(), path(path, "base"), mode, scope, errors);
            case INDEX -> {
                Expression.Index index = (Expression.Index) expr;
                walk(index.base(), path(path, "base"), mode, scope, errors);
                walk(index.key(), path(path, "key"), mode, scope, errors);
            }
            case CONCAT -> {
                List<Expression> items = ((Expression.Concat) expr).items();
                for (int i = 0; i < items.size(); i++) {
                    walk(items.get(i), path(path, "items", i), mode, scope, errors);
                }
            }
            case ARRAY -> {
                List<Expression> elements = ((Expression.ArrayLit) expr).elements();
                for (int i = 0; i < elements.size(); i++) {
                    walk(elements.get(i), path(path, "elements", i), mode, scope, errors);
                }
            }
            case CALL -> {
                Expression.Call call = (Expression.Call) expr;
                walk(call.target(), path(path, "target"), mode, scope, errors);
                for (int i = 0; i < call.args().size(); i++) {
                    walk(call.args().get(i), path(path, "args", i), mode, scope, errors);
                }
            }
            case LAMBDA -> {
                Expression.Lambda lambda = (Expression.Lambda) expr;
                walk(lambda.body(), path(path, "body"), mode, scope.withVars(lambda.param(), lambda.index()), errors);
            }
            case VALIDITY -> {
                // resolved against the DOM at runtime
            }
        }
    }

    private void checkState(String name, String path, Scope scope, List<ConstelaError> errors) {
        if (session.context().stateNames().contains(name)) {
            return;
        }
        if (scope.localStateNames().contains(name)) {
            return;
        }
        Set<String> candidates = new LinkedHashSet<>(session.context().stateNames());
        candidates.addAll(scope.localStateNames());
        errors.add(session.referenceError(
                ErrorCode.UNDEFINED_STATE,
                "Undefined state reference: '" + name + "' is not defined in state",
                path,
                name,
                candidates));
    }

    // Dotted names ("item.title") are bound by their first segment.
    private void checkVar(String name, String path, Scope scope, List<ConstelaError> errors) {
        int dot = name.indexOf('.');
        String base = dot < 0 ? name : name.substring(0, dot);
        if (!scope.hasVar(base)) {
            errors.add(session.referenceError(
                    ErrorCode.UNDEFINED_VAR,
                    "Undefined variable reference: '" + name + "' is not defined in scope",
                    path,
                    base,
                    scope.vars()));
        }
    }

    private void checkParam(String name, String path, Scope scope, List<ConstelaError> errors) {
        Set<String> params = scope.insideComponent() ? scope.component().params() : Set.of();
        if (!params.contains(name)) {
            errors.add(session.referenceError(
                    ErrorCode.UNDEFINED_PARAM,
                    "Undefined param reference: '" + name + "' is not defined in component params",
                    path,
                    name,
                    params));
        }
    }

    private void checkRoute(Expression.RouteRef route, String path, List<ConstelaError> errors) {
        if (!session.hasRoute()) {
            errors.add(ConstelaError.of(
                    ErrorCode.ROUTE_NOT_DEFINED,
                    "Route is not defined: '" + route.name() + "' cannot be read without a route declaration",
                    path));
            return;
        }
        Set<String> params = session.context().routeParams();
        if ("param".equals(route.effectiveSource()) && !params.contains(route.name())) {
            errors.add(session.referenceError(
                    ErrorCode.UNDEFINED_ROUTE_PARAM,
                    "Undefined route param: '" + route.name() + "' is not defined in route path '"
                            + session.program().route().path() + "'",
                    path,
                    route.name(),
                    params));
        }
    }

    private void checkImport(String name, String path, List<ConstelaError> errors) {
        if (!session.hasImports()) {
            errors.add(ConstelaError.of(
                    ErrorCode.IMPORTS_NOT_DEFINED,
                    "Imports are not defined: '" + name + "' cannot be read without an imports declaration",
                    path));
        } else if (!session.context().importNames().contains(name)) {
            errors.add(session.referenceError(
                    ErrorCode.UNDEFINED_IMPORT,
                    "Undefined import reference: '" + name + "' is not defined in imports",
                    path,
                    name,
                    session.context().importNames()));
        }
    }

    private void checkData(String name, String path, List<ConstelaError> errors) {
        if (!session.hasData()) {
            errors.add(ConstelaError.of(
                    ErrorCode.DATA_NOT_DEFINED,
                    "Data is not defined: '" + name + "' cannot be read without a data declaration",
                    path));
        } else if (!session.context().dataNames().contains(name)) {
            errors.add(session.referenceError(
                    ErrorCode.UNDEFINED_DATA,
                    "Undefined data reference: '" + name + "' is not defined in data",
                    path,
                    name,
                    session.context().dataNames()));
        }
    }

    private void checkStyle(
            Expression.Style style, String path, ValidationMode mode, Scope scope, List<ConstelaError> errors) {
        StylePreset preset = session.style(style.name());
        if (preset == null) {
            errors.add(session.referenceError(
                    ErrorCode.UNDEFINED_STYLE,
                    "Undefined style reference: '" + style.name() + "' is not defined in styles",
                    path,
                    style.name(),
                    session.context().styleNames()));
        }
        for (Map.Entry<String, Expression> variant : style.variants().entrySet()) {
            String variantPath = path(path, "variants", variant.getKey());
            if (preset != null && !preset.hasVariant(variant.getKey())) {
                errors.add(session.referenceError(
                        ErrorCode.UNDEFINED_VARIANT,
                        "Undefined style variant: '" + variant.getKey() + "' is not defined in style '"
                                + style.name() + "'",
                        variantPath,
                        variant.getKey(),
                        preset.variants().keySet()));
            }
            walk(variant.getValue(), variantPath, mode, scope, errors);
        }
    }
}
