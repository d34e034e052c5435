package io.constela.core.transform;

import com.fasterxml.jackson.databind.node.NullNode;
import io.constela.core.compiled.CompiledEventHandler;
import io.constela.core.compiled.CompiledExpression;
import io.constela.core.compiled.CompiledPropValue;
import io.constela.core.model.EventHandler;
import io.constela.core.model.Expression;
import io.constela.core.model.PropValue;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Lowers source expressions, substituting component params from the {@link TransformContext}. */
final class ExpressionTransformer {

    private static final CompiledExpression.Lit NULL_LITERAL = new CompiledExpression.Lit(NullNode.getInstance());

    private ExpressionTransformer() {
        // utility class
    }

    static CompiledExpression transform(Expression expr, TransformContext ctx) {
        if (expr == null) {
            return null;
        }
        return switch (expr.kind()) {
            case LIT -> new CompiledExpression.Lit(((Expression.Lit) expr).value());
            case STATE -> {
                Expression.StateRef state = (Expression.StateRef) expr;
                yield new CompiledExpression.StateRef(state.name(), state.path());
            }
            case VAR -> {
                Expression.VarRef var = (Expression.VarRef) expr;
                yield new CompiledExpression.VarRef(var.name(), var.path());
            }
            case BIN -> {
                Expression.Binary bin = (Expression.Binary) expr;
                yield new CompiledExpression.Binary(bin.op(), transform(bin.left(), ctx), transform(bin.right(), ctx));
            }
            case NOT -> new CompiledExpression.Not(transform(((Expression.Not) expr).operand(), ctx));
            case COND -> {
                Expression.Cond cond = (Expression.Cond) expr;
                yield new CompiledExpression.Cond(
                        transform(cond.condition(), ctx), transform(cond.then(), ctx), transform(cond.otherwise(), ctx));
            }
            case GET -> {
                Expression.Get get = (Expression.Get) expr;
                yield new CompiledExpression.Get(transform(get.base(), ctx), get.path());
            }
            case ROUTE -> {
                Expression.RouteRef route = (Expression.RouteRef) expr;
                yield new CompiledExpression.RouteRef(route.name(), route.effectiveSource());
            }
            case IMPORT -> {
                Expression.ImportRef ref = (Expression.ImportRef) expr;
                yield new CompiledExpression.ImportRef(ref.name(), ref.path());
            }
            // data sources are resolved at build time and read like imports
            case DATA -> {
                Expression.DataRef ref = (Expression.DataRef) expr;
                yield new CompiledExpression.ImportRef(ref.name(), ref.path());
            }
            case REF -> new CompiledExpression.Ref(((Expression.Ref) expr).name());
            case INDEX -> {
                Expression.Index index = (Expression.Index) expr;
                yield new CompiledExpression.Index(transform(index.base(), ctx), transform(index.key(), ctx));
            }
            case PARAM -> {
                CompiledPropValue bound = substitute((Expression.ParamRef) expr, ctx);
                yield bound instanceof CompiledExpression compiled ? compiled : NULL_LITERAL;
            }
            case STYLE -> {
                Expression.Style style = (Expression.Style) expr;
                Map<String, CompiledExpression> variants = new LinkedHashMap<>();
                style.variants().forEach((key, value) -> variants.put(key, transform(value, ctx)));
                yield new CompiledExpression.Style(style.name(), variants);
            }
            case CONCAT -> new CompiledExpression.Concat(transformAll(((Expression.Concat) expr).items(), ctx));
            case VALIDITY -> {
                Expression.Validity validity = (Expression.Validity) expr;
                yield new CompiledExpression.Validity(validity.ref(), validity.property());
            }
            case CALL -> {
                Expression.Call call = (Expression.Call) expr;
                yield new CompiledExpression.Call(
                        transform(call.target(), ctx), call.method(), transformAll(call.args(), ctx));
            }
            case LAMBDA -> {
                Expression.Lambda lambda = (Expression.Lambda) expr;
                yield new CompiledExpression.Lambda(lambda.param(), lambda.index(), transform(lambda.body(), ctx));
            }
            case ARRAY -> new CompiledExpression.ArrayLit(transformAll(((Expression.ArrayLit) expr).elements(), ctx));
        };
    }

    /**
     * Lowers a prop value. A {@code param} expression bound to an event handler yields the handler
     * itself here, while in any other expression position it yields {@code null}.
     */
    static CompiledPropValue transformProp(PropValue value, TransformContext ctx) {
        if (value instanceof EventHandler handler) {
            return transformHandler(handler, ctx);
        }
        Expression expr = (Expression) value;
        if (expr instanceof Expression.ParamRef param) {
            CompiledPropValue bound = substitute(param, ctx);
            return bound == null ? NULL_LITERAL : bound;
        }
        return transform(expr, ctx);
    }

    static CompiledEventHandler transformHandler(EventHandler handler, TransformContext ctx) {
        Map<String, CompiledExpression> fields = new LinkedHashMap<>();
        handler.payloadFields().forEach((key, value) -> fields.put(key, transform(value, ctx)));
        return new CompiledEventHandler(
                handler.event(),
                handler.action(),
                transform(handler.payload(), ctx),
                fields,
                handler.debounce(),
                handler.throttle(),
                handler.options());
    }

    /** Resolves a param against the current invocation, or null when it was not supplied. */
    private static CompiledPropValue substitute(Expression.ParamRef param, TransformContext ctx) {
        CompiledPropValue bound = ctx.currentParams().get(param.name());
        if (bound == null || bound instanceof CompiledEventHandler || param.path() == null) {
            return bound;
        }
        CompiledExpression value = (CompiledExpression) bound;
        if (value instanceof CompiledExpression.VarRef var) {
            String joined = var.path() == null ? param.path() : var.path() + "." + param.path();
            return new CompiledExpression.VarRef(var.name(), joined);
        }
        if (value instanceof CompiledExpression.StateRef state) {
            return new CompiledExpression.VarRef(state.name(), param.path());
        }
        return value;
    }

    private static List<CompiledExpression> transformAll(List<Expression> exprs, TransformContext ctx) {
        List<CompiledExpression> out = new ArrayList<>(exprs.size());
        for (Expression expr : exprs) {
            out.add(transform(expr, ctx));
        }
        return out;
    }
}
