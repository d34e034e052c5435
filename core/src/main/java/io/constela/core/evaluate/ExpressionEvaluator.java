package io.constela.core.evaluate;

import static io.constela.core.evaluate.JsonNodeUtils.UNDEFINED;
import static io.constela.core.evaluate.JsonNodeUtils.number;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.POJONode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.constela.core.compiled.CompiledExpression;
import io.constela.core.error.ExpressionEvalException;
import io.constela.core.model.StylePreset;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates compiled expressions for server-side rendering.
 *
 * <p>Data-level problems never throw: a missing key, a wrong type or a method outside the
 * whitelist yields {@code undefined} (see {@link JsonNodeUtils#UNDEFINED}). Only an unknown binary
 * operator raises {@link ExpressionEvalException}.
 *
 * <p>Thread-safe (stateless utility class).
 */
public final class ExpressionEvaluator {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private ExpressionEvaluator() {
        // utility class
    }

    public static JsonNode evaluate(CompiledExpression expr, EvaluationContext ctx) {
        return switch (expr.kind()) {
            case LIT -> ((CompiledExpression.Lit) expr).value();
            case STATE -> {
                CompiledExpression.StateRef state = (CompiledExpression.StateRef) expr;
                JsonNode value = ctx.state().getOrDefault(state.name(), UNDEFINED);
                yield state.path() == null || JsonNodeUtils.isNullish(value) ? value : nested(value, state.path());
            }
            case VAR -> evaluateVar((CompiledExpression.VarRef) expr, ctx);
            case BIN -> {
                CompiledExpression.Binary bin = (CompiledExpression.Binary) expr;
                yield evaluateBinary(bin.op(), bin.left(), bin.right(), ctx);
            }
            case NOT -> BooleanNode.valueOf(!JsonNodeUtils.isTruthy(evaluate(((CompiledExpression.Not) expr).operand(), ctx)));
            case COND -> {
                CompiledExpression.Cond cond = (CompiledExpression.Cond) expr;
                yield JsonNodeUtils.isTruthy(evaluate(cond.condition(), ctx))
                        ? evaluate(cond.then(), ctx)
                        : evaluate(cond.otherwise(), ctx);
            }
            case GET -> {
                CompiledExpression.Get get = (CompiledExpression.Get) expr;
                JsonNode base = evaluate(get.base(), ctx);
                yield JsonNodeUtils.isNullish(base) ? UNDEFINED : nested(base, get.path());
            }
            case ROUTE -> evaluateRoute((CompiledExpression.RouteRef) expr, ctx);
            case IMPORT -> {
                CompiledExpression.ImportRef ref = (CompiledExpression.ImportRef) expr;
                yield importValue(ref.name(), ref.path(), ctx);
            }
            case DATA -> {
                CompiledExpression.DataRef ref = (CompiledExpression.DataRef) expr;
                yield importValue(ref.name(), ref.path(), ctx);
            }
            // no DOM on the server
            case REF -> NullNode.getInstance();
            case VALIDITY -> BooleanNode.FALSE;
            case INDEX -> {
                CompiledExpression.Index index = (CompiledExpression.Index) expr;
                yield evaluateIndex(evaluate(index.base(), ctx), evaluate(index.key(), ctx));
            }
            case PARAM, LAMBDA -> UNDEFINED;
            case STYLE -> TextNode.valueOf(evaluateStyle((CompiledExpression.Style) expr, ctx));
            case CONCAT -> {
                StringBuilder sb = new StringBuilder();
                for (CompiledExpression item : ((CompiledExpression.Concat) expr).items()) {
                    JsonNode value = evaluate(item, ctx);
                    sb.append(JsonNodeUtils.isNullish(value) ? "" : JsonNodeUtils.toJsString(value));
                }
                yield TextNode.valueOf(sb.toString());
            }
            case CALL -> evaluateCall((CompiledExpression.Call) expr, ctx);
            case ARRAY -> {
                List<JsonNode> elements = new ArrayList<>();
                for (CompiledExpression element : ((CompiledExpression.ArrayLit) expr).elements()) {
                    JsonNode value = evaluate(element, ctx);
                    elements.add(JsonNodeUtils.isUndefined(value) ? NullNode.getInstance() : value);
                }
                yield NODES.arrayNode().addAll(elements);
            }
        };
    }

    /**
     * Resolves a style preset to its class string: the base classes, then for each variant key in
     * declaration order the class of the supplied (or default) variant value.
     */
    public static String evaluateStyle(CompiledExpression.Style expr, EvaluationContext ctx) {
        StylePreset preset = ctx.styles().get(expr.name());
        if (preset == null) {
            return "";
        }
        StringBuilder classes = new StringBuilder(preset.base());
        for (String key : preset.variants().keySet()) {
            String value = null;
            CompiledExpression supplied = expr.variants().get(key);
            if (supplied != null) {
                JsonNode evaluated;
                try {
                    evaluated = evaluate(supplied, ctx);
                } catch (ExpressionEvalException e) {
                    // a broken variant drops only that variant
                    continue;
                }
                if (!JsonNodeUtils.isNullish(evaluated)) {
                    value = JsonNodeUtils.toJsString(evaluated);
                }
            } else {
                value = preset.defaultVariants().get(key);
            }
            String variantClasses = value == null ? null : preset.classFor(key, value);
            if (variantClasses != null && !variantClasses.isEmpty()) {
                classes.append(' ').append(variantClasses);
            }
        }
        return classes.toString().trim();
    }

    private static JsonNode evaluateVar(CompiledExpression.VarRef var, EvaluationContext ctx) {
        String name = var.name();
        List<String> path = new ArrayList<>();
        int dot = name.indexOf('.');
        if (dot >= 0) {
            path.addAll(List.of(name.substring(dot + 1).split("\\.", -1)));
            name = name.substring(0, dot);
        }
        if (var.path() != null) {
            path.addAll(List.of(var.path().split("\\.", -1)));
        }
        for (String segment : path) {
            if (SafeMethods.isForbidden(segment)) {
                return UNDEFINED;
            }
        }
        JsonNode value = ctx.locals().get(name);
        if (value == null) {
            BuiltinGlobal global = BuiltinGlobal.byName(name);
            value = global == null ? UNDEFINED : global.node();
        }
        for (String segment : path) {
            if (JsonNodeUtils.isNullish(value)) {
                return UNDEFINED;
            }
            value = property(value, segment);
        }
        return value;
    }

    private static JsonNode evaluateRoute(CompiledExpression.RouteRef route, EvaluationContext ctx) {
        RouteContext routeCtx = ctx.route();
        if (routeCtx == null) {
            return TextNode.valueOf("");
        }
        String source = route.source() == null ? "param" : route.source();
        return switch (source) {
            case "param" -> TextNode.valueOf(routeCtx.params().getOrDefault(route.name(), ""));
            case "query" -> TextNode.valueOf(routeCtx.query().getOrDefault(route.name(), ""));
            case "path" -> TextNode.valueOf(routeCtx.path());
            default -> TextNode.valueOf("");
        };
    }

    private static JsonNode importValue(String name, String path, EvaluationContext ctx) {
        JsonNode value = ctx.imports().get(name);
        if (value == null) {
            return UNDEFINED;
        }
        return path == null ? value : nested(value, path);
    }

    private static JsonNode evaluateIndex(JsonNode base, JsonNode key) {
        if (JsonNodeUtils.isNullish(base) || JsonNodeUtils.isNullish(key)) {
            return UNDEFINED;
        }
        if (key.isTextual() && SafeMethods.isForbidden(key.textValue())) {
            return UNDEFINED;
        }
        if (base.isTextual() && key.isNumber()) {
            String text = base.textValue();
            double index = key.doubleValue();
            return index >= 0 && index < text.length() && index == Math.rint(index)
                    ? TextNode.valueOf(String.valueOf(text.charAt((int) index)))
                    : UNDEFINED;
        }
        return property(base, JsonNodeUtils.toJsString(key));
    }

    private static JsonNode evaluateBinary(
            String op, CompiledExpression leftExpr, CompiledExpression rightExpr, EvaluationContext ctx) {
        if ("&&".equals(op)) {
            JsonNode left = evaluate(leftExpr, ctx);
            return JsonNodeUtils.isTruthy(left) ? evaluate(rightExpr, ctx) : left;
        }
        if ("||".equals(op)) {
            JsonNode left = evaluate(leftExpr, ctx);
            return JsonNodeUtils.isTruthy(left) ? left : evaluate(rightExpr, ctx);
        }
        JsonNode left = evaluate(leftExpr, ctx);
        JsonNode right = evaluate(rightExpr, ctx);
        boolean numeric = left.isNumber() && right.isNumber();
        switch (op) {
            case "+":
                return numeric
                        ? number(left.doubleValue() + right.doubleValue())
                        : TextNode.valueOf(JsonNodeUtils.toJsString(left) + JsonNodeUtils.toJsString(right));
            case "-":
                return number(JsonNodeUtils.numberOrZero(left) - JsonNodeUtils.numberOrZero(right));
            case "*":
                return number(JsonNodeUtils.numberOrZero(left) * JsonNodeUtils.numberOrZero(right));
            case "/":
                return number(JsonNodeUtils.numberOrZero(left) / JsonNodeUtils.numberOrZero(right));
            case "%":
                return number(JsonNodeUtils.numberOrZero(left) % JsonNodeUtils.numberOrZero(right));
            case "==":
                return BooleanNode.valueOf(JsonNodeUtils.strictEquals(left, right));
            case "!=":
                return BooleanNode.valueOf(!JsonNodeUtils.strictEquals(left, right));
            case "<":
                return BooleanNode.valueOf(compare(left, right, numeric) < 0);
            case "<=":
                return BooleanNode.valueOf(compare(left, right, numeric) <= 0);
            case ">":
                return BooleanNode.valueOf(compare(left, right, numeric) > 0);
            case ">=":
                return BooleanNode.valueOf(compare(left, right, numeric) >= 0);
            default:
                throw new ExpressionEvalException("Unknown binary operator: " + op);
        }
    }

    // NaN compares false both ways, so it is mapped to a value that fails every relation
    private static double compare(JsonNode left, JsonNode right, boolean numeric) {
        if (numeric) {
            double l = left.doubleValue();
            double r = right.doubleValue();
            return Double.isNaN(l) || Double.isNaN(r) ? Double.NaN : Double.compare(l, r);
        }
        return JsonNodeUtils.toJsString(left).compareTo(JsonNodeUtils.toJsString(right));
    }

    private static JsonNode evaluateCall(CompiledExpression.Call call, EvaluationContext ctx) {
        if (call.target() == null) {
            return UNDEFINED;
        }
        JsonNode target = evaluate(call.target(), ctx);
        List<JsonNode> args = new ArrayList<>();
        SafeMethods.Callback callback = null;
        for (int i = 0; i < call.args().size(); i++) {
            CompiledExpression arg = call.args().get(i);
            if (arg instanceof CompiledExpression.Lambda lambda) {
                if (i == 0) {
                    callback = bind(lambda, ctx);
                }
                args.add(UNDEFINED);
            } else {
                args.add(evaluate(arg, ctx));
            }
        }
        if (target.isArray()) {
            return SafeMethods.callArray(target, call.method(), args, callback);
        }
        if (target.isTextual()) {
            return SafeMethods.callString(target.textValue(), call.method(), args);
        }
        if (target.isPojo()) {
            Object pojo = ((POJONode) target).getPojo();
            if (pojo == BuiltinGlobal.MATH) {
                return SafeMethods.callMath(call.method(), args);
            }
            if (pojo == BuiltinGlobal.DATE) {
                return SafeMethods.callDateStatic(call.method(), args);
            }
            if (pojo instanceof Instant instant) {
                return SafeMethods.callDateInstance(instant, call.method());
            }
        }
        return UNDEFINED;
    }

    private static SafeMethods.Callback bind(CompiledExpression.Lambda lambda, EvaluationContext ctx) {
        return (item, index) -> {
            EvaluationContext inner = ctx.withLocal(lambda.param(), item);
            if (lambda.index() != null) {
                inner = inner.withLocal(lambda.index(), number(index));
            }
            return evaluate(lambda.body(), inner);
        };
    }

    /** Follows a dotted path; forbidden keys and steps through null or undefined yield undefined. */
    static JsonNode nested(JsonNode value, String path) {
        JsonNode current = value;
        for (String segment : path.split("\\.", -1)) {
            if (SafeMethods.isForbidden(segment) || JsonNodeUtils.isNullish(current)) {
                return UNDEFINED;
            }
            current = property(current, segment);
        }
        return current;
    }

    private static JsonNode property(JsonNode container, String key) {
        if (container.isArray()) {
            if ("length".equals(key)) {
                return number(container.size());
            }
            if (isIndex(key)) {
                return container.path(Integer.parseInt(key));
            }
            return UNDEFINED;
        }
        if (container.isTextual()) {
            String text = container.textValue();
            if ("length".equals(key)) {
                return number(text.length());
            }
            if (isIndex(key) && Integer.parseInt(key) < text.length()) {
                return TextNode.valueOf(String.valueOf(text.charAt(Integer.parseInt(key))));
            }
            return UNDEFINED;
        }
        if (container.isObject()) {
            return container.path(key);
        }
        return UNDEFINED;
    }

    private static boolean isIndex(String key) {
        if (key.isEmpty() || key.length() > 9) {
            return false;
        }
        for (int i = 0; i < key.length(); i++) {
            if (!Character.isDigit(key.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
