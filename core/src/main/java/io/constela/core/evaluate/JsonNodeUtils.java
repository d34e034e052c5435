package io.constela.core.evaluate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.POJONode;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Iterator;

/**
 * JavaScript value semantics over Jackson nodes, shared by the evaluator and the HTML renderer.
 *
 * <p>Mapping: {@link MissingNode} is {@code undefined}, {@code NullNode} is {@code null}, every
 * numeric node is a JavaScript number (a double), and {@link POJONode}s carry the {@code Math} and
 * {@code Date} globals ({@link BuiltinGlobal}) and date instances ({@link Instant}).
 *
 * <p>Thread-safe (stateless utility class).
 */
public final class JsonNodeUtils {

    /** The {@code undefined} value. */
    public static final JsonNode UNDEFINED = MissingNode.getInstance();

    private JsonNodeUtils() {}

    public static boolean isUndefined(JsonNode node) {
        return node == null || node.isMissingNode();
    }

    /** {@code null} or {@code undefined}. */
    public static boolean isNullish(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    /**
     * JavaScript truthiness: {@code false}, {@code 0}, {@code NaN}, {@code ""}, {@code null} and
     * {@code undefined} are falsy, everything else (including empty arrays and objects) is truthy.
     */
    public static boolean isTruthy(JsonNode node) {
        if (isNullish(node)) {
            return false;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            double value = node.doubleValue();
            return value != 0 && !Double.isNaN(value);
        }
        if (node.isTextual()) {
            return !node.textValue().isEmpty();
        }
        return true;
    }

    /** Wraps a double, using an integral node when the value has no fraction. */
    public static JsonNode number(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && !isNegativeZero(value)) {
            if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
                return IntNode.valueOf((int) value);
            }
            if (Math.abs(value) < 9.007199254740992E15) {
                return LongNode.valueOf((long) value);
            }
        }
        return DoubleNode.valueOf(value);
    }

    /** The numeric value, or 0 when the node is not a number. */
    public static double numberOrZero(JsonNode node) {
        return node != null && node.isNumber() ? node.doubleValue() : 0;
    }

    /** {@code String(value)} in JavaScript. */
    public static String toJsString(JsonNode node) {
        if (isUndefined(node)) {
            return "undefined";
        }
        if (node.isNull()) {
            return "null";
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue() ? "true" : "false";
        }
        if (node.isNumber()) {
            return formatNumber(node.doubleValue());
        }
        if (node.isArray()) {
            StringBuilder sb = new StringBuilder();
            Iterator<JsonNode> it = node.elements();
            while (it.hasNext()) {
                JsonNode element = it.next();
                sb.append(isNullish(element) ? "" : toJsString(element));
                if (it.hasNext()) {
                    sb.append(',');
                }
            }
            return sb.toString();
        }
        if (node.isPojo()) {
            Object pojo = ((POJONode) node).getPojo();
            if (pojo instanceof Instant instant) {
                return instant.toString();
            }
            if (pojo instanceof BuiltinGlobal global) {
                return global.toJsString();
            }
        }
        return "[object Object]";
    }

    /** Number to string the way JavaScript prints it: {@code 3}, {@code 0.5}, {@code NaN}, {@code 1e-7}. */
    public static String formatNumber(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "Infinity" : "-Infinity";
        }
        if (value == 0) {
            return "0";
        }
        double abs = Math.abs(value);
        if (abs >= 1e-6 && abs < 1e21) {
            return new BigDecimal(Double.toString(value)).stripTrailingZeros().toPlainString();
        }
        String java = Double.toString(value);
        int e = java.indexOf('E');
        String mantissa = java.substring(0, e);
        if (mantissa.endsWith(".0")) {
            mantissa = mantissa.substring(0, mantissa.length() - 2);
        }
        String exponent = java.substring(e + 1);
        return mantissa + "e" + (exponent.startsWith("-") ? exponent : "+" + exponent);
    }

    /**
     * {@code ===}: numbers compare numerically ({@code NaN} never equal), strings and booleans by
     * value, arrays and objects by identity.
     */
    public static boolean strictEquals(JsonNode left, JsonNode right) {
        if (isUndefined(left) || isUndefined(right)) {
            return isUndefined(left) && isUndefined(right);
        }
        if (left.isNull() || right.isNull()) {
            return left.isNull() && right.isNull();
        }
        if (left.isNumber() && right.isNumber()) {
            return left.doubleValue() == right.doubleValue();
        }
        if (left.isTextual() && right.isTextual()) {
            return left.textValue().equals(right.textValue());
        }
        if (left.isBoolean() && right.isBoolean()) {
            return left.booleanValue() == right.booleanValue();
        }
        if (left.isPojo() && right.isPojo()) {
            return ((POJONode) left).getPojo() == ((POJONode) right).getPojo();
        }
        return left == right;
    }

    /** Like {@link #strictEquals} but {@code NaN} equals {@code NaN}, as {@code includes} compares. */
    public static boolean sameValueZero(JsonNode left, JsonNode right) {
        if (left != null && right != null && left.isNumber() && right.isNumber()
                && Double.isNaN(left.doubleValue()) && Double.isNaN(right.doubleValue())) {
            return true;
        }
        return strictEquals(left, right);
    }

    private static boolean isNegativeZero(double value) {
        return value == 0 && Double.doubleToRawLongBits(value) != 0;
    }
}
