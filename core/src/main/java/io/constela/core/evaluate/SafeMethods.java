package io.constela.core.evaluate;

import static io.constela.core.evaluate.JsonNodeUtils.UNDEFINED;
import static io.constela.core.evaluate.JsonNodeUtils.number;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * The methods {@code call} expressions may invoke. Anything not listed yields {@code undefined}.
 * Date methods work in UTC.
 */
final class SafeMethods {

    static final Set<String> ARRAY_METHODS = Set.of(
            "length", "at", "includes", "slice", "indexOf", "join",
            "filter", "map", "find", "findIndex", "some", "every");

    static final Set<String> STRING_METHODS = Set.of(
            "length", "charAt", "substring", "slice", "split", "trim", "toUpperCase", "toLowerCase",
            "replace", "includes", "startsWith", "endsWith", "indexOf");

    static final Set<String> MATH_METHODS = Set.of(
            "min", "max", "round", "floor", "ceil", "abs", "sqrt", "pow", "random", "sin", "cos", "tan");

    static final Set<String> DATE_STATIC_METHODS = Set.of("now", "parse");

    static final Set<String> DATE_INSTANCE_METHODS = Set.of(
            "toISOString", "toDateString", "toTimeString", "getTime", "getFullYear", "getMonth",
            "getDate", "getHours", "getMinutes", "getSeconds", "getMilliseconds");

    /** Keys that never resolve, on any object. */
    static final Set<String> FORBIDDEN_KEYS = Set.of("__proto__", "constructor", "prototype");

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final DateTimeFormatter ISO_MILLIS =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter DATE_STRING =
            DateTimeFormatter.ofPattern("EEE MMM dd uuuu", Locale.ENGLISH).withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter TIME_STRING = DateTimeFormatter.ofPattern(
                    "HH:mm:ss 'GMT+0000 (Coordinated Universal Time)'", Locale.ENGLISH)
            .withZone(ZoneOffset.UTC);

    /** A lambda argument bound to the evaluation context it was written in. */
    @FunctionalInterface
    interface Callback {
        JsonNode apply(JsonNode item, int index);
    }

    private SafeMethods() {
        // utility class
    }

    static boolean isForbidden(String key) {
        return FORBIDDEN_KEYS.contains(key);
    }

    // ── arrays ──

    static JsonNode callArray(JsonNode target, String method, List<JsonNode> args, Callback callback) {
        if (!ARRAY_METHODS.contains(method)) {
            return UNDEFINED;
        }
        List<JsonNode> items = new ArrayList<>();
        target.elements().forEachRemaining(items::add);
        int size = items.size();
        switch (method) {
            case "length":
                return number(size);
            case "at": {
                long index = intArg(args, 0, 0);
                long resolved = index < 0 ? size + index : index;
                return resolved >= 0 && resolved < size ? items.get((int) resolved) : UNDEFINED;
            }
            case "includes": {
                for (int i = fromIndex(args, 1, size); i < size; i++) {
                    if (JsonNodeUtils.sameValueZero(items.get(i), arg(args, 0))) {
                        return BooleanNode.TRUE;
                    }
                }
                return BooleanNode.FALSE;
            }
            case "slice": {
                int start = relativeIndex(args, 0, 0, size);
                int end = relativeIndex(args, 1, size, size);
                ArrayNode out = NODES.arrayNode();
                for (int i = start; i < end; i++) {
                    out.add(items.get(i));
                }
                return out;
            }
            case "indexOf": {
                for (int i = fromIndex(args, 1, size); i < size; i++) {
                    if (JsonNodeUtils.strictEquals(items.get(i), arg(args, 0))) {
                        return number(i);
                    }
                }
                return number(-1);
            }
            case "join": {
                JsonNode separator = arg(args, 0);
                String sep = separator.isTextual() ? separator.textValue() : ",";
                StringBuilder sb = new StringBuilder();
                for (int i = 0; i < size; i++) {
                    if (i > 0) {
                        sb.append(sep);
                    }
                    JsonNode item = items.get(i);
                    sb.append(JsonNodeUtils.isNullish(item) ? "" : JsonNodeUtils.toJsString(item));
                }
                return TextNode.valueOf(sb.toString());
            }
            default:
                return callIterating(items, method, callback);
        }
    }

    private static JsonNode callIterating(List<JsonNode> items, String method, Callback callback) {
        if (callback == null) {
            return UNDEFINED;
        }
        switch (method) {
            case "filter": {
                ArrayNode out = NODES.arrayNode();
                for (int i = 0; i < items.size(); i++) {
                    if (JsonNodeUtils.isTruthy(callback.apply(items.get(i), i))) {
                        out.add(items.get(i));
                    }
                }
                return out;
            }
            case "map": {
                ArrayNode out = NODES.arrayNode();
                for (int i = 0; i < items.size(); i++) {
                    JsonNode mapped = callback.apply(items.get(i), i);
                    out.add(JsonNodeUtils.isUndefined(mapped) ? NODES.nullNode() : mapped);
                }
                return out;
            }
            case "find": {
                for (int i = 0; i < items.size(); i++) {
                    if (JsonNodeUtils.isTruthy(callback.apply(items.get(i), i))) {
                        return items.get(i);
                    }
                }
                return UNDEFINED;
            }
            case "findIndex": {
                for (int i = 0; i < items.size(); i++) {
                    if (JsonNodeUtils.isTruthy(callback.apply(items.get(i), i))) {
                        return number(i);
                    }
                }
                return number(-1);
            }
            case "some": {
                for (int i = 0; i < items.size(); i++) {
                    if (JsonNodeUtils.isTruthy(callback.apply(items.get(i), i))) {
                        return BooleanNode.TRUE;
                    }
                }
                return BooleanNode.FALSE;
            }
            case "every": {
                for (int i = 0; i < items.size(); i++) {
                    if (!JsonNodeUtils.isTruthy(callback.apply(items.get(i), i))) {
                        return BooleanNode.FALSE;
                    }
                }
                return BooleanNode.TRUE;
            }
            default:
                return UNDEFINED;
        }
    }

    // ── strings ──

    static JsonNode callString(String target, String method, List<JsonNode> args) {
        if (!STRING_METHODS.contains(method)) {
            return UNDEFINED;
        }
        int length = target.length();
        switch (method) {
            case "length":
                return number(length);
            case "charAt": {
                long index = intArg(args, 0, 0);
                return TextNode.valueOf(index >= 0 && index < length ? String.valueOf(target.charAt((int) index)) : "");
            }
            case "substring": {
                int start = clamp(intArg(args, 0, 0), length);
                int end = clamp(intArg(args, 1, length), length);
                return TextNode.valueOf(target.substring(Math.min(start, end), Math.max(start, end)));
            }
            case "slice": {
                int start = relativeIndex(args, 0, 0, length);
                int end = relativeIndex(args, 1, length, length);
                return TextNode.valueOf(start < end ? target.substring(start, end) : "");
            }
            case "split":
                return split(target, stringArg(args, 0, ""));
            case "trim":
                return TextNode.valueOf(jsTrim(target));
            case "toUpperCase":
                return TextNode.valueOf(target.toUpperCase(Locale.ROOT));
            case "toLowerCase":
                return TextNode.valueOf(target.toLowerCase(Locale.ROOT));
            case "replace": {
                String search = stringArg(args, 0, "");
                String replacement = stringArg(args, 1, "");
                int at = target.indexOf(search);
                return TextNode.valueOf(
                        at < 0 ? target : target.substring(0, at) + replacement + target.substring(at + search.length()));
            }
            case "includes":
                return BooleanNode.valueOf(
                        target.indexOf(stringArg(args, 0, ""), clamp(intArg(args, 1, 0), length)) >= 0);
            case "startsWith":
                return BooleanNode.valueOf(
                        target.startsWith(stringArg(args, 0, ""), clamp(intArg(args, 1, 0), length)));
            case "endsWith": {
                int end = clamp(intArg(args, 1, length), length);
                return BooleanNode.valueOf(target.substring(0, end).endsWith(stringArg(args, 0, "")));
            }
            case "indexOf":
                return number(target.indexOf(stringArg(args, 0, ""), clamp(intArg(args, 1, 0), length)));
            default:
                return UNDEFINED;
        }
    }

    private static JsonNode split(String target, String separator) {
        ArrayNode out = NODES.arrayNode();
        if (separator.isEmpty()) {
            for (int i = 0; i < target.length(); i++) {
                out.add(String.valueOf(target.charAt(i)));
            }
            return out;
        }
        int from = 0;
        int at;
        while ((at = target.indexOf(separator, from)) >= 0) {
            out.add(target.substring(from, at));
            from = at + separator.length();
        }
        out.add(target.substring(from));
        return out;
    }

    // ── Math ──

    static JsonNode callMath(String method, List<JsonNode> args) {
        if (!MATH_METHODS.contains(method)) {
            return UNDEFINED;
        }
        List<Double> numbers = new ArrayList<>();
        for (JsonNode arg : args) {
            if (arg.isNumber()) {
                numbers.add(arg.doubleValue());
            }
        }
        if ("random".equals(method)) {
            return number(ThreadLocalRandom.current().nextDouble());
        }
        if ("min".equals(method) || "max".equals(method)) {
            if (numbers.isEmpty()) {
                return UNDEFINED;
            }
            double result = numbers.get(0);
            for (double n : numbers) {
                result = "min".equals(method) ? Math.min(result, n) : Math.max(result, n);
            }
            return number(result);
        }
        if (numbers.isEmpty()) {
            return UNDEFINED;
        }
        double x = numbers.get(0);
        switch (method) {
            case "round":
                return number(Math.floor(x + 0.5));
            case "floor":
                return number(Math.floor(x));
            case "ceil":
                return number(Math.ceil(x));
            case "abs":
                return number(Math.abs(x));
            case "sqrt":
                return number(Math.sqrt(x));
            case "pow":
                return numbers.size() < 2 ? UNDEFINED : number(Math.pow(x, numbers.get(1)));
            case "sin":
                return number(Math.sin(x));
            case "cos":
                return number(Math.cos(x));
            case "tan":
                return number(Math.tan(x));
            default:
                return UNDEFINED;
        }
    }

    // ── Date ──

    static JsonNode callDateStatic(String method, List<JsonNode> args) {
        if (!DATE_STATIC_METHODS.contains(method)) {
            return UNDEFINED;
        }
        if ("now".equals(method)) {
            return number(System.currentTimeMillis());
        }
        JsonNode text = arg(args, 0);
        if (!text.isTextual()) {
            return UNDEFINED;
        }
        Instant parsed = parseDate(text.textValue());
        return number(parsed == null ? Double.NaN : parsed.toEpochMilli());
    }

    static JsonNode callDateInstance(Instant target, String method) {
        if (!DATE_INSTANCE_METHODS.contains(method)) {
            return UNDEFINED;
        }
        ZonedDateTime utc = target.atZone(ZoneOffset.UTC);
        switch (method) {
            case "toISOString":
                return TextNode.valueOf(ISO_MILLIS.format(target));
            case "toDateString":
                return TextNode.valueOf(DATE_STRING.format(target));
            case "toTimeString":
                return TextNode.valueOf(TIME_STRING.format(target));
            case "getTime":
                return number(target.toEpochMilli());
            case "getFullYear":
                return number(utc.getYear());
            case "getMonth":
                return number(utc.getMonthValue() - 1);
            case "getDate":
                return number(utc.getDayOfMonth());
            case "getHours":
                return number(utc.getHour());
            case "getMinutes":
                return number(utc.getMinute());
            case "getSeconds":
                return number(utc.getSecond());
            case "getMilliseconds":
                return number(utc.getNano() / 1_000_000);
            default:
                return UNDEFINED;
        }
    }

    /** ISO instants, offset date-times and plain dates (UTC midnight); null when unparseable. */
    static Instant parseDate(String text) {
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException notInstant) {
            try {
                return OffsetDateTime.parse(text).toInstant();
            } catch (DateTimeParseException notOffset) {
                try {
                    return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
                } catch (DateTimeParseException notDate) {
                    return null;
                }
            }
        }
    }

    // ── JavaScript whitespace ──

    static String jsTrim(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && isJsWhitespace(text.charAt(start))) {
            start++;
        }
        while (end > start && isJsWhitespace(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(start, end);
    }

    // WhiteSpace and LineTerminator code points from ECMA-262
    private static boolean isJsWhitespace(char c) {
        switch (c) {
            case '\t':
            case '\n':
            case '\u000B':
            case '\f':
            case '\r':
            case ' ':
            case '\u00A0':
            case '\u1680':
            case '\u2028':
            case '\u2029':
            case '\u202F':
            case '\u205F':
            case '\u3000':
            case '\uFEFF':
                return true;
            default:
                return c >= '\u2000' && c <= '\u200A';
        }
    }

    // ── argument helpers ──

    private static JsonNode arg(List<JsonNode> args, int index) {
        return index < args.size() ? args.get(index) : UNDEFINED;
    }

    private static long intArg(List<JsonNode> args, int index, long fallback) {
        JsonNode value = arg(args, index);
        if (!value.isNumber() || Double.isNaN(value.doubleValue())) {
            return fallback;
        }
        return (long) value.doubleValue();
    }

    private static String stringArg(List<JsonNode> args, int index, String fallback) {
        JsonNode value = arg(args, index);
        return value.isTextual() ? value.textValue() : fallback;
    }

    private static int clamp(long index, int length) {
        return (int) Math.max(0, Math.min(index, length));
    }

    // negative values count from the end, as in slice
    private static int relativeIndex(List<JsonNode> args, int index, int fallback, int length) {
        long value = intArg(args, index, fallback);
        long resolved = value < 0 ? length + value : value;
        return clamp(resolved, length);
    }

    private static int fromIndex(List<JsonNode> args, int index, int length) {
        return relativeIndex(args, index, 0, length);
    }
}
