package io.constela.core.error;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single analysis diagnostic.
 *
 * @param code       the error category
 * @param message    human-readable description
 * @param path       JSON pointer into the program ({@code /actions/0/steps/1/target})
 * @param suggestion optional "Did you mean ..." hint, {@code null} when none
 * @param context    optional structured details (e.g. {@code availableNames}), never null
 */
public record ConstelaError(
        ErrorCode code, String message, String path, String suggestion, Map<String, Object> context) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public ConstelaError {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(path, "path must not be null");
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public static ConstelaError of(ErrorCode code, String message, String path) {
        return new ConstelaError(code, message, path, null, null);
    }

    /** Returns a copy carrying the given suggestion. */
    public ConstelaError withSuggestion(String suggestion) {
        return new ConstelaError(code, message, path, suggestion, context);
    }

    /** Returns a copy with one extra context entry. */
    public ConstelaError withContext(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(context);
        merged.put(key, value);
        return new ConstelaError(code, message, path, suggestion, merged);
    }

    /** Serializes to {@code {code, message, path, suggestion?, context?}}. */
    public JsonNode toJson() {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("code", code.name());
        node.put("message", message);
        node.put("path", path);
        if (suggestion != null) {
            node.put("suggestion", suggestion);
        }
        if (!context.isEmpty()) {
            node.set("context", MAPPER.valueToTree(context));
        }
        return node;
    }
}
