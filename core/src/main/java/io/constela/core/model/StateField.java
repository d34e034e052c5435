package io.constela.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import java.util.Objects;

/**
 * A declared state field. Used unchanged in both the AST and the compiled program.
 *
 * @param type    declared type ({@code number}, {@code string}, {@code boolean}, {@code list},
 *                {@code object})
 * @param initial initial value; may be a cookie expression {@code {expr:"cookie", key, default}}
 */
public record StateField(String type, JsonNode initial) {

    public StateField {
        Objects.requireNonNull(type, "type must not be null");
        initial = initial == null ? NullNode.getInstance() : initial;
    }

    /** Whether the initial value is resolved from a cookie at render time. */
    public boolean isCookieInitial() {
        return initial.isObject()
                && "cookie".equals(initial.path("expr").asText(null))
                && initial.path("key").isTextual();
    }
}
