package io.constela.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Page route: a path pattern such as {@code /users/:id} plus head metadata.
 *
 * @param path      path pattern; {@code :name} segments declare route params
 * @param title     document title expression, or null
 * @param layout    name of the enclosing layout, or null
 * @param meta      meta tag expressions keyed by name
 * @param canonical canonical URL expression, or null
 * @param jsonLd    structured data, or null
 */
public record RouteDefinition(
        String path,
        Expression title,
        String layout,
        Map<String, Expression> meta,
        Expression canonical,
        JsonLd jsonLd) {

    public RouteDefinition {
        Objects.requireNonNull(path, "path must not be null");
        meta = ModelCollections.orderedCopy(meta);
    }

    public static RouteDefinition of(String path) {
        return new RouteDefinition(path, null, null, null, null, null);
    }

    /** Param names declared by the path pattern, without the leading colon, in order. */
    public List<String> paramNames() {
        return extractParams(path);
    }

    /** Splits {@code path} on {@code /} and keeps the {@code :segment} names. */
    public static List<String> extractParams(String path) {
        List<String> params = new ArrayList<>();
        for (String segment : path.split("/")) {
            if (segment.startsWith(":")) {
                params.add(segment.substring(1));
            }
        }
        return List.copyOf(params);
    }

    /** JSON-LD block: schema.org {@code @type} plus property expressions. */
    public record JsonLd(String type, Map<String, Expression> properties) {
        public JsonLd {
            Objects.requireNonNull(type, "type must not be null");
            properties = ModelCollections.orderedCopy(properties);
        }
    }
}
