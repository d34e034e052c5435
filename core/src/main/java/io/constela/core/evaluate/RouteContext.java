package io.constela.core.evaluate;

import io.constela.core.model.ModelCollections;
import java.util.Map;

/**
 * The request route seen by {@code route} expressions.
 *
 * @param params path params by name
 * @param query  query string values by name
 * @param path   the request path
 */
public record RouteContext(Map<String, String> params, Map<String, String> query, String path) {

    public RouteContext {
        params = ModelCollections.orderedCopy(params);
        query = ModelCollections.orderedCopy(query);
        path = path == null ? "" : path;
    }
}
