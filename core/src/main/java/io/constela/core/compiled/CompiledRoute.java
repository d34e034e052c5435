package io.constela.core.compiled;

import io.constela.core.model.ModelCollections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Lowered route with its param names extracted from the path pattern. */
public record CompiledRoute(
        String path,
        List<String> params,
        CompiledExpression title,
        String layout,
        Map<String, CompiledExpression> meta,
        CompiledExpression canonical,
        JsonLd jsonLd) {

    public CompiledRoute {
        Objects.requireNonNull(path, "path must not be null");
        params = ModelCollections.listCopy(params);
        meta = ModelCollections.orderedCopy(meta);
    }

    public record JsonLd(String type, Map<String, CompiledExpression> properties) {
        public JsonLd {
            properties = ModelCollections.orderedCopy(properties);
        }
    }
}
