package io.constela.core.render;

import com.fasterxml.jackson.databind.JsonNode;
import io.constela.core.evaluate.RouteContext;
import io.constela.core.model.ModelCollections;
import io.constela.core.model.StylePreset;
import java.util.Map;

/**
 * Per-request inputs to {@link HtmlRenderer}.
 *
 * @param route          route params, query and path; null renders without a route
 * @param imports        import data; null falls back to the program's {@code importData}
 * @param styles         style presets for {@code style} expressions
 * @param stateOverrides values replacing state initials by name
 * @param cookies        request cookies, used by cookie-initialized state
 */
public record RenderOptions(
        RouteContext route,
        Map<String, JsonNode> imports,
        Map<String, StylePreset> styles,
        Map<String, JsonNode> stateOverrides,
        Map<String, String> cookies) {

    /** No route, no overrides, no cookies. */
    public static final RenderOptions DEFAULT = builder().build();

    public RenderOptions {
        imports = imports == null ? null : ModelCollections.orderedCopy(imports);
        styles = ModelCollections.orderedCopy(styles);
        stateOverrides = ModelCollections.orderedCopy(stateOverrides);
        cookies = ModelCollections.orderedCopy(cookies);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link RenderOptions}. */
    public static final class Builder {
        private RouteContext route;
        private Map<String, JsonNode> imports;
        private Map<String, StylePreset> styles;
        private Map<String, JsonNode> stateOverrides;
        private Map<String, String> cookies;

        private Builder() {}

        public Builder route(RouteContext route) {
            this.route = route;
            return this;
        }

        public Builder imports(Map<String, JsonNode> imports) {
            this.imports = imports;
            return this;
        }

        public Builder styles(Map<String, StylePreset> styles) {
            this.styles = styles;
            return this;
        }

        public Builder stateOverrides(Map<String, JsonNode> stateOverrides) {
            this.stateOverrides = stateOverrides;
            return this;
        }

        public Builder cookies(Map<String, String> cookies) {
            this.cookies = cookies;
            return this;
        }

        public RenderOptions build() {
            return new RenderOptions(route, imports, styles, stateOverrides, cookies);
        }
    }
}
