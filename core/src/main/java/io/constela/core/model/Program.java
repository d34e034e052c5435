package io.constela.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Root of the source AST. Immutable; analysis and lowering never modify it.
 *
 * <p>{@code route}, {@code imports} and {@code data} are nullable: a null value means the
 * declaration is absent, which analysis distinguishes from an empty declaration.
 */
public record Program(
        String version,
        String type,
        RouteDefinition route,
        Map<String, JsonNode> imports,
        Map<String, DataSource> data,
        Map<String, StylePreset> styles,
        LifecycleHooks lifecycle,
        Map<String, StateField> state,
        List<ActionDefinition> actions,
        ViewNode view,
        Map<String, ComponentDef> components) {

    public static final String SUPPORTED_VERSION = "1.0";

    public Program {
        Objects.requireNonNull(version, "version must not be null");
        Objects.requireNonNull(view, "view must not be null");
        imports = imports == null ? null : ModelCollections.orderedCopy(imports);
        data = data == null ? null : ModelCollections.orderedCopy(data);
        styles = ModelCollections.orderedCopy(styles);
        lifecycle = lifecycle == null ? LifecycleHooks.NONE : lifecycle;
        state = ModelCollections.orderedCopy(state);
        actions = ModelCollections.listCopy(actions);
        components = ModelCollections.orderedCopy(components);
    }

    /** Whether this program is a layout wrapping pages through a {@code slot}. */
    public boolean isLayout() {
        return "layout".equals(type);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link Program}; {@code version} defaults to {@value #SUPPORTED_VERSION}. */
    public static final class Builder {
        private String version = SUPPORTED_VERSION;
        private String type;
        private RouteDefinition route;
        private Map<String, JsonNode> imports;
        private Map<String, DataSource> data;
        private Map<String, StylePreset> styles;
        private LifecycleHooks lifecycle;
        private Map<String, StateField> state;
        private List<ActionDefinition> actions;
        private ViewNode view;
        private Map<String, ComponentDef> components;

        Builder() {}

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder route(RouteDefinition route) {
            this.route = route;
            return this;
        }

        public Builder imports(Map<String, JsonNode> imports) {
            this.imports = imports;
            return this;
        }

        public Builder data(Map<String, DataSource> data) {
            this.data = data;
            return this;
        }

        public Builder styles(Map<String, StylePreset> styles) {
            this.styles = styles;
            return this;
        }

        public Builder lifecycle(LifecycleHooks lifecycle) {
            this.lifecycle = lifecycle;
            return this;
        }

        public Builder state(Map<String, StateField> state) {
            this.state = state;
            return this;
        }

        public Builder actions(List<ActionDefinition> actions) {
            this.actions = actions;
            return this;
        }

        public Builder view(ViewNode view) {
            this.view = view;
            return this;
        }

        public Builder components(Map<String, ComponentDef> components) {
            this.components = components;
            return this;
        }

        public Program build() {
            return new Program(
                    version, type, route, imports, data, styles, lifecycle, state, actions, view, components);
        }
    }
}
