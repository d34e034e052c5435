package io.constela.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Source-level view tree node, discriminated by {@code kind}. */
public sealed interface ViewNode
        permits ViewNode.Element,
                ViewNode.Text,
                ViewNode.If,
                ViewNode.Each,
                ViewNode.Component,
                ViewNode.Markdown,
                ViewNode.Code,
                ViewNode.Slot,
                ViewNode.Portal,
                ViewNode.Island,
                ViewNode.Suspense,
                ViewNode.ErrorBoundary {

    /** View node discriminant. */
    enum Kind {
        ELEMENT("element"),
        TEXT("text"),
        IF("if"),
        EACH("each"),
        COMPONENT("component"),
        MARKDOWN("markdown"),
        CODE("code"),
        SLOT("slot"),
        PORTAL("portal"),
        ISLAND("island"),
        SUSPENSE("suspense"),
        ERROR_BOUNDARY("errorBoundary");

        private final String wireName;

        Kind(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }

        /** Resolves a wire name, or {@code null} if unknown. */
        public static Kind fromWire(String name) {
            for (Kind kind : values()) {
                if (kind.wireName.equals(name)) {
                    return kind;
                }
            }
            return null;
        }
    }

    Kind kind();

    record Element(String tag, String ref, Map<String, PropValue> props, List<ViewNode> children)
            implements ViewNode {
        public Element {
            Objects.requireNonNull(tag, "tag must not be null");
            props = ModelCollections.orderedCopy(props);
            children = ModelCollections.listCopy(children);
        }

        @Override
        public Kind kind() {
            return Kind.ELEMENT;
        }
    }

    record Text(Expression value) implements ViewNode {
        public Text {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.TEXT;
        }
    }

    /** Conditional; {@code otherwise} is serialized as {@code else} and may be null. */
    record If(Expression condition, ViewNode then, ViewNode otherwise) implements ViewNode {
        public If {
            Objects.requireNonNull(condition, "condition must not be null");
            Objects.requireNonNull(then, "then must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.IF;
        }
    }

    /**
     * Loop over {@code items}, binding each item to {@code as} (and its position to {@code index}
     * when given) inside {@code body} and {@code key}.
     */
    record Each(Expression items, String as, String index, Expression key, ViewNode body) implements ViewNode {
        public Each {
            Objects.requireNonNull(items, "items must not be null");
            Objects.requireNonNull(as, "as must not be null");
            Objects.requireNonNull(body, "body must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.EACH;
        }
    }

    /** Invocation of a named component; {@code children} fill the component's slot. */
    record Component(String name, Map<String, PropValue> props, List<ViewNode> children) implements ViewNode {
        public Component {
            Objects.requireNonNull(name, "name must not be null");
            props = ModelCollections.orderedCopy(props);
            children = ModelCollections.listCopy(children);
        }

        @Override
        public Kind kind() {
            return Kind.COMPONENT;
        }
    }

    record Markdown(Expression content) implements ViewNode {
        @Override
        public Kind kind() {
            return Kind.MARKDOWN;
        }
    }

    record Code(Expression language, Expression content) implements ViewNode {
        @Override
        public Kind kind() {
            return Kind.CODE;
        }
    }

    record Slot(String name) implements ViewNode {
        @Override
        public Kind kind() {
            return Kind.SLOT;
        }
    }

    record Portal(String target, List<ViewNode> children) implements ViewNode {
        public Portal {
            children = ModelCollections.listCopy(children);
        }

        @Override
        public Kind kind() {
            return Kind.PORTAL;
        }
    }

    /** Independently hydrated region with its own state and actions. */
    record Island(
            String id,
            String strategy,
            JsonNode strategyOptions,
            ViewNode content,
            Map<String, StateField> state,
            List<ActionDefinition> actions)
            implements ViewNode {
        public Island {
            Objects.requireNonNull(content, "content must not be null");
            state = ModelCollections.orderedCopy(state);
            actions = ModelCollections.listCopy(actions);
        }

        @Override
        public Kind kind() {
            return Kind.ISLAND;
        }
    }

    record Suspense(String id, ViewNode fallback, ViewNode content) implements ViewNode {
        @Override
        public Kind kind() {
            return Kind.SUSPENSE;
        }
    }

    record ErrorBoundary(ViewNode fallback, ViewNode content) implements ViewNode {
        @Override
        public Kind kind() {
            return Kind.ERROR_BOUNDARY;
        }
    }
}
