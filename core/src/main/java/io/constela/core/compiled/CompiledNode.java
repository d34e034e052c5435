package io.constela.core.compiled;

import com.fasterxml.jackson.databind.JsonNode;
import io.constela.core.model.ModelCollections;
import io.constela.core.model.StateField;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Lowered view node. Component invocations no longer exist at this level: they have been inlined,
 * and components with local state appear as {@link LocalState} wrappers.
 */
public sealed interface CompiledNode
        permits CompiledNode.Element,
                CompiledNode.Text,
                CompiledNode.If,
                CompiledNode.Each,
                CompiledNode.Markdown,
                CompiledNode.Code,
                CompiledNode.Slot,
                CompiledNode.Portal,
                CompiledNode.LocalState,
                CompiledNode.Island,
                CompiledNode.Suspense,
                CompiledNode.ErrorBoundary {

    /** Compiled node discriminant ({@code kind} field). */
    enum Kind {
        ELEMENT("element"),
        TEXT("text"),
        IF("if"),
        EACH("each"),
        MARKDOWN("markdown"),
        CODE("code"),
        SLOT("slot"),
        PORTAL("portal"),
        LOCAL_STATE("localState"),
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
    }

    Kind kind();

    record Element(String tag, String ref, Map<String, CompiledPropValue> props, List<CompiledNode> children)
            implements CompiledNode {
        public Element {
            Objects.requireNonNull(tag, "tag must not be null");
            props = ModelCollections.orderedCopy(props);
            children = ModelCollections.listCopy(children);
        }

        public static Element of(String tag) {
            return new Element(tag, null, null, null);
        }

        @Override
        public Kind kind() {
            return Kind.ELEMENT;
        }
    }

    record Text(CompiledExpression value) implements CompiledNode {
        public Text {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.TEXT;
        }
    }

    record If(CompiledExpression condition, CompiledNode then, CompiledNode otherwise) implements CompiledNode {
        @Override
        public Kind kind() {
            return Kind.IF;
        }
    }

    record Each(CompiledExpression items, String as, String index, CompiledExpression key, CompiledNode body)
            implements CompiledNode {
        @Override
        public Kind kind() {
            return Kind.EACH;
        }
    }

    record Markdown(CompiledExpression content) implements CompiledNode {
        @Override
        public Kind kind() {
            return Kind.MARKDOWN;
        }
    }

    record Code(CompiledExpression language, CompiledExpression content) implements CompiledNode {
        @Override
        public Kind kind() {
            return Kind.CODE;
        }
    }

    /** Unfilled slot; only emitted for layout programs, whose slots are filled by page composition. */
    record Slot(String name) implements CompiledNode {
        @Override
        public Kind kind() {
            return Kind.SLOT;
        }
    }

    record Portal(String target, List<CompiledNode> children) implements CompiledNode {
        public Portal {
            children = ModelCollections.listCopy(children);
        }

        @Override
        public Kind kind() {
            return Kind.PORTAL;
        }
    }

    /** Per-instance state scope produced by inlining a component that declares local state. */
    record LocalState(Map<String, StateField> state, Map<String, CompiledAction> actions, CompiledNode child)
            implements CompiledNode {
        public LocalState {
            state = ModelCollections.orderedCopy(state);
            actions = ModelCollections.orderedCopy(actions);
            Objects.requireNonNull(child, "child must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.LOCAL_STATE;
        }
    }

    record Island(
            String id,
            String strategy,
            JsonNode strategyOptions,
            CompiledNode content,
            Map<String, StateField> state,
            Map<String, CompiledAction> actions)
            implements CompiledNode {
        public Island {
            state = ModelCollections.orderedCopy(state);
            actions = ModelCollections.orderedCopy(actions);
        }

        @Override
        public Kind kind() {
            return Kind.ISLAND;
        }
    }

    record Suspense(String id, CompiledNode fallback, CompiledNode content) implements CompiledNode {
        @Override
        public Kind kind() {
            return Kind.SUSPENSE;
        }
    }

    record ErrorBoundary(CompiledNode fallback, CompiledNode content) implements CompiledNode {
        @Override
        public Kind kind() {
            return Kind.ERROR_BOUNDARY;
        }
    }
}
