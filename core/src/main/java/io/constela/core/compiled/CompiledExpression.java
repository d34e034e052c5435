package io.constela.core.compiled;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.constela.core.model.ModelCollections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Lowered expression, the input of the evaluator. Same shapes as the source expressions; after
 * lowering no {@code data} or {@code param} node remains, but both stay representable so that
 * hand-built IR evaluates predictably.
 */
public sealed interface CompiledExpression extends CompiledPropValue
        permits CompiledExpression.Lit,
                CompiledExpression.StateRef,
                CompiledExpression.VarRef,
                CompiledExpression.Binary,
                CompiledExpression.Not,
                CompiledExpression.Cond,
                CompiledExpression.Get,
                CompiledExpression.RouteRef,
                CompiledExpression.ImportRef,
                CompiledExpression.DataRef,
                CompiledExpression.Ref,
                CompiledExpression.Index,
                CompiledExpression.ParamRef,
                CompiledExpression.Style,
                CompiledExpression.Concat,
                CompiledExpression.Validity,
                CompiledExpression.Call,
                CompiledExpression.Lambda,
                CompiledExpression.ArrayLit {

    /** Expression discriminant ({@code expr} field). */
    enum Kind {
        LIT("lit"),
        STATE("state"),
        VAR("var"),
        BIN("bin"),
        NOT("not"),
        COND("cond"),
        GET("get"),
        ROUTE("route"),
        IMPORT("import"),
        DATA("data"),
        REF("ref"),
        INDEX("index"),
        PARAM("param"),
        STYLE("style"),
        CONCAT("concat"),
        VALIDITY("validity"),
        CALL("call"),
        LAMBDA("lambda"),
        ARRAY("array");

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

    record Lit(JsonNode value) implements CompiledExpression {
        public Lit {
            value = value == null ? NullNode.getInstance() : value;
        }

        @Override
        public Kind kind() {
            return Kind.LIT;
        }
    }

    record StateRef(String name, String path) implements CompiledExpression {
        public StateRef {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.STATE;
        }
    }

    record VarRef(String name, String path) implements CompiledExpression {
        public VarRef {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.VAR;
        }
    }

    record Binary(String op, CompiledExpression left, CompiledExpression right) implements CompiledExpression {
        public Binary {
            Objects.requireNonNull(op, "op must not be null");
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.BIN;
        }
    }

    record Not(CompiledExpression operand) implements CompiledExpression {
        public Not {
            Objects.requireNonNull(operand, "operand must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.NOT;
        }
    }

    /** Ternary; serialized with {@code if}/{@code then}/{@code else} fields. */
    record Cond(CompiledExpression condition, CompiledExpression then, CompiledExpression otherwise) implements CompiledExpression {
        public Cond {
            Objects.requireNonNull(condition, "condition must not be null");
            Objects.requireNonNull(then, "then must not be null");
            Objects.requireNonNull(otherwise, "otherwise must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.COND;
        }
    }

    record Get(CompiledExpression base, String path) implements CompiledExpression {
        public Get {
            Objects.requireNonNull(base, "base must not be null");
            Objects.requireNonNull(path, "path must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.GET;
        }
    }

    /** Route read; {@code source} is {@code param}, {@code query} or {@code path}, null meaning param. */
    record RouteRef(String name, String source) implements CompiledExpression {
        public RouteRef {
            Objects.requireNonNull(name, "name must not be null");
        }

        /** Source with the {@code param} default applied. */
        public String effectiveSource() {
            return source == null ? "param" : source;
        }

        @Override
        public Kind kind() {
            return Kind.ROUTE;
        }
    }

    record ImportRef(String name, String path) implements CompiledExpression {
        public ImportRef {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.IMPORT;
        }
    }

    record DataRef(String name, String path) implements CompiledExpression {
        public DataRef {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.DATA;
        }
    }

    /** DOM element reference by {@code ref} name. */
    record Ref(String name) implements CompiledExpression {
        public Ref {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.REF;
        }
    }

    record Index(CompiledExpression base, CompiledExpression key) implements CompiledExpression {
        public Index {
            Objects.requireNonNull(base, "base must not be null");
            Objects.requireNonNull(key, "key must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.INDEX;
        }
    }

    record ParamRef(String name, String path) implements CompiledExpression {
        public ParamRef {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.PARAM;
        }
    }

    record Style(String name, Map<String, CompiledExpression> variants) implements CompiledExpression {
        public Style {
            Objects.requireNonNull(name, "name must not be null");
            variants = ModelCollections.orderedCopy(variants);
        }

        @Override
        public Kind kind() {
            return Kind.STYLE;
        }
    }

    record Concat(List<CompiledExpression> items) implements CompiledExpression {
        public Concat {
            items = ModelCollections.listCopy(items);
        }

        @Override
        public Kind kind() {
            return Kind.CONCAT;
        }
    }

    record Validity(String ref, String property) implements CompiledExpression {
        public Validity {
            Objects.requireNonNull(ref, "ref must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.VALIDITY;
        }
    }

    /** Method call on {@code target}; a null target means a global function. */
    record Call(CompiledExpression target, String method, List<CompiledExpression> args) implements CompiledExpression {
        public Call {
            Objects.requireNonNull(method, "method must not be null");
            args = ModelCollections.listCopy(args);
        }

        @Override
        public Kind kind() {
            return Kind.CALL;
        }
    }

    record Lambda(String param, String index, CompiledExpression body) implements CompiledExpression {
        public Lambda {
            Objects.requireNonNull(param, "param must not be null");
            Objects.requireNonNull(body, "body must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.LAMBDA;
        }
    }

    record ArrayLit(List<CompiledExpression> elements) implements CompiledExpression {
        public ArrayLit {
            elements = ModelCollections.listCopy(elements);
        }

        @Override
        public Kind kind() {
            return Kind.ARRAY;
        }
    }
}
