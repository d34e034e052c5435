package io.constela.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Source-level expression. The {@code expr} discriminant is exposed through {@link #kind()} so
 * that consumers can dispatch with an exhaustive {@code switch}.
 */
public sealed interface Expression extends PropValue
        permits Expression.Lit,
                Expression.StateRef,
                Expression.VarRef,
                Expression.Binary,
                Expression.Not,
                Expression.Cond,
                Expression.Get,
                Expression.RouteRef,
                Expression.ImportRef,
                Expression.DataRef,
                Expression.Ref,
                Expression.Index,
                Expression.ParamRef,
                Expression.Style,
                Expression.Concat,
                Expression.Validity,
                Expression.Call,
                Expression.Lambda,
                Expression.ArrayLit {

    /** Expression discriminant. */
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

    record Lit(JsonNode value) implements Expression {
        public Lit {
            value = value == null ? NullNode.getInstance() : value;
        }

        @Override
        public Kind kind() {
            return Kind.LIT;
        }
    }

    /** Global (or component-local) state read. {@code path} is an optional dotted path. */
    record StateRef(String name, String path) implements Expression {
        public StateRef {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.STATE;
        }
    }

    /** Lexical variable read, e.g. an {@code each} loop variable or an event payload field. */
    record VarRef(String name, String path) implements Expression {
        public VarRef {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.VAR;
        }
    }

    record Binary(String op, Expression left, Expression right) implements Expression {
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

    record Not(Expression operand) implements Expression {
        public Not {
            Objects.requireNonNull(operand, "operand must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.NOT;
        }
    }

    /** Ternary; serialized with {@code if}/{@code then}/{@code else} fields. */
    record Cond(Expression condition, Expression then, Expression otherwise) implements Expression {
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

    record Get(Expression base, String path) implements Expression {
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
    record RouteRef(String name, String source) implements Expression {
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

    record ImportRef(String name, String path) implements Expression {
        public ImportRef {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.IMPORT;
        }
    }

    record DataRef(String name, String path) implements Expression {
        public DataRef {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.DATA;
        }
    }

    /** DOM element reference by {@code ref} name. */
    record Ref(String name) implements Expression {
        public Ref {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.REF;
        }
    }

    record Index(Expression base, Expression key) implements Expression {
        public Index {
            Objects.requireNonNull(base, "base must not be null");
            Objects.requireNonNull(key, "key must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.INDEX;
        }
    }

    /** Component parameter read; only meaningful inside a component definition. */
    record ParamRef(String name, String path) implements Expression {
        public ParamRef {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.PARAM;
        }
    }

    record Style(String name, Map<String, Expression> variants) implements Expression {
        public Style {
            Objects.requireNonNull(name, "name must not be null");
            variants = ModelCollections.orderedCopy(variants);
        }

        @Override
        public Kind kind() {
            return Kind.STYLE;
        }
    }

    record Concat(List<Expression> items) implements Expression {
        public Concat {
            items = ModelCollections.listCopy(items);
        }

        @Override
        public Kind kind() {
            return Kind.CONCAT;
        }
    }

    record Validity(String ref, String property) implements Expression {
        public Validity {
            Objects.requireNonNull(ref, "ref must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.VALIDITY;
        }
    }

    /** Method call on {@code target}; a null target means a global function. */
    record Call(Expression target, String method, List<Expression> args) implements Expression {
        public Call {
            Objects.requireNonNull(method, "method must not be null");
            args = ModelCollections.listCopy(args);
        }

        @Override
        public Kind kind() {
            return Kind.CALL;
        }
    }

    record Lambda(String param, String index, Expression body) implements Expression {
        public Lambda {
            Objects.requireNonNull(param, "param must not be null");
            Objects.requireNonNull(body, "body must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.LAMBDA;
        }
    }

    record ArrayLit(List<Expression> elements) implements Expression {
        public ArrayLit {
            elements = ModelCollections.listCopy(elements);
        }

        @Override
        public Kind kind() {
            return Kind.ARRAY;
        }
    }
}
