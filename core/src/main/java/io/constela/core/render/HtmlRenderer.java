package io.constela.core.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.constela.core.compiled.CompiledEventHandler;
import io.constela.core.compiled.CompiledExpression;
import io.constela.core.compiled.CompiledNode;
import io.constela.core.compiled.CompiledPropValue;
import io.constela.core.compiled.CompiledProgram;
import io.constela.core.evaluate.EvaluationContext;
import io.constela.core.evaluate.ExpressionEvaluator;
import io.constela.core.evaluate.JsonNodeUtils;
import io.constela.core.model.StateField;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Server-side rendering of a {@link CompiledProgram} to an HTML string.
 *
 * <p>Event handlers are dropped. Conditional and portal output carries comment markers
 * ({@code <!--if:then-->}, {@code <!--portal:target-->}) that the client runtime uses to hydrate.
 *
 * <p>Thread-safe (stateless utility class).
 */
public final class HtmlRenderer {

    private static final Set<String> VOID_ELEMENTS = Set.of(
            "area", "base", "br", "col", "embed", "hr", "img", "input",
            "link", "meta", "param", "source", "track", "wbr");

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private HtmlRenderer() {
        // utility class
    }

    public static String renderToString(CompiledProgram program) {
        return renderToString(program, RenderOptions.DEFAULT);
    }

    public static String renderToString(CompiledProgram program, RenderOptions options) {
        EvaluationContext ctx = new EvaluationContext(
                initialState(program.state(), options),
                null,
                options.route(),
                options.imports() != null ? options.imports() : program.importData(),
                options.styles());
        StringBuilder html = new StringBuilder();
        render(program.view(), ctx, html);
        return html.toString();
    }

    /** Seeds state from initials, then overrides, then cookies for cookie-initialized fields. */
    static Map<String, JsonNode> initialState(Map<String, StateField> fields, RenderOptions options) {
        Map<String, JsonNode> state = new LinkedHashMap<>();
        fields.forEach((name, field) -> {
            JsonNode override = options.stateOverrides().get(name);
            if (override != null) {
                state.put(name, override);
            } else if (field.isCookieInitial()) {
                String cookie = options.cookies().get(field.initial().get("key").textValue());
                state.put(name, cookie != null ? TextNode.valueOf(cookie) : field.initial().path("default"));
            } else {
                state.put(name, field.initial());
            }
        });
        return state;
    }

    private static void render(CompiledNode node, EvaluationContext ctx, StringBuilder out) {
        switch (node.kind()) {
            case ELEMENT -> renderElement((CompiledNode.Element) node, ctx, out);
            case TEXT -> out.append(escape(formatValue(
                    ExpressionEvaluator.evaluate(((CompiledNode.Text) node).value(), ctx))));
            case IF -> {
                CompiledNode.If branch = (CompiledNode.If) node;
                if (JsonNodeUtils.isTruthy(ExpressionEvaluator.evaluate(branch.condition(), ctx))) {
                    out.append("<!--if:then-->");
                    render(branch.then(), ctx, out);
                } else if (branch.otherwise() != null) {
                    out.append("<!--if:else-->");
                    render(branch.otherwise(), ctx, out);
                } else {
                    out.append("<!--if:none-->");
                }
            }
            case EACH -> renderEach((CompiledNode.Each) node, ctx, out);
            case MARKDOWN -> {
                JsonNode content = ExpressionEvaluator.evaluate(((CompiledNode.Markdown) node).content(), ctx);
                out.append("<div class=\"constela-markdown\">").append(escape(formatValue(content))).append("</div>");
            }
            case CODE -> {
                CompiledNode.Code code = (CompiledNode.Code) node;
                String language = escape(formatValue(ExpressionEvaluator.evaluate(code.language(), ctx)));
                String content = escape(formatValue(ExpressionEvaluator.evaluate(code.content(), ctx)));
                out.append("<div class=\"constela-code\" data-language=\"").append(language).append("\">")
                        .append("<pre><code class=\"language-").append(language).append("\">")
                        .append(content)
                        .append("</code></pre></div>");
            }
            case SLOT -> {
                // filled by layout composition; nothing to render on its own
            }
            case PORTAL -> {
                CompiledNode.Portal portal = (CompiledNode.Portal) node;
                out.append("<!--portal:").append(portal.target()).append("-->");
                portal.children().forEach(child -> render(child, ctx, out));
                out.append("<!--/portal-->");
            }
            case LOCAL_STATE -> {
                CompiledNode.LocalState local = (CompiledNode.LocalState) node;
                render(local.child(), withScopedState(ctx, local.state(), true), out);
            }
            case ISLAND -> renderIsland((CompiledNode.Island) node, ctx, out);
            case SUSPENSE -> render(((CompiledNode.Suspense) node).content(), ctx, out);
            case ERROR_BOUNDARY -> render(((CompiledNode.ErrorBoundary) node).content(), ctx, out);
        }
    }

    private static void renderElement(CompiledNode.Element element, EvaluationContext ctx, StringBuilder out) {
        out.append('<').append(element.tag());
        for (Map.Entry<String, CompiledPropValue> prop : element.props().entrySet()) {
            if (prop.getValue() instanceof CompiledEventHandler) {
                continue;
            }
            JsonNode value = ExpressionEvaluator.evaluate((CompiledExpression) prop.getValue(), ctx);
            if (JsonNodeUtils.isNullish(value) || (value.isBoolean() && !value.booleanValue())) {
                continue;
            }
            out.append(' ').append(prop.getKey());
            if (!value.isBoolean()) {
                out.append("=\"").append(escape(JsonNodeUtils.toJsString(value))).append('"');
            }
        }
        if (VOID_ELEMENTS.contains(element.tag())) {
            out.append(" />");
            return;
        }
        out.append('>');
        element.children().forEach(child -> render(child, ctx, out));
        out.append("</").append(element.tag()).append('>');
    }

    private static void renderEach(CompiledNode.Each each, EvaluationContext ctx, StringBuilder out) {
        JsonNode items = ExpressionEvaluator.evaluate(each.items(), ctx);
        if (!items.isArray()) {
            return;
        }
        for (int i = 0; i < items.size(); i++) {
            EvaluationContext itemCtx = ctx.withLocal(each.as(), items.get(i));
            if (each.index() != null) {
                itemCtx = itemCtx.withLocal(each.index(), JsonNodeUtils.number(i));
            }
            render(each.body(), itemCtx, out);
        }
    }

    private static void renderIsland(CompiledNode.Island island, EvaluationContext ctx, StringBuilder out) {
        StringBuilder content = new StringBuilder();
        render(island.content(), withScopedState(ctx, island.state(), false), content);
        out.append("<div data-island-id=\"").append(escape(island.id())).append('"')
                .append(" data-island-strategy=\"").append(escape(island.strategy())).append('"');
        if (island.strategyOptions() != null && !island.strategyOptions().isNull()) {
            out.append(" data-island-options=\"").append(escape(toJson(island.strategyOptions()))).append('"');
        }
        if (!island.state().isEmpty()) {
            ObjectNode initial = MAPPER.createObjectNode();
            island.state().forEach((name, field) -> initial.set(name, field.initial()));
            out.append(" data-island-state=\"").append(escape(toJson(initial))).append('"');
        }
        out.append('>').append(content).append("</div>");
    }

    /**
     * Makes scoped initial values visible to {@code state} reads, shadowing global state. Component
     * local state is also exposed as locals.
     */
    private static EvaluationContext withScopedState(
            EvaluationContext ctx, Map<String, StateField> fields, boolean asLocals) {
        if (fields.isEmpty()) {
            return ctx;
        }
        Map<String, JsonNode> initials = new LinkedHashMap<>();
        fields.forEach((name, field) -> initials.put(name, field.initial()));
        Map<String, JsonNode> state = new LinkedHashMap<>(ctx.state());
        state.putAll(initials);
        EvaluationContext scoped = new EvaluationContext(state, ctx.locals(), ctx.route(), ctx.imports(), ctx.styles());
        return asLocals ? scoped.withLocals(initials) : scoped;
    }

    /** Text content: nullish renders empty, containers render as JSON. */
    static String formatValue(JsonNode value) {
        if (JsonNodeUtils.isNullish(value)) {
            return "";
        }
        if (value.isContainerNode()) {
            return toJson(value);
        }
        return JsonNodeUtils.toJsString(value);
    }

    static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 16);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append("&quot;");
                case '\'' -> sb.append("&#039;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    private static String toJson(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Value could not be serialized", e);
        }
    }
}
