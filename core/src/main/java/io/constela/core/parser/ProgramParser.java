package io.constela.core.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.constela.core.error.ProgramParseException;
import io.constela.core.model.ActionDefinition;
import io.constela.core.model.ActionStep;
import io.constela.core.model.ComponentDef;
import io.constela.core.model.DataSource;
import io.constela.core.model.EventHandler;
import io.constela.core.model.Expression;
import io.constela.core.model.LifecycleHooks;
import io.constela.core.model.ParamDef;
import io.constela.core.model.Program;
import io.constela.core.model.PropValue;
import io.constela.core.model.RouteDefinition;
import io.constela.core.model.StateField;
import io.constela.core.model.StylePreset;
import io.constela.core.model.ViewNode;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Reads program documents (JSON or YAML) into the {@link Program} AST.
 *
 * <p>The parser checks only what it needs to build typed nodes: discriminants ({@code expr},
 * {@code kind}, {@code do}) and the fields each variant requires. Semantic problems (unknown names,
 * wrong operations) are left to analysis. Failures raise {@link ProgramParseException} whose
 * {@code source} is the JSON pointer of the offending node.
 *
 * <p>Thread-safe: holds no state besides the shared, immutable mappers.
 */
public final class ProgramParser {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ProgramParser() {
        // utility class
    }

    // ── entry points ──

    /** Parses a program file; {@code .yaml}/{@code .yml} files are read as YAML, anything else as JSON. */
    public static Program parse(Path path) {
        return parse(readTree(path));
    }

    /** Parses JSON program text. */
    public static Program parse(String json) {
        return parse(readTree(json));
    }

    public static Program parse(JsonNode root) {
        Objects.requireNonNull(root, "root must not be null");
        requireObject(root, "");
        Program.Builder builder = Program.builder()
                .version(requireString(root, "version", ""))
                .type(optionalString(root, "type"))
                .state(parseStateMap(root.get("state"), "/state"))
                .actions(parseActions(root.get("actions"), "/actions"))
                .view(parseViewNode(require(root, "view", ""), "/view"))
                .lifecycle(parseLifecycle(root.get("lifecycle")));
        if (isPresent(root, "route")) {
            builder.route(parseRoute(root.get("route"), "/route"));
        }
        if (isPresent(root, "imports")) {
            builder.imports(parseImports(root.get("imports"), "/imports"));
        }
        if (isPresent(root, "data")) {
            builder.data(parseDataSources(root.get("data"), "/data"));
        }
        if (isPresent(root, "styles")) {
            builder.styles(parseStyles(root.get("styles"), "/styles"));
        }
        if (isPresent(root, "components")) {
            builder.components(parseComponents(root.get("components"), "/components"));
        }
        return builder.build();
    }

    /** Reads a file into a JSON tree without building the AST. */
    public static JsonNode readTree(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        ObjectMapper mapper = name.endsWith(".yaml") || name.endsWith(".yml") ? YAML_MAPPER : JSON_MAPPER;
        try (Reader reader = Files.newBufferedReader(path)) {
            return mapper.readTree(reader);
        } catch (IOException e) {
            throw new ProgramParseException("Failed to read program " + path + ": " + e.getMessage(), e, "");
        }
    }

    /** Reads JSON text into a tree without building the AST. */
    public static JsonNode readTree(String json) {
        Objects.requireNonNull(json, "json must not be null");
        try {
            return JSON_MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ProgramParseException("Invalid JSON: " + e.getOriginalMessage(), e, "");
        }
    }

    // ── program sections ──

    private static Map<String, StateField> parseStateMap(JsonNode node, String pointer) {
        Map<String, StateField> fields = new LinkedHashMap<>();
        if (node == null || node.isNull()) {
            return fields;
        }
        requireObject(node, pointer);
        node.fields().forEachRemaining(entry -> {
            String fieldPointer = pointer + "/" + entry.getKey();
            requireObject(entry.getValue(), fieldPointer);
            fields.put(
                    entry.getKey(),
                    new StateField(
                            requireString(entry.getValue(), "type", fieldPointer),
                            entry.getValue().get("initial")));
        });
        return fields;
    }

    private static List<ActionDefinition> parseActions(JsonNode node, String pointer) {
        List<ActionDefinition> actions = new ArrayList<>();
        if (node == null || node.isNull()) {
            return actions;
        }
        requireArray(node, pointer);
        for (int i = 0; i < node.size(); i++) {
            String actionPointer = pointer + "/" + i;
            JsonNode action = node.get(i);
            requireObject(action, actionPointer);
            actions.add(new ActionDefinition(
                    requireString(action, "name", actionPointer),
                    parseSteps(action.get("steps"), actionPointer + "/steps")));
        }
        return actions;
    }

    private static RouteDefinition parseRoute(JsonNode node, String pointer) {
        requireObject(node, pointer);
        Map<String, Expression> meta = new LinkedHashMap<>();
        if (isPresent(node, "meta")) {
            meta = parseExpressionMap(node.get("meta"), pointer + "/meta");
        }
        RouteDefinition.JsonLd jsonLd = null;
        if (isPresent(node, "jsonLd")) {
            JsonNode ld = node.get("jsonLd");
            requireObject(ld, pointer + "/jsonLd");
            jsonLd = new RouteDefinition.JsonLd(
                    requireString(ld, "type", pointer + "/jsonLd"),
                    isPresent(ld, "properties")
                            ? parseExpressionMap(ld.get("properties"), pointer + "/jsonLd/properties")
                            : Map.of());
        }
        return new RouteDefinition(
                requireString(node, "path", pointer),
                optionalExpression(node, "title", pointer),
                optionalString(node, "layout"),
                meta,
                optionalExpression(node, "canonical", pointer),
                jsonLd);
    }

    private static Map<String, JsonNode> parseImports(JsonNode node, String pointer) {
        requireObject(node, pointer);
        Map<String, JsonNode> imports = new LinkedHashMap<>();
        node.fields().forEachRemaining(entry -> imports.put(entry.getKey(), entry.getValue()));
        return imports;
    }

    private static Map<String, DataSource> parseDataSources(JsonNode node, String pointer) {
        requireObject(node, pointer);
        Map<String, DataSource> sources = new LinkedHashMap<>();
        node.fields().forEachRemaining(entry -> {
            String sourcePointer = pointer + "/" + entry.getKey();
            JsonNode source = entry.getValue();
            requireObject(source, sourcePointer);
            sources.put(
                    entry.getKey(),
                    new DataSource(
                            requireString(source, "type", sourcePointer),
                            optionalString(source, "pattern"),
                            optionalString(source, "path"),
                            optionalString(source, "url"),
                            optionalString(source, "transform")));
        });
        return sources;
    }

    private static Map<String, StylePreset> parseStyles(JsonNode node, String pointer) {
        requireObject(node, pointer);
        Map<String, StylePreset> styles = new LinkedHashMap<>();
        node.fields().forEachRemaining(entry -> {
            String stylePointer = pointer + "/" + entry.getKey();
            JsonNode preset = entry.getValue();
            requireObject(preset, stylePointer);
            Map<String, Map<String, String>> variants = new LinkedHashMap<>();
            JsonNode variantsNode = preset.path("variants");
            variantsNode.fields().forEachRemaining(variant -> {
                Map<String, String> table = new LinkedHashMap<>();
                variant.getValue().fields().forEachRemaining(option -> table.put(
                        option.getKey(), option.getValue().asText()));
                variants.put(variant.getKey(), table);
            });
            Map<String, String> defaults = new LinkedHashMap<>();
            preset.path("defaultVariants")
                    .fields()
                    .forEachRemaining(def -> defaults.put(def.getKey(), def.getValue().asText()));
            styles.put(entry.getKey(), new StylePreset(optionalString(preset, "base"), variants, defaults));
        });
        return styles;
    }

    private static LifecycleHooks parseLifecycle(JsonNode node) {
        if (node == null || !node.isObject()) {
            return LifecycleHooks.NONE;
        }
        return new LifecycleHooks(
                optionalString(node, "onMount"),
                optionalString(node, "onUnmount"),
                optionalString(node, "onRouteEnter"),
                optionalString(node, "onRouteLeave"));
    }

    private static Map<String, ComponentDef> parseComponents(JsonNode node, String pointer) {
        requireObject(node, pointer);
        Map<String, ComponentDef> components = new LinkedHashMap<>();
        node.fields().forEachRemaining(entry -> {
            String componentPointer = pointer + "/" + entry.getKey();
            JsonNode def = entry.getValue();
            requireObject(def, componentPointer);
            Map<String, ParamDef> params = new LinkedHashMap<>();
            def.path("params").fields().forEachRemaining(param -> {
                JsonNode paramNode = param.getValue();
                JsonNode required = paramNode.get("required");
                params.put(
                        param.getKey(),
                        new ParamDef(
                                paramNode.path("type").asText("any"),
                                required != null && required.isBoolean() ? required.booleanValue() : null));
            });
            components.put(
                    entry.getKey(),
                    new ComponentDef(
                            params,
                            parseStateMap(def.get("localState"), componentPointer + "/localState"),
                            parseActions(def.get("localActions"), componentPointer + "/localActions"),
                            parseViewNode(require(def, "view", componentPointer), componentPointer + "/view")));
        });
        return components;
    }

    // ── expressions ──

    /** Parses a single expression node. */
    public static Expression parseExpression(JsonNode node, String pointer) {
        requireObject(node, pointer);
        String tag = requireString(node, "expr", pointer);
        Expression.Kind kind = Expression.Kind.fromWire(tag);
        if (kind == null) {
            throw new ProgramParseException("Unknown expression type '" + tag + "'", pointer);
        }
        return switch (kind) {
            case LIT -> new Expression.Lit(node.get("value"));
            case STATE -> new Expression.StateRef(
                    requireString(node, "name", pointer), optionalString(node, "path"));
            case VAR -> new Expression.VarRef(requireString(node, "name", pointer), optionalString(node, "path"));
            case BIN -> new Expression.Binary(
                    requireString(node, "op", pointer),
                    parseExpression(require(node, "left", pointer), pointer + "/left"),
                    parseExpression(require(node, "right", pointer), pointer + "/right"));
            case NOT -> new Expression.Not(parseExpression(require(node, "operand", pointer), pointer + "/operand"));
            case COND -> new Expression.Cond(
                    parseExpression(require(node, "if", pointer), pointer + "/if"),
                    parseExpression(require(node, "then", pointer), pointer + "/then"),
                    parseExpression(require(node, "else", pointer), pointer + "/else"));
            case GET -> new Expression.Get(
                    parseExpression(require(node, "base", pointer), pointer + "/base"),
                    requireString(node, "path", pointer));
            case ROUTE -> new Expression.RouteRef(
                    requireString(node, "name", pointer), optionalString(node, "source"));
            case IMPORT -> new Expression.ImportRef(
                    requireString(node, "name", pointer), optionalString(node, "path"));
            case DATA -> new Expression.DataRef(requireString(node, "name", pointer), optionalString(node, "path"));
            case REF -> new Expression.Ref(requireString(node, "name", pointer));
            case INDEX -> new Expression.Index(
                    parseExpression(require(node, "base", pointer), pointer + "/base"),
                    parseExpression(require(node, "key", pointer), pointer + "/key"));
            case PARAM -> new Expression.ParamRef(
                    requireString(node, "name", pointer), optionalString(node, "path"));
            case STYLE -> new Expression.Style(
                    requireString(node, "name", pointer),
                    isPresent(node, "variants")
                            ? parseExpressionMap(node.get("variants"), pointer + "/variants")
                            : Map.of());
            case CONCAT -> new Expression.Concat(parseExpressionList(node.get("items"), pointer + "/items"));
            case VALIDITY -> new Expression.Validity(
                    requireString(node, "ref", pointer), optionalString(node, "property"));
            case CALL -> new Expression.Call(
                    optionalExpression(node, "target", pointer),
                    requireString(node, "method", pointer),
                    parseExpressionList(node.get("args"), pointer + "/args"));
            case LAMBDA -> new Expression.Lambda(
                    requireString(node, "param", pointer),
                    optionalString(node, "index"),
                    parseExpression(require(node, "body", pointer), pointer + "/body"));
            case ARRAY -> new Expression.ArrayLit(parseExpressionList(node.get("elements"), pointer + "/elements"));
        };
    }

    private static Expression optionalExpression(JsonNode parent, String field, String pointer) {
        return isPresent(parent, field) ? parseExpression(parent.get(field), pointer + "/" + field) : null;
    }

    private static List<Expression> parseExpressionList(JsonNode node, String pointer) {
        List<Expression> items = new ArrayList<>();
        if (node == null || node.isNull()) {
            return items;
        }
        requireArray(node, pointer);
        for (int i = 0; i < node.size(); i++) {
            items.add(parseExpression(node.get(i), pointer + "/" + i));
        }
        return items;
    }

    private static Map<String, Expression> parseExpressionMap(JsonNode node, String pointer) {
        requireObject(node, pointer);
        Map<String, Expression> entries = new LinkedHashMap<>();
        node.fields().forEachRemaining(entry -> entries.put(
                entry.getKey(), parseExpression(entry.getValue(), pointer + "/" + entry.getKey())));
        return entries;
    }

    // ── props and event handlers ──

    private static Map<String, PropValue> parseProps(JsonNode node, String pointer) {
        Map<String, PropValue> props = new LinkedHashMap<>();
        if (node == null || node.isNull()) {
            return props;
        }
        requireObject(node, pointer);
        node.fields().forEachRemaining(entry -> {
            String propPointer = pointer + "/" + entry.getKey();
            props.put(entry.getKey(), parsePropValue(entry.getValue(), propPointer));
        });
        return props;
    }

    private static PropValue parsePropValue(JsonNode node, String pointer) {
        requireObject(node, pointer);
        if (!node.has("expr") && node.path("event").isTextual()) {
            return parseEventHandler(node, pointer);
        }
        return parseExpression(node, pointer);
    }

    private static EventHandler parseEventHandler(JsonNode node, String pointer) {
        Expression payload = null;
        Map<String, Expression> payloadFields = Map.of();
        JsonNode payloadNode = node.get("payload");
        if (payloadNode != null && !payloadNode.isNull()) {
            requireObject(payloadNode, pointer + "/payload");
            if (payloadNode.has("expr")) {
                payload = parseExpression(payloadNode, pointer + "/payload");
            } else {
                payloadFields = parseExpressionMap(payloadNode, pointer + "/payload");
            }
        }
        EventHandler.Options options = null;
        JsonNode optionsNode = node.get("options");
        if (optionsNode != null && optionsNode.isObject()) {
            options = new EventHandler.Options(
                    optionsNode.has("threshold") ? optionsNode.get("threshold").asDouble() : null,
                    optionalString(optionsNode, "rootMargin"),
                    optionsNode.has("once") ? optionsNode.get("once").asBoolean() : null);
        }
        return new EventHandler(
                requireString(node, "event", pointer),
                requireString(node, "action", pointer),
                payload,
                payloadFields,
                optionalInt(node, "debounce"),
                optionalInt(node, "throttle"),
                options);
    }

    // ── view nodes ──

    /** Parses a single view node. */
    public static ViewNode parseViewNode(JsonNode node, String pointer) {
        requireObject(node, pointer);
        String tag = requireString(node, "kind", pointer);
        ViewNode.Kind kind = ViewNode.Kind.fromWire(tag);
        if (kind == null) {
            throw new ProgramParseException("Unknown view node kind '" + tag + "'", pointer);
        }
        return switch (kind) {
            case ELEMENT -> new ViewNode.Element(
                    requireString(node, "tag", pointer),
                    optionalString(node, "ref"),
                    parseProps(node.get("props"), pointer + "/props"),
                    parseChildren(node.get("children"), pointer + "/children"));
            case TEXT -> new ViewNode.Text(parseExpression(require(node, "value", pointer), pointer + "/value"));
            case IF -> new ViewNode.If(
                    parseExpression(require(node, "condition", pointer), pointer + "/condition"),
                    parseViewNode(require(node, "then", pointer), pointer + "/then"),
                    isPresent(node, "else") ? parseViewNode(node.get("else"), pointer + "/else") : null);
            case EACH -> new ViewNode.Each(
                    parseExpression(require(node, "items", pointer), pointer + "/items"),
                    requireString(node, "as", pointer),
                    optionalString(node, "index"),
                    optionalExpression(node, "key", pointer),
                    parseViewNode(require(node, "body", pointer), pointer + "/body"));
            case COMPONENT -> new ViewNode.Component(
                    requireString(node, "name", pointer),
                    parseProps(node.get("props"), pointer + "/props"),
                    parseChildren(node.get("children"), pointer + "/children"));
            case MARKDOWN -> new ViewNode.Markdown(
                    parseExpression(require(node, "content", pointer), pointer + "/content"));
            case CODE -> new ViewNode.Code(
                    parseExpression(require(node, "language", pointer), pointer + "/language"),
                    parseExpression(require(node, "content", pointer), pointer + "/content"));
            case SLOT -> new ViewNode.Slot(optionalString(node, "name"));
            case PORTAL -> new ViewNode.Portal(
                    requireString(node, "target", pointer), parseChildren(node.get("children"), pointer + "/children"));
            case ISLAND -> new ViewNode.Island(
                    requireString(node, "id", pointer),
                    requireString(node, "strategy", pointer),
                    node.get("strategyOptions"),
                    parseViewNode(require(node, "content", pointer), pointer + "/content"),
                    parseStateMap(node.get("state"), pointer + "/state"),
                    parseActions(node.get("actions"), pointer + "/actions"));
            case SUSPENSE -> new ViewNode.Suspense(
                    requireString(node, "id", pointer),
                    parseViewNode(require(node, "fallback", pointer), pointer + "/fallback"),
                    parseViewNode(require(node, "content", pointer), pointer + "/content"));
            case ERROR_BOUNDARY -> new ViewNode.ErrorBoundary(
                    parseViewNode(require(node, "fallback", pointer), pointer + "/fallback"),
                    parseViewNode(require(node, "content", pointer), pointer + "/content"));
        };
    }

    private static List<ViewNode> parseChildren(JsonNode node, String pointer) {
        List<ViewNode> children = new ArrayList<>();
        if (node == null || node.isNull()) {
            return children;
        }
        requireArray(node, pointer);
        for (int i = 0; i < node.size(); i++) {
            children.add(parseViewNode(node.get(i), pointer + "/" + i));
        }
        return children;
    }

    // ── action steps ──

    private static List<ActionStep> parseSteps(JsonNode node, String pointer) {
        List<ActionStep> steps = new ArrayList<>();
        if (node == null || node.isNull()) {
            return steps;
        }
        requireArray(node, pointer);
        for (int i = 0; i < node.size(); i++) {
            steps.add(parseStep(node.get(i), pointer + "/" + i));
        }
        return steps;
    }

    /** Parses a single action step. */
    public static ActionStep parseStep(JsonNode node, String p) {
        requireObject(node, p);
        String tag = requireString(node, "do", p);
        ActionStep.Kind kind = ActionStep.Kind.fromWire(tag);
        if (kind == null) {
            throw new ProgramParseException("Unknown action step '" + tag + "'", p);
        }
        return switch (kind) {
            case SET -> new ActionStep.SetStep(str(node, "target", p), expr(node, "value", p));
            case UPDATE -> new ActionStep.UpdateStep(
                    str(node, "target", p),
                    str(node, "operation", p),
                    optExpr(node, "value", p),
                    optExpr(node, "index", p),
                    optExpr(node, "deleteCount", p));
            case SET_PATH -> new ActionStep.SetPathStep(
                    str(node, "target", p), expr(node, "path", p), expr(node, "value", p));
            case FETCH -> new ActionStep.FetchStep(
                    expr(node, "url", p),
                    optionalString(node, "method"),
                    optExpr(node, "body", p),
                    optionalString(node, "result"),
                    steps(node, "onSuccess", p),
                    steps(node, "onError", p));
            case STORAGE -> new ActionStep.StorageStep(
                    str(node, "operation", p),
                    expr(node, "key", p),
                    str(node, "storage", p),
                    optExpr(node, "value", p),
                    optionalString(node, "result"),
                    steps(node, "onSuccess", p),
                    steps(node, "onError", p));
            case CLIPBOARD -> new ActionStep.ClipboardStep(
                    str(node, "operation", p),
                    optExpr(node, "value", p),
                    optionalString(node, "result"),
                    steps(node, "onSuccess", p),
                    steps(node, "onError", p));
            case NAVIGATE -> new ActionStep.NavigateStep(
                    expr(node, "url", p),
                    optionalString(node, "target"),
                    node.has("replace") ? node.get("replace").asBoolean() : null);
            case IMPORT -> new ActionStep.ImportStep(
                    str(node, "module", p),
                    str(node, "result", p),
                    steps(node, "onSuccess", p),
                    steps(node, "onError", p));
            case CALL -> new ActionStep.CallStep(
                    expr(node, "target", p),
                    parseExpressionList(node.get("args"), p + "/args"),
                    optionalString(node, "result"),
                    steps(node, "onSuccess", p),
                    steps(node, "onError", p));
            case SUBSCRIBE -> new ActionStep.SubscribeStep(
                    expr(node, "target", p), str(node, "event", p), str(node, "action", p));
            case DISPOSE -> new ActionStep.DisposeStep(expr(node, "target", p));
            case DOM -> new ActionStep.DomStep(
                    str(node, "operation", p),
                    expr(node, "selector", p),
                    optExpr(node, "value", p),
                    optionalString(node, "attribute"));
            case SEND -> new ActionStep.SendStep(str(node, "connection", p), expr(node, "data", p));
            case CLOSE -> new ActionStep.CloseStep(str(node, "connection", p));
            case DELAY -> new ActionStep.DelayStep(
                    expr(node, "ms", p), steps(node, "then", p), optionalString(node, "result"));
            case INTERVAL -> new ActionStep.IntervalStep(
                    expr(node, "ms", p), str(node, "action", p), optionalString(node, "result"));
            case CLEAR_TIMER -> new ActionStep.ClearTimerStep(expr(node, "target", p));
            case FOCUS -> new ActionStep.FocusStep(
                    expr(node, "target", p),
                    str(node, "operation", p),
                    steps(node, "onSuccess", p),
                    steps(node, "onError", p));
            case IF -> new ActionStep.IfStep(
                    expr(node, "condition", p), steps(node, "then", p), steps(node, "else", p));
            case GENERATE -> new ActionStep.GenerateStep(
                    str(node, "provider", p),
                    expr(node, "prompt", p),
                    str(node, "output", p),
                    str(node, "result", p),
                    optionalString(node, "model"),
                    steps(node, "onSuccess", p),
                    steps(node, "onError", p));
            case SSE_CONNECT -> new ActionStep.SseConnectStep(
                    str(node, "connection", p),
                    expr(node, "url", p),
                    stringList(node.get("eventTypes")),
                    node.get("reconnect"),
                    steps(node, "onOpen", p),
                    steps(node, "onMessage", p),
                    steps(node, "onError", p));
            case SSE_CLOSE -> new ActionStep.SseCloseStep(str(node, "connection", p));
            case OPTIMISTIC -> new ActionStep.OptimisticStep(
                    str(node, "target", p),
                    expr(node, "value", p),
                    optExpr(node, "path", p),
                    optionalString(node, "result"),
                    optionalInt(node, "timeout"));
            case CONFIRM -> new ActionStep.ConfirmStep(expr(node, "id", p));
            case REJECT -> new ActionStep.RejectStep(expr(node, "id", p));
            case BIND -> new ActionStep.BindStep(
                    str(node, "connection", p),
                    str(node, "target", p),
                    optionalString(node, "eventType"),
                    optExpr(node, "path", p),
                    optExpr(node, "transform", p),
                    node.has("patch") ? node.get("patch").asBoolean() : null);
            case UNBIND -> new ActionStep.UnbindStep(str(node, "connection", p), str(node, "target", p));
        };
    }

    private static String str(JsonNode node, String field, String pointer) {
        return requireString(node, field, pointer);
    }

    private static Expression expr(JsonNode node, String field, String pointer) {
        return parseExpression(require(node, field, pointer), pointer + "/" + field);
    }

    private static Expression optExpr(JsonNode node, String field, String pointer) {
        return optionalExpression(node, field, pointer);
    }

    private static List<ActionStep> steps(JsonNode node, String field, String pointer) {
        return parseSteps(node.get(field), pointer + "/" + field);
    }

    private static List<String> stringList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node != null && node.isArray()) {
            Iterator<JsonNode> it = node.elements();
            while (it.hasNext()) {
                values.add(it.next().asText());
            }
        }
        return values;
    }

    // ── field helpers ──

    private static boolean isPresent(JsonNode parent, String field) {
        JsonNode value = parent.get(field);
        return value != null && !value.isNull() && !value.isMissingNode();
    }

    private static JsonNode require(JsonNode parent, String field, String pointer) {
        if (!isPresent(parent, field)) {
            throw new ProgramParseException("Missing required field '" + field + "'", pointer);
        }
        return parent.get(field);
    }

    private static String requireString(JsonNode parent, String field, String pointer) {
        JsonNode value = require(parent, field, pointer);
        if (!value.isTextual()) {
            throw new ProgramParseException(
                    "Field '" + field + "' must be a string, got " + value.getNodeType(), pointer + "/" + field);
        }
        return value.asText();
    }

    private static String optionalString(JsonNode parent, String field) {
        JsonNode value = parent.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private static Integer optionalInt(JsonNode parent, String field) {
        JsonNode value = parent.get(field);
        return value != null && value.isNumber() ? value.asInt() : null;
    }

    private static void requireObject(JsonNode node, String pointer) {
        if (node == null || !node.isObject()) {
            throw new ProgramParseException("Expected an object", pointer);
        }
    }

    private static void requireArray(JsonNode node, String pointer) {
        if (!node.isArray()) {
            throw new ProgramParseException("Expected an array", pointer);
        }
    }
}
