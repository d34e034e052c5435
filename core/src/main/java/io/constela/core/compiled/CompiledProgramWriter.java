package io.constela.core.compiled;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.constela.core.model.EventHandler;
import io.constela.core.model.LifecycleHooks;
import io.constela.core.model.StateField;
import java.util.List;
import java.util.Map;

/**
 * Serializes a {@link CompiledProgram} to its JSON wire format.
 *
 * <p>Optional fields are omitted rather than written as {@code null}; the client runtime treats
 * presence as meaningful (e.g. {@code importData} present implies non-empty data). Discriminants
 * are written first: {@code expr} for expressions, {@code kind} for nodes, {@code do} for steps.
 *
 * <p>Thread-safe and stateless.
 */
public final class CompiledProgramWriter {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ObjectMapper PRETTY_MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private CompiledProgramWriter() {
        // utility class
    }

    /** Serializes to a JSON string, optionally indented. */
    public static String toJsonString(CompiledProgram program, boolean pretty) {
        try {
            return (pretty ? PRETTY_MAPPER : MAPPER).writeValueAsString(toJson(program));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Compiled program could not be serialized", e);
        }
    }

    public static ObjectNode toJson(CompiledProgram program) {
        ObjectNode root = NODES.objectNode();
        root.put("version", program.version());
        if (program.route() != null) {
            root.set("route", route(program.route()));
        }
        if (program.lifecycle() != null && !program.lifecycle().isEmpty()) {
            root.set("lifecycle", lifecycle(program.lifecycle()));
        }
        root.set("state", state(program.state()));
        root.set("actions", actions(program.actions()));
        root.set("view", node(program.view()));
        if (program.importData() != null) {
            ObjectNode data = root.putObject("importData");
            program.importData().forEach(data::set);
        }
        return root;
    }

    // ── program parts ──

    private static ObjectNode route(CompiledRoute route) {
        ObjectNode out = NODES.objectNode();
        out.put("path", route.path());
        ArrayNode params = out.putArray("params");
        route.params().forEach(params::add);
        putExpr(out, "title", route.title());
        putText(out, "layout", route.layout());
        if (!route.meta().isEmpty()) {
            out.set("meta", exprMap(route.meta()));
        }
        putExpr(out, "canonical", route.canonical());
        if (route.jsonLd() != null) {
            ObjectNode jsonLd = out.putObject("jsonLd");
            jsonLd.put("type", route.jsonLd().type());
            jsonLd.set("properties", exprMap(route.jsonLd().properties()));
        }
        return out;
    }

    private static ObjectNode lifecycle(LifecycleHooks hooks) {
        ObjectNode out = NODES.objectNode();
        putText(out, "onMount", hooks.onMount());
        putText(out, "onUnmount", hooks.onUnmount());
        putText(out, "onRouteEnter", hooks.onRouteEnter());
        putText(out, "onRouteLeave", hooks.onRouteLeave());
        return out;
    }

    private static ObjectNode state(Map<String, StateField> fields) {
        ObjectNode out = NODES.objectNode();
        fields.forEach((name, field) -> {
            ObjectNode entry = out.putObject(name);
            entry.put("type", field.type());
            entry.set("initial", field.initial().deepCopy());
        });
        return out;
    }

    private static ObjectNode actions(Map<String, CompiledAction> actions) {
        ObjectNode out = NODES.objectNode();
        actions.forEach((name, action) -> {
            ObjectNode entry = out.putObject(name);
            entry.put("name", action.name());
            entry.set("steps", steps(action.steps()));
        });
        return out;
    }

    // ── view nodes ──

    public static ObjectNode node(CompiledNode node) {
        ObjectNode out = NODES.objectNode();
        out.put("kind", node.kind().wireName());
        switch (node.kind()) {
            case ELEMENT -> {
                CompiledNode.Element element = (CompiledNode.Element) node;
                out.put("tag", element.tag());
                putText(out, "ref", element.ref());
                if (!element.props().isEmpty()) {
                    ObjectNode props = out.putObject("props");
                    element.props().forEach((name, value) -> props.set(name, propValue(value)));
                }
                putNodes(out, "children", element.children());
            }
            case TEXT -> out.set("value", expression(((CompiledNode.Text) node).value()));
            case IF -> {
                CompiledNode.If branch = (CompiledNode.If) node;
                out.set("condition", expression(branch.condition()));
                out.set("then", node(branch.then()));
                if (branch.otherwise() != null) {
                    out.set("else", node(branch.otherwise()));
                }
            }
            case EACH -> {
                CompiledNode.Each each = (CompiledNode.Each) node;
                out.set("items", expression(each.items()));
                out.put("as", each.as());
                putText(out, "index", each.index());
                putExpr(out, "key", each.key());
                out.set("body", node(each.body()));
            }
            case MARKDOWN -> out.set("content", expression(((CompiledNode.Markdown) node).content()));
            case CODE -> {
                CompiledNode.Code code = (CompiledNode.Code) node;
                out.set("language", expression(code.language()));
                out.set("content", expression(code.content()));
            }
            case SLOT -> putText(out, "name", ((CompiledNode.Slot) node).name());
            case PORTAL -> {
                CompiledNode.Portal portal = (CompiledNode.Portal) node;
                out.put("target", portal.target());
                ArrayNode children = out.putArray("children");
                portal.children().forEach(child -> children.add(node(child)));
            }
            case LOCAL_STATE -> {
                CompiledNode.LocalState local = (CompiledNode.LocalState) node;
                out.set("state", state(local.state()));
                out.set("actions", actions(local.actions()));
                out.set("child", node(local.child()));
            }
            case ISLAND -> {
                CompiledNode.Island island = (CompiledNode.Island) node;
                out.put("id", island.id());
                out.put("strategy", island.strategy());
                if (island.strategyOptions() != null) {
                    out.set("strategyOptions", island.strategyOptions().deepCopy());
                }
                out.set("content", node(island.content()));
                if (!island.state().isEmpty()) {
                    out.set("state", state(island.state()));
                }
                if (!island.actions().isEmpty()) {
                    out.set("actions", actions(island.actions()));
                }
            }
            case SUSPENSE -> {
                CompiledNode.Suspense suspense = (CompiledNode.Suspense) node;
                out.put("id", suspense.id());
                out.set("fallback", node(suspense.fallback()));
                out.set("content", node(suspense.content()));
            }
            case ERROR_BOUNDARY -> {
                CompiledNode.ErrorBoundary boundary = (CompiledNode.ErrorBoundary) node;
                out.set("fallback", node(boundary.fallback()));
                out.set("content", node(boundary.content()));
            }
        }
        return out;
    }

    private static ObjectNode propValue(CompiledPropValue value) {
        if (value instanceof CompiledEventHandler handler) {
            return eventHandler(handler);
        }
        return expression((CompiledExpression) value);
    }

    private static ObjectNode eventHandler(CompiledEventHandler handler) {
        ObjectNode out = NODES.objectNode();
        out.put("event", handler.event());
        out.put("action", handler.action());
        if (handler.payload() != null) {
            out.set("payload", expression(handler.payload()));
        } else if (!handler.payloadFields().isEmpty()) {
            out.set("payload", exprMap(handler.payloadFields()));
        }
        if (handler.debounce() != null) {
            out.put("debounce", handler.debounce());
        }
        if (handler.throttle() != null) {
            out.put("throttle", handler.throttle());
        }
        EventHandler.Options options = handler.options();
        if (options != null) {
            ObjectNode opts = out.putObject("options");
            if (options.threshold() != null) {
                opts.put("threshold", options.threshold());
            }
            putText(opts, "rootMargin", options.rootMargin());
            if (options.once() != null) {
                opts.put("once", options.once());
            }
        }
        return out;
    }

    // ── expressions ──

    public static ObjectNode expression(CompiledExpression expr) {
        ObjectNode out = NODES.objectNode();
        out.put("expr", expr.kind().wireName());
        switch (expr.kind()) {
            case LIT -> out.set("value", ((CompiledExpression.Lit) expr).value().deepCopy());
            case STATE -> {
                CompiledExpression.StateRef ref = (CompiledExpression.StateRef) expr;
                out.put("name", ref.name());
                putText(out, "path", ref.path());
            }
            case VAR -> {
                CompiledExpression.VarRef ref = (CompiledExpression.VarRef) expr;
                out.put("name", ref.name());
                putText(out, "path", ref.path());
            }
            case BIN -> {
                CompiledExpression.Binary bin = (CompiledExpression.Binary) expr;
                out.put("op", bin.op());
                out.set("left", expression(bin.left()));
                out.set("right", expression(bin.right()));
            }
            case NOT -> out.set("operand", expression(((CompiledExpression.Not) expr).operand()));
            case COND -> {
                CompiledExpression.Cond cond = (CompiledExpression.Cond) expr;
                out.set("if", expression(cond.condition()));
                out.set("then", expression(cond.then()));
                out.set("else", expression(cond.otherwise()));
            }
            case GET -> {
                CompiledExpression.Get get = (CompiledExpression.Get) expr;
                out.set("base", expression(get.base()));
                out.put("path", get.path());
            }
            case ROUTE -> {
                CompiledExpression.RouteRef route = (CompiledExpression.RouteRef) expr;
                out.put("name", route.name());
                out.put("source", route.effectiveSource());
            }
            case IMPORT -> {
                CompiledExpression.ImportRef ref = (CompiledExpression.ImportRef) expr;
                out.put("name", ref.name());
                putText(out, "path", ref.path());
            }
            case DATA -> {
                CompiledExpression.DataRef ref = (CompiledExpression.DataRef) expr;
                out.put("name", ref.name());
                putText(out, "path", ref.path());
            }
            case REF -> out.put("name", ((CompiledExpression.Ref) expr).name());
            case INDEX -> {
                CompiledExpression.Index index = (CompiledExpression.Index) expr;
                out.set("base", expression(index.base()));
                out.set("key", expression(index.key()));
            }
            case PARAM -> {
                CompiledExpression.ParamRef ref = (CompiledExpression.ParamRef) expr;
                out.put("name", ref.name());
                putText(out, "path", ref.path());
            }
            case STYLE -> {
                CompiledExpression.Style style = (CompiledExpression.Style) expr;
                out.put("name", style.name());
                if (!style.variants().isEmpty()) {
                    out.set("variants", exprMap(style.variants()));
                }
            }
            case CONCAT -> out.set("items", exprList(((CompiledExpression.Concat) expr).items()));
            case VALIDITY -> {
                CompiledExpression.Validity validity = (CompiledExpression.Validity) expr;
                out.put("ref", validity.ref());
                putText(out, "property", validity.property());
            }
            case CALL -> {
                CompiledExpression.Call call = (CompiledExpression.Call) expr;
                if (call.target() == null) {
                    out.putNull("target");
                } else {
                    out.set("target", expression(call.target()));
                }
                out.put("method", call.method());
                if (!call.args().isEmpty()) {
                    out.set("args", exprList(call.args()));
                }
            }
            case LAMBDA -> {
                CompiledExpression.Lambda lambda = (CompiledExpression.Lambda) expr;
                out.put("param", lambda.param());
                putText(out, "index", lambda.index());
                out.set("body", expression(lambda.body()));
            }
            case ARRAY -> out.set("elements", exprList(((CompiledExpression.ArrayLit) expr).elements()));
        }
        return out;
    }

    // ── action steps ──

    public static ArrayNode steps(List<CompiledStep> steps) {
        ArrayNode out = NODES.arrayNode();
        steps.forEach(step -> out.add(step(step)));
        return out;
    }

    public static ObjectNode step(CompiledStep step) {
        ObjectNode out = NODES.objectNode();
        out.put("do", step.kind().wireName());
        switch (step.kind()) {
            case SET -> {
                CompiledStep.SetStep s = (CompiledStep.SetStep) step;
                out.put("target", s.target());
                out.set("value", expression(s.value()));
            }
            case UPDATE -> {
                CompiledStep.UpdateStep s = (CompiledStep.UpdateStep) step;
                out.put("target", s.target());
                out.put("operation", s.operation());
                putExpr(out, "value", s.value());
                putExpr(out, "index", s.index());
                putExpr(out, "deleteCount", s.deleteCount());
            }
            case SET_PATH -> {
                CompiledStep.SetPathStep s = (CompiledStep.SetPathStep) step;
                out.put("target", s.target());
                out.set("path", expression(s.path()));
                out.set("value", expression(s.value()));
            }
            case FETCH -> {
                CompiledStep.FetchStep s = (CompiledStep.FetchStep) step;
                out.set("url", expression(s.url()));
                putText(out, "method", s.method());
                putExpr(out, "body", s.body());
                putText(out, "result", s.result());
                putSteps(out, "onSuccess", s.onSuccess());
                putSteps(out, "onError", s.onError());
            }
            case STORAGE -> {
                CompiledStep.StorageStep s = (CompiledStep.StorageStep) step;
                out.put("operation", s.operation());
                out.set("key", expression(s.key()));
                out.put("storage", s.storage());
                putExpr(out, "value", s.value());
                putText(out, "result", s.result());
                putSteps(out, "onSuccess", s.onSuccess());
                putSteps(out, "onError", s.onError());
            }
            case CLIPBOARD -> {
                CompiledStep.ClipboardStep s = (CompiledStep.ClipboardStep) step;
                out.put("operation", s.operation());
                putExpr(out, "value", s.value());
                putText(out, "result", s.result());
                putSteps(out, "onSuccess", s.onSuccess());
                putSteps(out, "onError", s.onError());
            }
            case NAVIGATE -> {
                CompiledStep.NavigateStep s = (CompiledStep.NavigateStep) step;
                out.set("url", expression(s.url()));
                putText(out, "target", s.target());
                if (s.replace() != null) {
                    out.put("replace", s.replace());
                }
            }
            case IMPORT -> {
                CompiledStep.ImportStep s = (CompiledStep.ImportStep) step;
                out.put("module", s.module());
                out.put("result", s.result());
                putSteps(out, "onSuccess", s.onSuccess());
                putSteps(out, "onError", s.onError());
            }
            case CALL -> {
                CompiledStep.CallStep s = (CompiledStep.CallStep) step;
                out.set("target", expression(s.target()));
                if (!s.args().isEmpty()) {
                    out.set("args", exprList(s.args()));
                }
                putText(out, "result", s.result());
                putSteps(out, "onSuccess", s.onSuccess());
                putSteps(out, "onError", s.onError());
            }
            case SUBSCRIBE -> {
                CompiledStep.SubscribeStep s = (CompiledStep.SubscribeStep) step;
                out.set("target", expression(s.target()));
                out.put("event", s.event());
                out.put("action", s.action());
            }
            case DISPOSE -> out.set("target", expression(((CompiledStep.DisposeStep) step).target()));
            case DOM -> {
                CompiledStep.DomStep s = (CompiledStep.DomStep) step;
                out.put("operation", s.operation());
                out.set("selector", expression(s.selector()));
                putExpr(out, "value", s.value());
                putText(out, "attribute", s.attribute());
            }
            case SEND -> {
                CompiledStep.SendStep s = (CompiledStep.SendStep) step;
                out.put("connection", s.connection());
                out.set("data", expression(s.data()));
            }
            case CLOSE -> out.put("connection", ((CompiledStep.CloseStep) step).connection());
            case DELAY -> {
                CompiledStep.DelayStep s = (CompiledStep.DelayStep) step;
                out.set("ms", expression(s.ms()));
                out.set("then", steps(s.then()));
                putText(out, "result", s.result());
            }
            case INTERVAL -> {
                CompiledStep.IntervalStep s = (CompiledStep.IntervalStep) step;
                out.set("ms", expression(s.ms()));
                out.put("action", s.action());
                putText(out, "result", s.result());
            }
            case CLEAR_TIMER -> out.set("target", expression(((CompiledStep.ClearTimerStep) step).target()));
            case FOCUS -> {
                CompiledStep.FocusStep s = (CompiledStep.FocusStep) step;
                out.set("target", expression(s.target()));
                out.put("operation", s.operation());
                putSteps(out, "onSuccess", s.onSuccess());
                putSteps(out, "onError", s.onError());
            }
            case IF -> {
                CompiledStep.IfStep s = (CompiledStep.IfStep) step;
                out.set("condition", expression(s.condition()));
                out.set("then", steps(s.then()));
                putSteps(out, "else", s.otherwise());
            }
            case GENERATE -> {
                CompiledStep.GenerateStep s = (CompiledStep.GenerateStep) step;
                out.put("provider", s.provider());
                out.set("prompt", expression(s.prompt()));
                out.put("output", s.output());
                out.put("result", s.result());
                putText(out, "model", s.model());
                putSteps(out, "onSuccess", s.onSuccess());
                putSteps(out, "onError", s.onError());
            }
            case SSE_CONNECT -> {
                CompiledStep.SseConnectStep s = (CompiledStep.SseConnectStep) step;
                out.put("connection", s.connection());
                out.set("url", expression(s.url()));
                if (!s.eventTypes().isEmpty()) {
                    ArrayNode types = out.putArray("eventTypes");
                    s.eventTypes().forEach(types::add);
                }
                if (s.reconnect() != null) {
                    out.set("reconnect", s.reconnect().deepCopy());
                }
                putSteps(out, "onOpen", s.onOpen());
                putSteps(out, "onMessage", s.onMessage());
                putSteps(out, "onError", s.onError());
            }
            case SSE_CLOSE -> out.put("connection", ((CompiledStep.SseCloseStep) step).connection());
            case OPTIMISTIC -> {
                CompiledStep.OptimisticStep s = (CompiledStep.OptimisticStep) step;
                out.put("target", s.target());
                out.set("value", expression(s.value()));
                putExpr(out, "path", s.path());
                putText(out, "result", s.result());
                if (s.timeout() != null) {
                    out.put("timeout", s.timeout());
                }
            }
            case CONFIRM -> out.set("id", expression(((CompiledStep.ConfirmStep) step).id()));
            case REJECT -> out.set("id", expression(((CompiledStep.RejectStep) step).id()));
            case BIND -> {
                CompiledStep.BindStep s = (CompiledStep.BindStep) step;
                out.put("connection", s.connection());
                out.put("target", s.target());
                putText(out, "eventType", s.eventType());
                putExpr(out, "path", s.path());
                putExpr(out, "transform", s.transform());
                if (s.patch() != null) {
                    out.put("patch", s.patch());
                }
            }
            case UNBIND -> {
                CompiledStep.UnbindStep s = (CompiledStep.UnbindStep) step;
                out.put("connection", s.connection());
                out.put("target", s.target());
            }
        }
        return out;
    }

    // ── helpers ──

    private static void putText(ObjectNode out, String field, String value) {
        if (value != null) {
            out.put(field, value);
        }
    }

    private static void putExpr(ObjectNode out, String field, CompiledExpression value) {
        if (value != null) {
            out.set(field, expression(value));
        }
    }

    private static void putSteps(ObjectNode out, String field, List<CompiledStep> value) {
        if (!value.isEmpty()) {
            out.set(field, steps(value));
        }
    }

    private static void putNodes(ObjectNode out, String field, List<CompiledNode> value) {
        if (!value.isEmpty()) {
            ArrayNode array = out.putArray(field);
            value.forEach(child -> array.add(node(child)));
        }
    }

    private static ArrayNode exprList(List<CompiledExpression> items) {
        ArrayNode out = NODES.arrayNode();
        items.forEach(item -> out.add(expression(item)));
        return out;
    }

    private static ObjectNode exprMap(Map<String, CompiledExpression> entries) {
        ObjectNode out = NODES.objectNode();
        entries.forEach((key, value) -> out.set(key, expression(value)));
        return out;
    }
}
