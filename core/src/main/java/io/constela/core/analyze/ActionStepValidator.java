package io.constela.core.analyze;

import static io.constela.core.analyze.AnalysisSession.path;

import io.constela.core.error.ConstelaError;
import io.constela.core.error.ErrorCode;
import io.constela.core.model.ActionDefinition;
import io.constela.core.model.ActionStep;
import io.constela.core.model.Expression;
import io.constela.core.model.StateField;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates action steps: state targets, action references, per-kind operation tables and every
 * embedded expression (in {@link ValidationMode#STATE_ONLY} mode). Nested callback lists are
 * validated recursively under their own path.
 */
final class ActionStepValidator {

    private static final Map<String, String> REQUIRED_TYPE = Map.ofEntries(
            Map.entry("toggle", "boolean"),
            Map.entry("merge", "object"),
            Map.entry("increment", "number"),
            Map.entry("decrement", "number"),
            Map.entry("push", "list"),
            Map.entry("pop", "list"),
            Map.entry("remove", "list"),
            Map.entry("replaceAt", "list"),
            Map.entry("insertAt", "list"),
            Map.entry("splice", "list"));

    private static final Set<String> STORAGE_OPERATIONS = Set.of("get", "set", "remove");
    private static final Set<String> STORAGE_TYPES = Set.of("local", "session");
    private static final Set<String> CLIPBOARD_OPERATIONS = Set.of("read", "write");
    private static final Set<String> NAVIGATE_TARGETS = Set.of("_self", "_blank");
    private static final Set<String> FOCUS_OPERATIONS = Set.of("focus", "blur", "select");
    private static final Set<ActionStep.Kind> LOCAL_STEP_KINDS =
            Set.of(ActionStep.Kind.SET, ActionStep.Kind.UPDATE, ActionStep.Kind.SET_PATH);

    private final AnalysisSession session;
    private final ExpressionValidator expressions;

    ActionStepValidator(AnalysisSession session, ExpressionValidator expressions) {
        this.session = session;
        this.expressions = expressions;
    }

    /** Validates a global action's steps at {@code <path>/steps/<j>}. */
    List<ConstelaError> validateAction(ActionDefinition action, String path) {
        Targets targets = Targets.global(session);
        Scope scope = Scope.root(false);
        List<ConstelaError> errors = new ArrayList<>();
        validateSteps(action.steps(), path(path, "steps"), scope, targets, errors);
        return errors;
    }

    /**
     * Validates a component's local action. Only {@code set}, {@code update} and {@code setPath}
     * are allowed and their targets must be local state of that component.
     */
    List<ConstelaError> validateLocalAction(
            ActionDefinition action, String path, Scope scope, Map<String, StateField> localState) {
        Targets targets = Targets.local(scope.component().name(), localState);
        List<ConstelaError> errors = new ArrayList<>();
        for (int j = 0; j < action.steps().size(); j++) {
            ActionStep step = action.steps().get(j);
            String stepPath = path(path, "steps", j);
            if (!LOCAL_STEP_KINDS.contains(step.kind())) {
                errors.add(ConstelaError.of(
                        ErrorCode.LOCAL_ACTION_INVALID_STEP,
                        "Step '" + step.kind().wireName()
                                + "' is not allowed in local actions; only set, update, setPath are supported",
                        stepPath));
                continue;
            }
            validateStep(step, stepPath, scope, targets, errors);
        }
        return errors;
    }

    private void validateSteps(
            List<ActionStep> steps, String listPath, Scope scope, Targets targets, List<ConstelaError> errors) {
        for (int i = 0; i < steps.size(); i++) {
            validateStep(steps.get(i), path(listPath, i), scope, targets, errors);
        }
    }

    private void validateStep(ActionStep step, String path, Scope scope, Targets targets, List<ConstelaError> errors) {
        switch (step.kind()) {
            case SET -> {
                ActionStep.SetStep set = (ActionStep.SetStep) step;
                checkTarget(set.target(), path, targets, errors);
                expr(set.value(), path(path, "value"), scope, errors);
            }
            case UPDATE -> validateUpdate((ActionStep.UpdateStep) step, path, scope, targets, errors);
            case SET_PATH -> {
                ActionStep.SetPathStep setPath = (ActionStep.SetPathStep) step;
                checkTarget(setPath.target(), path, targets, errors);
                expr(setPath.path(), path(path, "path"), scope, errors);
                expr(setPath.value(), path(path, "value"), scope, errors);
            }
            case FETCH -> {
                ActionStep.FetchStep fetch = (ActionStep.FetchStep) step;
                expr(fetch.url(), path(path, "url"), scope, errors);
                expr(fetch.body(), path(path, "body"), scope, errors);
                callbacks(path, fetch.onSuccess(), fetch.onError(), scope, targets, errors);
            }
            case STORAGE -> validateStorage((ActionStep.StorageStep) step, path, scope, targets, errors);
            case CLIPBOARD -> validateClipboard((ActionStep.ClipboardStep) step, path, scope, targets, errors);
            case NAVIGATE -> {
                ActionStep.NavigateStep navigate = (ActionStep.NavigateStep) step;
                if (navigate.target() != null && !NAVIGATE_TARGETS.contains(navigate.target())) {
                    errors.add(ConstelaError.of(
                            ErrorCode.INVALID_NAVIGATE_TARGET,
                            "Invalid navigate target: '" + navigate.target() + "'. Expected one of: _self, _blank",
                            path(path, "target")));
                }
                expr(navigate.url(), path(path, "url"), scope, errors);
            }
            case IMPORT -> {
                ActionStep.ImportStep importStep = (ActionStep.ImportStep) step;
                callbacks(path, importStep.onSuccess(), importStep.onError(), scope, targets, errors);
            }
            case CALL -> {
                ActionStep.CallStep call = (ActionStep.CallStep) step;
                expr(call.target(), path(path, "target"), scope, errors);
                for (int i = 0; i < call.args().size(); i++) {
                    expr(call.args().get(i), path(path, "args", i), scope, errors);
                }
                callbacks(path, call.onSuccess(), call.onError(), scope, targets, errors);
            }
            case SUBSCRIBE -> {
                ActionStep.SubscribeStep subscribe = (ActionStep.SubscribeStep) step;
                expr(subscribe.target(), path(path, "target"), scope, errors);
                checkAction(subscribe.action(), path(path, "action"), errors);
            }
            case DISPOSE -> expr(((ActionStep.DisposeStep) step).target(), path(path, "target"), scope, errors);
            case DOM -> {
                ActionStep.DomStep dom = (ActionStep.DomStep) step;
                expr(dom.selector(), path(path, "selector"), scope, errors);
                expr(dom.value(), path(path, "value"), scope, errors);
            }
            case SEND -> expr(((ActionStep.SendStep) step).data(), path(path, "data"), scope, errors);
            case DELAY -> {
                ActionStep.DelayStep delay = (ActionStep.DelayStep) step;
                expr(delay.ms(), path(path, "ms"), scope, errors);
                validateSteps(delay.then(), path(path, "then"), scope, targets, errors);
            }
            case INTERVAL -> {
                ActionStep.IntervalStep interval = (ActionStep.IntervalStep) step;
                expr(interval.ms(), path(path, "ms"), scope, errors);
                checkAction(interval.action(), path(path, "action"), errors);
            }
            case CLEAR_TIMER -> expr(((ActionStep.ClearTimerStep) step).target(), path(path, "target"), scope, errors);
            case FOCUS -> {
                ActionStep.FocusStep focus = (ActionStep.FocusStep) step;
                expr(focus.target(), path(path, "target"), scope, errors);
                if (!oneOf(FOCUS_OPERATIONS, focus.operation())) {
                    errors.add(ConstelaError.of(
                            ErrorCode.SCHEMA_ERROR,
                            "Invalid focus operation: '" + focus.operation() + "'. Expected one of: focus, blur, select",
                            path(path, "operation")));
                }
                callbacks(path, focus.onSuccess(), focus.onError(), scope, targets, errors);
            }
            case IF -> {
                ActionStep.IfStep ifStep = (ActionStep.IfStep) step;
                expr(ifStep.condition(), path(path, "condition"), scope, errors);
                validateSteps(ifStep.then(), path(path, "then"), scope, targets, errors);
                validateSteps(ifStep.otherwise(), path(path, "else"), scope, targets, errors);
            }
            case GENERATE -> {
                ActionStep.GenerateStep generate = (ActionStep.GenerateStep) step;
                expr(generate.prompt(), path(path, "prompt"), scope, errors);
                callbacks(path, generate.onSuccess(), generate.onError(), scope, targets, errors);
            }
            case SSE_CONNECT -> {
                ActionStep.SseConnectStep sse = (ActionStep.SseConnectStep) step;
                expr(sse.url(), path(path, "url"), scope, errors);
                validateSteps(sse.onOpen(), path(path, "onOpen"), scope, targets, errors);
                validateSteps(sse.onMessage(), path(path, "onMessage"), scope, targets, errors);
                validateSteps(sse.onError(), path(path, "onError"), scope, targets, errors);
            }
            case OPTIMISTIC -> {
                ActionStep.OptimisticStep optimistic = (ActionStep.OptimisticStep) step;
                checkTarget(optimistic.target(), path, targets, errors);
                expr(optimistic.value(), path(path, "value"), scope, errors);
                expr(optimistic.path(), path(path, "path"), scope, errors);
            }
            case BIND -> {
                ActionStep.BindStep bind = (ActionStep.BindStep) step;
                checkTarget(bind.target(), path, targets, errors);
                expr(bind.path(), path(path, "path"), scope, errors);
                expr(bind.transform(), path(path, "transform"), scope, errors);
            }
            case CONFIRM -> expr(((ActionStep.ConfirmStep) step).id(), path(path, "id"), scope, errors);
            case REJECT -> expr(((ActionStep.RejectStep) step).id(), path(path, "id"), scope, errors);
            case CLOSE, SSE_CLOSE, UNBIND -> {
                // connection names are runtime handles
            }
        }
    }

    private void validateUpdate(
            ActionStep.UpdateStep update, String path, Scope scope, Targets targets, List<ConstelaError> errors) {
        StateField field = checkTarget(update.target(), path, targets, errors);
        String operation = update.operation();
        if (field != null) {
            String required = operation == null ? null : REQUIRED_TYPE.get(operation);
            if (required != null && !"any".equals(field.type()) && !required.equals(field.type())) {
                errors.add(ConstelaError.of(
                                ErrorCode.OPERATION_INVALID_FOR_TYPE,
                                "Operation '" + operation + "' requires " + required + " state, but '"
                                        + update.target() + "' is " + field.type(),
                                path(path, "operation"))
                        .withContext("operation", operation)
                        .withContext("expectedType", required)
                        .withContext("actualType", field.type()));
            }
        }
        if ("merge".equals(operation)) {
            requireField(operation, "value", update.value(), path, errors);
        } else if ("replaceAt".equals(operation) || "insertAt".equals(operation)) {
            requireField(operation, "index", update.index(), path, errors);
            requireField(operation, "value", update.value(), path, errors);
        } else if ("splice".equals(operation)) {
            requireField(operation, "index", update.index(), path, errors);
            requireField(operation, "deleteCount", update.deleteCount(), path, errors);
        }
        expr(update.value(), path(path, "value"), scope, errors);
        expr(update.index(), path(path, "index"), scope, errors);
        expr(update.deleteCount(), path(path, "deleteCount"), scope, errors);
    }

    private static void requireField(
            String operation, String field, Expression value, String path, List<ConstelaError> errors) {
        if (value == null) {
            errors.add(ConstelaError.of(
                    ErrorCode.OPERATION_MISSING_FIELD,
                    "Operation '" + operation + "' requires field '" + field + "'",
                    path(path, field)));
        }
    }

    private void validateStorage(
            ActionStep.StorageStep storage, String path, Scope scope, Targets targets, List<ConstelaError> errors) {
        if (!oneOf(STORAGE_OPERATIONS, storage.operation())) {
            errors.add(ConstelaError.of(
                    ErrorCode.INVALID_STORAGE_OPERATION,
                    "Invalid storage operation: '" + storage.operation() + "'. Expected one of: get, set, remove",
                    path(path, "operation")));
        }
        if (!oneOf(STORAGE_TYPES, storage.storage())) {
            errors.add(ConstelaError.of(
                    ErrorCode.INVALID_STORAGE_TYPE,
                    "Invalid storage type: '" + storage.storage() + "'. Expected one of: local, session",
                    path(path, "storage")));
        }
        if ("set".equals(storage.operation()) && storage.value() == null) {
            errors.add(ConstelaError.of(
                    ErrorCode.STORAGE_SET_MISSING_VALUE,
                    "Storage 'set' operation requires a value",
                    path(path, "value")));
        }
        expr(storage.key(), path(path, "key"), scope, errors);
        expr(storage.value(), path(path, "value"), scope, errors);
        callbacks(path, storage.onSuccess(), storage.onError(), scope, targets, errors);
    }

    private void validateClipboard(
            ActionStep.ClipboardStep clipboard, String path, Scope scope, Targets targets, List<ConstelaError> errors) {
        if (!oneOf(CLIPBOARD_OPERATIONS, clipboard.operation())) {
            errors.add(ConstelaError.of(
                    ErrorCode.INVALID_CLIPBOARD_OPERATION,
                    "Invalid clipboard operation: '" + clipboard.operation() + "'. Expected one of: read, write",
                    path(path, "operation")));
        }
        if ("write".equals(clipboard.operation()) && clipboard.value() == null) {
            errors.add(ConstelaError.of(
                    ErrorCode.CLIPBOARD_WRITE_MISSING_VALUE,
                    "Clipboard 'write' operation requires a value",
                    path(path, "value")));
        }
        expr(clipboard.value(), path(path, "value"), scope, errors);
        callbacks(path, clipboard.onSuccess(), clipboard.onError(), scope, targets, errors);
    }

    private void callbacks(
            String path,
            List<ActionStep> onSuccess,
            List<ActionStep> onError,
            Scope scope,
            Targets targets,
            List<ConstelaError> errors) {
        validateSteps(onSuccess, path(path, "onSuccess"), scope, targets, errors);
        validateSteps(onError, path(path, "onError"), scope, targets, errors);
    }

    private StateField checkTarget(String target, String path, Targets targets, List<ConstelaError> errors) {
        StateField field = target == null ? null : targets.fields().get(target);
        if (field == null) {
            errors.add(session.referenceError(
                    targets.code(),
                    targets.message(target),
                    path(path, "target"),
                    target,
                    targets.fields().keySet()));
        }
        return field;
    }

    private void checkAction(String action, String path, List<ConstelaError> errors) {
        if (action != null && !session.context().hasAction(action)) {
            errors.add(session.referenceError(
                    ErrorCode.UNDEFINED_ACTION,
                    "Undefined action reference: '" + action + "' is not defined in actions",
                    path,
                    action,
                    session.context().actionNames()));
        }
    }

    // Set.of rejects null lookups
    private static boolean oneOf(Set<String> allowed, String value) {
        return value != null && allowed.contains(value);
    }

    private void expr(Expression expression, String path, Scope scope, List<ConstelaError> errors) {
        if (expression != null) {
            errors.addAll(expressions.validate(expression, path, ValidationMode.STATE_ONLY, scope));
        }
    }

    /** The state fields a step may write, and how a miss is reported. */
    private record Targets(Map<String, StateField> fields, ErrorCode code, String component) {

        static Targets global(AnalysisSession session) {
            return new Targets(session.program().state(), ErrorCode.UNDEFINED_STATE, null);
        }

        static Targets local(String component, Map<String, StateField> localState) {
            return new Targets(localState, ErrorCode.UNDEFINED_LOCAL_STATE, component);
        }

        String message(String target) {
            if (component == null) {
                return "Undefined state reference: '" + target + "' is not defined in state";
            }
            return "Undefined local state reference: '" + target + "' is not defined in localState of component '"
                    + component + "'";
        }
    }
}
