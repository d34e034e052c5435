package io.constela.core.transform;

import io.constela.core.compiled.CompiledAction;
import io.constela.core.compiled.CompiledExpression;
import io.constela.core.compiled.CompiledStep;
import io.constela.core.model.ActionDefinition;
import io.constela.core.model.ActionStep;
import io.constela.core.model.Expression;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lowers action steps. Steps are lowered outside any component expansion, so a {@code param}
 * inside a step becomes {@code null}.
 */
final class StepTransformer {

    private StepTransformer() {
        // utility class
    }

    /** Lowers actions into a map keyed by name; a later duplicate replaces an earlier one. */
    static Map<String, CompiledAction> transformActions(List<ActionDefinition> actions) {
        Map<String, CompiledAction> compiled = new LinkedHashMap<>();
        for (ActionDefinition action : actions) {
            compiled.put(action.name(), new CompiledAction(action.name(), transformAll(action.steps())));
        }
        return compiled;
    }

    static List<CompiledStep> transformAll(List<ActionStep> steps) {
        List<CompiledStep> out = new ArrayList<>(steps.size());
        for (ActionStep step : steps) {
            out.add(transform(step));
        }
        return out;
    }

    static CompiledStep transform(ActionStep step) {
        return switch (step.kind()) {
            case SET -> {
                ActionStep.SetStep s = (ActionStep.SetStep) step;
                yield new CompiledStep.SetStep(s.target(), expr(s.value()));
            }
            case UPDATE -> {
                ActionStep.UpdateStep s = (ActionStep.UpdateStep) step;
                yield new CompiledStep.UpdateStep(
                        s.target(), s.operation(), expr(s.value()), expr(s.index()), expr(s.deleteCount()));
            }
            case SET_PATH -> {
                ActionStep.SetPathStep s = (ActionStep.SetPathStep) step;
                yield new CompiledStep.SetPathStep(s.target(), expr(s.path()), expr(s.value()));
            }
            case FETCH -> {
                ActionStep.FetchStep s = (ActionStep.FetchStep) step;
                yield new CompiledStep.FetchStep(
                        expr(s.url()),
                        s.method(),
                        expr(s.body()),
                        s.result(),
                        transformAll(s.onSuccess()),
                        transformAll(s.onError()));
            }
            case STORAGE -> {
                ActionStep.StorageStep s = (ActionStep.StorageStep) step;
                yield new CompiledStep.StorageStep(
                        s.operation(),
                        expr(s.key()),
                        s.storage(),
                        expr(s.value()),
                        s.result(),
                        transformAll(s.onSuccess()),
                        transformAll(s.onError()));
            }
            case CLIPBOARD -> {
                ActionStep.ClipboardStep s = (ActionStep.ClipboardStep) step;
                yield new CompiledStep.ClipboardStep(
                        s.operation(),
                        expr(s.value()),
                        s.result(),
                        transformAll(s.onSuccess()),
                        transformAll(s.onError()));
            }
            case NAVIGATE -> {
                ActionStep.NavigateStep s = (ActionStep.NavigateStep) step;
                yield new CompiledStep.NavigateStep(expr(s.url()), s.target(), s.replace());
            }
            case IMPORT -> {
                ActionStep.ImportStep s = (ActionStep.ImportStep) step;
                yield new CompiledStep.ImportStep(
                        s.module(), s.result(), transformAll(s.onSuccess()), transformAll(s.onError()));
            }
            case CALL -> {
                ActionStep.CallStep s = (ActionStep.CallStep) step;
                List<CompiledExpression> args = new ArrayList<>();
                s.args().forEach(arg -> args.add(expr(arg)));
                yield new CompiledStep.CallStep(
                        expr(s.target()), args, s.result(), transformAll(s.onSuccess()), transformAll(s.onError()));
            }
            case SUBSCRIBE -> {
                ActionStep.SubscribeStep s = (ActionStep.SubscribeStep) step;
                yield new CompiledStep.SubscribeStep(expr(s.target()), s.event(), s.action());
            }
            case DISPOSE -> new CompiledStep.DisposeStep(expr(((ActionStep.DisposeStep) step).target()));
            case DOM -> {
                ActionStep.DomStep s = (ActionStep.DomStep) step;
                yield new CompiledStep.DomStep(s.operation(), expr(s.selector()), expr(s.value()), s.attribute());
            }
            case SEND -> {
                ActionStep.SendStep s = (ActionStep.SendStep) step;
                yield new CompiledStep.SendStep(s.connection(), expr(s.data()));
            }
            case CLOSE -> new CompiledStep.CloseStep(((ActionStep.CloseStep) step).connection());
            case DELAY -> {
                ActionStep.DelayStep s = (ActionStep.DelayStep) step;
                yield new CompiledStep.DelayStep(expr(s.ms()), transformAll(s.then()), s.result());
            }
            case INTERVAL -> {
                ActionStep.IntervalStep s = (ActionStep.IntervalStep) step;
                yield new CompiledStep.IntervalStep(expr(s.ms()), s.action(), s.result());
            }
            case CLEAR_TIMER -> new CompiledStep.ClearTimerStep(expr(((ActionStep.ClearTimerStep) step).target()));
            case FOCUS -> {
                ActionStep.FocusStep s = (ActionStep.FocusStep) step;
                yield new CompiledStep.FocusStep(
                        expr(s.target()), s.operation(), transformAll(s.onSuccess()), transformAll(s.onError()));
            }
            case IF -> {
                ActionStep.IfStep s = (ActionStep.IfStep) step;
                yield new CompiledStep.IfStep(
                        expr(s.condition()), transformAll(s.then()), transformAll(s.otherwise()));
            }
            case GENERATE -> {
                ActionStep.GenerateStep s = (ActionStep.GenerateStep) step;
                yield new CompiledStep.GenerateStep(
                        s.provider(),
                        expr(s.prompt()),
                        s.output(),
                        s.result(),
                        s.model(),
                        transformAll(s.onSuccess()),
                        transformAll(s.onError()));
            }
            case SSE_CONNECT -> {
                ActionStep.SseConnectStep s = (ActionStep.SseConnectStep) step;
                yield new CompiledStep.SseConnectStep(
                        s.connection(),
                        expr(s.url()),
                        s.eventTypes(),
                        s.reconnect(),
                        transformAll(s.onOpen()),
                        transformAll(s.onMessage()),
                        transformAll(s.onError()));
            }
            case SSE_CLOSE -> new CompiledStep.SseCloseStep(((ActionStep.SseCloseStep) step).connection());
            case OPTIMISTIC -> {
                ActionStep.OptimisticStep s = (ActionStep.OptimisticStep) step;
                yield new CompiledStep.OptimisticStep(
                        s.target(), expr(s.value()), expr(s.path()), s.result(), s.timeout());
            }
            case CONFIRM -> new CompiledStep.ConfirmStep(expr(((ActionStep.ConfirmStep) step).id()));
            case REJECT -> new CompiledStep.RejectStep(expr(((ActionStep.RejectStep) step).id()));
            case BIND -> {
                ActionStep.BindStep s = (ActionStep.BindStep) step;
                yield new CompiledStep.BindStep(
                        s.connection(), s.target(), s.eventType(), expr(s.path()), expr(s.transform()), s.patch());
            }
            case UNBIND -> {
                ActionStep.UnbindStep s = (ActionStep.UnbindStep) step;
                yield new CompiledStep.UnbindStep(s.connection(), s.target());
            }
        };
    }

    private static CompiledExpression expr(Expression expression) {
        return ExpressionTransformer.transform(expression, TransformContext.EMPTY);
    }
}
