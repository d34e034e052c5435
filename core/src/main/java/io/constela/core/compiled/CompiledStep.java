package io.constela.core.compiled;

import com.fasterxml.jackson.databind.JsonNode;
import io.constela.core.model.ModelCollections;
import java.util.List;

/**
 * Lowered action step. Field names and the {@code do} discriminant are the wire contract read by
 * the client runtime; see {@link CompiledProgramWriter}.
 */
public sealed interface CompiledStep
        permits CompiledStep.SetStep,
                CompiledStep.UpdateStep,
                CompiledStep.SetPathStep,
                CompiledStep.FetchStep,
                CompiledStep.StorageStep,
                CompiledStep.ClipboardStep,
                CompiledStep.NavigateStep,
                CompiledStep.ImportStep,
                CompiledStep.CallStep,
                CompiledStep.SubscribeStep,
                CompiledStep.DisposeStep,
                CompiledStep.DomStep,
                CompiledStep.SendStep,
                CompiledStep.CloseStep,
                CompiledStep.DelayStep,
                CompiledStep.IntervalStep,
                CompiledStep.ClearTimerStep,
                CompiledStep.FocusStep,
                CompiledStep.IfStep,
                CompiledStep.GenerateStep,
                CompiledStep.SseConnectStep,
                CompiledStep.SseCloseStep,
                CompiledStep.OptimisticStep,
                CompiledStep.ConfirmStep,
                CompiledStep.RejectStep,
                CompiledStep.BindStep,
                CompiledStep.UnbindStep {

    /** Step discriminant ({@code do} field). */
    enum Kind {
        SET("set"),
        UPDATE("update"),
        SET_PATH("setPath"),
        FETCH("fetch"),
        STORAGE("storage"),
        CLIPBOARD("clipboard"),
        NAVIGATE("navigate"),
        IMPORT("import"),
        CALL("call"),
        SUBSCRIBE("subscribe"),
        DISPOSE("dispose"),
        DOM("dom"),
        SEND("send"),
        CLOSE("close"),
        DELAY("delay"),
        INTERVAL("interval"),
        CLEAR_TIMER("clearTimer"),
        FOCUS("focus"),
        IF("if"),
        GENERATE("generate"),
        SSE_CONNECT("sseConnect"),
        SSE_CLOSE("sseClose"),
        OPTIMISTIC("optimistic"),
        CONFIRM("confirm"),
        REJECT("reject"),
        BIND("bind"),
        UNBIND("unbind");

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

    record SetStep(String target, CompiledExpression value) implements CompiledStep {
        @Override
        public Kind kind() {
            return Kind.SET;
        }
    }

    record UpdateStep(
            String target,
            String operation,
            CompiledExpression value,
            CompiledExpression index,
            CompiledExpression deleteCount)
            implements CompiledStep {
        @Override
        public Kind kind() {
            return Kind.UPDATE;
        }
    }

    record SetPathStep(
            String target,
            CompiledExpression path,
            CompiledExpression value)
            implements CompiledStep {
        @Override
        public Kind kind() {
            return Kind.SET_PATH;
        }
    }

    record FetchStep(
            CompiledExpression url,
            String method,
            CompiledExpression body,
            String result,
            List<CompiledStep> onSuccess,
            List<CompiledStep> onError)
            implements CompiledStep {
        public FetchStep {
            onSuccess = ModelCollections.listCopy(onSuccess);
            onError = ModelCollections.listCopy(onError);
        }

        @Override
        public Kind kind() {
            return Kind.FETCH;
        }
    }

    record StorageStep(
            String operation,
            CompiledExpression key,
            String storage,
            CompiledExpression value,
            String result,
            List<CompiledStep> onSuccess,
            List<CompiledStep> onError)
            implements CompiledStep {
        public StorageStep {
            onSuccess = ModelCollections.listCopy(onSuccess);
            onError = ModelCollections.listCopy(onError);
        }

        @Override
        public Kind kind() {
            return Kind.STORAGE;
        }
    }

    record ClipboardStep(
            String operation,
            CompiledExpression value,
            String result,
            List<CompiledStep> onSuccess,
            List<CompiledStep> onError)
            implements CompiledStep {
        public ClipboardStep {
            onSuccess = ModelCollections.listCopy(onSuccess);
            onError = ModelCollections.listCopy(onError);
        }

        @Override
        public Kind kind() {
            return Kind.CLIPBOARD;
        }
    }

    record NavigateStep(CompiledExpression url, String target, Boolean replace) implements CompiledStep {
        @Override
        public Kind kind() {
            return Kind.NAVIGATE;
        }
    }

    record ImportStep(
            String module,
            String result,
            List<CompiledStep> onSuccess,
            List<CompiledStep> onError)
            implements CompiledStep {
        public ImportStep {
            onSuccess = ModelCollections.listCopy(onSuccess);
            onError = ModelCollections.listCopy(onError);
        }

        @Override
        public Kind kind() {
            return Kind.IMPORT;
        }
    }

    record CallStep(
            CompiledExpression target,
            List<CompiledExpression> args,
            String result,
            List<CompiledStep> onSuccess,
            List<CompiledStep> onError)
            implements CompiledStep {
        public CallStep {
            args = ModelCollections.listCopy(args);
            onSuccess = ModelCollections.listCopy(onSuccess);
            onError = ModelCollections.listCopy(onError);
        }

        @Override
        public Kind kind() {
            return Kind.CALL;
        }
    }

    record SubscribeStep(CompiledExpression target, String event, String action) implements CompiledStep {
        @Override
        public Kind kind() {
            return Kind.SUBSCRIBE;
        }
    }

    record DisposeStep(CompiledExpression target) implements CompiledStep {
        @Override
        public Kind kind() {
            return Kind.DISPOSE;
        }
    }

    record DomStep(
            String operation,
            CompiledExpression selector,
            CompiledExpression value,
            String attribute)
            implements CompiledStep {
        @Override
        public Kind kind() {
            return Kind.DOM;
        }
    }

    record SendStep(String connection, CompiledExpression data) implements CompiledStep {
        @Override
        public Kind kind() {
            return Kind.SEND;
        }
    }

    record CloseStep(String connection) implements CompiledStep {
        @Override
        public Kind kind() {
            return Kind.CLOSE;
        }
    }

    record DelayStep(CompiledExpression ms, List<CompiledStep> then, String result) implements CompiledStep {
        public DelayStep {
            then = ModelCollections.listCopy(then);
        }

        @Override
        public Kind kind() {
            return Kind.DELAY;
        }
    }

    record IntervalStep(CompiledExpression ms, String action, String result) implements CompiledStep {
        @Override
        public Kind kind() {
            return Kind.INTERVAL;
        }
    }

    record ClearTimerStep(CompiledExpression target) implements CompiledStep {
        @Override
        public Kind kind() {
            return Kind.CLEAR_TIMER;
        }
    }

    record FocusStep(
            CompiledExpression target,
            String operation,
            List<CompiledStep> onSuccess,
            List<CompiledStep> onError)
            implements CompiledStep {
        public FocusStep {
            onSuccess = ModelCollections.listCopy(onSuccess);
            onError = ModelCollections.listCopy(onError);
        }

        @Override
        public Kind kind() {
            return Kind.FOCUS;
        }
    }

    record IfStep(
            CompiledExpression condition,
            List<CompiledStep> then,
            List<CompiledStep> otherwise)
            implements CompiledStep {
        public IfStep {
            then = ModelCollections.listCopy(then);
            otherwise = ModelCollections.listCopy(otherwise);
        }

        @Override
        public Kind kind() {
            return Kind.IF;
        }
    }

    record GenerateStep(
            String provider,
            CompiledExpression prompt,
            String output,
            String result,
            String model,
            List<CompiledStep> onSuccess,
            List<CompiledStep> onError)
            implements CompiledStep {
        public GenerateStep {
            onSuccess = ModelCollections.listCopy(onSuccess);
            onError = ModelCollections.listCopy(onError);
        }

        @Override
        public Kind kind() {
            return Kind.GENERATE;
        }
    }

    record SseConnectStep(
            String connection,
            CompiledExpression url,
            List<String> eventTypes,
            JsonNode reconnect,
            List<CompiledStep> onOpen,
            List<CompiledStep> onMessage,
            List<CompiledStep> onError)
            implements CompiledStep {
        public SseConnectStep {
            eventTypes = ModelCollections.listCopy(eventTypes);
            onOpen = ModelCollections.listCopy(onOpen);
            onMessage = ModelCollections.listCopy(onMessage);
            onError = ModelCollections.listCopy(onError);
        }

        @Override
        public Kind kind() {
            return Kind.SSE_CONNECT;
        }
    }

    record SseCloseStep(String connection) implements CompiledStep {
        @Override
        public Kind kind() {
            return Kind.SSE_CLOSE;
        }
    }

    record OptimisticStep(
            String target,
            CompiledExpression value,
            CompiledExpression path,
            String result,
            Integer timeout)
            implements CompiledStep {
        @Override
        public Kind kind() {
            return Kind.OPTIMISTIC;
        }
    }

    record ConfirmStep(CompiledExpression id) implements CompiledStep {
        @Override
        public Kind kind() {
            return Kind.CONFIRM;
        }
    }

    record RejectStep(CompiledExpression id) implements CompiledStep {
        @Override
        public Kind kind() {
            return Kind.REJECT;
        }
    }

    record BindStep(
            String connection,
            String target,
            String eventType,
            CompiledExpression path,
            CompiledExpression transform,
            Boolean patch)
            implements CompiledStep {
        @Override
        public Kind kind() {
            return Kind.BIND;
        }
    }

    record UnbindStep(String connection, String target) implements CompiledStep {
        @Override
        public Kind kind() {
            return Kind.UNBIND;
        }
    }
}
