package io.constela.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * One step of an action. Steps run sequentially; callback lists ({@code onSuccess}, {@code
 * onError}, {@code then}, {@code else}, ...) nest further step lists. Optional fields are null
 * when absent and optional lists are empty.
 */
public sealed interface ActionStep
        permits ActionStep.SetStep,
                ActionStep.UpdateStep,
                ActionStep.SetPathStep,
                ActionStep.FetchStep,
                ActionStep.StorageStep,
                ActionStep.ClipboardStep,
                ActionStep.NavigateStep,
                ActionStep.ImportStep,
                ActionStep.CallStep,
                ActionStep.SubscribeStep,
                ActionStep.DisposeStep,
                ActionStep.DomStep,
                ActionStep.SendStep,
                ActionStep.CloseStep,
                ActionStep.DelayStep,
                ActionStep.IntervalStep,
                ActionStep.ClearTimerStep,
                ActionStep.FocusStep,
                ActionStep.IfStep,
                ActionStep.GenerateStep,
                ActionStep.SseConnectStep,
                ActionStep.SseCloseStep,
                ActionStep.OptimisticStep,
                ActionStep.ConfirmStep,
                ActionStep.RejectStep,
                ActionStep.BindStep,
                ActionStep.UnbindStep {

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

    /** Assigns a state field. */
    record SetStep(String target, Expression value) implements ActionStep {
        @Override
        public Kind kind() {
            return Kind.SET;
        }
    }

    /** Applies a typed operation ({@code increment}, {@code push}, {@code toggle}, ...) to a state field. */
    record UpdateStep(
            String target,
            String operation,
            Expression value,
            Expression index,
            Expression deleteCount)
            implements ActionStep {
        @Override
        public Kind kind() {
            return Kind.UPDATE;
        }
    }

    record SetPathStep(String target, Expression path, Expression value) implements ActionStep {
        @Override
        public Kind kind() {
            return Kind.SET_PATH;
        }
    }

    record FetchStep(
            Expression url,
            String method,
            Expression body,
            String result,
            List<ActionStep> onSuccess,
            List<ActionStep> onError)
            implements ActionStep {
        public FetchStep {
            onSuccess = ModelCollections.listCopy(onSuccess);
            onError = ModelCollections.listCopy(onError);
        }

        @Override
        public Kind kind() {
            return Kind.FETCH;
        }
    }

    /** Reads or writes {@code localStorage}/{@code sessionStorage}. */
    record StorageStep(
            String operation,
            Expression key,
            String storage,
            Expression value,
            String result,
            List<ActionStep> onSuccess,
            List<ActionStep> onError)
            implements ActionStep {
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
            Expression value,
            String result,
            List<ActionStep> onSuccess,
            List<ActionStep> onError)
            implements ActionStep {
        public ClipboardStep {
            onSuccess = ModelCollections.listCopy(onSuccess);
            onError = ModelCollections.listCopy(onError);
        }

        @Override
        public Kind kind() {
            return Kind.CLIPBOARD;
        }
    }

    record NavigateStep(Expression url, String target, Boolean replace) implements ActionStep {
        @Override
        public Kind kind() {
            return Kind.NAVIGATE;
        }
    }

    /** Dynamically imports a module. */
    record ImportStep(
            String module,
            String result,
            List<ActionStep> onSuccess,
            List<ActionStep> onError)
            implements ActionStep {
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
            Expression target,
            List<Expression> args,
            String result,
            List<ActionStep> onSuccess,
            List<ActionStep> onError)
            implements ActionStep {
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

    record SubscribeStep(Expression target, String event, String action) implements ActionStep {
        @Override
        public Kind kind() {
            return Kind.SUBSCRIBE;
        }
    }

    record DisposeStep(Expression target) implements ActionStep {
        @Override
        public Kind kind() {
            return Kind.DISPOSE;
        }
    }

    record DomStep(
            String operation,
            Expression selector,
            Expression value,
            String attribute)
            implements ActionStep {
        @Override
        public Kind kind() {
            return Kind.DOM;
        }
    }

    /** Sends data over a named WebSocket connection. */
    record SendStep(String connection, Expression data) implements ActionStep {
        @Override
        public Kind kind() {
            return Kind.SEND;
        }
    }

    record CloseStep(String connection) implements ActionStep {
        @Override
        public Kind kind() {
            return Kind.CLOSE;
        }
    }

    record DelayStep(Expression ms, List<ActionStep> then, String result) implements ActionStep {
        public DelayStep {
            then = ModelCollections.listCopy(then);
        }

        @Override
        public Kind kind() {
            return Kind.DELAY;
        }
    }

    record IntervalStep(Expression ms, String action, String result) implements ActionStep {
        @Override
        public Kind kind() {
            return Kind.INTERVAL;
        }
    }

    record ClearTimerStep(Expression target) implements ActionStep {
        @Override
        public Kind kind() {
            return Kind.CLEAR_TIMER;
        }
    }

    record FocusStep(
            Expression target,
            String operation,
            List<ActionStep> onSuccess,
            List<ActionStep> onError)
            implements ActionStep {
        public FocusStep {
            onSuccess = ModelCollections.listCopy(onSuccess);
            onError = ModelCollections.listCopy(onError);
        }

        @Override
        public Kind kind() {
            return Kind.FOCUS;
        }
    }

    /** Conditional branch; {@code otherwise} is serialized as {@code else}. */
    record IfStep(
            Expression condition,
            List<ActionStep> then,
            List<ActionStep> otherwise)
            implements ActionStep {
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
            Expression prompt,
            String output,
            String result,
            String model,
            List<ActionStep> onSuccess,
            List<ActionStep> onError)
            implements ActionStep {
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
            Expression url,
            List<String> eventTypes,
            JsonNode reconnect,
            List<ActionStep> onOpen,
            List<ActionStep> onMessage,
            List<ActionStep> onError)
            implements ActionStep {
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

    record SseCloseStep(String connection) implements ActionStep {
        @Override
        public Kind kind() {
            return Kind.SSE_CLOSE;
        }
    }

    record OptimisticStep(
            String target,
            Expression value,
            Expression path,
            String result,
            Integer timeout)
            implements ActionStep {
        @Override
        public Kind kind() {
            return Kind.OPTIMISTIC;
        }
    }

    record ConfirmStep(Expression id) implements ActionStep {
        @Override
        public Kind kind() {
            return Kind.CONFIRM;
        }
    }

    record RejectStep(Expression id) implements ActionStep {
        @Override
        public Kind kind() {
            return Kind.REJECT;
        }
    }

    /** Binds messages from a realtime connection into a state field. */
    record BindStep(
            String connection,
            String target,
            String eventType,
            Expression path,
            Expression transform,
            Boolean patch)
            implements ActionStep {
        @Override
        public Kind kind() {
            return Kind.BIND;
        }
    }

    record UnbindStep(String connection, String target) implements ActionStep {
        @Override
        public Kind kind() {
            return Kind.UNBIND;
        }
    }
}
