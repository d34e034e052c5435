package io.constela.core.engine;

import static io.constela.core.testkit.Programs.EMPTY_VIEW;
import static io.constela.core.testkit.Programs.program;
import static org.assertj.core.api.Assertions.assertThat;

import io.constela.core.error.ErrorCode;
import io.constela.core.spi.CompilationListener;
import io.constela.core.spi.CompilationListener.CompileFailedEvent;
import io.constela.core.spi.CompilationListener.CompileStartedEvent;
import io.constela.core.spi.CompilationListener.CompileSucceededEvent;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Verifies that a registered {@link CompilationListener} receives started, succeeded and failed
 * events, and that a failing listener never changes the compile result.
 */
@DisplayName("CompilationListenerTest")
class CompilationListenerTest {

    private CapturingListener listener;
    private ConstelaCompiler compiler;

    @BeforeEach
    void setUp() {
        listener = new CapturingListener();
        compiler = new ConstelaCompiler(CompilerOptions.DEFAULT, listener);
    }

    @Test
    @DisplayName("Successful compile → started + succeeded events")
    void successEmitsStartedAndSucceeded() {
        String json = program("{}", "[]", EMPTY_VIEW, """
                "components": {"A": {"view": {"kind": "slot"}}, "B": {"view": {"kind": "slot"}}}
                """);

        compiler.compile(json);

        assertThat(listener.started).extracting(CompileStartedEvent::source).containsExactly("<string>");
        assertThat(listener.succeeded).singleElement().satisfies(event -> {
            assertThat(event.componentCount()).isEqualTo(2);
            assertThat(event.durationMs()).isGreaterThanOrEqualTo(0);
        });
        assertThat(listener.failed).isEmpty();
    }

    @Test
    @DisplayName("Rejected program → started + failed events with the first error code")
    void failureEmitsFailed() {
        String json = program("{}", "[]", """
                {"kind": "element", "tag": "div", "children": [
                  {"kind": "component", "name": "Missing"},
                  {"kind": "text", "value": {"expr": "state", "name": "x"}}]}
                """);

        compiler.compile(json);

        assertThat(listener.started).hasSize(1);
        assertThat(listener.succeeded).isEmpty();
        assertThat(listener.failed).singleElement().satisfies(event -> {
            assertThat(event.errorCount()).isEqualTo(2);
            assertThat(event.firstErrorCode()).isEqualTo(ErrorCode.COMPONENT_NOT_FOUND);
        });
    }

    @Test
    @DisplayName("Throwing listener → compile result unaffected")
    void throwingListenerIsIsolated() {
        ConstelaCompiler withBrokenListener = new ConstelaCompiler(CompilerOptions.DEFAULT, new CompilationListener() {
            @Override
            public void onCompileStarted(CompileStartedEvent event) {
                throw new IllegalStateException("boom");
            }

            @Override
            public void onCompileSucceeded(CompileSucceededEvent event) {
                throw new IllegalStateException("boom");
            }

            @Override
            public void onCompileFailed(CompileFailedEvent event) {
                throw new IllegalStateException("boom");
            }
        });

        assertThat(withBrokenListener.compile(program("{}", "[]", EMPTY_VIEW)).isOk()).isTrue();
        assertThat(withBrokenListener.compile("{}").isOk()).isFalse();
    }

    @Test
    @DisplayName("No listener → compiles normally")
    void noListener() {
        assertThat(new ConstelaCompiler().compile(program("{}", "[]", EMPTY_VIEW)).isOk()).isTrue();
    }

    private static class CapturingListener implements CompilationListener {
        final List<CompileStartedEvent> started = new ArrayList<>();
        final List<CompileSucceededEvent> succeeded = new ArrayList<>();
        final List<CompileFailedEvent> failed = new ArrayList<>();

        @Override
        public void onCompileStarted(CompileStartedEvent event) {
            started.add(event);
        }

        @Override
        public void onCompileSucceeded(CompileSucceededEvent event) {
            succeeded.add(event);
        }

        @Override
        public void onCompileFailed(CompileFailedEvent event) {
            failed.add(event);
        }
    }
}
