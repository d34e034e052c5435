package io.constela.core.engine;

import static io.constela.core.testkit.Programs.EMPTY_VIEW;
import static io.constela.core.testkit.Programs.program;
import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.constela.core.spi.CompilationListener;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/** Structured log lines emitted by {@link ConstelaCompiler} for each compilation. */
@DisplayName("CompilerLoggingTest")
class CompilerLoggingTest {

    private ListAppender<ILoggingEvent> logAppender;
    private Logger compilerLogger;

    @BeforeEach
    void setUp() {
        compilerLogger = (Logger) LoggerFactory.getLogger(ConstelaCompiler.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        compilerLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        compilerLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    private List<ILoggingEvent> eventsContaining(String marker) {
        return logAppender.list.stream()
                .filter(e -> e.getMessage() != null && e.getMessage().contains(marker))
                .toList();
    }

    @Test
    @DisplayName("Successful compile → one compile.completed entry at INFO")
    void successLogsCompleted() {
        new ConstelaCompiler().compile(program("{}", "[{\"name\": \"a\", \"steps\": []}]", EMPTY_VIEW));

        List<ILoggingEvent> completed = eventsContaining("compile.completed");
        assertThat(completed).singleElement().satisfies(event -> {
            assertThat(event.getLevel()).isEqualTo(Level.INFO);
            assertThat(event.getFormattedMessage())
                    .contains("source=<string>")
                    .contains("components=0")
                    .contains("actions=1")
                    .contains("warnings=0")
                    .contains("durationMs=");
        });
        assertThat(eventsContaining("compile.failed")).isEmpty();
    }

    @Test
    @DisplayName("Rejected program → one compile.failed entry at WARN with the first code")
    void failureLogsFailed() {
        new ConstelaCompiler().compile(program("{}", "[]", "{\"kind\": \"text\", \"value\": {\"expr\": \"state\", \"name\": \"x\"}}"));

        assertThat(eventsContaining("compile.failed")).singleElement().satisfies(event -> {
            assertThat(event.getLevel()).isEqualTo(Level.WARN);
            assertThat(event.getFormattedMessage())
                    .contains("errors=1")
                    .contains("firstCode=UNDEFINED_STATE");
        });
        assertThat(eventsContaining("compile.completed")).isEmpty();
    }

    @Test
    @DisplayName("Failing listener → warning names the callback")
    void listenerFailureIsLogged() {
        ConstelaCompiler compiler = new ConstelaCompiler(CompilerOptions.DEFAULT, new CompilationListener() {
            @Override
            public void onCompileStarted(CompileStartedEvent event) {
                throw new IllegalStateException("boom");
            }

            @Override
            public void onCompileSucceeded(CompileSucceededEvent event) {}

            @Override
            public void onCompileFailed(CompileFailedEvent event) {}
        });

        compiler.compile(program("{}", "[]", EMPTY_VIEW));

        assertThat(eventsContaining("CompilationListener.onCompileStarted failed")).singleElement()
                .satisfies(event -> assertThat(event.getThrowableProxy().getMessage()).isEqualTo("boom"));
    }
}
