package io.constela.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.constela.core.analyze.AccessibilityValidator;
import io.constela.core.analyze.AnalyzeResult;
import io.constela.core.analyze.Analyzer;
import io.constela.core.compiled.CompiledProgram;
import io.constela.core.error.ConstelaError;
import io.constela.core.error.ErrorCode;
import io.constela.core.error.ProgramAnalysisException;
import io.constela.core.error.ProgramParseException;
import io.constela.core.model.Program;
import io.constela.core.parser.ProgramParser;
import io.constela.core.parser.ProgramSchemaValidator;
import io.constela.core.spi.CompilationListener;
import io.constela.core.transform.LayoutComposer;
import io.constela.core.transform.ProgramTransformer;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the compiler: validates a program document, parses it, analyzes it and lowers it
 * to a {@link CompiledProgram}.
 *
 * <p>Problems with the program are returned as {@link CompileResult.Failure} rather than thrown;
 * {@link #compileOrThrow(JsonNode)} converts them into a {@link ProgramAnalysisException}. The
 * program's own {@code imports} become the compiled program's {@code importData}.
 *
 * <p>Thread-safe: the compiler holds only immutable collaborators.
 */
public final class ConstelaCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(ConstelaCompiler.class);

    private final CompilerOptions options;
    private final Analyzer analyzer;
    private final ProgramSchemaValidator schemaValidator;
    private final CompilationListener listener;

    public ConstelaCompiler() {
        this(CompilerOptions.DEFAULT, null);
    }

    public ConstelaCompiler(CompilerOptions options) {
        this(options, null);
    }

    /**
     * @param options  compiler options
     * @param listener optional listener for compile lifecycle events, may be null
     */
    public ConstelaCompiler(CompilerOptions options, CompilationListener listener) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.analyzer = new Analyzer(options.analysisOptions());
        this.schemaValidator = options.validateSchema() ? new ProgramSchemaValidator() : null;
        this.listener = listener; // nullable
    }

    public CompilerOptions options() {
        return options;
    }

    /** Compiles a JSON or YAML program file. */
    public CompileResult compile(Path file) {
        Objects.requireNonNull(file, "file must not be null");
        String source = file.toString();
        long startNanos = System.nanoTime();
        notifyStarted(source);
        try {
            return compileDocument(ProgramParser.readTree(file), source, startNanos);
        } catch (ProgramParseException e) {
            return parseFailure(e, source, startNanos);
        }
    }

    /** Compiles JSON program text. */
    public CompileResult compile(String json) {
        Objects.requireNonNull(json, "json must not be null");
        long startNanos = System.nanoTime();
        notifyStarted("<string>");
        try {
            return compileDocument(ProgramParser.readTree(json), "<string>", startNanos);
        } catch (ProgramParseException e) {
            return parseFailure(e, "<string>", startNanos);
        }
    }

    /** Compiles a raw program document. */
    public CompileResult compile(JsonNode document) {
        Objects.requireNonNull(document, "document must not be null");
        long startNanos = System.nanoTime();
        notifyStarted("<document>");
        return compileDocument(document, "<document>", startNanos);
    }

    /** Compiles an already-parsed program; schema validation does not apply. */
    public CompileResult compile(Program program) {
        Objects.requireNonNull(program, "program must not be null");
        long startNanos = System.nanoTime();
        notifyStarted("<program>");
        return compileProgram(program, "<program>", startNanos);
    }

    /**
     * Compiles a raw program document.
     *
     * @throws ProgramAnalysisException carrying every error when compilation fails
     */
    public CompiledProgram compileOrThrow(JsonNode document) {
        return unwrap(compile(document));
    }

    /**
     * Compiles JSON program text.
     *
     * @throws ProgramAnalysisException carrying every error when compilation fails
     */
    public CompiledProgram compileOrThrow(String json) {
        return unwrap(compile(json));
    }

    /**
     * Places a compiled page into the slots of a compiled layout.
     *
     * @see LayoutComposer
     */
    public CompiledProgram composeLayout(CompiledProgram layout, CompiledProgram page) {
        return LayoutComposer.compose(layout, page);
    }

    private static CompiledProgram unwrap(CompileResult result) {
        if (result instanceof CompileResult.Failure failure) {
            throw new ProgramAnalysisException(failure.errors());
        }
        return ((CompileResult.Success) result).program();
    }

    private CompileResult compileDocument(JsonNode document, String source, long startNanos) {
        if (schemaValidator != null) {
            List<ConstelaError> schemaErrors = schemaValidator.validate(document);
            if (!schemaErrors.isEmpty()) {
                return failed(schemaErrors, source, startNanos);
            }
        }
        Program program;
        try {
            program = ProgramParser.parse(document);
        } catch (ProgramParseException e) {
            return parseFailure(e, source, startNanos);
        }
        return compileProgram(program, source, startNanos);
    }

    private CompileResult compileProgram(Program program, String source, long startNanos) {
        AnalyzeResult analysis = analyzer.analyze(program);
        if (analysis instanceof AnalyzeResult.Failure failure) {
            return failed(failure.errors(), source, startNanos);
        }
        CompiledProgram compiled = ProgramTransformer.transform(program, program.imports());
        List<ConstelaError> warnings = options.checkAccessibility()
                ? AccessibilityValidator.validate(program.view())
                : List.of();
        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
        LOG.info(
                "compile.completed: source={}, components={}, actions={}, warnings={}, durationMs={}",
                source,
                program.components().size(),
                compiled.actions().size(),
                warnings.size(),
                durationMs);
        notifySucceeded(source, durationMs, program.components().size());
        return new CompileResult.Success(compiled, warnings);
    }

    private CompileResult parseFailure(ProgramParseException e, String source, long startNanos) {
        String pointer = e.source() == null || !e.source().startsWith("/") ? "/" : e.source();
        LOG.debug("Program could not be parsed: source={}, pointer={}", source, pointer, e);
        return failed(List.of(ConstelaError.of(ErrorCode.SCHEMA_ERROR, e.getMessage(), pointer)), source, startNanos);
    }

    private CompileResult failed(List<ConstelaError> errors, String source, long startNanos) {
        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
        LOG.warn(
                "compile.failed: source={}, errors={}, firstCode={}, durationMs={}",
                source,
                errors.size(),
                errors.get(0).code(),
                durationMs);
        notifyFailed(source, durationMs, errors);
        return new CompileResult.Failure(errors);
    }

    // --- Listener notification helpers ---
    // Listener exceptions are caught and logged; they never change the compile result.

    private void notifyStarted(String source) {
        LOG.debug("compile.started: source={}", source);
        if (listener == null) return;
        try {
            listener.onCompileStarted(new CompilationListener.CompileStartedEvent(source));
        } catch (Exception e) {
            LOG.warn("CompilationListener.onCompileStarted failed", e);
        }
    }

    private void notifySucceeded(String source, long durationMs, int componentCount) {
        if (listener == null) return;
        try {
            listener.onCompileSucceeded(
                    new CompilationListener.CompileSucceededEvent(source, durationMs, componentCount));
        } catch (Exception e) {
            LOG.warn("CompilationListener.onCompileSucceeded failed", e);
        }
    }

    private void notifyFailed(String source, long durationMs, List<ConstelaError> errors) {
        if (listener == null) return;
        try {
            listener.onCompileFailed(new CompilationListener.CompileFailedEvent(
                    source, durationMs, errors.size(), errors.get(0).code()));
        } catch (Exception e) {
            LOG.warn("CompilationListener.onCompileFailed failed", e);
        }
    }
}
