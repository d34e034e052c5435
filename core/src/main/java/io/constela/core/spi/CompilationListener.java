package io.constela.core.spi;

import io.constela.core.error.ErrorCode;

/**
 * SPI for observing compilations, for example to feed metrics or build tooling.
 *
 * <p>All methods receive immutable event objects. Implementations must be thread-safe and
 * non-blocking. Exceptions thrown by listeners are caught by the compiler and logged; they do not
 * affect the compile result.
 */
public interface CompilationListener {

    /**
     * Called before schema validation starts.
     *
     * @param event contains the source label
     */
    void onCompileStarted(CompileStartedEvent event);

    /**
     * Called when a program compiled without errors.
     *
     * @param event contains source, durationMs, componentCount
     */
    void onCompileSucceeded(CompileSucceededEvent event);

    /**
     * Called when schema validation, parsing or analysis rejected the program.
     *
     * @param event contains source, durationMs, errorCount, firstErrorCode
     */
    void onCompileFailed(CompileFailedEvent event);

    // --- Event records ---

    /** Event emitted when a compilation starts. */
    record CompileStartedEvent(String source) {}

    /** Event emitted when a compilation produced a compiled program. */
    record CompileSucceededEvent(String source, long durationMs, int componentCount) {}

    /** Event emitted when a compilation was rejected. */
    record CompileFailedEvent(String source, long durationMs, int errorCount, ErrorCode firstErrorCode) {}
}
