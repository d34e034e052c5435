package io.constela.core.error;

/**
 * Abstract base for all constela exceptions. Never thrown directly; the concrete subclasses are
 * {@link ProgramParseException}, {@link ProgramAnalysisException} or {@link
 * ExpressionEvalException}.
 *
 * <p>Diagnostics about the program itself (undefined names, wrong operations, missing props) are
 * reported as {@link ConstelaError} values, not as exceptions.
 */
public abstract class ConstelaException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        ANALYZE,
        EVALUATION
    }

    private final Phase phase;

    protected ConstelaException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected ConstelaException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
