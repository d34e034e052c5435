package io.constela.core.error;

/**
 * Thrown when program text cannot be read into the AST: malformed JSON/YAML, a missing
 * discriminant or an unrecognized {@code expr}/{@code kind}/{@code do} tag. Carries the JSON
 * pointer of the offending node in {@link #source()}.
 */
public final class ProgramParseException extends ConstelaException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public ProgramParseException(String message, String source) {
        super(message, Phase.LOAD);
        this.source = source;
    }

    public ProgramParseException(String message, Throwable cause, String source) {
        super(message, cause, Phase.LOAD);
        this.source = source;
    }

    /** JSON pointer of the node where parsing failed; empty for the document itself. */
    public String source() {
        return source;
    }
}
