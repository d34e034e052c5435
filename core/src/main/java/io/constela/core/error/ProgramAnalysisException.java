package io.constela.core.error;

import java.util.List;

/** Thrown by {@code ConstelaCompiler.compileOrThrow} when analysis reports one or more errors. */
public final class ProgramAnalysisException extends ConstelaException {

    private static final long serialVersionUID = 1L;

    private final transient List<ConstelaError> errors;

    public ProgramAnalysisException(List<ConstelaError> errors) {
        super(summarize(errors), Phase.ANALYZE);
        this.errors = List.copyOf(errors);
    }

    /** All errors reported by analysis, in discovery order. */
    public List<ConstelaError> errors() {
        return errors;
    }

    private static String summarize(List<ConstelaError> errors) {
        if (errors.isEmpty()) {
            return "Program analysis failed";
        }
        ConstelaError first = errors.get(0);
        String head = first.code() + " at " + first.path() + ": " + first.message();
        return errors.size() == 1 ? head : head + " (and " + (errors.size() - 1) + " more)";
    }
}
