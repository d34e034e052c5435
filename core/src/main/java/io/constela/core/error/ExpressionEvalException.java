package io.constela.core.error;

/**
 * Thrown when the evaluator meets a case that lowering should have made impossible, e.g. an
 * unknown binary operator. Data-level problems (missing keys, wrong types) never throw; they yield
 * {@code undefined}.
 */
public final class ExpressionEvalException extends ConstelaException {

    private static final long serialVersionUID = 1L;

    public ExpressionEvalException(String message) {
        super(message, Phase.EVALUATION);
    }

    public ExpressionEvalException(String message, Throwable cause) {
        super(message, cause, Phase.EVALUATION);
    }
}
