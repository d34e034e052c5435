package io.constela.core.analyze;

import io.constela.core.error.ConstelaError;
import io.constela.core.model.Program;
import java.util.List;
import java.util.Objects;

/** Outcome of {@link Analyzer#analyze}: the validated program with its context, or every error found. */
public sealed interface AnalyzeResult permits AnalyzeResult.Success, AnalyzeResult.Failure {

    boolean isOk();

    record Success(Program program, AnalysisContext context) implements AnalyzeResult {
        public Success {
            Objects.requireNonNull(program, "program must not be null");
            Objects.requireNonNull(context, "context must not be null");
        }

        @Override
        public boolean isOk() {
            return true;
        }
    }

    /** At least one error; errors are in discovery order. */
    record Failure(List<ConstelaError> errors) implements AnalyzeResult {
        public Failure {
            errors = List.copyOf(errors);
            if (errors.isEmpty()) {
                throw new IllegalArgumentException("Failure requires at least one error");
            }
        }

        @Override
        public boolean isOk() {
            return false;
        }
    }
}
