package io.constela.core.engine;

import io.constela.core.compiled.CompiledProgram;
import io.constela.core.error.ConstelaError;
import java.util.List;
import java.util.Objects;

/** Outcome of {@link ConstelaCompiler#compile}: a compiled program or the errors that prevented it. */
public sealed interface CompileResult permits CompileResult.Success, CompileResult.Failure {

    boolean isOk();

    /**
     * @param program  the compiled program
     * @param warnings non-blocking findings such as accessibility issues, never null
     */
    record Success(CompiledProgram program, List<ConstelaError> warnings) implements CompileResult {
        public Success {
            Objects.requireNonNull(program, "program must not be null");
            warnings = warnings == null ? List.of() : List.copyOf(warnings);
        }

        public Success(CompiledProgram program) {
            this(program, List.of());
        }

        @Override
        public boolean isOk() {
            return true;
        }
    }

    record Failure(List<ConstelaError> errors) implements CompileResult {
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
