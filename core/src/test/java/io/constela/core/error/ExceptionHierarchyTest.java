package io.constela.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Exception hierarchy")
class ExceptionHierarchyTest {

    @Test
    @DisplayName("each concrete exception reports its phase")
    void phases() {
        assertThat(new ProgramParseException("bad", "/view").phase()).isEqualTo(ConstelaException.Phase.LOAD);
        assertThat(new ProgramAnalysisException(List.of(ConstelaError.of(ErrorCode.SCHEMA_ERROR, "bad", "/")))
                        .phase())
                .isEqualTo(ConstelaException.Phase.ANALYZE);
        assertThat(new ExpressionEvalException("bad").phase()).isEqualTo(ConstelaException.Phase.EVALUATION);
    }

    @Test
    @DisplayName("parse exceptions keep the pointer and the cause")
    void parseSource() {
        IllegalStateException cause = new IllegalStateException("eof");
        ProgramParseException e = new ProgramParseException("Invalid program JSON", cause, "/");

        assertThat(e.source()).isEqualTo("/");
        assertThat(e.getCause()).isSameAs(cause);
        assertThat(e.detail()).isEqualTo("Invalid program JSON");
    }

    @Test
    @DisplayName("a single analysis error is summarized without a count")
    void singleSummary() {
        ProgramAnalysisException e = new ProgramAnalysisException(
                List.of(ConstelaError.of(ErrorCode.DUPLICATE_ACTION, "Duplicate action name 'save'", "/actions/1")));

        assertThat(e.getMessage()).isEqualTo("DUPLICATE_ACTION at /actions/1: Duplicate action name 'save'");
    }

    @Test
    @DisplayName("the error list is copied")
    void errorsCopied() {
        List<ConstelaError> errors = new ArrayList<>();
        errors.add(ConstelaError.of(ErrorCode.UNDEFINED_VAR, "x", "/view"));
        ProgramAnalysisException e = new ProgramAnalysisException(errors);
        errors.clear();

        assertThat(e.errors()).hasSize(1);
    }

    @Test
    @DisplayName("error JSON leaves out absent suggestion and context")
    void errorJson() {
        ConstelaError plain = ConstelaError.of(ErrorCode.UNDEFINED_STATE, "msg", "/view/value");
        ConstelaError rich = plain.withSuggestion("Did you mean 'count'?")
                .withContext("availableNames", List.of("count"));

        assertThat(plain.toJson().has("suggestion")).isFalse();
        assertThat(plain.toJson().has("context")).isFalse();
        assertThat(rich.toJson().get("suggestion").asText()).isEqualTo("Did you mean 'count'?");
        assertThat(rich.toJson().at("/context/availableNames/0").asText()).isEqualTo("count");
        assertThat(rich.toJson().get("code").asText()).isEqualTo("UNDEFINED_STATE");
    }
}
