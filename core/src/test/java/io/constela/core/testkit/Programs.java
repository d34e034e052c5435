package io.constela.core.testkit;

import io.constela.core.analyze.AnalyzeResult;
import io.constela.core.analyze.Analyzer;
import io.constela.core.error.ConstelaError;
import io.constela.core.model.Program;
import io.constela.core.parser.ProgramParser;
import java.util.List;

/**
 * Builds program documents for tests. Sections are given as JSON text and spliced into a minimal
 * version 1.0 envelope.
 */
public final class Programs {

    public static final String EMPTY_VIEW = "{\"kind\": \"element\", \"tag\": \"div\"}";

    private Programs() {}

    /** A program with the given state object, actions array and view node. */
    public static String program(String state, String actions, String view) {
        return program(state, actions, view, "");
    }

    /**
     * A program with extra top-level members, given as a JSON fragment such as
     * {@code "components": {...}}.
     */
    public static String program(String state, String actions, String view, String extra) {
        return """
                {
                  "version": "1.0",
                  "state": %s,
                  "actions": %s,
                  "view": %s%s
                }
                """
                .formatted(state, actions, view, extra.isBlank() ? "" : ",\n" + extra);
    }

    public static Program parse(String json) {
        return ProgramParser.parse(json);
    }

    /** Analyzes the document and returns its errors, empty when analysis succeeded. */
    public static List<ConstelaError> errors(String json) {
        AnalyzeResult result = new Analyzer().analyze(parse(json));
        return result instanceof AnalyzeResult.Failure failure ? failure.errors() : List.of();
    }
}
