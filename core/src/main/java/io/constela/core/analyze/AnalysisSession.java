package io.constela.core.analyze;

import io.constela.core.error.ConstelaError;
import io.constela.core.error.ErrorCode;
import io.constela.core.model.ComponentDef;
import io.constela.core.model.Program;
import io.constela.core.model.StateField;
import io.constela.core.model.StylePreset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Everything one analysis run reads: the program, its collected names and the diagnostic options.
 * A fresh session is created per {@link Analyzer#analyze} call and shared by the validators of
 * that call only.
 */
final class AnalysisSession {

    private final Program program;
    private final AnalysisContext context;
    private final AnalysisOptions options;

    AnalysisSession(Program program, AnalysisContext context, AnalysisOptions options) {
        this.program = program;
        this.context = context;
        this.options = options;
    }

    Program program() {
        return program;
    }

    AnalysisContext context() {
        return context;
    }

    boolean hasRoute() {
        return program.route() != null;
    }

    boolean hasImports() {
        return program.imports() != null;
    }

    boolean hasData() {
        return program.data() != null;
    }

    StateField stateField(String name) {
        return program.state().get(name);
    }

    StylePreset style(String name) {
        return program.styles().get(name);
    }

    ComponentDef component(String name) {
        return program.components().get(name);
    }

    /**
     * Builds a reference error for {@code name}, attaching the closest candidate as a suggestion and,
     * when enabled, the sorted candidate list as {@code context.availableNames}.
     */
    ConstelaError referenceError(
            ErrorCode code, String message, String path, String name, Collection<String> candidates) {
        ConstelaError error = ConstelaError.of(code, message, path);
        Optional<String> suggestion = NameSuggester.closest(name, candidates, options.maxSuggestionDistance());
        if (suggestion.isPresent()) {
            error = error.withSuggestion(NameSuggester.didYouMean(suggestion.get()));
        }
        if (options.includeAvailableNames()) {
            List<String> available = new ArrayList<>(new LinkedHashSet<>(candidates));
            Collections.sort(available);
            error = error.withContext("availableNames", List.copyOf(available));
        }
        return error;
    }

    /** Joins JSON-pointer segments onto {@code base}. */
    static String path(String base, Object... segments) {
        StringBuilder sb = new StringBuilder(base);
        for (Object segment : segments) {
            sb.append('/').append(segment);
        }
        return sb.toString();
    }
}
