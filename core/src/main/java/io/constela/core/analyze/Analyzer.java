package io.constela.core.analyze;

import static io.constela.core.analyze.AnalysisSession.path;

import io.constela.core.error.ConstelaError;
import io.constela.core.error.ErrorCode;
import io.constela.core.model.ActionDefinition;
import io.constela.core.model.ComponentDef;
import io.constela.core.model.DataSource;
import io.constela.core.model.Expression;
import io.constela.core.model.LifecycleHooks;
import io.constela.core.model.Program;
import io.constela.core.model.RouteDefinition;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Semantic analysis of a parsed {@link Program}. Every check runs to completion and all errors are
 * returned together; analysis never throws for an invalid program.
 *
 * <p>Instances are stateless and thread-safe. Each call works on its own {@link AnalysisSession}.
 */
public final class Analyzer {

    private static final Logger LOG = LoggerFactory.getLogger(Analyzer.class);

    private final AnalysisOptions options;

    public Analyzer() {
        this(AnalysisOptions.DEFAULT);
    }

    public Analyzer(AnalysisOptions options) {
        this.options = options;
    }

    public AnalyzeResult analyze(Program program) {
        AnalysisContext context = ContextCollector.collect(program);
        AnalysisSession session = new AnalysisSession(program, context, options);
        ExpressionValidator expressions = new ExpressionValidator(session);
        ActionStepValidator steps = new ActionStepValidator(session, expressions);
        ViewNodeValidator views = new ViewNodeValidator(session, expressions);

        List<ConstelaError> errors = new ArrayList<>();
        if (!Program.SUPPORTED_VERSION.equals(program.version())) {
            errors.add(ConstelaError.of(
                    ErrorCode.UNSUPPORTED_VERSION,
                    "Unsupported version: '" + program.version() + "'. Supported versions: "
                            + Program.SUPPORTED_VERSION,
                    "/version"));
        }
        errors.addAll(duplicateActions(program));
        for (int i = 0; i < program.actions().size(); i++) {
            errors.addAll(steps.validateAction(program.actions().get(i), path("/actions", i)));
        }
        errors.addAll(lifecycle(session, program.lifecycle()));
        if (program.route() != null) {
            errors.addAll(route(expressions, program.route()));
        }
        if (program.data() != null) {
            errors.addAll(dataSources(program.data()));
        }
        errors.addAll(views.validate(program.view(), "/view", Scope.root(program.isLayout())));
        if (program.isLayout()) {
            errors.addAll(LayoutSlotValidator.validate(program.view()));
        }
        for (Map.Entry<String, ComponentDef> entry : program.components().entrySet()) {
            errors.addAll(component(entry.getKey(), entry.getValue(), views, steps));
        }
        errors.addAll(ComponentGraphAnalyzer.detectCycles(program.components()));

        if (!errors.isEmpty()) {
            LOG.debug("Analysis found {} error(s)", errors.size());
            return new AnalyzeResult.Failure(errors);
        }
        return new AnalyzeResult.Success(program, context);
    }

    private static List<ConstelaError> duplicateActions(Program program) {
        List<ConstelaError> errors = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Set<String> reported = new HashSet<>();
        List<ActionDefinition> actions = program.actions();
        for (int i = 0; i < actions.size(); i++) {
            String name = actions.get(i).name();
            if (!seen.add(name) && reported.add(name)) {
                errors.add(ConstelaError.of(
                        ErrorCode.DUPLICATE_ACTION,
                        "Duplicate action name: '" + name + "' is already defined",
                        path("/actions", i, "name")));
            }
        }
        return errors;
    }

    private static List<ConstelaError> lifecycle(AnalysisSession session, LifecycleHooks hooks) {
        Map<String, String> named = new LinkedHashMap<>();
        named.put("onMount", hooks.onMount());
        named.put("onUnmount", hooks.onUnmount());
        named.put("onRouteEnter", hooks.onRouteEnter());
        named.put("onRouteLeave", hooks.onRouteLeave());
        List<ConstelaError> errors = new ArrayList<>();
        named.forEach((hook, action) -> {
            if (action != null && !session.context().hasAction(action)) {
                errors.add(session.referenceError(
                        ErrorCode.UNDEFINED_ACTION,
                        "Undefined action reference: '" + action + "' is not defined in actions",
                        path("/lifecycle", hook),
                        action,
                        session.context().actionNames()));
            }
        });
        return errors;
    }

    private static List<ConstelaError> route(ExpressionValidator expressions, RouteDefinition route) {
        Scope scope = Scope.root(false);
        List<ConstelaError> errors = new ArrayList<>();
        if (route.title() != null) {
            errors.addAll(expressions.validate(route.title(), "/route/title", ValidationMode.FULL, scope));
        }
        for (Map.Entry<String, Expression> meta : route.meta().entrySet()) {
            errors.addAll(expressions.validate(
                    meta.getValue(), path("/route/meta", meta.getKey()), ValidationMode.FULL, scope));
        }
        if (route.canonical() != null) {
            errors.addAll(expressions.validate(route.canonical(), "/route/canonical", ValidationMode.FULL, scope));
        }
        if (route.jsonLd() != null) {
            for (Map.Entry<String, Expression> property : route.jsonLd().properties().entrySet()) {
                errors.addAll(expressions.validate(
                        property.getValue(),
                        path("/route/jsonLd/properties", property.getKey()),
                        ValidationMode.FULL,
                        scope));
            }
        }
        return errors;
    }

    private static List<ConstelaError> dataSources(Map<String, DataSource> data) {
        List<ConstelaError> errors = new ArrayList<>();
        data.forEach((name, source) -> {
            String problem = switch (source.type()) {
                case "glob" -> source.pattern() == null ? "glob data source requires 'pattern'" : null;
                case "file" -> source.path() == null ? "file data source requires 'path'" : null;
                case "api" -> source.url() == null ? "api data source requires 'url'" : null;
                default -> "unknown type '" + source.type() + "'; expected glob, file or api";
            };
            if (problem != null) {
                errors.add(ConstelaError.of(
                        ErrorCode.INVALID_DATA_SOURCE,
                        "Invalid data source '" + name + "': " + problem,
                        path("/data", name)));
            }
        });
        return errors;
    }

    private static List<ConstelaError> component(
            String name, ComponentDef def, ViewNodeValidator views, ActionStepValidator steps) {
        String base = path("/components", name);
        Scope scope = Scope.of(name, def);
        List<ConstelaError> errors = new ArrayList<>(views.validate(def.view(), path(base, "view"), scope));
        for (int i = 0; i < def.localActions().size(); i++) {
            errors.addAll(steps.validateLocalAction(
                    def.localActions().get(i), path(base, "localActions", i), scope, def.localState()));
        }
        return errors;
    }
}
