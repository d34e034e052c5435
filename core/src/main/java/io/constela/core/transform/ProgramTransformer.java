package io.constela.core.transform;

import com.fasterxml.jackson.databind.JsonNode;
import io.constela.core.compiled.CompiledExpression;
import io.constela.core.compiled.CompiledProgram;
import io.constela.core.compiled.CompiledRoute;
import io.constela.core.model.Expression;
import io.constela.core.model.Program;
import io.constela.core.model.RouteDefinition;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lowers an analyzed {@link Program} into a {@link CompiledProgram}: components are inlined,
 * params substituted, slots filled and actions keyed by name.
 *
 * <p>The input must have passed analysis. Invalid input is not detected here: a missing
 * component lowers to an empty {@code div} and a missing param to {@code null}.
 */
public final class ProgramTransformer {

    private ProgramTransformer() {
        // utility class
    }

    public static CompiledProgram transform(Program program) {
        return transform(program, null);
    }

    /**
     * @param importData resolved import and data values embedded as {@code importData}; null or
     *     empty means none
     */
    public static CompiledProgram transform(Program program, Map<String, JsonNode> importData) {
        TransformContext ctx = TransformContext.forProgram(program.components(), program.isLayout());
        return new CompiledProgram(
                Program.SUPPORTED_VERSION,
                program.route() == null ? null : route(program.route(), ctx),
                program.lifecycle().isEmpty() ? null : program.lifecycle(),
                program.state(),
                StepTransformer.transformActions(program.actions()),
                ViewTransformer.transform(program.view(), ctx),
                importData);
    }

    private static CompiledRoute route(RouteDefinition route, TransformContext ctx) {
        Map<String, CompiledExpression> meta = new LinkedHashMap<>();
        route.meta().forEach((key, value) -> meta.put(key, ExpressionTransformer.transform(value, ctx)));
        CompiledRoute.JsonLd jsonLd = null;
        if (route.jsonLd() != null) {
            Map<String, CompiledExpression> properties = new LinkedHashMap<>();
            for (Map.Entry<String, Expression> property : route.jsonLd().properties().entrySet()) {
                properties.put(property.getKey(), ExpressionTransformer.transform(property.getValue(), ctx));
            }
            jsonLd = new CompiledRoute.JsonLd(route.jsonLd().type(), properties);
        }
        return new CompiledRoute(
                route.path(),
                RouteDefinition.extractParams(route.path()),
                ExpressionTransformer.transform(route.title(), ctx),
                route.layout(),
                meta,
                ExpressionTransformer.transform(route.canonical(), ctx),
                jsonLd);
    }
}
