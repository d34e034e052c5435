package io.constela.core.transform;

import com.fasterxml.jackson.databind.node.TextNode;
import io.constela.core.compiled.CompiledExpression;
import io.constela.core.compiled.CompiledNode;
import io.constela.core.compiled.CompiledPropValue;
import io.constela.core.model.ComponentDef;
import io.constela.core.model.PropValue;
import io.constela.core.model.ViewNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lowers view nodes. Component invocations are inlined: their props become the params of the
 * expansion and their children fill the definition's {@code slot}.
 */
final class ViewTransformer {

    private ViewTransformer() {
        // utility class
    }

    static CompiledNode transform(ViewNode node, TransformContext ctx) {
        if (node == null) {
            return null;
        }
        return switch (node.kind()) {
            case ELEMENT -> {
                ViewNode.Element element = (ViewNode.Element) node;
                yield new CompiledNode.Element(
                        element.tag(),
                        element.ref(),
                        props(element.props(), ctx),
                        flattenSlotChildren(element.children(), ctx));
            }
            case TEXT -> new CompiledNode.Text(ExpressionTransformer.transform(((ViewNode.Text) node).value(), ctx));
            case IF -> {
                ViewNode.If branch = (ViewNode.If) node;
                yield new CompiledNode.If(
                        ExpressionTransformer.transform(branch.condition(), ctx),
                        transform(branch.then(), ctx),
                        transform(branch.otherwise(), ctx));
            }
            case EACH -> {
                ViewNode.Each each = (ViewNode.Each) node;
                yield new CompiledNode.Each(
                        ExpressionTransformer.transform(each.items(), ctx),
                        each.as(),
                        each.index(),
                        ExpressionTransformer.transform(each.key(), ctx),
                        transform(each.body(), ctx));
            }
            case COMPONENT -> expand((ViewNode.Component) node, ctx);
            case MARKDOWN -> new CompiledNode.Markdown(
                    ExpressionTransformer.transform(((ViewNode.Markdown) node).content(), ctx));
            case CODE -> {
                ViewNode.Code code = (ViewNode.Code) node;
                yield new CompiledNode.Code(
                        ExpressionTransformer.transform(code.language(), ctx),
                        ExpressionTransformer.transform(code.content(), ctx));
            }
            case SLOT -> slot((ViewNode.Slot) node, ctx);
            case PORTAL -> {
                ViewNode.Portal portal = (ViewNode.Portal) node;
                yield new CompiledNode.Portal(portal.target(), transformAll(portal.children(), ctx));
            }
            case ISLAND -> {
                ViewNode.Island island = (ViewNode.Island) node;
                yield new CompiledNode.Island(
                        island.id(),
                        island.strategy(),
                        island.strategyOptions(),
                        transform(island.content(), ctx),
                        island.state(),
                        StepTransformer.transformActions(island.actions()));
            }
            case SUSPENSE -> {
                ViewNode.Suspense suspense = (ViewNode.Suspense) node;
                yield new CompiledNode.Suspense(
                        suspense.id(), transform(suspense.fallback(), ctx), transform(suspense.content(), ctx));
            }
            case ERROR_BOUNDARY -> {
                ViewNode.ErrorBoundary boundary = (ViewNode.ErrorBoundary) node;
                yield new CompiledNode.ErrorBoundary(
                        transform(boundary.fallback(), ctx), transform(boundary.content(), ctx));
            }
        };
    }

    private static CompiledNode expand(ViewNode.Component invocation, TransformContext ctx) {
        ComponentDef def = ctx.components().get(invocation.name());
        if (def == null) {
            return CompiledNode.Element.of("div");
        }
        // props and slot content belong to the caller, so they are lowered in the caller's context
        Map<String, CompiledPropValue> params = props(invocation.props(), ctx);
        List<CompiledNode> children = transformAll(invocation.children(), ctx);
        CompiledNode expanded = transform(def.view(), ctx.expand(params, children));
        if (def.localState().isEmpty()) {
            return expanded;
        }
        return new CompiledNode.LocalState(
                def.localState(), StepTransformer.transformActions(def.localActions()), expanded);
    }

    private static CompiledNode slot(ViewNode.Slot slot, TransformContext ctx) {
        if (!ctx.insideComponent() && ctx.preserveSlots()) {
            return new CompiledNode.Slot(slot.name());
        }
        List<CompiledNode> children = ctx.currentChildren();
        if (children.isEmpty()) {
            return new CompiledNode.Text(new CompiledExpression.Lit(TextNode.valueOf("")));
        }
        if (children.size() == 1) {
            return children.get(0);
        }
        return new CompiledNode.Element("span", null, null, children);
    }

    /** Lowers element children, splicing slot content in place of each {@code slot}. */
    private static List<CompiledNode> flattenSlotChildren(List<ViewNode> children, TransformContext ctx) {
        List<CompiledNode> out = new ArrayList<>();
        for (ViewNode child : children) {
            if (child.kind() == ViewNode.Kind.SLOT && (ctx.insideComponent() || !ctx.preserveSlots())) {
                out.addAll(ctx.currentChildren());
            } else {
                out.add(transform(child, ctx));
            }
        }
        return out;
    }

    private static Map<String, CompiledPropValue> props(Map<String, PropValue> props, TransformContext ctx) {
        Map<String, CompiledPropValue> out = new LinkedHashMap<>();
        props.forEach((name, value) -> out.put(name, ExpressionTransformer.transformProp(value, ctx)));
        return out;
    }

    private static List<CompiledNode> transformAll(List<ViewNode> nodes, TransformContext ctx) {
        List<CompiledNode> out = new ArrayList<>(nodes.size());
        for (ViewNode node : nodes) {
            out.add(transform(node, ctx));
        }
        return out;
    }
}
