package org.irnorm.compiler.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * A comprehension. Generator bindings are visible to later generators, to the filters and
 * to the body.
 *
 * @param generators The generators.
 * @param filters Boolean filter expressions.
 * @param into The collectable target, or {@code null}.
 * @param body The element body.
 * @param meta The node metadata.
 */
public record For(List<ForGenerator> generators, List<IrNode> filters, IrNode into, IrNode body, NodeMeta meta)
        implements IrNode {

    public For {
        generators = List.copyOf(generators);
        filters = List.copyOf(filters);
        meta = meta == null ? NodeMeta.EMPTY : meta;
    }

    @Override
    public List<IrNode> getChildren() {
        List<IrNode> children = new ArrayList<>(generators.size() + filters.size() + 2);
        children.addAll(generators);
        children.addAll(filters);
        children.add(into);
        children.add(body);
        return children;
    }

    @Override
    public IrNode reconstructWithChildren(List<IrNode> newChildren) {
        int g = generators.size();
        int f = filters.size();
        return new For(
                Children.slice(newChildren, 0, g, ForGenerator.class),
                newChildren.subList(g, g + f),
                newChildren.get(g + f),
                newChildren.get(g + f + 1),
                meta);
    }

    @Override
    public IrNode withMeta(NodeMeta meta) {
        return new For(generators, filters, into, body, meta);
    }
}
