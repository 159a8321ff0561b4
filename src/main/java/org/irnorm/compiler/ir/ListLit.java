package org.irnorm.compiler.ir;

import java.util.List;

/**
 * A list literal, optionally with a cons tail ({@code [a, b | tail]}).
 *
 * @param elements The leading elements.
 * @param tail The tail expression, or {@code null} for a proper list.
 * @param meta The node metadata.
 */
public record ListLit(List<IrNode> elements, IrNode tail, NodeMeta meta) implements IrNode {

    public ListLit {
        elements = List.copyOf(elements);
        meta = meta == null ? NodeMeta.EMPTY : meta;
    }

    @Override
    public List<IrNode> getChildren() {
        return Children.concat(elements, tail);
    }

    @Override
    public IrNode reconstructWithChildren(List<IrNode> newChildren) {
        int n = newChildren.size() - 1;
        return new ListLit(newChildren.subList(0, n), newChildren.get(n), meta);
    }

    @Override
    public IrNode withMeta(NodeMeta meta) {
        return new ListLit(elements, tail, meta);
    }
}
