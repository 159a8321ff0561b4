package org.irnorm.compiler.ir;

import java.util.List;

/**
 * A tuple literal.
 *
 * @param elements The elements.
 * @param meta The node metadata.
 */
public record TupleLit(List<IrNode> elements, NodeMeta meta) implements IrNode {

    public TupleLit {
        elements = List.copyOf(elements);
        meta = meta == null ? NodeMeta.EMPTY : meta;
    }

    @Override
    public List<IrNode> getChildren() {
        return elements;
    }

    @Override
    public IrNode reconstructWithChildren(List<IrNode> newChildren) {
        return new TupleLit(newChildren, meta);
    }

    @Override
    public IrNode withMeta(NodeMeta meta) {
        return new TupleLit(elements, meta);
    }
}
