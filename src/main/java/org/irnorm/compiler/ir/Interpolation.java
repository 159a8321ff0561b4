package org.irnorm.compiler.ir;

import java.util.List;

/**
 * A string with interpolated expressions. Parts are STRING literals or arbitrary expressions,
 * concatenated in order.
 *
 * @param parts The parts.
 * @param meta The node metadata.
 */
public record Interpolation(List<IrNode> parts, NodeMeta meta) implements IrNode {

    public Interpolation {
        parts = List.copyOf(parts);
        meta = meta == null ? NodeMeta.EMPTY : meta;
    }

    @Override
    public List<IrNode> getChildren() {
        return parts;
    }

    @Override
    public IrNode reconstructWithChildren(List<IrNode> newChildren) {
        return new Interpolation(newChildren, meta);
    }

    @Override
    public IrNode withMeta(NodeMeta meta) {
        return new Interpolation(parts, meta);
    }
}
