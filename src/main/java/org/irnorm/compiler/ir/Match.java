package org.irnorm.compiler.ir;

import java.util.List;

/**
 * A binding, {@code pattern = value}.
 *
 * @param pattern The pattern on the left.
 * @param value The matched expression.
 * @param meta The node metadata.
 */
public record Match(IrPattern pattern, IrNode value, NodeMeta meta) implements IrNode {

    public Match {
        meta = meta == null ? NodeMeta.EMPTY : meta;
    }

    public Match withPattern(IrPattern newPattern) {
        return new Match(newPattern, value, meta);
    }

    @Override
    public List<IrNode> getChildren() {
        return Children.of(value);
    }

    @Override
    public IrNode reconstructWithChildren(List<IrNode> newChildren) {
        return new Match(pattern, newChildren.get(0), meta);
    }

    @Override
    public IrNode withMeta(NodeMeta meta) {
        return new Match(pattern, value, meta);
    }
}
