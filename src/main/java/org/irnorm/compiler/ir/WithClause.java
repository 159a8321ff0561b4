package org.irnorm.compiler.ir;

import java.util.List;

/**
 * One {@code pattern <- value} step of a {@link With}.
 *
 * @param pattern The pattern the value must match to continue.
 * @param value The expression.
 * @param meta The node metadata.
 */
public record WithClause(IrPattern pattern, IrNode value, NodeMeta meta) implements IrNode {

    public WithClause {
        meta = meta == null ? NodeMeta.EMPTY : meta;
    }

    public WithClause withPattern(IrPattern newPattern) {
        return new WithClause(newPattern, value, meta);
    }

    @Override
    public List<IrNode> getChildren() {
        return Children.of(value);
    }

    @Override
    public IrNode reconstructWithChildren(List<IrNode> newChildren) {
        return new WithClause(pattern, newChildren.get(0), meta);
    }

    @Override
    public IrNode withMeta(NodeMeta meta) {
        return new WithClause(pattern, value, meta);
    }
}
