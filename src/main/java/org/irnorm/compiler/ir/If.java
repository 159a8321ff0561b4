package org.irnorm.compiler.ir;

import java.util.List;

/**
 * A two-way conditional. {@code elseBranch} is {@code null} when the host code had no else.
 *
 * @param condition The condition.
 * @param thenBranch The branch taken when the condition holds.
 * @param elseBranch The other branch, or {@code null}.
 * @param meta The node metadata.
 */
public record If(IrNode condition, IrNode thenBranch, IrNode elseBranch, NodeMeta meta) implements IrNode {

    public If {
        meta = meta == null ? NodeMeta.EMPTY : meta;
    }

    public boolean hasElse() {
        return elseBranch != null;
    }

    @Override
    public List<IrNode> getChildren() {
        return Children.of(condition, thenBranch, elseBranch);
    }

    @Override
    public IrNode reconstructWithChildren(List<IrNode> newChildren) {
        return new If(newChildren.get(0), newChildren.get(1), newChildren.get(2), meta);
    }

    @Override
    public IrNode withMeta(NodeMeta meta) {
        return new If(condition, thenBranch, elseBranch, meta);
    }
}
