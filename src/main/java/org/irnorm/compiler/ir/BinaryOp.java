package org.irnorm.compiler.ir;

import java.util.List;

/**
 * A binary operator application.
 *
 * @param operator The operator as written in the target ({@code +}, {@code <>}, {@code ==}, {@code and}, ...).
 * @param left The left operand.
 * @param right The right operand.
 * @param meta The node metadata.
 */
public record BinaryOp(String operator, IrNode left, IrNode right, NodeMeta meta) implements IrNode {

    public BinaryOp {
        meta = meta == null ? NodeMeta.EMPTY : meta;
    }

    @Override
    public List<IrNode> getChildren() {
        return Children.of(left, right);
    }

    @Override
    public IrNode reconstructWithChildren(List<IrNode> newChildren) {
        return new BinaryOp(operator, newChildren.get(0), newChildren.get(1), meta);
    }

    @Override
    public IrNode withMeta(NodeMeta meta) {
        return new BinaryOp(operator, left, right, meta);
    }
}
