package org.irnorm.compiler.ir;

import java.util.List;

/**
 * A unary operator application.
 *
 * @param operator The operator ({@code -}, {@code not}, {@code !}).
 * @param operand The operand.
 * @param meta The node metadata.
 */
public record UnaryOp(String operator, IrNode operand, NodeMeta meta) implements IrNode {

    public UnaryOp {
        meta = meta == null ? NodeMeta.EMPTY : meta;
    }

    @Override
    public List<IrNode> getChildren() {
        return Children.of(operand);
    }

    @Override
    public IrNode reconstructWithChildren(List<IrNode> newChildren) {
        return new UnaryOp(operator, newChildren.get(0), meta);
    }

    @Override
    public IrNode withMeta(NodeMeta meta) {
        return new UnaryOp(operator, operand, meta);
    }
}
