package org.irnorm.compiler.ir;

import java.util.List;

/**
 * The pipeline operator, {@code left |> right}. {@code right} is a call whose first argument
 * is implied.
 *
 * @param left The piped value.
 * @param right The receiving call.
 * @param meta The node metadata.
 */
public record Pipe(IrNode left, IrNode right, NodeMeta meta) implements IrNode {

    public Pipe {
        meta = meta == null ? NodeMeta.EMPTY : meta;
    }

    @Override
    public List<IrNode> getChildren() {
        return Children.of(left, right);
    }

    @Override
    public IrNode reconstructWithChildren(List<IrNode> newChildren) {
        return new Pipe(newChildren.get(0), newChildren.get(1), meta);
    }

    @Override
    public IrNode withMeta(NodeMeta meta) {
        return new Pipe(left, right, meta);
    }
}
