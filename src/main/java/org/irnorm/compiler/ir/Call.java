package org.irnorm.compiler.ir;

import java.util.List;

/**
 * A call of a local (or imported) function.
 *
 * @param function The function name.
 * @param args The arguments.
 * @param meta The node metadata.
 */
public record Call(String function, List<IrNode> args, NodeMeta meta) implements IrNode {

    public Call {
        args = List.copyOf(args);
        meta = meta == null ? NodeMeta.EMPTY : meta;
    }

    @Override
    public List<IrNode> getChildren() {
        return args;
    }

    @Override
    public IrNode reconstructWithChildren(List<IrNode> newChildren) {
        return new Call(function, newChildren, meta);
    }

    @Override
    public IrNode withMeta(NodeMeta meta) {
        return new Call(function, args, meta);
    }
}
