package org.irnorm.compiler.ir;

import java.util.List;

/**
 * An indexed access, {@code receiver[key]}.
 *
 * @param receiver The accessed value.
 * @param key The key expression.
 * @param meta The node metadata.
 */
public record IndexAccess(IrNode receiver, IrNode key, NodeMeta meta) implements IrNode {

    public IndexAccess {
        meta = meta == null ? NodeMeta.EMPTY : meta;
    }

    @Override
    public List<IrNode> getChildren() {
        return Children.of(receiver, key);
    }

    @Override
    public IrNode reconstructWithChildren(List<IrNode> newChildren) {
        return new IndexAccess(newChildren.get(0), newChildren.get(1), meta);
    }

    @Override
    public IrNode withMeta(NodeMeta meta) {
        return new IndexAccess(receiver, key, meta);
    }
}
