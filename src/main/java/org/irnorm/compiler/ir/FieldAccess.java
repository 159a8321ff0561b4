package org.irnorm.compiler.ir;

import java.util.List;

/**
 * A field access, {@code receiver.field}.
 *
 * @param receiver The accessed value.
 * @param field The field name.
 * @param meta The node metadata.
 */
public record FieldAccess(IrNode receiver, String field, NodeMeta meta) implements IrNode {

    public FieldAccess {
        meta = meta == null ? NodeMeta.EMPTY : meta;
    }

    @Override
    public List<IrNode> getChildren() {
        return Children.of(receiver);
    }

    @Override
    public IrNode reconstructWithChildren(List<IrNode> newChildren) {
        return new FieldAccess(newChildren.get(0), field, meta);
    }

    @Override
    public IrNode withMeta(NodeMeta meta) {
        return new FieldAccess(receiver, field, meta);
    }
}
