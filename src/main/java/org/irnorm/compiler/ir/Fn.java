package org.irnorm.compiler.ir;

import java.util.List;

/**
 * A multi-clause anonymous function.
 *
 * @param clauses The clauses.
 * @param meta The node metadata.
 */
public record Fn(List<FnClause> clauses, NodeMeta meta) implements IrNode {

    public Fn {
        clauses = List.copyOf(clauses);
        meta = meta == null ? NodeMeta.EMPTY : meta;
    }

    @Override
    public List<IrNode> getChildren() {
        return List.copyOf(clauses);
    }

    @Override
    public IrNode reconstructWithChildren(List<IrNode> newChildren) {
        return new Fn(Children.slice(newChildren, 0, newChildren.size(), FnClause.class), meta);
    }

    @Override
    public IrNode withMeta(NodeMeta meta) {
        return new Fn(clauses, meta);
    }
}
