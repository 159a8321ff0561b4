package org.irnorm.compiler.ir;

import java.util.List;

/**
 * One clause of an anonymous function.
 *
 * @param params The parameter patterns.
 * @param guard The guard, or {@code null}.
 * @param body The clause body.
 * @param meta The node metadata.
 */
public record FnClause(List<IrPattern> params, IrNode guard, IrNode body, NodeMeta meta) implements IrNode {

    public FnClause {
        params = List.copyOf(params);
        meta = meta == null ? NodeMeta.EMPTY : meta;
    }

    public FnClause withParamsAndBody(List<IrPattern> newParams, IrNode newGuard, IrNode newBody) {
        return new FnClause(newParams, newGuard, newBody, meta);
    }

    @Override
    public List<IrNode> getChildren() {
        return Children.of(guard, body);
    }

    @Override
    public IrNode reconstructWithChildren(List<IrNode> newChildren) {
        return new FnClause(params, newChildren.get(0), newChildren.get(1), meta);
    }

    @Override
    public IrNode withMeta(NodeMeta meta) {
        return new FnClause(params, guard, body, meta);
    }
}
