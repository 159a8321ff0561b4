package org.irnorm.compiler.ir;

import java.util.List;

/**
 * One {@code pattern [when guard] -> body} clause. Used by case, receive, rescue/catch and
 * the else part of {@code with}.
 *
 * @param pattern The clause pattern.
 * @param guard The guard expression, or {@code null}.
 * @param body The clause body.
 * @param meta The node metadata.
 */
public record CaseClause(IrPattern pattern, IrNode guard, IrNode body, NodeMeta meta) implements IrNode {

    public CaseClause {
        meta = meta == null ? NodeMeta.EMPTY : meta;
    }

    public CaseClause withPatternAndBody(IrPattern newPattern, IrNode newGuard, IrNode newBody) {
        return new CaseClause(newPattern, newGuard, newBody, meta);
    }

    @Override
    public List<IrNode> getChildren() {
        return Children.of(guard, body);
    }

    @Override
    public IrNode reconstructWithChildren(List<IrNode> newChildren) {
        return new CaseClause(pattern, newChildren.get(0), newChildren.get(1), meta);
    }

    @Override
    public IrNode withMeta(NodeMeta meta) {
        return new CaseClause(pattern, guard, body, meta);
    }
}
