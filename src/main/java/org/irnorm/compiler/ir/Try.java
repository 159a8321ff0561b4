package org.irnorm.compiler.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * A try expression with rescue and catch clauses and an optional after body.
 *
 * @param body The protected body.
 * @param rescueClauses Exception-handling clauses.
 * @param catchClauses Throw/exit-handling clauses.
 * @param afterBody The body always run at the end, or {@code null}.
 * @param meta The node metadata.
 */
public record Try(IrNode body, List<CaseClause> rescueClauses, List<CaseClause> catchClauses, IrNode afterBody,
                  NodeMeta meta) implements IrNode {

    public Try {
        rescueClauses = List.copyOf(rescueClauses);
        catchClauses = List.copyOf(catchClauses);
        meta = meta == null ? NodeMeta.EMPTY : meta;
    }

    @Override
    public List<IrNode> getChildren() {
        List<IrNode> children = new ArrayList<>(rescueClauses.size() + catchClauses.size() + 2);
        children.add(body);
        children.addAll(rescueClauses);
        children.addAll(catchClauses);
        children.add(afterBody);
        return children;
    }

    @Override
    public IrNode reconstructWithChildren(List<IrNode> newChildren) {
        int r = rescueClauses.size();
        int c = catchClauses.size();
        return new Try(
                newChildren.get(0),
                Children.slice(newChildren, 1, 1 + r, CaseClause.class),
                Children.slice(newChildren, 1 + r, 1 + r + c, CaseClause.class),
                newChildren.get(1 + r + c),
                meta);
    }

    @Override
    public IrNode withMeta(NodeMeta meta) {
        return new Try(body, rescueClauses, catchClauses, afterBody, meta);
    }
}
