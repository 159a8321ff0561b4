package org.irnorm.compiler.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * A sequential-match expression. Each clause's bindings are visible to the following clauses
 * and to the body; else clauses see none of them.
 *
 * @param clauses The match steps.
 * @param body The body evaluated when every step matched.
 * @param elseClauses Clauses handling the first non-matching value; may be empty.
 * @param meta The node metadata.
 */
public record With(List<WithClause> clauses, IrNode body, List<CaseClause> elseClauses, NodeMeta meta)
        implements IrNode {

    public With {
        clauses = List.copyOf(clauses);
        elseClauses = List.copyOf(elseClauses);
        meta = meta == null ? NodeMeta.EMPTY : meta;
    }

    @Override
    public List<IrNode> getChildren() {
        List<IrNode> children = new ArrayList<>(clauses.size() + elseClauses.size() + 1);
        children.addAll(clauses);
        children.add(body);
        children.addAll(elseClauses);
        return children;
    }

    @Override
    public IrNode reconstructWithChildren(List<IrNode> newChildren) {
        int n = clauses.size();
        return new With(
                Children.slice(newChildren, 0, n, WithClause.class),
                newChildren.get(n),
                Children.slice(newChildren, n + 1, newChildren.size(), CaseClause.class),
                meta);
    }

    @Override
    public IrNode withMeta(NodeMeta meta) {
        return new With(clauses, body, elseClauses, meta);
    }
}
