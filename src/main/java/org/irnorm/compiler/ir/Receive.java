package org.irnorm.compiler.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * A receive expression with an optional timeout.
 *
 * @param clauses The message clauses.
 * @param timeout The timeout expression, or {@code null}.
 * @param afterBody The body run on timeout, or {@code null}.
 * @param meta The node metadata.
 */
public record Receive(List<CaseClause> clauses, IrNode timeout, IrNode afterBody, NodeMeta meta)
        implements IrNode {

    public Receive {
        clauses = List.copyOf(clauses);
        meta = meta == null ? NodeMeta.EMPTY : meta;
    }

    @Override
    public List<IrNode> getChildren() {
        List<IrNode> children = new ArrayList<>(clauses.size() + 2);
        children.addAll(clauses);
        children.add(timeout);
        children.add(afterBody);
        return children;
    }

    @Override
    public IrNode reconstructWithChildren(List<IrNode> newChildren) {
        int n = clauses.size();
        return new Receive(Children.slice(newChildren, 0, n, CaseClause.class),
                newChildren.get(n), newChildren.get(n + 1), meta);
    }

    @Override
    public IrNode withMeta(NodeMeta meta) {
        return new Receive(clauses, timeout, afterBody, meta);
    }
}
