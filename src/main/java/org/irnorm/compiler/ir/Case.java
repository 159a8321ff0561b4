package org.irnorm.compiler.ir;

import java.util.List;

/**
 * A multi-clause case expression.
 *
 * @param subject The matched expression.
 * @param clauses The clauses, tried in order.
 * @param meta The node metadata.
 */
public record Case(IrNode subject, List<CaseClause> clauses, NodeMeta meta) implements IrNode {

    public Case {
        clauses = List.copyOf(clauses);
        meta = meta == null ? NodeMeta.EMPTY : meta;
    }

    @Override
    public List<IrNode> getChildren() {
        return Children.concat(List.of(subject), clauses.toArray(new IrNode[0]));
    }

    @Override
    public IrNode reconstructWithChildren(List<IrNode> newChildren) {
        return new Case(newChildren.get(0),
                Children.slice(newChildren, 1, newChildren.size(), CaseClause.class), meta);
    }

    @Override
    public IrNode withMeta(NodeMeta meta) {
        return new Case(subject, clauses, meta);
    }
}
