package org.irnorm.compiler.ir;

import java.util.List;

/**
 * An ordered sequence of statements. The value of a block is its last statement.
 *
 * @param statements The statements.
 * @param meta The node metadata.
 */
public record Block(List<IrNode> statements, NodeMeta meta) implements IrNode {

    public Block {
        statements = List.copyOf(statements);
        meta = meta == null ? NodeMeta.EMPTY : meta;
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    /**
     * @return The trailing statement, i.e. the block's value, or {@code null} for an empty block.
     */
    public IrNode last() {
        return statements.isEmpty() ? null : statements.get(statements.size() - 1);
    }

    public Block withStatements(List<IrNode> newStatements) {
        return new Block(newStatements, meta);
    }

    @Override
    public List<IrNode> getChildren() {
        return statements;
    }

    @Override
    public IrNode reconstructWithChildren(List<IrNode> newChildren) {
        return new Block(newChildren, meta);
    }

    @Override
    public IrNode withMeta(NodeMeta meta) {
        return new Block(statements, meta);
    }
}
