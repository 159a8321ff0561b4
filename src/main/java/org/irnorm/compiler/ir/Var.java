package org.irnorm.compiler.ir;

/**
 * A variable reference.
 *
 * @param name The referenced name.
 * @param meta The node metadata.
 */
public record Var(String name, NodeMeta meta) implements IrNode {

    public Var {
        meta = meta == null ? NodeMeta.EMPTY : meta;
    }

    public Var withName(String newName) {
        return new Var(newName, meta);
    }

    @Override
    public IrNode withMeta(NodeMeta meta) {
        return new Var(name, meta);
    }
}
