package org.irnorm.compiler.ir;

/**
 * A module alias such as {@code Enum} or {@code MyApp.Repo}.
 *
 * @param name The alias.
 * @param meta The node metadata.
 */
public record ModuleRef(String name, NodeMeta meta) implements IrNode {

    public ModuleRef {
        meta = meta == null ? NodeMeta.EMPTY : meta;
    }

    @Override
    public IrNode withMeta(NodeMeta meta) {
        return new ModuleRef(name, meta);
    }
}
