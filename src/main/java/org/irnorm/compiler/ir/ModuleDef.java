package org.irnorm.compiler.ir;

import java.util.List;

/**
 * A module (container) definition; the usual root of a compilation unit.
 *
 * @param name The module name.
 * @param body Definitions and module-level expressions.
 * @param meta The node metadata.
 */
public record ModuleDef(String name, List<IrNode> body, NodeMeta meta) implements IrNode {

    public ModuleDef {
        body = List.copyOf(body);
        meta = meta == null ? NodeMeta.EMPTY : meta;
    }

    @Override
    public List<IrNode> getChildren() {
        return body;
    }

    @Override
    public IrNode reconstructWithChildren(List<IrNode> newChildren) {
        return new ModuleDef(name, newChildren, meta);
    }

    @Override
    public IrNode withMeta(NodeMeta meta) {
        return new ModuleDef(name, body, meta);
    }
}
