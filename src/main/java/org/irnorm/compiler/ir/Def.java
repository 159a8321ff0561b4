package org.irnorm.compiler.ir;

import java.util.List;

/**
 * A named function definition (one clause).
 *
 * @param name The function name.
 * @param params The parameter patterns.
 * @param guard The guard, or {@code null}.
 * @param body The function body.
 * @param isPrivate Whether the function is module-private.
 * @param meta The node metadata.
 */
public record Def(String name, List<IrPattern> params, IrNode guard, IrNode body, boolean isPrivate,
                  NodeMeta meta) implements IrNode {

    public Def {
        params = List.copyOf(params);
        meta = meta == null ? NodeMeta.EMPTY : meta;
    }

    public Def withParamsAndBody(List<IrPattern> newParams, IrNode newGuard, IrNode newBody) {
        return new Def(name, newParams, newGuard, newBody, isPrivate, meta);
    }

    @Override
    public List<IrNode> getChildren() {
        return Children.of(guard, body);
    }

    @Override
    public IrNode reconstructWithChildren(List<IrNode> newChildren) {
        return new Def(name, params, newChildren.get(0), newChildren.get(1), isPrivate, meta);
    }

    @Override
    public IrNode withMeta(NodeMeta meta) {
        return new Def(name, params, guard, body, isPrivate, meta);
    }
}
