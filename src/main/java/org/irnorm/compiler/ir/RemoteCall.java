package org.irnorm.compiler.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * A qualified call, {@code target.function(args)}. The target is usually a {@link ModuleRef},
 * but may be any expression evaluating to a module.
 *
 * @param target The module expression.
 * @param function The function name.
 * @param args The arguments.
 * @param meta The node metadata.
 */
public record RemoteCall(IrNode target, String function, List<IrNode> args, NodeMeta meta) implements IrNode {

    public RemoteCall {
        args = List.copyOf(args);
        meta = meta == null ? NodeMeta.EMPTY : meta;
    }

    /**
     * @return {@code Module.function} when the target is a module alias, otherwise {@code null}.
     */
    public String qualifiedName() {
        return target instanceof ModuleRef ref ? ref.name() + "." + function : null;
    }

    @Override
    public List<IrNode> getChildren() {
        List<IrNode> children = new ArrayList<>(args.size() + 1);
        children.add(target);
        children.addAll(args);
        return children;
    }

    @Override
    public IrNode reconstructWithChildren(List<IrNode> newChildren) {
        return new RemoteCall(newChildren.get(0), function, newChildren.subList(1, newChildren.size()), meta);
    }

    @Override
    public IrNode withMeta(NodeMeta meta) {
        return new RemoteCall(target, function, args, meta);
    }
}
