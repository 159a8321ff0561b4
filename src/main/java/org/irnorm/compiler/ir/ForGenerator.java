package org.irnorm.compiler.ir;

import java.util.List;

/**
 * One {@code pattern <- enumerable} generator of a comprehension.
 *
 * @param pattern The element pattern.
 * @param enumerable The enumerated expression.
 * @param meta The node metadata.
 */
public record ForGenerator(IrPattern pattern, IrNode enumerable, NodeMeta meta) implements IrNode {

    public ForGenerator {
        meta = meta == null ? NodeMeta.EMPTY : meta;
    }

    public ForGenerator withPattern(IrPattern newPattern) {
        return new ForGenerator(newPattern, enumerable, meta);
    }

    @Override
    public List<IrNode> getChildren() {
        return Children.of(enumerable);
    }

    @Override
    public IrNode reconstructWithChildren(List<IrNode> newChildren) {
        return new ForGenerator(pattern, newChildren.get(0), meta);
    }

    @Override
    public IrNode withMeta(NodeMeta meta) {
        return new ForGenerator(pattern, enumerable, meta);
    }
}
