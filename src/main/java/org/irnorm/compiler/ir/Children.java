package org.irnorm.compiler.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Helpers for building and splitting child lists that may contain {@code null} slots.
 */
final class Children {

    private Children() {}

    static List<IrNode> of(IrNode... nodes) {
        List<IrNode> out = new ArrayList<>(nodes.length);
        Collections.addAll(out, nodes);
        return Collections.unmodifiableList(out);
    }

    static List<IrNode> concat(List<? extends IrNode> first, IrNode... rest) {
        List<IrNode> out = new ArrayList<>(first.size() + rest.length);
        out.addAll(first);
        Collections.addAll(out, rest);
        return Collections.unmodifiableList(out);
    }

    static <T extends IrNode> List<T> slice(List<IrNode> children, int from, int to, Class<T> type) {
        List<T> out = new ArrayList<>(to - from);
        for (int i = from; i < to; i++) {
            out.add(type.cast(children.get(i)));
        }
        return out;
    }
}
