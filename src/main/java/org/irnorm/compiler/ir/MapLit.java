package org.irnorm.compiler.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * A map literal.
 *
 * @param entries The key/value entries in source order.
 * @param meta The node metadata.
 */
public record MapLit(List<Entry> entries, NodeMeta meta) implements IrNode {

    /**
     * One {@code key => value} entry.
     *
     * @param key The key expression.
     * @param value The value expression.
     */
    public record Entry(IrNode key, IrNode value) {}

    public MapLit {
        entries = List.copyOf(entries);
        meta = meta == null ? NodeMeta.EMPTY : meta;
    }

    @Override
    public List<IrNode> getChildren() {
        List<IrNode> children = new ArrayList<>(entries.size() * 2);
        for (Entry e : entries) {
            children.add(e.key());
            children.add(e.value());
        }
        return children;
    }

    @Override
    public IrNode reconstructWithChildren(List<IrNode> newChildren) {
        List<Entry> rebuilt = new ArrayList<>(entries.size());
        for (int i = 0; i + 1 < newChildren.size(); i += 2) {
            rebuilt.add(new Entry(newChildren.get(i), newChildren.get(i + 1)));
        }
        return new MapLit(rebuilt, meta);
    }

    @Override
    public IrNode withMeta(NodeMeta meta) {
        return new MapLit(entries, meta);
    }
}
