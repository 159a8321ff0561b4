package org.irnorm.compiler.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * A struct or map update, {@code %{base | field: value}}.
 *
 * @param base The updated value.
 * @param fields The replaced fields.
 * @param meta The node metadata.
 */
public record StructUpdate(IrNode base, List<FieldValue> fields, NodeMeta meta) implements IrNode {

    public StructUpdate {
        fields = List.copyOf(fields);
        meta = meta == null ? NodeMeta.EMPTY : meta;
    }

    @Override
    public List<IrNode> getChildren() {
        List<IrNode> children = new ArrayList<>(fields.size() + 1);
        children.add(base);
        fields.forEach(f -> children.add(f.value()));
        return children;
    }

    @Override
    public IrNode reconstructWithChildren(List<IrNode> newChildren) {
        List<FieldValue> rebuilt = new ArrayList<>(fields.size());
        for (int i = 0; i < fields.size(); i++) {
            rebuilt.add(new FieldValue(fields.get(i).field(), newChildren.get(i + 1)));
        }
        return new StructUpdate(newChildren.get(0), rebuilt, meta);
    }

    @Override
    public IrNode withMeta(NodeMeta meta) {
        return new StructUpdate(base, fields, meta);
    }
}
