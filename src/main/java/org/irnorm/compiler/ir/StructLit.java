package org.irnorm.compiler.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * A struct literal, {@code %Module{field: value}}.
 *
 * @param module The struct module.
 * @param fields The field initializers.
 * @param meta The node metadata.
 */
public record StructLit(String module, List<FieldValue> fields, NodeMeta meta) implements IrNode {

    public StructLit {
        fields = List.copyOf(fields);
        meta = meta == null ? NodeMeta.EMPTY : meta;
    }

    @Override
    public List<IrNode> getChildren() {
        return fields.stream().map(FieldValue::value).toList();
    }

    @Override
    public IrNode reconstructWithChildren(List<IrNode> newChildren) {
        List<FieldValue> rebuilt = new ArrayList<>(fields.size());
        for (int i = 0; i < fields.size(); i++) {
            rebuilt.add(new FieldValue(fields.get(i).field(), newChildren.get(i)));
        }
        return new StructLit(module, rebuilt, meta);
    }

    @Override
    public IrNode withMeta(NodeMeta meta) {
        return new StructLit(module, fields, meta);
    }
}
