package org.irnorm.compiler.ir;

/**
 * A literal value. {@code value} is a {@link Long} for INTEGER, a {@link Double} for FLOAT,
 * a {@link String} for STRING and ATOM, a {@link Boolean} for BOOLEAN and {@code null} for NIL.
 *
 * @param kind The literal kind.
 * @param value The boxed value.
 * @param meta The node metadata.
 */
public record Literal(LiteralKind kind, Object value, NodeMeta meta) implements IrNode {

    public Literal {
        meta = meta == null ? NodeMeta.EMPTY : meta;
    }

    public boolean isNil() {
        return kind == LiteralKind.NIL;
    }

    @Override
    public IrNode withMeta(NodeMeta meta) {
        return new Literal(kind, value, meta);
    }
}
