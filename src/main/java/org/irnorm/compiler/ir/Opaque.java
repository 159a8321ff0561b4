package org.irnorm.compiler.ir;

/**
 * Raw target text for constructs the structured model does not cover. Passes only look inside
 * through {@link org.irnorm.compiler.analysis.IdentifierScanner}.
 *
 * @param text The raw text.
 * @param meta The node metadata.
 */
public record Opaque(String text, NodeMeta meta) implements IrNode {

    public Opaque {
        meta = meta == null ? NodeMeta.EMPTY : meta;
    }

    @Override
    public IrNode withMeta(NodeMeta meta) {
        return new Opaque(text, meta);
    }
}
