package org.irnorm.compiler.ir;

/**
 * Side-channel flags the upstream lowering stage attaches to nodes.
 * The normalizer relies on them being set faithfully; it never infers them.
 */
public enum MetaFlag {
    /** The node is the value of a host-language early {@code return}. */
    EARLY_RETURN,
    /** The binding introduces a temporary the lowering stage invented. */
    COMPILER_TEMP,
    /** The call stands for an in-place mutation of its first argument. */
    MUTATES_RECEIVER,
    /** The literal is a placeholder with no meaning of its own. */
    SENTINEL
}
