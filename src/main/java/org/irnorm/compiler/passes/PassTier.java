package org.irnorm.compiler.passes;

/**
 * Pipeline tiers. A pipeline runs tiers in declaration order; a later tier relies on the shapes
 * the earlier ones establish.
 */
public enum PassTier {
    /** Reshapes control flow and blocks. */
    STRUCTURAL,
    /** Repairs binder/reference consistency. */
    SEMANTIC,
    /** Removes warnings and makes the output idiomatic. */
    CLEANUP
}
