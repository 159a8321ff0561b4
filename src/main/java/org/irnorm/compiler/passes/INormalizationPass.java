package org.irnorm.compiler.passes;

import org.irnorm.compiler.ir.IrNode;

import java.util.List;

/**
 * A single-purpose rewrite of the IR tree.
 * <p>
 * Implementations are total, stateless and reentrant: they return the input instance when they
 * have nothing to do, and leave a subtree unchanged when no unique safe rewrite exists.
 */
public interface INormalizationPass {

    /**
     * @return The stable name used in configuration and diagnostics.
     */
    String name();

    /**
     * @return The tier this pass belongs to.
     */
    PassTier tier();

    /**
     * @return Names of passes that must run earlier when they are part of the pipeline.
     */
    default List<String> runsAfter() {
        return List.of();
    }

    /**
     * Rewrites a tree.
     *
     * @param root The unit root.
     * @param context Diagnostics and configuration.
     * @return The rewritten tree.
     */
    IrNode run(IrNode root, PassContext context);
}
