package org.irnorm.compiler.passes.structural;

import org.irnorm.compiler.diagnostics.CompilerLogger;
import org.irnorm.compiler.ir.Block;
import org.irnorm.compiler.ir.IrNode;
import org.irnorm.compiler.ir.MetaFlag;
import org.irnorm.compiler.ir.TreeWalker;
import org.irnorm.compiler.passes.INormalizationPass;
import org.irnorm.compiler.passes.PassContext;
import org.irnorm.compiler.passes.PassTier;

/**
 * Drops the statements of a block that follow an early return.
 */
public class DeadCodeAfterReturnPass implements INormalizationPass {

    public static final String NAME = "dead-code-after-return";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public PassTier tier() {
        return PassTier.STRUCTURAL;
    }

    @Override
    public IrNode run(IrNode root, PassContext context) {
        return new TreeWalker().rewriteBottomUp(root, n -> n instanceof Block block ? truncate(block) : n);
    }

    private IrNode truncate(Block block) {
        int last = block.statements().size() - 1;
        for (int i = 0; i < last; i++) {
            if (block.statements().get(i).hasFlag(MetaFlag.EARLY_RETURN)) {
                CompilerLogger.trace(NAME + ": dropping " + (last - i) + " unreachable statement(s)");
                return block.withStatements(block.statements().subList(0, i + 1));
            }
        }
        return block;
    }
}
