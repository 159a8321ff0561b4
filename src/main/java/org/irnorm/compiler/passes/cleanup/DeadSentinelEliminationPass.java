package org.irnorm.compiler.passes.cleanup;

import org.irnorm.compiler.diagnostics.CompilerLogger;
import org.irnorm.compiler.ir.Block;
import org.irnorm.compiler.ir.IrNode;
import org.irnorm.compiler.ir.Literal;
import org.irnorm.compiler.ir.TreeWalker;
import org.irnorm.compiler.passes.INormalizationPass;
import org.irnorm.compiler.passes.PassContext;
import org.irnorm.compiler.passes.PassTier;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes bare literals in non-terminal statement position; the target reports them as unused
 * values. The terminal statement is the block's value and always stays.
 */
public class DeadSentinelEliminationPass implements INormalizationPass {

    public static final String NAME = "dead-sentinel-elimination";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public PassTier tier() {
        return PassTier.CLEANUP;
    }

    @Override
    public IrNode run(IrNode root, PassContext context) {
        return new TreeWalker().rewriteBottomUp(root, n -> n instanceof Block block ? eliminate(block) : n);
    }

    private IrNode eliminate(Block block) {
        List<IrNode> statements = block.statements();
        int last = statements.size() - 1;
        List<IrNode> out = new ArrayList<>(statements.size());
        for (int i = 0; i < statements.size(); i++) {
            IrNode statement = statements.get(i);
            if (i < last && statement instanceof Literal) {
                continue;
            }
            out.add(statement);
        }
        if (out.size() == statements.size()) {
            return block;
        }
        CompilerLogger.trace(NAME + ": removed " + (statements.size() - out.size()) + " bare literal(s)");
        return block.withStatements(out);
    }
}
