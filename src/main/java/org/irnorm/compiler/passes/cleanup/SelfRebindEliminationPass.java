package org.irnorm.compiler.passes.cleanup;

import org.irnorm.compiler.ir.Block;
import org.irnorm.compiler.ir.IrNode;
import org.irnorm.compiler.ir.IrPattern.BindPat;
import org.irnorm.compiler.ir.Match;
import org.irnorm.compiler.ir.TreeWalker;
import org.irnorm.compiler.ir.Var;
import org.irnorm.compiler.passes.INormalizationPass;
import org.irnorm.compiler.passes.PassContext;
import org.irnorm.compiler.passes.PassTier;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes {@code x = x}. A trailing one is replaced by {@code x} so the block keeps its value.
 */
public class SelfRebindEliminationPass implements INormalizationPass {

    public static final String NAME = "self-rebind-elimination";

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
        if (statements.stream().noneMatch(SelfRebindEliminationPass::isSelfRebind)) {
            return block;
        }
        List<IrNode> out = new ArrayList<>(statements.size());
        for (int i = 0; i < statements.size(); i++) {
            IrNode statement = statements.get(i);
            if (!isSelfRebind(statement)) {
                out.add(statement);
            } else if (i == statements.size() - 1) {
                out.add(((Match) statement).value());
            }
        }
        return block.withStatements(out);
    }

    private static boolean isSelfRebind(IrNode statement) {
        return statement instanceof Match match
                && match.pattern() instanceof BindPat bind
                && match.value() instanceof Var v
                && v.name().equals(bind.name());
    }
}
