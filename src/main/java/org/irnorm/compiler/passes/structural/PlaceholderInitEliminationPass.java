package org.irnorm.compiler.passes.structural;

import org.irnorm.compiler.analysis.UsageIndex;
import org.irnorm.compiler.ir.Block;
import org.irnorm.compiler.ir.IrNode;
import org.irnorm.compiler.ir.IrPattern.BindPat;
import org.irnorm.compiler.ir.Literal;
import org.irnorm.compiler.ir.Match;
import org.irnorm.compiler.ir.MetaFlag;
import org.irnorm.compiler.ir.TreeWalker;
import org.irnorm.compiler.passes.INormalizationPass;
import org.irnorm.compiler.passes.PassContext;
import org.irnorm.compiler.passes.PassTier;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes placeholder initializations ({@code x = nil}, or a sentinel literal) that are overwritten
 * at block level before anything reads them.
 */
public class PlaceholderInitEliminationPass implements INormalizationPass {

    public static final String NAME = "placeholder-init-elimination";

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
        return new TreeWalker().rewriteBottomUp(root, n -> n instanceof Block block ? eliminate(block) : n);
    }

    private IrNode eliminate(Block block) {
        List<IrNode> statements = block.statements();
        int last = statements.size() - 1;
        UsageIndex index = null;
        List<IrNode> out = null;
        for (int i = 0; i < statements.size(); i++) {
            IrNode statement = statements.get(i);
            String name = i < last ? placeholderName(statement) : null;
            if (name != null) {
                if (index == null) {
                    index = UsageIndex.build(statements);
                }
                if (index.reboundFrom(i + 1, name) && !index.readBeforeRebind(i + 1, name)) {
                    if (out == null) {
                        out = new ArrayList<>(statements.subList(0, i));
                    }
                    continue;
                }
            }
            if (out != null) {
                out.add(statement);
            }
        }
        return out == null ? block : block.withStatements(out);
    }

    private static String placeholderName(IrNode statement) {
        if (statement instanceof Match match && match.pattern() instanceof BindPat bind && !bind.isUnderscored()
                && match.value() instanceof Literal literal
                && (literal.isNil() || literal.hasFlag(MetaFlag.SENTINEL))) {
            return bind.name();
        }
        return null;
    }
}
