package org.irnorm.compiler.passes.structural;

import org.irnorm.compiler.ir.Block;
import org.irnorm.compiler.ir.IrNode;
import org.irnorm.compiler.ir.Literal;
import org.irnorm.compiler.ir.LiteralKind;
import org.irnorm.compiler.ir.MetaFlag;
import org.irnorm.compiler.ir.TreeWalker;
import org.irnorm.compiler.passes.INormalizationPass;
import org.irnorm.compiler.passes.PassContext;
import org.irnorm.compiler.passes.PassTier;

import java.util.ArrayList;
import java.util.List;

/**
 * Splices nested bare blocks into their parent block. Bindings of a nested bare block are visible
 * after it anyway, so splicing changes nothing but the shape. Empty nested blocks disappear; an
 * empty trailing one becomes {@code nil} so the parent keeps its value.
 */
public class BlockFlatteningPass implements INormalizationPass {

    public static final String NAME = "block-flattening";

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
        return new TreeWalker().rewriteBottomUp(root, n -> n instanceof Block block ? flatten(block) : n);
    }

    private IrNode flatten(Block block) {
        List<IrNode> statements = block.statements();
        if (statements.stream().noneMatch(s -> s instanceof Block)) {
            return block;
        }
        List<IrNode> out = new ArrayList<>(statements.size());
        for (int i = 0; i < statements.size(); i++) {
            IrNode statement = statements.get(i);
            boolean terminal = i == statements.size() - 1;
            if (!(statement instanceof Block nested)) {
                out.add(statement);
            } else if (nested.isEmpty()) {
                if (terminal) {
                    out.add(new Literal(LiteralKind.NIL, null, nested.meta()));
                }
            } else {
                out.addAll(nested.statements().subList(0, nested.statements().size() - 1));
                IrNode last = nested.last();
                // a flagged block returns through its value
                if (nested.hasFlag(MetaFlag.EARLY_RETURN) && !last.hasFlag(MetaFlag.EARLY_RETURN)) {
                    last = last.withMeta(last.meta().with(MetaFlag.EARLY_RETURN));
                }
                out.add(last);
            }
        }
        return block.withStatements(out);
    }
}
