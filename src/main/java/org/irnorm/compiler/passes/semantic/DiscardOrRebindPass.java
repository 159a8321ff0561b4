package org.irnorm.compiler.passes.semantic;

import org.irnorm.compiler.analysis.UsageIndex;
import org.irnorm.compiler.diagnostics.CompilerLogger;
import org.irnorm.compiler.ir.Block;
import org.irnorm.compiler.ir.Call;
import org.irnorm.compiler.ir.IrNode;
import org.irnorm.compiler.ir.IrPattern.BindPat;
import org.irnorm.compiler.ir.Match;
import org.irnorm.compiler.ir.MetaFlag;
import org.irnorm.compiler.ir.NodeMeta;
import org.irnorm.compiler.ir.RemoteCall;
import org.irnorm.compiler.ir.TreeWalker;
import org.irnorm.compiler.ir.Var;
import org.irnorm.compiler.passes.INormalizationPass;
import org.irnorm.compiler.passes.PassContext;
import org.irnorm.compiler.passes.PassTier;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Handles statement-position calls whose result the host program discarded.
 * <ul>
 *   <li>A call standing for an in-place update of its first argument (flagged, or listed under
 *       {@code normalizer.discard.rebind-calls}) is rebound: {@code x = call(x, ...)}, when
 *       {@code x} is read later in the block.</li>
 *   <li>A binding of an upstream temporary to a call result that nothing reads becomes
 *       {@code _ = call(...)}.</li>
 * </ul>
 */
public class DiscardOrRebindPass implements INormalizationPass {

    public static final String NAME = "discard-or-rebind";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public PassTier tier() {
        return PassTier.SEMANTIC;
    }

    @Override
    public IrNode run(IrNode root, PassContext context) {
        Set<String> rebindCalls = context.config().rebindCalls();
        return new TreeWalker().rewriteBottomUp(root, n -> n instanceof Block block ? rewrite(block, rebindCalls) : n);
    }

    private IrNode rewrite(Block block, Set<String> rebindCalls) {
        List<IrNode> statements = block.statements();
        UsageIndex index = null;
        List<IrNode> out = new ArrayList<>(statements);
        boolean changed = false;
        for (int i = 0; i < statements.size(); i++) {
            IrNode statement = statements.get(i);
            String receiver = mutatedReceiver(statement, rebindCalls);
            if (receiver != null) {
                index = index == null ? UsageIndex.build(statements) : index;
                if (index.usedLater(i + 1, receiver)) {
                    CompilerLogger.debug(NAME + ": rebinding '" + receiver + "'");
                    out.set(i, new Match(new BindPat(receiver), statement, NodeMeta.at(statement.source())));
                    changed = true;
                }
                continue;
            }
            if (statement instanceof Match match && match.hasFlag(MetaFlag.COMPILER_TEMP)
                    && match.pattern() instanceof BindPat bind && !bind.isDiscard()
                    && (match.value() instanceof Call || match.value() instanceof RemoteCall)) {
                index = index == null ? UsageIndex.build(statements) : index;
                if (!index.usedLater(i + 1, bind.name())) {
                    out.set(i, match.withPattern(new BindPat("_")));
                    changed = true;
                }
            }
        }
        return changed ? block.withStatements(out) : block;
    }

    private static String mutatedReceiver(IrNode statement, Set<String> rebindCalls) {
        List<IrNode> args;
        if (statement instanceof Call call) {
            if (!call.hasFlag(MetaFlag.MUTATES_RECEIVER)) {
                return null;
            }
            args = call.args();
        } else if (statement instanceof RemoteCall call) {
            String qualified = call.qualifiedName();
            if (!call.hasFlag(MetaFlag.MUTATES_RECEIVER) && (qualified == null || !rebindCalls.contains(qualified))) {
                return null;
            }
            args = call.args();
        } else {
            return null;
        }
        return !args.isEmpty() && args.get(0) instanceof Var v ? v.name() : null;
    }
}
