package org.irnorm.compiler.passes.cleanup;

import org.irnorm.compiler.analysis.LiveNames;
import org.irnorm.compiler.analysis.UsageIndex;
import org.irnorm.compiler.ir.Block;
import org.irnorm.compiler.ir.IrNode;
import org.irnorm.compiler.ir.IrPattern;
import org.irnorm.compiler.ir.Match;
import org.irnorm.compiler.ir.Patterns;
import org.irnorm.compiler.ir.TreeWalker;
import org.irnorm.compiler.passes.INormalizationPass;
import org.irnorm.compiler.passes.PassContext;
import org.irnorm.compiler.passes.PassTier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Prefixes with an underscore the binders of block-level matches whose values nothing reads:
 * neither the rest of the block nor any enclosing block after it. Liveness is threaded outward
 * through a {@link LiveNames} chain, but only where bindings leak: into nested bare blocks and
 * match values. Branches, clauses, closures and definitions start a fresh chain, since their
 * bindings are never seen after them.
 */
public class UnusedResultUnderscoringPass implements INormalizationPass {

    public static final String NAME = "unused-result-underscoring";

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
        return process(root, null);
    }

    private IrNode process(IrNode node, LiveNames outer) {
        if (node == null) {
            return null;
        }
        if (node instanceof Block block) {
            return processBlock(block, outer);
        }
        if (node instanceof Match match) {
            return TreeWalker.rebuild(match, child -> process(child, outer));
        }
        return TreeWalker.rebuild(node, child -> process(child, null));
    }

    private IrNode processBlock(Block block, LiveNames outer) {
        List<IrNode> statements = block.statements();
        UsageIndex index = UsageIndex.build(statements);
        List<IrNode> out = new ArrayList<>(statements.size());
        boolean changed = false;
        for (int i = 0; i < statements.size(); i++) {
            IrNode statement = statements.get(i);
            LiveNames live = outer == null ? LiveNames.root(index, i + 1) : outer.enter(index, i + 1);
            IrNode rewritten = process(statement, live);
            if (rewritten instanceof Match match) {
                rewritten = underscoreDead(match, live);
            }
            changed |= rewritten != statement;
            out.add(rewritten);
        }
        return changed ? block.withStatements(out) : block;
    }

    private IrNode underscoreDead(Match match, LiveNames live) {
        List<String> binders = Patterns.binderOccurrences(match.pattern());
        IrPattern pattern = Patterns.mapBinders(match.pattern(), name ->
                name.startsWith("_") || Collections.frequency(binders, name) > 1 || live.isLive(name)
                        ? name : Patterns.underscore(name));
        return pattern == match.pattern() ? match : match.withPattern(pattern);
    }
}
