package org.irnorm.compiler.passes;

import org.irnorm.compiler.analysis.ScopeContext;
import org.irnorm.compiler.analysis.ScopeWalker;
import org.irnorm.compiler.ir.Block;
import org.irnorm.compiler.ir.CaseClause;
import org.irnorm.compiler.ir.Def;
import org.irnorm.compiler.ir.FnClause;
import org.irnorm.compiler.ir.For;
import org.irnorm.compiler.ir.ForGenerator;
import org.irnorm.compiler.ir.IrNode;
import org.irnorm.compiler.ir.TreeWalker;
import org.irnorm.compiler.ir.With;
import org.irnorm.compiler.ir.WithClause;

import java.util.ArrayList;
import java.util.List;

/**
 * Copy-on-change rewrite that threads a {@link ScopeContext} down the tree.
 * <p>
 * Children are rewritten first; {@link #leave(IrNode, ScopeContext)} then sees the rebuilt node
 * together with the context in which the node itself appears. Blocks thread their statement
 * bindings to later statements, clause heads and parameters extend the context of their guard and
 * body, and definitions start from their parameters alone.
 */
public abstract class ScopedRewriter {

    protected final ScopeWalker scopes = new ScopeWalker();

    /**
     * Rewrites a tree starting from the module-level context.
     * @param root The unit root.
     * @return The rewritten tree.
     */
    public IrNode rewrite(IrNode root) {
        return visit(root, ScopeContext.root());
    }

    /**
     * Hook called after a node's children were rewritten.
     * @param node The rebuilt node.
     * @param scope The context the node appears in.
     * @return The replacement; the node itself when nothing changes.
     */
    protected IrNode leave(IrNode node, ScopeContext scope) {
        return node;
    }

    protected IrNode visit(IrNode node, ScopeContext scope) {
        if (node == null) {
            return null;
        }
        return leave(descend(node, scope), scope);
    }

    private IrNode descend(IrNode node, ScopeContext scope) {
        if (node instanceof Def def) {
            ScopeContext inner = scope.enterFunction(def.name(), scopes.boundNames(def.params()));
            return TreeWalker.rebuild(def, child -> visit(child, inner));
        }
        if (node instanceof CaseClause clause) {
            ScopeContext inner = scope.bind(scopes.boundNames(clause.pattern()));
            return TreeWalker.rebuild(clause, child -> visit(child, inner));
        }
        if (node instanceof FnClause clause) {
            ScopeContext inner = scope.bind(scopes.boundNames(clause.params()));
            return TreeWalker.rebuild(clause, child -> visit(child, inner));
        }
        if (node instanceof Block block) {
            return descendBlock(block, scope);
        }
        if (node instanceof With with) {
            return descendWith(with, scope);
        }
        if (node instanceof For comprehension) {
            return descendFor(comprehension, scope);
        }
        return TreeWalker.rebuild(node, child -> visit(child, scope));
    }

    private IrNode descendBlock(Block block, ScopeContext scope) {
        List<IrNode> statements = new ArrayList<>(block.statements().size());
        boolean changed = false;
        ScopeContext current = scope;
        for (IrNode statement : block.statements()) {
            IrNode rewritten = visit(statement, current);
            changed |= rewritten != statement;
            statements.add(rewritten);
            current = current.bind(scopes.statementBindings(rewritten));
        }
        return changed ? block.withStatements(statements) : block;
    }

    private IrNode descendWith(With with, ScopeContext scope) {
        List<WithClause> clauses = new ArrayList<>(with.clauses().size());
        boolean changed = false;
        ScopeContext current = scope;
        for (WithClause clause : with.clauses()) {
            IrNode rewritten = visit(clause, current);
            changed |= rewritten != clause;
            WithClause kept = (WithClause) rewritten;
            clauses.add(kept);
            current = current.bind(scopes.boundNames(kept.pattern()));
        }
        IrNode body = visit(with.body(), current);
        List<CaseClause> elseClauses = new ArrayList<>(with.elseClauses().size());
        for (CaseClause clause : with.elseClauses()) {
            IrNode rewritten = visit(clause, scope);
            changed |= rewritten != clause;
            elseClauses.add((CaseClause) rewritten);
        }
        changed |= body != with.body();
        return changed ? new With(clauses, body, elseClauses, with.meta()) : with;
    }

    private IrNode descendFor(For comprehension, ScopeContext scope) {
        List<ForGenerator> generators = new ArrayList<>(comprehension.generators().size());
        boolean changed = false;
        ScopeContext current = scope;
        for (ForGenerator generator : comprehension.generators()) {
            IrNode rewritten = visit(generator, current);
            changed |= rewritten != generator;
            ForGenerator kept = (ForGenerator) rewritten;
            generators.add(kept);
            current = current.bind(scopes.boundNames(kept.pattern()));
        }
        List<IrNode> filters = new ArrayList<>(comprehension.filters().size());
        for (IrNode filter : comprehension.filters()) {
            IrNode rewritten = visit(filter, current);
            changed |= rewritten != filter;
            filters.add(rewritten);
        }
        IrNode into = visit(comprehension.into(), scope);
        IrNode body = visit(comprehension.body(), current);
        changed |= into != comprehension.into() || body != comprehension.body();
        return changed ? new For(generators, filters, into, body, comprehension.meta()) : comprehension;
    }
}
