package org.irnorm.compiler.analysis;

import org.irnorm.compiler.ir.Block;
import org.irnorm.compiler.ir.CaseClause;
import org.irnorm.compiler.ir.Def;
import org.irnorm.compiler.ir.FnClause;
import org.irnorm.compiler.ir.For;
import org.irnorm.compiler.ir.ForGenerator;
import org.irnorm.compiler.ir.IrNode;
import org.irnorm.compiler.ir.IrPattern;
import org.irnorm.compiler.ir.Match;
import org.irnorm.compiler.ir.Opaque;
import org.irnorm.compiler.ir.Patterns;
import org.irnorm.compiler.ir.TreeWalker;
import org.irnorm.compiler.ir.Var;
import org.irnorm.compiler.ir.With;
import org.irnorm.compiler.ir.WithClause;

import java.util.ArrayList;
import java.util.List;

/**
 * Renames the reads of one binding inside a scope.
 * <p>
 * The rewrite stops where the binding stops being visible: at clause, function or generator heads
 * that bind the same name again, and after a block statement that rebinds it. The rebinding
 * statement itself is still rewritten, since its value reads the old binding.
 */
public class ReferenceRenamer {

    private final ScopeWalker scopes = new ScopeWalker();
    private final String from;
    private final String to;

    /**
     * @param from The name being replaced.
     * @param to The replacement name.
     */
    public ReferenceRenamer(String from, String to) {
        this.from = from;
        this.to = to;
    }

    /**
     * Convenience for a one-off rename.
     * @param node The scope root.
     * @param from The old name.
     * @param to The new name.
     * @return The rewritten node.
     */
    public static IrNode rename(IrNode node, String from, String to) {
        return new ReferenceRenamer(from, to).apply(node);
    }

    /**
     * @param node The scope root; {@code null} is returned as is.
     * @return The rewritten node, the same instance if no read was renamed.
     */
    public IrNode apply(IrNode node) {
        if (node == null) {
            return null;
        }
        if (node instanceof Var v) {
            return v.name().equals(from) ? v.withName(to) : v;
        }
        if (node instanceof Opaque opaque) {
            String text = IdentifierScanner.replace(opaque.text(), from, to);
            return text.equals(opaque.text()) ? opaque : new Opaque(text, opaque.meta());
        }
        if (node instanceof Block block) {
            return renameBlock(block);
        }
        if (node instanceof Match match) {
            IrNode value = apply(match.value());
            IrPattern pattern = Patterns.renamePins(match.pattern(), from, to);
            if (value == match.value() && pattern == match.pattern()) {
                return match;
            }
            return new Match(pattern, value, match.meta());
        }
        if (node instanceof CaseClause clause) {
            IrPattern pattern = Patterns.renamePins(clause.pattern(), from, to);
            if (scopes.boundNames(pattern).contains(from)) {
                return pattern == clause.pattern() ? clause : clause.withPatternAndBody(pattern, clause.guard(), clause.body());
            }
            IrNode guard = apply(clause.guard());
            IrNode body = apply(clause.body());
            if (pattern == clause.pattern() && guard == clause.guard() && body == clause.body()) {
                return clause;
            }
            return clause.withPatternAndBody(pattern, guard, body);
        }
        if (node instanceof FnClause clause) {
            List<IrPattern> params = clause.params().stream()
                    .map(p -> Patterns.renamePins(p, from, to)).toList();
            if (scopes.boundNames(params).contains(from)) {
                return params.equals(clause.params()) ? clause : clause.withParamsAndBody(params, clause.guard(), clause.body());
            }
            IrNode guard = apply(clause.guard());
            IrNode body = apply(clause.body());
            if (params.equals(clause.params()) && guard == clause.guard() && body == clause.body()) {
                return clause;
            }
            return clause.withParamsAndBody(params, guard, body);
        }
        if (node instanceof Def def) {
            if (scopes.boundNames(def.params()).contains(from)) {
                return def;
            }
            return TreeWalker.rebuild(def, this::apply);
        }
        if (node instanceof With with) {
            return renameWith(with);
        }
        if (node instanceof For comprehension) {
            return renameFor(comprehension);
        }
        return TreeWalker.rebuild(node, this::apply);
    }

    private IrNode renameBlock(Block block) {
        List<IrNode> statements = block.statements();
        List<IrNode> out = null;
        for (int i = 0; i < statements.size(); i++) {
            IrNode statement = statements.get(i);
            IrNode renamed = apply(statement);
            if (renamed != statement) {
                if (out == null) {
                    out = new ArrayList<>(statements.subList(0, i));
                }
            }
            if (out != null) {
                out.add(renamed);
            }
            if (scopes.statementBindings(statement).contains(from)) {
                if (out != null) {
                    out.addAll(statements.subList(i + 1, statements.size()));
                }
                break;
            }
        }
        return out == null ? block : block.withStatements(out);
    }

    private IrNode renameWith(With with) {
        List<WithClause> clauses = new ArrayList<>(with.clauses().size());
        boolean shadowed = false;
        boolean changed = false;
        for (WithClause clause : with.clauses()) {
            if (shadowed) {
                clauses.add(clause);
                continue;
            }
            IrNode value = apply(clause.value());
            IrPattern pattern = Patterns.renamePins(clause.pattern(), from, to);
            if (value != clause.value() || pattern != clause.pattern()) {
                changed = true;
                clauses.add(new WithClause(pattern, value, clause.meta()));
            } else {
                clauses.add(clause);
            }
            shadowed = scopes.boundNames(pattern).contains(from);
        }
        IrNode body = shadowed ? with.body() : apply(with.body());
        List<CaseClause> elseClauses = with.elseClauses().stream().map(c -> (CaseClause) apply(c)).toList();
        changed |= body != with.body() || !sameElements(elseClauses, with.elseClauses());
        return changed ? new With(clauses, body, elseClauses, with.meta()) : with;
    }

    private IrNode renameFor(For comprehension) {
        List<ForGenerator> generators = new ArrayList<>(comprehension.generators().size());
        boolean shadowed = false;
        boolean changed = false;
        for (ForGenerator generator : comprehension.generators()) {
            if (shadowed) {
                generators.add(generator);
                continue;
            }
            IrNode enumerable = apply(generator.enumerable());
            IrPattern pattern = Patterns.renamePins(generator.pattern(), from, to);
            if (enumerable != generator.enumerable() || pattern != generator.pattern()) {
                changed = true;
                generators.add(new ForGenerator(pattern, enumerable, generator.meta()));
            } else {
                generators.add(generator);
            }
            shadowed = scopes.boundNames(pattern).contains(from);
        }
        final boolean hidden = shadowed;
        List<IrNode> filters = comprehension.filters().stream().map(f -> hidden ? f : apply(f)).toList();
        IrNode body = hidden ? comprehension.body() : apply(comprehension.body());
        IrNode into = apply(comprehension.into());
        changed |= body != comprehension.body() || into != comprehension.into()
                || !sameElements(filters, comprehension.filters());
        return changed ? new For(generators, filters, into, body, comprehension.meta()) : comprehension;
    }

    private static boolean sameElements(List<? extends IrNode> a, List<? extends IrNode> b) {
        for (int i = 0; i < a.size(); i++) {
            if (a.get(i) != b.get(i)) {
                return false;
            }
        }
        return true;
    }
}
