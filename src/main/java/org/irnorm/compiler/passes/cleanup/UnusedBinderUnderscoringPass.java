package org.irnorm.compiler.passes.cleanup;

import org.irnorm.compiler.analysis.ScopeWalker;
import org.irnorm.compiler.ir.CaseClause;
import org.irnorm.compiler.ir.Def;
import org.irnorm.compiler.ir.FnClause;
import org.irnorm.compiler.ir.For;
import org.irnorm.compiler.ir.ForGenerator;
import org.irnorm.compiler.ir.IrNode;
import org.irnorm.compiler.ir.IrPattern;
import org.irnorm.compiler.ir.Patterns;
import org.irnorm.compiler.ir.TreeWalker;
import org.irnorm.compiler.ir.With;
import org.irnorm.compiler.ir.WithClause;
import org.irnorm.compiler.passes.INormalizationPass;
import org.irnorm.compiler.passes.PassContext;
import org.irnorm.compiler.passes.PassTier;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Prefixes with an underscore parameters and clause-head binders their scope never reads:
 * definition and closure parameters, case-like clause heads, {@code with} steps and
 * comprehension generators.
 */
public class UnusedBinderUnderscoringPass implements INormalizationPass {

    public static final String NAME = "unused-binder-underscoring";

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
        ScopeWalker walker = new ScopeWalker();
        return new TreeWalker().rewriteBottomUp(root, n -> {
            if (n instanceof Def def) {
                List<IrPattern> params = underscore(def.params(), walker.referencedNames(Arrays.asList(def.guard(), def.body())));
                return params == def.params() ? def : def.withParamsAndBody(params, def.guard(), def.body());
            }
            if (n instanceof FnClause clause) {
                List<IrPattern> params = underscore(clause.params(), walker.referencedNames(Arrays.asList(clause.guard(), clause.body())));
                return params == clause.params() ? clause : clause.withParamsAndBody(params, clause.guard(), clause.body());
            }
            if (n instanceof CaseClause clause) {
                List<IrPattern> head = underscore(List.of(clause.pattern()),
                        walker.referencedNames(Arrays.asList(clause.guard(), clause.body())));
                return head.get(0) == clause.pattern() ? clause
                        : clause.withPatternAndBody(head.get(0), clause.guard(), clause.body());
            }
            if (n instanceof With with) {
                return underscoreWith(with, walker);
            }
            if (n instanceof For comprehension) {
                return underscoreFor(comprehension, walker);
            }
            return n;
        });
    }

    private IrNode underscoreWith(With with, ScopeWalker walker) {
        List<WithClause> clauses = new ArrayList<>(with.clauses());
        boolean changed = false;
        for (int i = 0; i < clauses.size(); i++) {
            List<IrNode> governed = new ArrayList<>(clauses.subList(i + 1, clauses.size()));
            governed.add(with.body());
            WithClause clause = clauses.get(i);
            IrPattern pattern = underscore(List.of(clause.pattern()), walker.referencedNames(governed)).get(0);
            if (pattern != clause.pattern()) {
                clauses.set(i, clause.withPattern(pattern));
                changed = true;
            }
        }
        return changed ? new With(clauses, with.body(), with.elseClauses(), with.meta()) : with;
    }

    private IrNode underscoreFor(For comprehension, ScopeWalker walker) {
        List<ForGenerator> generators = new ArrayList<>(comprehension.generators());
        boolean changed = false;
        for (int i = 0; i < generators.size(); i++) {
            List<IrNode> governed = new ArrayList<>(generators.subList(i + 1, generators.size()));
            governed.addAll(comprehension.filters());
            governed.add(comprehension.body());
            ForGenerator generator = generators.get(i);
            IrPattern pattern = underscore(List.of(generator.pattern()), walker.referencedNames(governed)).get(0);
            if (pattern != generator.pattern()) {
                generators.set(i, generator.withPattern(pattern));
                changed = true;
            }
        }
        return changed
                ? new For(generators, comprehension.filters(), comprehension.into(), comprehension.body(), comprehension.meta())
                : comprehension;
    }

    /**
     * Underscores binders not in {@code used}; binders repeated across the patterns are left alone.
     * @return The same list instance if nothing changed.
     */
    private static List<IrPattern> underscore(List<IrPattern> patterns, Set<String> used) {
        List<String> binders = new ArrayList<>();
        patterns.forEach(p -> binders.addAll(Patterns.binderOccurrences(p)));
        List<IrPattern> out = new ArrayList<>(patterns.size());
        boolean changed = false;
        for (IrPattern pattern : patterns) {
            IrPattern rewritten = Patterns.mapBinders(pattern, name ->
                    name.startsWith("_") || used.contains(name) || Collections.frequency(binders, name) > 1
                            ? name : Patterns.underscore(name));
            changed |= rewritten != pattern;
            out.add(rewritten);
        }
        return changed ? out : patterns;
    }
}
