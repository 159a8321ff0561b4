package org.irnorm.compiler.passes.semantic;

import org.irnorm.compiler.analysis.BinderHarmonizer;
import org.irnorm.compiler.analysis.Harmonization;
import org.irnorm.compiler.analysis.ScopeContext;
import org.irnorm.compiler.analysis.ScopeWalker;
import org.irnorm.compiler.api.SourceInfo;
import org.irnorm.compiler.diagnostics.CompilerLogger;
import org.irnorm.compiler.ir.CaseClause;
import org.irnorm.compiler.ir.FnClause;
import org.irnorm.compiler.ir.IrNode;
import org.irnorm.compiler.ir.IrPattern;
import org.irnorm.compiler.ir.Patterns;
import org.irnorm.compiler.ir.With;
import org.irnorm.compiler.ir.WithClause;
import org.irnorm.compiler.passes.INormalizationPass;
import org.irnorm.compiler.passes.PassContext;
import org.irnorm.compiler.passes.ScopedRewriter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Shared walk of the clause-harmonizing passes: visits case-like clauses, {@code with} steps and
 * (optionally) single-parameter closures, and hands every selected head to the harmonizer with
 * the names visible around it.
 */
abstract class ClauseHarmonizationSupport implements INormalizationPass {

    /**
     * @param pattern A clause head.
     * @return {@code true} if this pass harmonizes the head.
     */
    protected abstract boolean selects(IrPattern pattern);

    protected abstract BinderHarmonizer.Mode mode();

    /**
     * @return {@code true} to include single-parameter anonymous-function clauses.
     */
    protected boolean includesFnClauses() {
        return false;
    }

    /**
     * @param pattern A pattern.
     * @return {@code true} if the pattern contains a tagged tuple anywhere.
     */
    protected static boolean containsTagged(IrPattern pattern) {
        boolean[] found = {false};
        Patterns.forEach(pattern, p -> found[0] |= BinderHarmonizer.isTagged(p));
        return found[0];
    }

    @Override
    public IrNode run(IrNode root, PassContext context) {
        BinderHarmonizer harmonizer = new BinderHarmonizer(context.config().harmonizerPolicy());
        return new ScopedRewriter() {
            @Override
            protected IrNode leave(IrNode node, ScopeContext scope) {
                if (node instanceof CaseClause clause && selects(clause.pattern())) {
                    Harmonization result = harmonizer.harmonize(List.of(clause.pattern()),
                            Arrays.asList(clause.guard(), clause.body()), scope.visible(), mode());
                    report(result, clause.source(), context);
                    return result.changed()
                            ? clause.withPatternAndBody(result.patterns().get(0), result.scope().get(0), result.scope().get(1))
                            : clause;
                }
                if (includesFnClauses() && node instanceof FnClause clause
                        && clause.params().size() == 1 && selects(clause.params().get(0))) {
                    Harmonization result = harmonizer.harmonize(clause.params(),
                            Arrays.asList(clause.guard(), clause.body()), scope.visible(), mode());
                    report(result, clause.source(), context);
                    return result.changed()
                            ? clause.withParamsAndBody(result.patterns(), result.scope().get(0), result.scope().get(1))
                            : clause;
                }
                if (node instanceof With with) {
                    return harmonizeWith(with, scope, harmonizer, context);
                }
                return node;
            }
        }.rewrite(root);
    }

    private IrNode harmonizeWith(With with, ScopeContext scope, BinderHarmonizer harmonizer, PassContext context) {
        List<WithClause> clauses = new ArrayList<>(with.clauses());
        IrNode body = with.body();
        boolean changed = false;
        Set<String> visible = new HashSet<>(scope.visible());
        ScopeWalker walker = new ScopeWalker();
        for (int i = 0; i < clauses.size(); i++) {
            WithClause clause = clauses.get(i);
            if (selects(clause.pattern())) {
                List<IrNode> governed = new ArrayList<>(clauses.subList(i + 1, clauses.size()));
                governed.add(body);
                Harmonization result = harmonizer.harmonize(List.of(clause.pattern()), governed, visible, mode());
                report(result, clause.source(), context);
                if (result.changed()) {
                    changed = true;
                    clause = clause.withPattern(result.patterns().get(0));
                    clauses.set(i, clause);
                    for (int j = i + 1; j < clauses.size(); j++) {
                        clauses.set(j, (WithClause) result.scope().get(j - i - 1));
                    }
                    body = result.scope().get(result.scope().size() - 1);
                }
            }
            visible.addAll(walker.boundNames(clause.pattern()));
        }
        return changed ? new With(clauses, body, with.elseClauses(), with.meta()) : with;
    }

    private void report(Harmonization result, SourceInfo source, PassContext context) {
        if (result.isAmbiguous()) {
            context.info(this, result.ambiguity(), source);
        } else if (result.changed()) {
            CompilerLogger.debug(name() + ": binder '" + result.renamedFrom() + "' -> '" + result.renamedTo() + "'");
        }
    }
}
