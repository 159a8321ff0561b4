package org.irnorm.compiler.passes.semantic;

import org.irnorm.compiler.analysis.BinderHarmonizer;
import org.irnorm.compiler.analysis.Harmonization;
import org.irnorm.compiler.analysis.ScopeContext;
import org.irnorm.compiler.diagnostics.CompilerLogger;
import org.irnorm.compiler.ir.Call;
import org.irnorm.compiler.ir.Fn;
import org.irnorm.compiler.ir.FnClause;
import org.irnorm.compiler.ir.IrNode;
import org.irnorm.compiler.ir.RemoteCall;
import org.irnorm.compiler.ir.TreeWalker;
import org.irnorm.compiler.passes.INormalizationPass;
import org.irnorm.compiler.passes.PassContext;
import org.irnorm.compiler.passes.PassTier;
import org.irnorm.compiler.passes.ScopedRewriter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Aligns the parameter of an anonymous function passed to a higher-order call with the one
 * name its body reads without a binding, when that name is used as a field/index receiver or as
 * a call argument. Names closed over from the enclosing scope are never captured.
 */
public class ClosureParameterAlignmentPass implements INormalizationPass {

    public static final String NAME = "closure-parameter-alignment";

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
        BinderHarmonizer harmonizer = new BinderHarmonizer(context.config().harmonizerPolicy());
        return new ScopedRewriter() {
            @Override
            protected IrNode leave(IrNode node, ScopeContext scope) {
                if (node instanceof Call || node instanceof RemoteCall) {
                    return TreeWalker.rebuild(node, child -> child instanceof Fn fn
                            ? align(fn, scope.visible(), harmonizer, context) : child);
                }
                return node;
            }
        }.rewrite(root);
    }

    private IrNode align(Fn fn, Set<String> enclosing, BinderHarmonizer harmonizer, PassContext context) {
        List<FnClause> clauses = new ArrayList<>(fn.clauses().size());
        boolean changed = false;
        for (FnClause clause : fn.clauses()) {
            Harmonization result = harmonizer.harmonize(clause.params(),
                    Arrays.asList(clause.guard(), clause.body()), enclosing, BinderHarmonizer.Mode.CLOSURE);
            if (result.isAmbiguous()) {
                context.info(this, "closure: " + result.ambiguity(), fn.source());
            }
            if (result.changed()) {
                CompilerLogger.debug(NAME + ": closure parameter '" + result.renamedFrom()
                        + "' -> '" + result.renamedTo() + "'");
                clauses.add(clause.withParamsAndBody(result.patterns(), result.scope().get(0), result.scope().get(1)));
                changed = true;
            } else {
                clauses.add(clause);
            }
        }
        return changed ? new Fn(clauses, fn.meta()) : fn;
    }
}
