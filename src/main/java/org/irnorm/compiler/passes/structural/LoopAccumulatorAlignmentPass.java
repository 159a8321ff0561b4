package org.irnorm.compiler.passes.structural;

import org.irnorm.compiler.analysis.IdentifierScanner;
import org.irnorm.compiler.analysis.ScopeWalker;
import org.irnorm.compiler.diagnostics.CompilerLogger;
import org.irnorm.compiler.ir.Fn;
import org.irnorm.compiler.ir.FnClause;
import org.irnorm.compiler.ir.IrNode;
import org.irnorm.compiler.ir.IrPattern;
import org.irnorm.compiler.ir.IrPattern.BindPat;
import org.irnorm.compiler.ir.IrPattern.TuplePat;
import org.irnorm.compiler.ir.Opaque;
import org.irnorm.compiler.ir.Patterns;
import org.irnorm.compiler.ir.RemoteCall;
import org.irnorm.compiler.ir.TreeWalker;
import org.irnorm.compiler.ir.TupleLit;
import org.irnorm.compiler.ir.Var;
import org.irnorm.compiler.passes.INormalizationPass;
import org.irnorm.compiler.passes.PassContext;
import org.irnorm.compiler.passes.PassTier;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Lines up the accumulator binders of lowered loops with the names their bodies use.
 * <p>
 * A loop is lowered to {@code Enum.reduce_while(enum, {i, j}, fn _, {acc_i, acc_j} -> ... end)}
 * (or {@code Enum.reduce}). The accumulator is seeded from outer variables, but the body is
 * sometimes lowered against the outer names, so it reads and rebinds {@code i} while the updated
 * value travels in {@code acc_i}. For each accumulator slot bound to a plain binder and seeded
 * from a plain variable whose name the body reads freely:
 * <ul>
 *   <li>if the body never mentions the binder, the binder takes the seed's name, so the body's
 *       reads see the accumulator;</li>
 *   <li>otherwise every occurrence of the seed's name in the body becomes the binder's name.</li>
 * </ul>
 * Slots whose seed name is also bound by another parameter are left alone.
 */
public class LoopAccumulatorAlignmentPass implements INormalizationPass {

    public static final String NAME = "loop-accumulator-alignment";

    private static final Set<String> LOOP_FUNCTIONS = Set.of("Enum.reduce_while", "Enum.reduce");

    private final ScopeWalker walker = new ScopeWalker();

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
        return new TreeWalker().rewriteBottomUp(root, n -> n instanceof RemoteCall call && isLoop(call) ? align(call) : n);
    }

    private static boolean isLoop(RemoteCall call) {
        String qualified = call.qualifiedName();
        if (qualified == null || !LOOP_FUNCTIONS.contains(qualified) || call.args().size() != 3) {
            return false;
        }
        return call.args().get(2) instanceof Fn fn && fn.clauses().size() == 1
                && fn.clauses().get(0).params().size() == 2;
    }

    private IrNode align(RemoteCall call) {
        Fn fn = (Fn) call.args().get(2);
        FnClause clause = fn.clauses().get(0);
        IrPattern accumulator = clause.params().get(1);
        IrNode seed = call.args().get(1);

        List<IrPattern> slots;
        List<IrNode> seeds;
        if (accumulator instanceof TuplePat tuple && seed instanceof TupleLit literal
                && tuple.elements().size() == literal.elements().size()) {
            slots = tuple.elements();
            seeds = literal.elements();
        } else {
            slots = List.of(accumulator);
            seeds = List.of(seed);
        }

        List<IrPattern> params = clause.params();
        IrNode guard = clause.guard();
        IrNode body = clause.body();
        for (int k = 0; k < slots.size(); k++) {
            if (!(slots.get(k) instanceof BindPat binder) || !(seeds.get(k) instanceof Var outer)) {
                continue;
            }
            String accName = binder.name();
            String outerName = outer.name();
            if (accName.equals(outerName) || "_".equals(accName) || walker.boundNames(params).contains(outerName)) {
                continue;
            }
            List<IrNode> scope = Arrays.asList(guard, body);
            if (!isFree(outerName, scope)) {
                continue;
            }
            if (!mentions(accName, scope)) {
                params = params.stream().map(p -> Patterns.renameBinder(p, accName, outerName)).toList();
                CompilerLogger.debug(NAME + ": binder " + accName + " -> " + outerName);
            } else {
                guard = renameAll(guard, outerName, accName);
                body = renameAll(body, outerName, accName);
                CompilerLogger.debug(NAME + ": body " + outerName + " -> " + accName);
            }
        }
        if (params == clause.params() && guard == clause.guard() && body == clause.body()) {
            return call;
        }
        FnClause aligned = clause.withParamsAndBody(params, guard, body);
        List<IrNode> args = new ArrayList<>(call.args());
        args.set(2, new Fn(List.of(aligned), fn.meta()));
        return new RemoteCall(call.target(), call.function(), args, call.meta());
    }

    private boolean isFree(String name, List<IrNode> scope) {
        for (IrNode node : scope) {
            if (node != null && walker.freeNames(node).contains(name)) {
                return true;
            }
        }
        return false;
    }

    private boolean mentions(String name, List<IrNode> scope) {
        for (IrNode node : scope) {
            if (node != null && (walker.referencedNames(node).contains(name)
                    || walker.declaredInSubtree(node).contains(name))) {
                return true;
            }
        }
        return false;
    }

    private static IrNode renameAll(IrNode node, String from, String to) {
        return new TreeWalker().rewriteBottomUp(node, n -> {
            if (n instanceof Var v) {
                return v.name().equals(from) ? v.withName(to) : v;
            }
            if (n instanceof Opaque opaque) {
                String text = IdentifierScanner.replace(opaque.text(), from, to);
                return text.equals(opaque.text()) ? opaque : new Opaque(text, opaque.meta());
            }
            return Patterns.mapNodePatterns(n, p -> Patterns.renamePins(Patterns.renameBinder(p, from, to), from, to));
        });
    }
}
