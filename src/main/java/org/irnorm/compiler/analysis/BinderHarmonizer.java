package org.irnorm.compiler.analysis;

import org.irnorm.compiler.ir.IrNode;
import org.irnorm.compiler.ir.IrPattern;
import org.irnorm.compiler.ir.IrPattern.BindPat;
import org.irnorm.compiler.ir.IrPattern.LitPat;
import org.irnorm.compiler.ir.IrPattern.TuplePat;
import org.irnorm.compiler.ir.LiteralKind;
import org.irnorm.compiler.ir.Patterns;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Usage-driven binder renaming.
 * <p>
 * Given binding patterns and the scope they govern, the harmonizer computes the names the scope
 * reads without any visible binding. If exactly one such name exists and exactly one binder is a
 * candidate for it (unused in the scope, or underscore-prefixed), the binder is renamed toward the
 * used name and the scope's reads of the old name follow. The harmonizer never renames a read
 * and never invents a name.
 */
public class BinderHarmonizer {

    /**
     * Which kind of binding site is being harmonized.
     */
    public enum Mode {
        /** Definition parameters against guard and body. */
        PARAMETER,
        /** Clause heads of case, receive, rescue and with. */
        CLAUSE,
        /** Tagged tuples {@code {:tag, binder}}: candidates are payload slots, tie-breaks apply. */
        PAYLOAD,
        /** Anonymous-function parameters; the target must be a receiver or call argument. */
        CLOSURE
    }

    private final HarmonizerPolicy policy;
    private final ShapeClassifier shapes = new ShapeClassifier();

    /**
     * @param policy The tie-break policy for payload mode.
     */
    public BinderHarmonizer(HarmonizerPolicy policy) {
        this.policy = policy;
    }

    /**
     * Harmonizes binders with their uses.
     *
     * @param patterns The binding patterns.
     * @param scope The nodes the binders govern (guard, body, later clauses); may contain nulls.
     * @param enclosing Names visible from enclosing scopes; never treated as undefined or captured.
     * @param mode The binding site kind.
     * @return The outcome; unchanged patterns and scope when no unique safe repair exists.
     */
    public Harmonization harmonize(List<IrPattern> patterns, List<IrNode> scope, Set<String> enclosing, Mode mode) {
        ScopeWalker walker = new ScopeWalker();
        List<IrNode> present = scope.stream().filter(n -> n != null).toList();

        Set<String> declared = new LinkedHashSet<>(walker.boundNames(patterns));
        declared.addAll(enclosing);
        for (IrNode node : present) {
            declared.addAll(walker.declaredInSubtree(node));
        }
        Set<String> used = walker.referencedNames(present);
        Set<String> undefined = new LinkedHashSet<>(used);
        undefined.removeAll(declared);
        if (undefined.isEmpty()) {
            return Harmonization.unchanged(patterns, scope);
        }

        List<String> candidates = candidates(patterns, used, mode);
        if (candidates.isEmpty()) {
            return Harmonization.unchanged(patterns, scope);
        }

        String from;
        String to;
        if (undefined.size() == 1) {
            to = undefined.iterator().next();
            Optional<String> chosen = choose(candidates, to);
            if (chosen.isEmpty()) {
                return Harmonization.ambiguous(patterns, scope,
                        "binders " + candidates + " could all stand for '" + to + "'");
            }
            from = chosen.get();
        } else {
            if (mode != Mode.PAYLOAD) {
                return Harmonization.ambiguous(patterns, scope, "undefined names " + undefined);
            }
            List<String> promotable = candidates.stream()
                    .filter(c -> c.length() > 1 && c.startsWith("_") && undefined.contains(c.substring(1)))
                    .toList();
            if (promotable.size() == 1) {
                from = promotable.get(0);
                to = from.substring(1);
            } else if (candidates.size() == 1 && policy.pick(undefined).isPresent()) {
                from = candidates.get(0);
                to = policy.pick(undefined).get();
            } else {
                return Harmonization.ambiguous(patterns, scope, "undefined names " + undefined);
            }
        }

        if ("_".equals(from) && Collections.frequency(allBinders(patterns), "_") > 1) {
            return Harmonization.ambiguous(patterns, scope, "several wildcards could stand for '" + to + "'");
        }
        if (mode == Mode.CLOSURE && !shapes.isReceiverOrArgument(to, present)) {
            return Harmonization.unchanged(patterns, scope);
        }
        if (!shapes.compatible(shapes.binderShape(patterns, from), shapes.usageShape(to, present))) {
            return Harmonization.unchanged(patterns, scope);
        }

        final String oldName = from;
        final String newName = to;
        List<IrPattern> renamedPatterns = patterns.stream()
                .map(p -> Patterns.renameBinder(p, oldName, newName)).toList();
        List<IrNode> renamedScope = new ArrayList<>(scope.size());
        ReferenceRenamer renamer = new ReferenceRenamer(oldName, newName);
        for (IrNode node : scope) {
            renamedScope.add("_".equals(oldName) ? node : renamer.apply(node));
        }
        return new Harmonization(renamedPatterns, renamedScope, oldName, newName, null);
    }

    private Optional<String> choose(List<String> candidates, String target) {
        String promoted = "_" + target;
        if (candidates.contains(promoted)) {
            return Optional.of(promoted);
        }
        return candidates.size() == 1 ? Optional.of(candidates.get(0)) : Optional.empty();
    }

    private List<String> candidates(List<IrPattern> patterns, Set<String> used, Mode mode) {
        List<String> binders = mode == Mode.PAYLOAD ? payloadBinders(patterns) : allBinders(patterns);
        // a bare wildcard in a clause head or parameter list is a deliberate catch-all
        boolean wildcards = mode == Mode.PAYLOAD || mode == Mode.CLOSURE;
        return binders.stream()
                .filter(name -> wildcards || !"_".equals(name))
                .filter(name -> name.startsWith("_") || !used.contains(name))
                .toList();
    }

    private static List<String> allBinders(List<IrPattern> patterns) {
        List<String> out = new ArrayList<>();
        for (IrPattern pattern : patterns) {
            out.addAll(Patterns.binderOccurrences(pattern));
        }
        return out;
    }

    /**
     * Collects plain binders that sit directly in the payload slots of tagged tuples
     * ({@code {:tag, binder}} and {@code {:tag, a, b}}), anywhere in the patterns.
     */
    private static List<String> payloadBinders(List<IrPattern> patterns) {
        List<String> out = new ArrayList<>();
        for (IrPattern pattern : patterns) {
            Patterns.forEach(pattern, p -> {
                if (isTagged(p)) {
                    List<IrPattern> elements = ((TuplePat) p).elements();
                    for (IrPattern element : elements.subList(1, elements.size())) {
                        if (element instanceof BindPat bind) {
                            out.add(bind.name());
                        }
                    }
                }
            });
        }
        return out;
    }

    /**
     * @param pattern A pattern.
     * @return {@code true} for a tuple of at least two elements whose first element is an atom.
     */
    public static boolean isTagged(IrPattern pattern) {
        return pattern instanceof TuplePat tuple && tuple.elements().size() >= 2
                && tuple.elements().get(0) instanceof LitPat lit && lit.kind() == LiteralKind.ATOM;
    }
}
