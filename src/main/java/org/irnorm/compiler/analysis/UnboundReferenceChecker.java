package org.irnorm.compiler.analysis;

import org.irnorm.compiler.api.SourceInfo;
import org.irnorm.compiler.diagnostics.DiagnosticsEngine;
import org.irnorm.compiler.ir.Def;
import org.irnorm.compiler.ir.IrNode;
import org.irnorm.compiler.ir.ModuleDef;

import java.util.ArrayList;
import java.util.List;

/**
 * Verifies that every variable read in a normalized tree resolves to a visible binder.
 * Definitions are checked one at a time; module-level expressions on their own.
 */
public class UnboundReferenceChecker {

    /** The name diagnostics of this check are reported under. */
    public static final String NAME = "unbound-reference-check";

    /**
     * One unresolved read.
     *
     * @param name The variable name.
     * @param function The enclosing definition, or {@code null} at module level.
     * @param source The position of the enclosing definition or expression.
     */
    public record UnboundReference(String name, String function, SourceInfo source) {
        @Override
        public String toString() {
            return function == null
                    ? "unbound variable '" + name + "'"
                    : "unbound variable '" + name + "' in " + function;
        }
    }

    /**
     * Finds unresolved reads.
     * @param root A unit root, usually a {@link ModuleDef}.
     * @return The unresolved reads; empty if the tree is closed.
     */
    public List<UnboundReference> check(IrNode root) {
        List<UnboundReference> found = new ArrayList<>();
        if (root instanceof ModuleDef module) {
            for (IrNode item : module.body()) {
                checkItem(item, found);
            }
        } else {
            checkItem(root, found);
        }
        return found;
    }

    /**
     * Finds unresolved reads and reports each one as a warning.
     * @param root A unit root.
     * @param diagnostics The sink.
     * @return The unresolved reads.
     */
    public List<UnboundReference> check(IrNode root, DiagnosticsEngine diagnostics) {
        List<UnboundReference> found = check(root);
        for (UnboundReference ref : found) {
            diagnostics.reportWarning(NAME, ref.toString(), ref.source());
        }
        return found;
    }

    private void checkItem(IrNode item, List<UnboundReference> found) {
        if (item instanceof ModuleDef nested) {
            nested.body().forEach(inner -> checkItem(inner, found));
            return;
        }
        String function = item instanceof Def def ? def.name() : null;
        for (String name : new ScopeWalker().freeNames(item)) {
            found.add(new UnboundReference(name, function, item.source()));
        }
    }
}
