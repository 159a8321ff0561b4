package org.irnorm.compiler.analysis;

import org.irnorm.compiler.ir.IrNode;
import org.irnorm.compiler.ir.IrPattern;

import java.util.List;

/**
 * Outcome of one harmonizer run.
 *
 * @param patterns The (possibly rewritten) binding patterns.
 * @param scope The (possibly rewritten) scope nodes, in input order.
 * @param renamedFrom The old binder name, or {@code null} if nothing changed.
 * @param renamedTo The new binder name, or {@code null} if nothing changed.
 * @param ambiguity Why a repair was skipped as ambiguous, or {@code null}.
 */
public record Harmonization(List<IrPattern> patterns, List<IrNode> scope, String renamedFrom, String renamedTo,
                            String ambiguity) {

    static Harmonization unchanged(List<IrPattern> patterns, List<IrNode> scope) {
        return new Harmonization(patterns, scope, null, null, null);
    }

    static Harmonization ambiguous(List<IrPattern> patterns, List<IrNode> scope, String reason) {
        return new Harmonization(patterns, scope, null, null, reason);
    }

    public boolean changed() {
        return renamedTo != null;
    }

    public boolean isAmbiguous() {
        return ambiguity != null;
    }
}
