package org.irnorm.compiler.api;

import org.irnorm.compiler.diagnostics.Diagnostic;
import org.irnorm.compiler.ir.IrNode;

import java.util.List;

/**
 * The outcome of normalizing one compilation unit.
 *
 * @param tree The rewritten IR tree, ready for the serializer.
 * @param diagnostics All non-fatal diagnostics the passes reported.
 */
public record NormalizationResult(IrNode tree, List<Diagnostic> diagnostics) {

    public NormalizationResult {
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return {@code true} if any diagnostic of type WARNING was reported.
     */
    public boolean hasWarnings() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.WARNING);
    }
}
