package org.irnorm.compiler.api;

import org.irnorm.compiler.ir.IrNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Defines the public, clean interface for the IR normalizer.
 * <p>
 * An implementation takes one IR tree per compilation unit from the upstream lowering stage and
 * returns a rewritten tree of the same variant set for the downstream serializer.
 */
public interface INormalizer {

    /**
     * Runs the configured pass pipeline on a single compilation unit.
     *
     * @param unit The root of the unit's IR tree (usually a {@code ModuleDef}).
     * @return The rewritten tree together with all collected diagnostics.
     * @throws NormalizationException if a pass fails or the result violates a fatal invariant.
     */
    NormalizationResult normalize(IrNode unit) throws NormalizationException;

    /**
     * Sets the verbosity level for log output.
     * @param level The verbosity level (0=error, 1=warn, 2=info, 3=debug, 4=trace).
     */
    void setVerbosity(int level);

    /**
     * Normalizes several independent compilation units in order.
     *
     * @param units The unit trees.
     * @return One result per unit, in input order.
     * @throws NormalizationException if any unit fails.
     */
    default List<NormalizationResult> normalizeAll(List<IrNode> units) throws NormalizationException {
        List<NormalizationResult> results = new ArrayList<>();
        for (IrNode unit : units) {
            results.add(normalize(unit));
        }
        return results;
    }
}
