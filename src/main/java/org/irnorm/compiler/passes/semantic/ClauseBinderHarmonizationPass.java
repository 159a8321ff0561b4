package org.irnorm.compiler.passes.semantic;

import org.irnorm.compiler.analysis.BinderHarmonizer;
import org.irnorm.compiler.ir.IrPattern;
import org.irnorm.compiler.passes.PassTier;

import java.util.List;

/**
 * Harmonizes the clause heads the payload pass leaves alone: untagged case, receive and rescue
 * patterns and {@code with} steps.
 */
public class ClauseBinderHarmonizationPass extends ClauseHarmonizationSupport {

    public static final String NAME = "clause-binder-harmonization";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public PassTier tier() {
        return PassTier.SEMANTIC;
    }

    @Override
    public List<String> runsAfter() {
        return List.of(PayloadBinderHarmonizationPass.NAME);
    }

    @Override
    protected boolean selects(IrPattern pattern) {
        return !containsTagged(pattern);
    }

    @Override
    protected BinderHarmonizer.Mode mode() {
        return BinderHarmonizer.Mode.CLAUSE;
    }
}
