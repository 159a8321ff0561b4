package org.irnorm.compiler.passes.semantic;

import org.irnorm.compiler.analysis.BinderHarmonizer;
import org.irnorm.compiler.ir.IrPattern;
import org.irnorm.compiler.passes.PassTier;

/**
 * Harmonizes binders in tagged-payload heads ({@code {:ok, value}}) of case, receive, rescue,
 * with and single-parameter closure clauses. An underscore-prefixed payload binder whose bare name
 * the body reads is promoted; with several undefined names the configured priority list decides.
 */
public class PayloadBinderHarmonizationPass extends ClauseHarmonizationSupport {

    public static final String NAME = "payload-binder-harmonization";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public PassTier tier() {
        return PassTier.SEMANTIC;
    }

    @Override
    protected boolean selects(IrPattern pattern) {
        return containsTagged(pattern);
    }

    @Override
    protected BinderHarmonizer.Mode mode() {
        return BinderHarmonizer.Mode.PAYLOAD;
    }

    @Override
    protected boolean includesFnClauses() {
        return true;
    }
}
