package org.irnorm.compiler.passes.semantic;

import org.irnorm.compiler.analysis.BinderHarmonizer;
import org.irnorm.compiler.analysis.Harmonization;
import org.irnorm.compiler.diagnostics.CompilerLogger;
import org.irnorm.compiler.ir.Def;
import org.irnorm.compiler.ir.IrNode;
import org.irnorm.compiler.ir.TreeWalker;
import org.irnorm.compiler.passes.INormalizationPass;
import org.irnorm.compiler.passes.PassContext;
import org.irnorm.compiler.passes.PassTier;

import java.util.Arrays;
import java.util.Set;

/**
 * Renames a definition's unused parameter toward the one name its body reads without a binding.
 */
public class FunctionParameterHarmonizationPass implements INormalizationPass {

    public static final String NAME = "function-parameter-harmonization";

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
        return new TreeWalker().rewriteBottomUp(root, n -> n instanceof Def def ? harmonize(def, harmonizer, context) : n);
    }

    private IrNode harmonize(Def def, BinderHarmonizer harmonizer, PassContext context) {
        Harmonization result = harmonizer.harmonize(def.params(), Arrays.asList(def.guard(), def.body()),
                Set.of(), BinderHarmonizer.Mode.PARAMETER);
        if (result.isAmbiguous()) {
            context.info(this, def.name() + ": " + result.ambiguity(), def.source());
        }
        if (!result.changed()) {
            return def;
        }
        CompilerLogger.debug(NAME + ": " + def.name() + " parameter '" + result.renamedFrom()
                + "' -> '" + result.renamedTo() + "'");
        return def.withParamsAndBody(result.patterns(), result.scope().get(0), result.scope().get(1));
    }
}
