package org.irnorm.compiler.passes;

import org.irnorm.compiler.passes.cleanup.DeadSentinelEliminationPass;
import org.irnorm.compiler.passes.cleanup.PipelineIdiomPass;
import org.irnorm.compiler.passes.cleanup.ReservedWordSanitizationPass;
import org.irnorm.compiler.passes.cleanup.SelfRebindEliminationPass;
import org.irnorm.compiler.passes.cleanup.StringConcatInterpolationPass;
import org.irnorm.compiler.passes.cleanup.UnusedBinderUnderscoringPass;
import org.irnorm.compiler.passes.cleanup.UnusedResultUnderscoringPass;
import org.irnorm.compiler.passes.semantic.ClauseBinderHarmonizationPass;
import org.irnorm.compiler.passes.semantic.ClosureParameterAlignmentPass;
import org.irnorm.compiler.passes.semantic.DiscardOrRebindPass;
import org.irnorm.compiler.passes.semantic.FunctionParameterHarmonizationPass;
import org.irnorm.compiler.passes.semantic.PayloadBinderHarmonizationPass;
import org.irnorm.compiler.passes.structural.BlockFlatteningPass;
import org.irnorm.compiler.passes.structural.DeadCodeAfterReturnPass;
import org.irnorm.compiler.passes.structural.EarlyReturnReconstructionPass;
import org.irnorm.compiler.passes.structural.LoopAccumulatorAlignmentPass;
import org.irnorm.compiler.passes.structural.PlaceholderInitEliminationPass;
import org.irnorm.compiler.passes.structural.TempVariableInliningPass;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Registry of normalization passes by name. Every lookup creates a fresh instance.
 */
public final class PassRegistry {

    private final Map<String, Supplier<INormalizationPass>> factories = new LinkedHashMap<>();

    /**
     * Registers a pass under the name its instances report.
     * @param factory Creates the pass.
     */
    public void register(Supplier<INormalizationPass> factory) {
        String name = factory.get().name();
        if (factories.putIfAbsent(name, factory) != null) {
            throw new PipelineConfigurationException("Pass registered twice: " + name);
        }
    }

    /**
     * @param name A pass name.
     * @return A new instance of the pass, or empty if the name is unknown.
     */
    public Optional<INormalizationPass> create(String name) {
        Supplier<INormalizationPass> factory = factories.get(name);
        return factory == null ? Optional.empty() : Optional.of(factory.get());
    }

    /**
     * @return All registered names in registration order.
     */
    public List<String> names() {
        return List.copyOf(factories.keySet());
    }

    /**
     * Initializes a new registry with the built-in passes in their default order.
     * @return A new registry with default passes.
     */
    public static PassRegistry initializeWithDefaults() {
        PassRegistry reg = new PassRegistry();
        reg.register(BlockFlatteningPass::new);
        reg.register(DeadCodeAfterReturnPass::new);
        reg.register(EarlyReturnReconstructionPass::new);
        reg.register(PlaceholderInitEliminationPass::new);
        reg.register(LoopAccumulatorAlignmentPass::new);
        reg.register(TempVariableInliningPass::new);
        reg.register(FunctionParameterHarmonizationPass::new);
        reg.register(PayloadBinderHarmonizationPass::new);
        reg.register(ClauseBinderHarmonizationPass::new);
        reg.register(ClosureParameterAlignmentPass::new);
        reg.register(DiscardOrRebindPass::new);
        reg.register(SelfRebindEliminationPass::new);
        reg.register(DeadSentinelEliminationPass::new);
        reg.register(StringConcatInterpolationPass::new);
        reg.register(PipelineIdiomPass::new);
        reg.register(UnusedResultUnderscoringPass::new);
        reg.register(UnusedBinderUnderscoringPass::new);
        reg.register(ReservedWordSanitizationPass::new);
        return reg;
    }
}
