package org.irnorm.compiler.passes;

import org.irnorm.config.NormalizerConfig;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves a configured list of pass names into a validated, ordered pipeline.
 * <p>
 * A list is valid when every name is registered and appears once, tiers never go back
 * (structural, semantic, cleanup), and every declared predecessor of a pass is present and
 * placed before it.
 */
public final class PassScheduler {

    private final List<INormalizationPass> passes;

    /**
     * @param registry Where pass names are looked up.
     * @param names The pass names in run order.
     * @throws PipelineConfigurationException if the list is not a valid pipeline.
     */
    public PassScheduler(PassRegistry registry, List<String> names) {
        List<INormalizationPass> resolved = new ArrayList<>(names.size());
        Map<String, Integer> positions = new HashMap<>();
        PassTier previousTier = null;
        for (String name : names) {
            INormalizationPass pass = registry.create(name)
                    .orElseThrow(() -> new PipelineConfigurationException("Unknown pass: " + name));
            if (positions.putIfAbsent(name, resolved.size()) != null) {
                throw new PipelineConfigurationException("Pass listed twice: " + name);
            }
            if (previousTier != null && pass.tier().compareTo(previousTier) < 0) {
                throw new PipelineConfigurationException("Pass " + name + " of tier " + pass.tier()
                        + " cannot run after a " + previousTier + " pass");
            }
            previousTier = pass.tier();
            resolved.add(pass);
        }
        for (INormalizationPass pass : resolved) {
            int position = positions.get(pass.name());
            for (String predecessor : pass.runsAfter()) {
                Integer at = positions.get(predecessor);
                if (at == null || at > position) {
                    throw new PipelineConfigurationException("Pass " + pass.name() + " must run after " + predecessor);
                }
            }
        }
        this.passes = List.copyOf(resolved);
    }

    /**
     * Builds the pipeline named in a configuration from the default registry.
     * @param config The normalizer configuration.
     * @return The scheduler.
     */
    public static PassScheduler fromConfig(NormalizerConfig config) {
        return new PassScheduler(PassRegistry.initializeWithDefaults(), config.passes());
    }

    /**
     * @return The passes in run order.
     */
    public List<INormalizationPass> passes() {
        return passes;
    }
}
