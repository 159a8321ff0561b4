package org.irnorm.compiler.passes;

import org.irnorm.compiler.api.SourceInfo;
import org.irnorm.compiler.diagnostics.DiagnosticsEngine;
import org.irnorm.config.NormalizerConfig;

/**
 * What a pass may see besides the tree: the diagnostics sink and the configuration.
 *
 * @param diagnostics The sink for WARNING and INFO diagnostics.
 * @param config The normalizer configuration.
 */
public record PassContext(DiagnosticsEngine diagnostics, NormalizerConfig config) {

    public void info(INormalizationPass pass, String message, SourceInfo source) {
        diagnostics.reportInfo(pass.name(), message, source);
    }

    public void warning(INormalizationPass pass, String message, SourceInfo source) {
        diagnostics.reportWarning(pass.name(), message, source);
    }
}
