package org.irnorm.compiler;

import org.irnorm.compiler.analysis.UnboundReferenceChecker;
import org.irnorm.compiler.analysis.UnboundReferenceChecker.UnboundReference;
import org.irnorm.compiler.api.INormalizer;
import org.irnorm.compiler.api.NormalizationException;
import org.irnorm.compiler.api.NormalizationResult;
import org.irnorm.compiler.codec.IrPrinter;
import org.irnorm.compiler.diagnostics.CompilerLogger;
import org.irnorm.compiler.diagnostics.DiagnosticsEngine;
import org.irnorm.compiler.ir.IrNode;
import org.irnorm.compiler.passes.INormalizationPass;
import org.irnorm.compiler.passes.PassContext;
import org.irnorm.compiler.passes.PassRegistry;
import org.irnorm.compiler.passes.PassScheduler;
import org.irnorm.config.NormalizerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The main normalizer implementation. It runs the configured pass pipeline over one compilation
 * unit at a time and then checks the result for unresolved variable reads.
 * <p>
 * The pipeline is resolved once at construction; an invalid pass list fails there. Instances
 * keep no per-unit state, every call gets its own diagnostics.
 */
public class Normalizer implements INormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(Normalizer.class);

    private final NormalizerConfig config;
    private final PassScheduler scheduler;
    private final UnboundReferenceChecker checker = new UnboundReferenceChecker();

    /**
     * Creates a normalizer with the classpath default configuration.
     */
    public Normalizer() {
        this(NormalizerConfig.defaults());
    }

    /**
     * @param config The configuration.
     * @throws org.irnorm.compiler.passes.PipelineConfigurationException if the pass list is invalid.
     */
    public Normalizer(NormalizerConfig config) {
        this(config, PassRegistry.initializeWithDefaults());
    }

    /**
     * Creates a normalizer that looks pass names up in a custom registry, e.g. one with
     * additional passes registered.
     * @param config The configuration.
     * @param registry Where the configured pass names are looked up.
     * @throws org.irnorm.compiler.passes.PipelineConfigurationException if the pass list is invalid.
     */
    public Normalizer(NormalizerConfig config, PassRegistry registry) {
        this.config = config;
        this.scheduler = new PassScheduler(registry, config.passes());
    }

    @Override
    public NormalizationResult normalize(IrNode unit) throws NormalizationException {
        if (unit == null) {
            throw new NormalizationException("No IR tree to normalize");
        }
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        PassContext context = new PassContext(diagnostics, config);
        IrNode tree = unit;
        for (INormalizationPass pass : scheduler.passes()) {
            tree = runPass(pass, tree, context);
        }

        List<UnboundReference> unbound = checker.check(tree, diagnostics);
        if (!unbound.isEmpty()) {
            if (config.failOnUnboundReference()) {
                throw new NormalizationException("Unbound references after normalization:\n" + diagnostics.summary());
            }
            LOG.warn("{} unbound reference(s) after normalization", unbound.size());
        }
        return new NormalizationResult(tree, diagnostics.getDiagnostics());
    }

    private IrNode runPass(INormalizationPass pass, IrNode tree, PassContext context) throws NormalizationException {
        long start = System.nanoTime();
        IrNode result;
        try {
            result = pass.run(tree, context);
        } catch (RuntimeException e) {
            LOG.error("Pass {} failed", pass.name(), e);
            throw new NormalizationException("Pass " + pass.name() + " failed: " + e.getMessage(), e);
        }
        if (result == null) {
            throw new NormalizationException("Pass " + pass.name() + " returned no tree");
        }
        long micros = (System.nanoTime() - start) / 1_000;
        CompilerLogger.debug(String.format("%s: %s in %d us", pass.name(), result == tree ? "unchanged" : "changed", micros));
        if (config.dumpIrAfterEachPass() && CompilerLogger.isEnabled(CompilerLogger.TRACE)) {
            CompilerLogger.trace("IR after " + pass.name() + ":\n" + IrPrinter.print(result));
        }
        return result;
    }

    @Override
    public void setVerbosity(int level) {
        CompilerLogger.setLevel(level);
    }

    /**
     * @return The passes this normalizer runs, in order.
     */
    public List<INormalizationPass> passes() {
        return scheduler.passes();
    }
}
