package org.irnorm.compiler;

import org.irnorm.compiler.analysis.UnboundReferenceChecker;
import org.irnorm.compiler.api.NormalizationException;
import org.irnorm.compiler.api.NormalizationResult;
import org.irnorm.compiler.diagnostics.Diagnostic;
import org.irnorm.compiler.ir.IrNode;
import org.irnorm.compiler.passes.INormalizationPass;
import org.irnorm.compiler.passes.PassContext;
import org.irnorm.compiler.passes.PassRegistry;
import org.irnorm.compiler.passes.PassTier;
import org.irnorm.compiler.passes.PipelineConfigurationException;
import org.irnorm.compiler.passes.structural.BlockFlatteningPass;
import org.irnorm.config.NormalizerConfig;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.function.UnaryOperator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.irnorm.compiler.ir.Ir.*;

/**
 * End-to-end tests for the {@link Normalizer}: the default pipeline over small units.
 */
@Tag("unit")
class NormalizerTest {

    private static IrNode lookupModule() {
        return module("Accounts", def("lookup", List.of(bind("id")), block(
                ifThen(call("blank?", var("id")), returnOf(atom("error"))),
                caseOf(remote("Repo", "get", var("id")),
                        clause(tagged("ok", "_"), call("render", var("user"))),
                        clause(tagged("error", "_"), atom("missing"))))));
    }

    @Test
    void testNormalize_RepairsEarlyReturnAndPayloadBinder() throws Exception {
        NormalizationResult result = new Normalizer().normalize(lookupModule());

        assertThat(result.tree()).isEqualTo(module("Accounts", def("lookup", List.of(bind("id")), block(
                ifElse(call("blank?", var("id")), atom("error"), block(
                        caseOf(remote("Repo", "get", var("id")),
                                clause(tagged("ok", "user"), call("render", var("user"))),
                                clause(tagged("error", "_"), atom("missing")))))))));
        assertThat(result.diagnostics()).isEmpty();
        assertThat(new UnboundReferenceChecker().check(result.tree())).isEmpty();
    }

    @Test
    void testNormalize_IsIdempotent() throws Exception {
        Normalizer normalizer = new Normalizer();
        IrNode once = normalizer.normalize(lookupModule()).tree();

        IrNode twice = normalizer.normalize(once).tree();

        assertThat(twice).isEqualTo(once);
    }

    @Test
    void testNormalize_TerminalValueSurvives() throws Exception {
        IrNode unit = def("f", List.of(bind("a")), block(
                assign("x", nil()), assign("x", call("g", var("a"))), atom("done")));

        IrNode result = new Normalizer().normalize(unit).tree();

        assertThat(result).isEqualTo(def("f", List.of(bind("a")), block(
                assign("_x", call("g", var("a"))), atom("done"))));
    }

    @Test
    void testNormalize_UnboundReferenceIsAWarning() throws Exception {
        IrNode unit = module("M", def("f", List.of(), call("g", var("missing"))));

        NormalizationResult result = new Normalizer().normalize(unit);

        assertThat(result.hasWarnings()).isTrue();
        assertThat(result.diagnostics()).extracting(Diagnostic::message).contains("unbound variable 'missing' in f");
    }

    @Test
    void testNormalize_UnboundReferenceFailsWhenConfigured() {
        Normalizer normalizer = new Normalizer(NormalizerConfig.defaults().withFailOnUnboundReference(true));
        IrNode unit = module("M", def("f", List.of(), call("g", var("missing"))));

        assertThatThrownBy(() -> normalizer.normalize(unit))
                .isInstanceOf(NormalizationException.class)
                .hasMessageContaining("Unbound references")
                .hasMessageContaining("missing");
    }

    @Test
    void testNormalize_FailingPassIsWrapped() {
        PassRegistry registry = PassRegistry.initializeWithDefaults();
        registry.register(() -> new FixedPass("explode", tree -> {
            throw new IllegalStateException("boom");
        }));
        Normalizer normalizer = new Normalizer(
                NormalizerConfig.defaults().withPasses(List.of(BlockFlatteningPass.NAME, "explode")), registry);

        assertThatThrownBy(() -> normalizer.normalize(block(call("f"))))
                .isInstanceOf(NormalizationException.class)
                .hasMessage("Pass explode failed: boom")
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void testNormalize_PassReturningNothingFails() {
        PassRegistry registry = PassRegistry.initializeWithDefaults();
        registry.register(() -> new FixedPass("vanish", tree -> null));
        Normalizer normalizer = new Normalizer(NormalizerConfig.defaults().withPasses(List.of("vanish")), registry);

        assertThatThrownBy(() -> normalizer.normalize(block(call("f"))))
                .isInstanceOf(NormalizationException.class)
                .hasMessage("Pass vanish returned no tree");
    }

    @Test
    void testNormalize_NullUnitFails() {
        assertThatThrownBy(() -> new Normalizer().normalize(null)).isInstanceOf(NormalizationException.class);
    }

    @Test
    void testConstructor_InvalidPipelineFailsEarly() {
        NormalizerConfig config = NormalizerConfig.defaults().withPasses(List.of("no-such-pass"));

        assertThatThrownBy(() -> new Normalizer(config)).isInstanceOf(PipelineConfigurationException.class);
    }

    @Test
    void testNormalize_EmptyPipelineReturnsInput() throws Exception {
        Normalizer normalizer = new Normalizer(NormalizerConfig.defaults().withPasses(List.of()));
        IrNode unit = block(assign("x", integer(1)), var("x"));

        assertThat(normalizer.normalize(unit).tree()).isSameAs(unit);
    }

    private record FixedPass(String name, UnaryOperator<IrNode> body) implements INormalizationPass {
        @Override
        public PassTier tier() {
            return PassTier.CLEANUP;
        }

        @Override
        public IrNode run(IrNode root, PassContext context) {
            return body.apply(root);
        }
    }
}
