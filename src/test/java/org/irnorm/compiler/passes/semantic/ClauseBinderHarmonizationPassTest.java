package org.irnorm.compiler.passes.semantic;

import org.irnorm.compiler.diagnostics.DiagnosticsEngine;
import org.irnorm.compiler.ir.IrNode;
import org.irnorm.compiler.ir.NodeMeta;
import org.irnorm.compiler.ir.With;
import org.irnorm.compiler.ir.WithClause;
import org.irnorm.compiler.passes.PassContext;
import org.irnorm.config.NormalizerConfig;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.irnorm.compiler.ir.Ir.*;

@Tag("unit")
class ClauseBinderHarmonizationPassTest {

    private final ClauseBinderHarmonizationPass pass = new ClauseBinderHarmonizationPass();
    private final PassContext context = new PassContext(new DiagnosticsEngine(), NormalizerConfig.defaults());

    @Test
    void testRunsAfter_PayloadPass() {
        assertThat(pass.runsAfter()).containsExactly(PayloadBinderHarmonizationPass.NAME);
    }

    @Test
    void testRun_UntaggedClauseBinderFollowsUse() {
        IrNode tree = def("f", List.of(bind("m")), caseOf(var("m"),
                clause(bind("x"), call("use", var("entry")))));

        IrNode result = pass.run(tree, context);

        assertThat(result).isEqualTo(def("f", List.of(bind("m")), caseOf(var("m"),
                clause(bind("entry"), call("use", var("entry"))))));
    }

    @Test
    void testRun_WildcardClauseIsACatchAll() {
        IrNode tree = def("f", List.of(bind("m")), caseOf(var("m"),
                clause(bind("_"), call("use", var("entry")))));

        assertThat(pass.run(tree, context)).isSameAs(tree);
    }

    @Test
    void testRun_WithStepGovernsLaterStepsAndBody() {
        IrNode tree = def("f", List.of(), new With(
                List.of(new WithClause(bind("x"), call("fetch"), NodeMeta.EMPTY)),
                call("use", var("item")), List.of(), NodeMeta.EMPTY));

        IrNode result = pass.run(tree, context);

        assertThat(result).isEqualTo(def("f", List.of(), new With(
                List.of(new WithClause(bind("item"), call("fetch"), NodeMeta.EMPTY)),
                call("use", var("item")), List.of(), NodeMeta.EMPTY)));
    }

    @Test
    void testRun_TaggedHeadsAreLeftToPayloadPass() {
        IrNode tree = def("f", List.of(bind("m")), caseOf(var("m"),
                clause(tagged("ok", "_"), call("use", var("value")))));

        assertThat(pass.run(tree, context)).isSameAs(tree);
    }
}
