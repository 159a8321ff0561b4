package org.irnorm.compiler.passes.cleanup;

import org.irnorm.compiler.diagnostics.DiagnosticsEngine;
import org.irnorm.compiler.ir.IrNode;
import org.irnorm.compiler.passes.PassContext;
import org.irnorm.config.NormalizerConfig;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.irnorm.compiler.ir.For;
import org.irnorm.compiler.ir.ForGenerator;
import org.irnorm.compiler.ir.NodeMeta;
import org.irnorm.compiler.ir.With;
import org.irnorm.compiler.ir.WithClause;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.irnorm.compiler.ir.Ir.*;

@Tag("unit")
class UnusedBinderUnderscoringPassTest {

    private final UnusedBinderUnderscoringPass pass = new UnusedBinderUnderscoringPass();
    private final PassContext context = new PassContext(new DiagnosticsEngine(), NormalizerConfig.defaults());

    @Test
    void testRun_DefinitionAndClosureParameters() {
        IrNode tree = def("f", List.of(bind("a"), bind("b")),
                call("each", var("a"), fn(List.of(bind("x")), atom("ok"))));

        IrNode result = pass.run(tree, context);

        assertThat(result).isEqualTo(def("f", List.of(bind("a"), bind("_b")),
                call("each", var("a"), fn(List.of(bind("_x")), atom("ok")))));
    }

    @Test
    void testRun_ClauseHeads() {
        IrNode tree = caseOf(var("m"),
                clause(tagged("ok", "v"), atom("done")),
                clause(tagged("error", "_"), atom("failed")));

        IrNode result = pass.run(tree, context);

        assertThat(result).isEqualTo(caseOf(var("m"),
                clause(tagged("ok", "_v"), atom("done")),
                clause(tagged("error", "_"), atom("failed"))));
    }

    @Test
    void testRun_WithStepsSeeLaterSteps() {
        IrNode tree = new With(List.of(
                new WithClause(bind("a"), call("f"), NodeMeta.EMPTY),
                new WithClause(bind("b"), call("g", var("a")), NodeMeta.EMPTY)),
                atom("ok"), List.of(), NodeMeta.EMPTY);

        IrNode result = pass.run(tree, context);

        assertThat(result).isEqualTo(new With(List.of(
                new WithClause(bind("a"), call("f"), NodeMeta.EMPTY),
                new WithClause(bind("_b"), call("g", var("a")), NodeMeta.EMPTY)),
                atom("ok"), List.of(), NodeMeta.EMPTY));
    }

    @Test
    void testRun_ComprehensionGenerators() {
        IrNode tree = new For(List.of(
                new ForGenerator(bind("x"), var("xs"), NodeMeta.EMPTY),
                new ForGenerator(bind("y"), var("ys"), NodeMeta.EMPTY)),
                List.of(), null, var("x"), NodeMeta.EMPTY);

        IrNode result = pass.run(tree, context);

        assertThat(result).isEqualTo(new For(List.of(
                new ForGenerator(bind("x"), var("xs"), NodeMeta.EMPTY),
                new ForGenerator(bind("_y"), var("ys"), NodeMeta.EMPTY)),
                List.of(), null, var("x"), NodeMeta.EMPTY));
    }
}
