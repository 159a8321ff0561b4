package org.irnorm.compiler.passes.cleanup;

import org.irnorm.compiler.diagnostics.DiagnosticsEngine;
import org.irnorm.compiler.ir.IrNode;
import org.irnorm.compiler.passes.PassContext;
import org.irnorm.config.NormalizerConfig;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.irnorm.compiler.ir.Interpolation;
import org.irnorm.compiler.ir.NodeMeta;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.irnorm.compiler.ir.Ir.*;

@Tag("unit")
class StringConcatInterpolationPassTest {

    private final StringConcatInterpolationPass pass = new StringConcatInterpolationPass();
    private final PassContext context = new PassContext(new DiagnosticsEngine(), NormalizerConfig.defaults());

    @Test
    void testRun_ChainBecomesInterpolation() {
        IrNode tree = binary("<>", str("id: "), binary("<>", call("to_string", var("id")), str("!")));

        IrNode result = pass.run(tree, context);

        assertThat(result).isEqualTo(new Interpolation(List.of(str("id: "), var("id"), str("!")), NodeMeta.EMPTY));
    }

    @Test
    void testRun_AdjacentStringsAreMerged() {
        IrNode tree = binary("<>", binary("<>", str("a"), str("b")), var("x"));

        IrNode result = pass.run(tree, context);

        assertThat(result).isEqualTo(new Interpolation(List.of(str("ab"), var("x")), NodeMeta.EMPTY));
    }

    @Test
    void testRun_ConcatWithoutStringLiteral_IsKept() {
        IrNode tree = binary("<>", var("a"), var("b"));

        assertThat(pass.run(tree, context)).isSameAs(tree);
    }

    @Test
    void testRun_OnlyStringLiterals_IsKept() {
        IrNode tree = binary("<>", str("a"), str("b"));

        assertThat(pass.run(tree, context)).isSameAs(tree);
    }
}
