package org.irnorm.compiler.passes.structural;

import org.irnorm.compiler.diagnostics.DiagnosticsEngine;
import org.irnorm.compiler.ir.IrNode;
import org.irnorm.compiler.ir.Literal;
import org.irnorm.compiler.ir.LiteralKind;
import org.irnorm.compiler.ir.MetaFlag;
import org.irnorm.compiler.ir.NodeMeta;
import org.irnorm.compiler.passes.PassContext;
import org.irnorm.config.NormalizerConfig;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.irnorm.compiler.ir.Ir.*;

@Tag("unit")
class PlaceholderInitEliminationPassTest {

    private final PlaceholderInitEliminationPass pass = new PlaceholderInitEliminationPass();
    private final PassContext context = new PassContext(new DiagnosticsEngine(), NormalizerConfig.defaults());

    @Test
    void testRun_OverwrittenNilIsRemoved() {
        IrNode tree = block(assign("x", nil()), call("log"), assign("x", call("g")), var("x"));

        assertThat(pass.run(tree, context)).isEqualTo(block(call("log"), assign("x", call("g")), var("x")));
    }

    @Test
    void testRun_SentinelLiteralIsRemoved() {
        Literal sentinel = new Literal(LiteralKind.INTEGER, -1L, NodeMeta.of(MetaFlag.SENTINEL));
        IrNode tree = block(assign("i", sentinel), assign("i", call("find")), var("i"));

        assertThat(pass.run(tree, context)).isEqualTo(block(assign("i", call("find")), var("i")));
    }

    @Test
    void testRun_ReadBeforeOverwrite_IsKept() {
        IrNode tree = block(assign("x", nil()), call("log", var("x")), assign("x", call("g")), var("x"));

        assertThat(pass.run(tree, context)).isSameAs(tree);
    }

    @Test
    void testRun_SelfReferencingOverwrite_IsKept() {
        IrNode tree = block(assign("x", nil()), assign("x", call("wrap", var("x"))), var("x"));

        assertThat(pass.run(tree, context)).isSameAs(tree);
    }

    @Test
    void testRun_OverwriteOnlyInsideBranch_IsKept() {
        IrNode tree = block(assign("x", nil()), ifThen(var("c"), assign("x", integer(1))), var("x"));

        assertThat(pass.run(tree, context)).isSameAs(tree);
    }

    @Test
    void testRun_PlainLiteralInitIsNotAPlaceholder() {
        IrNode tree = block(assign("x", integer(0)), assign("x", call("g")), var("x"));

        assertThat(pass.run(tree, context)).isSameAs(tree);
    }
}
