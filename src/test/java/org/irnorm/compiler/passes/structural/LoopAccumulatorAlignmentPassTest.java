package org.irnorm.compiler.passes.structural;

import org.irnorm.compiler.diagnostics.DiagnosticsEngine;
import org.irnorm.compiler.ir.IrNode;
import org.irnorm.compiler.ir.IrPattern;
import org.irnorm.compiler.passes.PassContext;
import org.irnorm.config.NormalizerConfig;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.irnorm.compiler.ir.Ir.*;

/**
 * Tests for the {@link LoopAccumulatorAlignmentPass}: loop bodies read the accumulator, not the
 * outer variable it was seeded from.
 */
@Tag("unit")
class LoopAccumulatorAlignmentPassTest {

    private final LoopAccumulatorAlignmentPass pass = new LoopAccumulatorAlignmentPass();
    private final PassContext context = new PassContext(new DiagnosticsEngine(), NormalizerConfig.defaults());

    private static IrNode whileLoop(IrNode seed, List<IrPattern> params, IrNode body) {
        return remote("Enum", "reduce_while", var("stream"), seed, fn(params, body));
    }

    @Test
    void testRun_BodyUsingOuterName_IsRewrittenToAccumulator() {
        IrNode tree = whileLoop(tuple(var("i"), atom("ok")),
                List.of(bind("_"), tuplePat(bind("acc_i"), bind("acc_state"))),
                ifElse(binary("<", var("i"), integer(5)),
                        block(assign("i", binary("+", var("i"), integer(1))),
                                tuple(atom("cont"), tuple(var("acc_i"), var("acc_state")))),
                        tuple(atom("halt"), tuple(var("acc_i"), var("acc_state")))));

        IrNode result = pass.run(tree, context);

        assertThat(result).isEqualTo(whileLoop(tuple(var("i"), atom("ok")),
                List.of(bind("_"), tuplePat(bind("acc_i"), bind("acc_state"))),
                ifElse(binary("<", var("acc_i"), integer(5)),
                        block(assign("acc_i", binary("+", var("acc_i"), integer(1))),
                                tuple(atom("cont"), tuple(var("acc_i"), var("acc_state")))),
                        tuple(atom("halt"), tuple(var("acc_i"), var("acc_state"))))));
    }

    @Test
    void testRun_UnmentionedAccumulatorBinder_TakesSeedName() {
        IrNode tree = remote("Enum", "reduce", var("xs"), var("total"),
                fn(List.of(bind("x"), bind("acc")), binary("+", var("total"), var("x"))));

        IrNode result = pass.run(tree, context);

        assertThat(result).isEqualTo(remote("Enum", "reduce", var("xs"), var("total"),
                fn(List.of(bind("x"), bind("total")), binary("+", var("total"), var("x")))));
    }

    @Test
    void testRun_OnlyMisalignedSlotsChange() {
        IrNode tree = whileLoop(tuple(var("numbers"), var("sum")),
                List.of(bind("_"), tuplePat(bind("numbers"), bind("acc_sum"))),
                tuple(atom("cont"), tuple(var("numbers"), binary("+", var("sum"), integer(1)))));

        IrNode result = pass.run(tree, context);

        assertThat(result).isEqualTo(whileLoop(tuple(var("numbers"), var("sum")),
                List.of(bind("_"), tuplePat(bind("numbers"), bind("sum"))),
                tuple(atom("cont"), tuple(var("numbers"), binary("+", var("sum"), integer(1))))));
    }

    @Test
    void testRun_AlignedLoop_ReturnsSameInstance() {
        IrNode tree = whileLoop(tuple(var("numbers"), var("sum")),
                List.of(bind("_"), tuplePat(bind("numbers"), bind("sum"))),
                tuple(atom("cont"), tuple(var("numbers"), var("sum"))));

        assertThat(pass.run(tree, context)).isSameAs(tree);
    }

    @Test
    void testRun_SeedNameBoundByElementParameter_IsLeftAlone() {
        IrNode tree = remote("Enum", "reduce", var("xs"), var("x"),
                fn(List.of(bind("x"), bind("acc")), var("x")));

        assertThat(pass.run(tree, context)).isSameAs(tree);
    }

    @Test
    void testRun_OuterNameReboundBeforeRead_IsLeftAlone() {
        IrNode tree = whileLoop(tuple(var("i"), atom("ok")),
                List.of(bind("_"), tuplePat(bind("acc_i"), bind("acc_state"))),
                block(assign("i", integer(0)), tuple(atom("cont"), tuple(var("acc_i"), var("i")))));

        assertThat(pass.run(tree, context)).isSameAs(tree);
    }

    @Test
    void testRun_OtherEnumFunctions_AreNotLoops() {
        IrNode tree = remote("Enum", "map", var("xs"), var("total"),
                fn(List.of(bind("x"), bind("acc")), var("total")));

        assertThat(pass.run(tree, context)).isSameAs(tree);
    }
}
