package org.irnorm.compiler.passes.cleanup;

import org.irnorm.compiler.diagnostics.DiagnosticsEngine;
import org.irnorm.compiler.ir.IrNode;
import org.irnorm.compiler.passes.PassContext;
import org.irnorm.config.NormalizerConfig;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.irnorm.compiler.ir.Ir.*;

@Tag("unit")
class UnusedResultUnderscoringPassTest {

    private final UnusedResultUnderscoringPass pass = new UnusedResultUnderscoringPass();
    private final PassContext context = new PassContext(new DiagnosticsEngine(), NormalizerConfig.defaults());

    @Test
    void testRun_UnderscoresBindersNothingReads() {
        IrNode tree = def("f", List.of(bind("c")), block(
                assign("unused", call("side")),
                assign("used", call("fetch")),
                ifThen(var("c"), block(assign("tmp", call("g")), call("h", var("used")))),
                var("used")));

        IrNode result = pass.run(tree, context);

        assertThat(result).isEqualTo(def("f", List.of(bind("c")), block(
                assign("_unused", call("side")),
                assign("used", call("fetch")),
                ifThen(var("c"), block(assign("_tmp", call("g")), call("h", var("used")))),
                var("used"))));
    }

    @Test
    void testRun_BranchAndClauseBindingsDoNotSeeLaterOuterReads() {
        IrNode tree = def("f", List.of(bind("c"), bind("m")), block(
                assign("x", integer(0)),
                ifThen(var("c"), block(assign("x", call("g")), atom("ok"))),
                caseOf(var("m"), clause(tagged("ok", "v"), block(assign("x", call("h", var("v"))), atom("ok")))),
                call("use", var("x"))));

        IrNode result = pass.run(tree, context);

        assertThat(result).isEqualTo(def("f", List.of(bind("c"), bind("m")), block(
                assign("x", integer(0)),
                ifThen(var("c"), block(assign("_x", call("g")), atom("ok"))),
                caseOf(var("m"), clause(tagged("ok", "v"), block(assign("_x", call("h", var("v"))), atom("ok")))),
                call("use", var("x")))));
    }

    @Test
    void testRun_BareNestedBlockBindingStaysLiveForOuterRead() {
        IrNode tree = def("f", List.of(), block(
                block(assign("y", call("g")), call("log")),
                call("use", var("y"))));

        assertThat(pass.run(tree, context)).isSameAs(tree);
    }

    @Test
    void testRun_PartiallyUsedDestructuring() {
        IrNode tree = def("f", List.of(), block(
                match(tuplePat(atomPat("ok"), bind("a"), bind("b")), call("pair")),
                var("a")));

        IrNode result = pass.run(tree, context);

        assertThat(result).isEqualTo(def("f", List.of(), block(
                match(tuplePat(atomPat("ok"), bind("a"), bind("_b")), call("pair")),
                var("a"))));
    }

    @Test
    void testRun_RepeatedBinderIsLeftAlone() {
        IrNode tree = def("f", List.of(), block(match(tuplePat(bind("a"), bind("a")), call("pair")), atom("ok")));

        assertThat(pass.run(tree, context)).isSameAs(tree);
    }
}
