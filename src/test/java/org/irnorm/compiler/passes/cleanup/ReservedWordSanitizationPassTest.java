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

/**
 * Tests for the {@link ReservedWordSanitizationPass}: keyword-named variables get a suffix.
 */
@Tag("unit")
class ReservedWordSanitizationPassTest {

    private final ReservedWordSanitizationPass pass = new ReservedWordSanitizationPass();
    private final PassContext context = new PassContext(new DiagnosticsEngine(), NormalizerConfig.defaults());

    @Test
    void testRun_RenamesBinderAndReads() {
        IrNode tree = def("f", List.of(bind("case")), call("g", var("case"), atom("case")));

        IrNode result = pass.run(tree, context);

        assertThat(result).isEqualTo(def("f", List.of(bind("case_")), call("g", var("case_"), atom("case"))));
    }

    @Test
    void testRun_FreshNameAvoidsExistingNames() {
        IrNode tree = def("f", List.of(bind("case"), bind("case_")), call("g", var("case"), var("case_")));

        IrNode result = pass.run(tree, context);

        assertThat(result).isEqualTo(def("f", List.of(bind("case__"), bind("case_")),
                call("g", var("case__"), var("case_"))));
    }

    @Test
    void testRun_EachDefinitionIsRenamedOnItsOwn() {
        IrNode tree = module("M",
                def("f", List.of(bind("end")), var("end")),
                def("g", List.of(bind("end_")), var("end_")));

        IrNode result = pass.run(tree, context);

        assertThat(result).isEqualTo(module("M",
                def("f", List.of(bind("end_")), var("end_")),
                def("g", List.of(bind("end_")), var("end_"))));
    }

    @Test
    void testRun_NoReservedNames_ReturnsSameInstance() {
        IrNode tree = module("M", def("f", List.of(bind("a")), var("a")));

        assertThat(pass.run(tree, context)).isSameAs(tree);
    }
}
