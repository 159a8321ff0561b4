package org.irnorm.compiler.passes.semantic;

import org.irnorm.compiler.diagnostics.DiagnosticsEngine;
import org.irnorm.compiler.ir.IrNode;
import org.irnorm.compiler.passes.PassContext;
import org.irnorm.config.NormalizerConfig;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.irnorm.compiler.ir.Ir.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Tests for the {@link PayloadBinderHarmonizationPass}: tagged payload binders follow their uses.
 */
@Tag("unit")
@ExtendWith(MockitoExtension.class)
class PayloadBinderHarmonizationPassTest {

    @Mock
    private DiagnosticsEngine diagnostics;

    private final PayloadBinderHarmonizationPass pass = new PayloadBinderHarmonizationPass();

    private PassContext context() {
        return new PassContext(diagnostics, NormalizerConfig.defaults());
    }

    @Test
    void testRun_WildcardAndUnderscoredPayloadsAreRepaired() {
        IrNode tree = def("handle", List.of(bind("msg")), caseOf(var("msg"),
                clause(tagged("ok", "_"), call("use", var("value"))),
                clause(tagged("error", "_reason"), call("log", var("reason")))));

        IrNode result = pass.run(tree, context());

        assertThat(result).isEqualTo(def("handle", List.of(bind("msg")), caseOf(var("msg"),
                clause(tagged("ok", "value"), call("use", var("value"))),
                clause(tagged("error", "reason"), call("log", var("reason"))))));
        verifyNoInteractions(diagnostics);
    }

    @Test
    void testRun_NameFromEnclosingScopeIsNotCaptured() {
        IrNode tree = def("handle", List.of(bind("msg"), bind("value")), caseOf(var("msg"),
                clause(tagged("ok", "_"), call("use", var("value")))));

        assertThat(pass.run(tree, context())).isSameAs(tree);
    }

    @Test
    void testRun_NoUniqueRepair_ReportsInfo() {
        IrNode tree = def("handle", List.of(bind("msg")), caseOf(var("msg"),
                clause(tagged("ok", "_"), call("use", var("foo"), var("bar")))));

        IrNode result = pass.run(tree, context());

        assertThat(result).isSameAs(tree);
        verify(diagnostics).reportInfo(eq(PayloadBinderHarmonizationPass.NAME), contains("foo"), any());
    }

    @Test
    void testRun_SingleParameterClosureWithTaggedHead() {
        IrNode tree = def("f", List.of(bind("xs")), call("each", var("xs"),
                fn(List.of(tagged("ok", "_")), call("send", var("value")))));

        IrNode result = pass.run(tree, context());

        assertThat(result).isEqualTo(def("f", List.of(bind("xs")), call("each", var("xs"),
                fn(List.of(tagged("ok", "value")), call("send", var("value"))))));
    }

    @Test
    void testRun_UntaggedHeadsAreLeftToClausePass() {
        IrNode tree = def("f", List.of(bind("m")), caseOf(var("m"), clause(bind("x"), call("use", var("y")))));

        assertThat(pass.run(tree, context())).isSameAs(tree);
    }
}
