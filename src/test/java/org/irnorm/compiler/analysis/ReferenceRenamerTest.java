package org.irnorm.compiler.analysis;

import org.irnorm.compiler.ir.IrNode;
import org.irnorm.compiler.ir.IrPattern.PinPat;
import org.irnorm.compiler.ir.NodeMeta;
import org.irnorm.compiler.ir.Opaque;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.irnorm.compiler.ir.Ir.*;

/**
 * Tests for the {@link ReferenceRenamer} class: reads are renamed only while the old binding is visible.
 */
@Tag("unit")
class ReferenceRenamerTest {

    @Test
    void testRename_StopsAfterBlockLevelRebinding() {
        IrNode tree = block(call("f", var("x")), assign("x", call("g", var("x"))), call("h", var("x")));

        IrNode result = ReferenceRenamer.rename(tree, "x", "y");

        assertThat(result).isEqualTo(block(call("f", var("y")), assign("x", call("g", var("y"))), call("h", var("x"))));
    }

    @Test
    void testRename_ClauseBinderShadows() {
        IrNode tree = caseOf(var("x"), clause(bind("x"), var("x")), clause(bind("_"), var("x")));

        IrNode result = ReferenceRenamer.rename(tree, "x", "y");

        assertThat(result).isEqualTo(caseOf(var("y"), clause(bind("x"), var("x")), clause(bind("_"), var("y"))));
    }

    @Test
    void testRename_ClosureParameterShadows() {
        IrNode tree = call("map", var("x"), fn(List.of(bind("x")), var("x")));

        IrNode result = ReferenceRenamer.rename(tree, "x", "y");

        assertThat(result).isEqualTo(call("map", var("y"), fn(List.of(bind("x")), var("x"))));
    }

    @Test
    void testRename_RewritesPinsAndRawText() {
        IrNode tree = block(
                match(tuplePat(new PinPat("x"), bind("v")), var("m")),
                new Opaque("x + v", NodeMeta.EMPTY));

        IrNode result = ReferenceRenamer.rename(tree, "x", "y");

        assertThat(result).isEqualTo(block(
                match(tuplePat(new PinPat("y"), bind("v")), var("m")),
                new Opaque("y + v", NodeMeta.EMPTY)));
    }

    @Test
    void testRename_NothingToRename_ReturnsSameInstance() {
        IrNode tree = block(assign("a", integer(1)), var("a"));

        assertThat(ReferenceRenamer.rename(tree, "x", "y")).isSameAs(tree);
    }
}
