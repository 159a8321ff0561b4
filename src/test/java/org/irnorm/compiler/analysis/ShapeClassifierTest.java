package org.irnorm.compiler.analysis;

import org.irnorm.compiler.ir.IrPattern;
import org.irnorm.compiler.ir.IrPattern.AliasPat;
import org.irnorm.compiler.ir.IrPattern.BinaryPat;
import org.irnorm.compiler.ir.IrPattern.Segment;
import org.irnorm.compiler.ir.IrPattern.TuplePat;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.irnorm.compiler.ir.Ir.*;

@Tag("unit")
class ShapeClassifierTest {

    private final ShapeClassifier shapes = new ShapeClassifier();

    @Test
    void testUsageShape_ReceiverIsStructuredAndOperandIsScalar() {
        assertThat(shapes.usageShape("u", List.of(field(var("u"), "name")))).isEqualTo(ValueShape.STRUCTURED);
        assertThat(shapes.usageShape("n", List.of(binary("*", var("n"), integer(2))))).isEqualTo(ValueShape.SCALAR);
        assertThat(shapes.usageShape("s", List.of(binary("==", var("s"), str("x"))))).isEqualTo(ValueShape.UNKNOWN);
    }

    @Test
    void testUsageShape_MixedUsesConflict() {
        assertThat(shapes.usageShape("v", List.of(block(field(var("v"), "x"), binary("+", var("v"), integer(1))))))
                .isEqualTo(ValueShape.CONFLICT);
    }

    @Test
    void testValueShape_ClassifiesLiteralsAndArithmetic() {
        assertThat(shapes.valueShape(tuple(integer(1)))).isEqualTo(ValueShape.STRUCTURED);
        assertThat(shapes.valueShape(integer(3))).isEqualTo(ValueShape.SCALAR);
        assertThat(shapes.valueShape(binary("-", var("a"), var("b")))).isEqualTo(ValueShape.SCALAR);
        assertThat(shapes.valueShape(binary("<", var("a"), var("b")))).isEqualTo(ValueShape.UNKNOWN);
        assertThat(shapes.valueShape(call("f"))).isEqualTo(ValueShape.UNKNOWN);
    }

    @Test
    void testBinderShape_AliasOverAggregateAndNumericSegment() {
        IrPattern alias = new AliasPat(new TuplePat(List.of(bind("a"))), "whole");
        IrPattern bits = new BinaryPat(List.of(new Segment(bind("len"), "integer-size(8)")));

        assertThat(shapes.binderShape(List.of(alias), "whole")).isEqualTo(ValueShape.STRUCTURED);
        assertThat(shapes.binderShape(List.of(alias), "a")).isEqualTo(ValueShape.UNKNOWN);
        assertThat(shapes.binderShape(List.of(bits), "len")).isEqualTo(ValueShape.SCALAR);
    }

    @Test
    void testCompatible_UnknownIsPermissiveAndConflictNever() {
        assertThat(shapes.compatible(ValueShape.UNKNOWN, ValueShape.SCALAR)).isTrue();
        assertThat(shapes.compatible(ValueShape.SCALAR, ValueShape.SCALAR)).isTrue();
        assertThat(shapes.compatible(ValueShape.STRUCTURED, ValueShape.SCALAR)).isFalse();
        assertThat(shapes.compatible(ValueShape.UNKNOWN, ValueShape.CONFLICT)).isFalse();
    }

    @Test
    void testIsReceiverOrArgument() {
        assertThat(shapes.isReceiverOrArgument("x", List.of(remote("Enum", "count", var("x"))))).isTrue();
        assertThat(shapes.isReceiverOrArgument("x", List.of(binary("+", var("x"), integer(1))))).isFalse();
    }
}
