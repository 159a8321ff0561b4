package org.irnorm.compiler.codec;

import org.irnorm.compiler.ir.IrPattern.ConsPat;
import org.irnorm.compiler.ir.IrPattern.PinPat;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.irnorm.compiler.ir.Ir.*;

@Tag("unit")
class IrPrinterTest {

    @Test
    void testPrint_IndentsChildrenAndShowsFlags() {
        String dump = IrPrinter.print(block(assign("x", integer(1)), returnOf(var("x"))));

        assertThat(dump).isEqualTo("""
                (Block
                  (Match [x]
                    (Literal 1))
                  (Var x #early_return))""");
    }

    @Test
    void testPattern_RendersNestedShapes() {
        assertThat(IrPrinter.pattern(tuplePat(atomPat("ok"), new ConsPat(bind("h"), bind("_t")), new PinPat("k"))))
                .isEqualTo("{:ok, [h | _t], ^k}");
    }
}
