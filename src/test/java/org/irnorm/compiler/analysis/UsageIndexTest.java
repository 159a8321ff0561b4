package org.irnorm.compiler.analysis;

import org.irnorm.compiler.ir.IrNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.irnorm.compiler.ir.Ir.*;

/**
 * Tests for the {@link UsageIndex} and {@link LiveNames} classes.
 */
@Tag("unit")
class UsageIndexTest {

    private final List<IrNode> statements = List.of(
            assign("x", integer(1)),
            assign("y", var("x")),
            assign("x", integer(2)),
            assign("z", var("x")));

    @Test
    void testUsedLater_LooksAtSuffix() {
        UsageIndex index = UsageIndex.build(statements);

        assertThat(index.size()).isEqualTo(4);
        assertThat(index.usedLater(1, "x")).isTrue();
        assertThat(index.usedLater(4, "x")).isFalse();
        assertThat(index.usedLater(0, "y")).isFalse();
    }

    @Test
    void testReadBeforeRebind_StopsAtRebinding() {
        UsageIndex index = UsageIndex.build(statements);

        assertThat(index.readBeforeRebind(1, "x")).isTrue();
        assertThat(index.readBeforeRebind(2, "x")).isFalse();
        assertThat(index.reboundFrom(1, "x")).isTrue();
        assertThat(index.reboundFrom(3, "x")).isFalse();
    }

    @Test
    void testReadBeforeRebind_RebindingValueReadsOldValue() {
        UsageIndex index = UsageIndex.build(List.of(
                assign("x", integer(0)),
                assign("x", binary("+", var("x"), integer(1)))));

        assertThat(index.readBeforeRebind(1, "x")).isTrue();
    }

    @Test
    void testNamesFrom_ReturnsNamesReadInSuffix() {
        UsageIndex index = UsageIndex.build(statements);

        assertThat(index.namesFrom(2)).containsExactly("x");
        assertThat(index.namesFrom(4)).isEmpty();
    }

    @Test
    void testBuild_LargeBlock_VisitsEachNodeAConstantNumberOfTimes() {
        int n = 5_000;
        List<IrNode> chain = new ArrayList<>(n);
        chain.add(assign("v0", integer(0)));
        for (int i = 1; i < n; i++) {
            chain.add(assign("v" + i, binary("+", var("v" + (i - 1)), integer(1))));
        }

        UsageIndex index = UsageIndex.build(chain);

        assertThat(index.nodeVisits()).isLessThanOrEqualTo(10L * n);
        assertThat(index.usedLater(n - 1, "v" + (n - 2))).isTrue();
        assertThat(index.usedLater(n - 1, "v0")).isFalse();
    }

    @Test
    void testLiveNames_FallsBackToEnclosingBlock() {
        UsageIndex outer = UsageIndex.build(List.of(
                assign("a", integer(1)),
                block(assign("b", integer(2)), var("b")),
                call("f", var("a"))));
        UsageIndex inner = UsageIndex.build(List.of(assign("b", integer(2)), var("b")));

        LiveNames live = LiveNames.root(outer, 2).enter(inner, 1);

        assertThat(live.isLive("a")).isTrue();
        assertThat(live.isLive("b")).isTrue();
        assertThat(live.at(2).isLive("b")).isFalse();
    }

    @Test
    void testLiveNames_RebindingHidesOuterRead() {
        UsageIndex outer = UsageIndex.build(List.of(assign("a", integer(1)), var("a")));
        UsageIndex inner = UsageIndex.build(List.of(assign("a", integer(1)), assign("a", integer(2))));

        LiveNames live = LiveNames.root(outer, 1).enter(inner, 1);

        assertThat(live.isLive("a")).isFalse();
    }
}
