package org.irnorm.compiler.analysis;

import org.irnorm.compiler.analysis.BinderHarmonizer.Mode;
import org.irnorm.compiler.ir.IrNode;
import org.irnorm.compiler.ir.IrPattern;
import org.irnorm.compiler.ir.IrPattern.AliasPat;
import org.irnorm.compiler.ir.IrPattern.MapPat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.irnorm.compiler.ir.Ir.*;

/**
 * Tests for the {@link BinderHarmonizer} class: a repair happens only when it is unique.
 */
@Tag("unit")
class BinderHarmonizerTest {

    private BinderHarmonizer harmonizer;

    @BeforeEach
    void setUp() {
        harmonizer = new BinderHarmonizer(HarmonizerPolicy.defaults());
    }

    private Harmonization run(List<IrPattern> patterns, IrNode body, Mode mode) {
        return harmonizer.harmonize(patterns, Arrays.asList(null, body), Set.of(), mode);
    }

    @Test
    void testHarmonize_NoUndefinedName_LeavesEverythingAlone() {
        Harmonization result = run(List.of(bind("a")), var("a"), Mode.PARAMETER);

        assertThat(result.changed()).isFalse();
        assertThat(result.isAmbiguous()).isFalse();
    }

    @Test
    void testHarmonize_OneUndefinedName_RenamesUnusedBinder() {
        Harmonization result = run(List.of(bind("x")), call("f", var("y")), Mode.PARAMETER);

        assertThat(result.changed()).isTrue();
        assertThat(result.renamedFrom()).isEqualTo("x");
        assertThat(result.renamedTo()).isEqualTo("y");
        assertThat(result.patterns()).containsExactly(bind("y"));
        assertThat(result.scope().get(0)).isNull();
        assertThat(result.scope().get(1)).isEqualTo(call("f", var("y")));
    }

    @Test
    void testHarmonize_TwoUndefinedNames_IsAmbiguous() {
        Harmonization result = run(List.of(bind("x")), call("f", var("y"), var("z")), Mode.PARAMETER);

        assertThat(result.changed()).isFalse();
        assertThat(result.isAmbiguous()).isTrue();
        assertThat(result.patterns()).containsExactly(bind("x"));
    }

    @Test
    void testHarmonize_TwoCandidates_IsAmbiguous() {
        Harmonization result = run(List.of(bind("a"), bind("b")), var("y"), Mode.PARAMETER);

        assertThat(result.isAmbiguous()).isTrue();
        assertThat(result.ambiguity()).contains("'y'");
    }

    @Test
    void testHarmonize_UnderscoredTwinIsPreferred() {
        Harmonization result = run(List.of(bind("_item"), bind("other")), field(var("item"), "name"), Mode.PARAMETER);

        assertThat(result.patterns()).containsExactly(bind("item"), bind("other"));
    }

    @Test
    void testHarmonize_UnderscoredBinderReadsFollowRename() {
        Harmonization result = run(List.of(bind("_acc")), binary("+", var("_acc"), var("acc")), Mode.PARAMETER);

        assertThat(result.patterns()).containsExactly(bind("acc"));
        assertThat(result.scope().get(1)).isEqualTo(binary("+", var("acc"), var("acc")));
    }

    @Test
    void testHarmonize_EnclosingNameIsNotUndefined() {
        Harmonization result = harmonizer.harmonize(List.of(bind("x")), List.of(var("outer")),
                Set.of("outer"), Mode.CLAUSE);

        assertThat(result.changed()).isFalse();
    }

    @Test
    void testHarmonize_ClauseWildcardIsACatchAll() {
        Harmonization result = run(List.of(bind("_")), var("x"), Mode.CLAUSE);

        assertThat(result.changed()).isFalse();
        assertThat(result.isAmbiguous()).isFalse();
    }

    @Test
    void testHarmonize_PayloadTieBreakUsesPriority() {
        Harmonization result = run(List.of(tagged("ok", "_")), call("log", var("other"), var("value")), Mode.PAYLOAD);

        assertThat(result.patterns()).containsExactly(tagged("ok", "value"));
        assertThat(result.scope().get(1)).isEqualTo(call("log", var("other"), var("value")));
    }

    @Test
    void testHarmonize_ShapeMismatchIsSilent() {
        IrPattern structured = new AliasPat(new MapPat(List.of()), "m");

        Harmonization result = run(List.of(structured), binary("+", var("n"), integer(1)), Mode.PARAMETER);

        assertThat(result.changed()).isFalse();
        assertThat(result.isAmbiguous()).isFalse();
    }

    @Test
    void testHarmonize_ClosureNeedsReceiverOrArgumentUse() {
        assertThat(run(List.of(bind("x")), binary("+", var("y"), integer(1)), Mode.CLOSURE).changed()).isFalse();
        assertThat(run(List.of(bind("x")), field(var("y"), "id"), Mode.CLOSURE).changed()).isTrue();
    }

    /** Names that are not on the default payload priority list. */
    private static final List<String> NEUTRAL_NAMES = List.of("a", "b", "count", "item", "name", "total");

    /**
     * Every subset of up to three neutral names, for each binding site kind, with the binder
     * under test and the binder expected after a rename to a given name.
     */
    static Stream<Arguments> undefinedNameSets() {
        List<List<String>> subsets = new ArrayList<>();
        subsets.add(List.of());
        for (int i = 0; i < NEUTRAL_NAMES.size(); i++) {
            subsets.add(List.of(NEUTRAL_NAMES.get(i)));
            for (int j = i + 1; j < NEUTRAL_NAMES.size(); j++) {
                subsets.add(List.of(NEUTRAL_NAMES.get(i), NEUTRAL_NAMES.get(j)));
                for (int k = j + 1; k < NEUTRAL_NAMES.size(); k++) {
                    subsets.add(List.of(NEUTRAL_NAMES.get(i), NEUTRAL_NAMES.get(j), NEUTRAL_NAMES.get(k)));
                }
            }
        }
        List<Arguments> cases = new ArrayList<>();
        for (List<String> names : subsets) {
            cases.add(Arguments.of(Mode.PAYLOAD, tagged("ok", "_value"),
                    (Function<String, IrPattern>) n -> tagged("ok", n), names));
            cases.add(Arguments.of(Mode.CLAUSE, bind("x"), (Function<String, IrPattern>) n -> bind(n), names));
            cases.add(Arguments.of(Mode.PARAMETER, bind("x"), (Function<String, IrPattern>) n -> bind(n), names));
        }
        return cases.stream();
    }

    @ParameterizedTest(name = "{0} with undefined {3}")
    @MethodSource("undefinedNameSets")
    void testHarmonize_RenamesOnlyForExactlyOneUndefinedName(Mode mode, IrPattern binder,
                                                              Function<String, IrPattern> renamed, List<String> names) {
        IrNode body = call("f", names.stream().map(n -> (IrNode) var(n)).toArray(IrNode[]::new));

        Harmonization result = run(List.of(binder), body, mode);

        if (names.size() == 1) {
            assertThat(result.changed()).isTrue();
            assertThat(result.renamedTo()).isEqualTo(names.get(0));
            assertThat(result.patterns()).containsExactly(renamed.apply(names.get(0)));
            assertThat(result.scope().get(1)).isEqualTo(body);
        } else {
            assertThat(result.changed()).isFalse();
            assertThat(result.patterns()).containsExactly(binder);
            assertThat(result.scope().get(1)).isSameAs(body);
            assertThat(result.isAmbiguous()).isEqualTo(names.size() > 1);
        }
    }

    @ParameterizedTest(name = "undefined {0} picks {1}")
    @CsvSource({
            "id;x, id",
            "x;value;reason, value",
            "error;data, data",
            "reason;count;total, reason"
    })
    void testHarmonize_PayloadPriorityNameBreaksTieAmongSeveralUndefined(String undefined, String expected) {
        IrNode body = call("f", Arrays.stream(undefined.split(";")).map(n -> (IrNode) var(n)).toArray(IrNode[]::new));

        Harmonization result = run(List.of(tagged("ok", "_value")), body, Mode.PAYLOAD);

        assertThat(result.patterns()).containsExactly(tagged("ok", expected));
    }

    @Test
    void testHarmonize_EmptyPriorityList_SeveralUndefinedIsANoOp() {
        BinderHarmonizer strict = new BinderHarmonizer(new HarmonizerPolicy(List.of()));
        IrNode body = call("f", var("id"), var("x"));

        Harmonization result = strict.harmonize(List.of(tagged("ok", "_value")), Arrays.asList(null, body),
                Set.of(), Mode.PAYLOAD);

        assertThat(result.changed()).isFalse();
        assertThat(result.isAmbiguous()).isTrue();
    }
}
