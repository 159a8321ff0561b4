package org.irnorm.compiler.codec;

import org.irnorm.compiler.api.SourceInfo;
import org.irnorm.compiler.ir.CaseClause;
import org.irnorm.compiler.ir.Def;
import org.irnorm.compiler.ir.For;
import org.irnorm.compiler.ir.ForGenerator;
import org.irnorm.compiler.ir.IrNode;
import org.irnorm.compiler.ir.IrPattern.MapPat;
import org.irnorm.compiler.ir.IrPattern.MapPatEntry;
import org.irnorm.compiler.ir.IrPattern.PinPat;
import org.irnorm.compiler.ir.Literal;
import org.irnorm.compiler.ir.Match;
import org.irnorm.compiler.ir.MetaFlag;
import org.irnorm.compiler.ir.ModuleDef;
import org.irnorm.compiler.ir.NodeMeta;
import org.irnorm.compiler.ir.Opaque;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.irnorm.compiler.ir.Ir.*;

/**
 * Tests for the {@link IrJsonCodec} class.
 */
@Tag("unit")
class IrJsonCodecTest {

    private IrJsonCodec codec;

    @BeforeEach
    void setUp() {
        codec = new IrJsonCodec();
    }

    @Test
    void testFromJson_ReadsDefinitionWithFlagsAndSource() {
        String json = """
                {"kind": "ModuleDef", "name": "Demo", "body": [
                  {"kind": "Def", "name": "run", "private": true,
                   "params": [{"kind": "BindPat", "name": "x"}],
                   "body": {"kind": "Block", "statements": [
                     {"kind": "Match", "flags": ["COMPILER_TEMP"],
                      "source": {"file": "demo.py", "line": 3, "column": 5},
                      "pattern": {"kind": "BindPat", "name": "tmp"},
                      "value": {"kind": "Call", "function": "load", "args": [{"kind": "Var", "name": "x"}]}},
                     {"kind": "Literal", "literal": "INTEGER", "value": 42}
                   ]}}
                ]}
                """;

        ModuleDef module = (ModuleDef) codec.fromJson(json);

        Def def = (Def) module.body().get(0);
        assertThat(def.name()).isEqualTo("run");
        assertThat(def.isPrivate()).isTrue();
        assertThat(def.params()).containsExactly(bind("x"));
        assertThat(def.guard()).isNull();
        Match match = (Match) ((org.irnorm.compiler.ir.Block) def.body()).statements().get(0);
        assertThat(match.hasFlag(MetaFlag.COMPILER_TEMP)).isTrue();
        assertThat(match.source()).isEqualTo(new SourceInfo("demo.py", 3, 5));
        assertThat(match.value()).isEqualTo(call("load", var("x")));
        Literal literal = (Literal) ((org.irnorm.compiler.ir.Block) def.body()).last();
        assertThat(literal.value()).isEqualTo(42L);
    }

    @Test
    void testToJson_ThenFromJson_PreservesTree() {
        IrNode tree = module("Demo",
                def("handle", List.of(bind("msg")), block(
                        new Match(bind("m"), remote("Map", "put", var("m"), atom("k"), str("v")),
                                new NodeMeta(EnumSet.of(MetaFlag.MUTATES_RECEIVER), new SourceInfo("a.py", 1, 2))),
                        caseOf(var("msg"),
                                clause(tagged("ok", "value"), var("value")),
                                new CaseClause(new MapPat(List.of(new MapPatEntry(atom("id"), new PinPat("m")))),
                                        binary(">", var("m"), integer(0)), nil(), NodeMeta.EMPTY)),
                        new Opaque("IO.puts(\"#{msg}\")", NodeMeta.EMPTY))));

        IrNode decoded = codec.fromJson(codec.toJson(tree));

        assertThat(decoded).isEqualTo(tree);
    }

    @Test
    void testToJson_ThenFromJson_PreservesComprehensionWithPositionedGenerator() {
        SourceInfo at = new SourceInfo("loop.py", 7, 9);
        IrNode tree = new For(
                List.of(new ForGenerator(bind("x"), var("xs"), NodeMeta.at(at)),
                        new ForGenerator(tagged("ok", "y"), call("fetch", var("x")), NodeMeta.EMPTY)),
                List.of(binary(">", var("y"), integer(0))),
                null,
                tuple(var("x"), var("y")),
                NodeMeta.EMPTY);

        IrNode decoded = codec.fromJson(codec.toJson(tree));

        assertThat(decoded).isEqualTo(tree);
        ForGenerator first = ((For) decoded).generators().get(0);
        assertThat(first.source()).isEqualTo(at);
        assertThat(first.enumerable()).isEqualTo(var("xs"));
    }

    @Test
    void testFromJson_InvalidJson_ThrowsFormatException() {
        assertThatThrownBy(() -> codec.fromJson("{\"kind\": "))
                .isInstanceOf(IrFormatException.class)
                .hasMessageContaining("Invalid JSON");
    }

    @Test
    void testFromJson_UnknownKind_ThrowsFormatException() {
        assertThatThrownBy(() -> codec.fromJson("{\"kind\": \"Goto\"}"))
                .isInstanceOf(IrFormatException.class)
                .hasMessageContaining("Goto");
    }

    @Test
    void testFromJson_MissingMember_ThrowsFormatException() {
        assertThatThrownBy(() -> codec.fromJson("{\"kind\": \"Var\"}"))
                .isInstanceOf(IrFormatException.class)
                .hasMessageContaining("name");
    }

    @Test
    void testFromJson_NonObjectNode_ThrowsFormatException() {
        assertThatThrownBy(() -> codec.fromJson("{\"kind\": \"Block\", \"statements\": [1]}"))
                .isInstanceOf(IrFormatException.class);
    }
}
