package org.irnorm.compiler.codec;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import org.irnorm.compiler.api.SourceInfo;
import org.irnorm.compiler.ir.BinaryOp;
import org.irnorm.compiler.ir.Block;
import org.irnorm.compiler.ir.Call;
import org.irnorm.compiler.ir.Case;
import org.irnorm.compiler.ir.CaseClause;
import org.irnorm.compiler.ir.Def;
import org.irnorm.compiler.ir.FieldAccess;
import org.irnorm.compiler.ir.FieldValue;
import org.irnorm.compiler.ir.Fn;
import org.irnorm.compiler.ir.FnClause;
import org.irnorm.compiler.ir.For;
import org.irnorm.compiler.ir.ForGenerator;
import org.irnorm.compiler.ir.If;
import org.irnorm.compiler.ir.IndexAccess;
import org.irnorm.compiler.ir.Interpolation;
import org.irnorm.compiler.ir.IrNode;
import org.irnorm.compiler.ir.IrPattern;
import org.irnorm.compiler.ir.IrPattern.AliasPat;
import org.irnorm.compiler.ir.IrPattern.BinaryPat;
import org.irnorm.compiler.ir.IrPattern.BindPat;
import org.irnorm.compiler.ir.IrPattern.ConsPat;
import org.irnorm.compiler.ir.IrPattern.FieldPat;
import org.irnorm.compiler.ir.IrPattern.ListPat;
import org.irnorm.compiler.ir.IrPattern.LitPat;
import org.irnorm.compiler.ir.IrPattern.MapPat;
import org.irnorm.compiler.ir.IrPattern.MapPatEntry;
import org.irnorm.compiler.ir.IrPattern.PinPat;
import org.irnorm.compiler.ir.IrPattern.Segment;
import org.irnorm.compiler.ir.IrPattern.StructPat;
import org.irnorm.compiler.ir.IrPattern.TuplePat;
import org.irnorm.compiler.ir.ListLit;
import org.irnorm.compiler.ir.Literal;
import org.irnorm.compiler.ir.LiteralKind;
import org.irnorm.compiler.ir.MapLit;
import org.irnorm.compiler.ir.Match;
import org.irnorm.compiler.ir.MetaFlag;
import org.irnorm.compiler.ir.ModuleDef;
import org.irnorm.compiler.ir.ModuleRef;
import org.irnorm.compiler.ir.NodeMeta;
import org.irnorm.compiler.ir.Opaque;
import org.irnorm.compiler.ir.Pipe;
import org.irnorm.compiler.ir.Receive;
import org.irnorm.compiler.ir.RemoteCall;
import org.irnorm.compiler.ir.StructLit;
import org.irnorm.compiler.ir.StructUpdate;
import org.irnorm.compiler.ir.Try;
import org.irnorm.compiler.ir.TupleLit;
import org.irnorm.compiler.ir.UnaryOp;
import org.irnorm.compiler.ir.Var;
import org.irnorm.compiler.ir.With;
import org.irnorm.compiler.ir.WithClause;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Reads and writes the JSON interchange format of the IR.
 * <p>
 * Every node and pattern is an object whose {@code kind} member names its variant (the simple
 * record name). Nodes may carry {@code flags} (an array of {@link MetaFlag} names) and a
 * {@code source} object with {@code file}, {@code line} and {@code column}. Absent optional
 * children are written as JSON {@code null} or left out.
 */
public final class IrJsonCodec {

    private final Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

    /**
     * Parses a JSON document into an IR tree.
     * @param json The document.
     * @return The root node.
     * @throws IrFormatException if the document is not valid JSON or not a well-formed tree.
     */
    public IrNode fromJson(String json) {
        JsonElement element;
        try {
            element = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new IrFormatException("Invalid JSON: " + e.getMessage(), e);
        }
        return decode(element);
    }

    /**
     * @param node The tree.
     * @return The tree as pretty-printed JSON.
     */
    public String toJson(IrNode node) {
        return gson.toJson(encode(node));
    }

    // ---- decoding ----

    /**
     * Decodes a JSON element into an IR node.
     * @param element An object describing a node.
     * @return The node.
     * @throws IrFormatException if the element is not a well-formed node.
     */
    public IrNode decode(JsonElement element) {
        try {
            return node(element);
        } catch (IllegalStateException | ClassCastException | UnsupportedOperationException
                 | NullPointerException | IllegalArgumentException e) {
            throw new IrFormatException("Malformed IR: " + e.getMessage(), e);
        }
    }

    private IrNode node(JsonElement element) {
        JsonObject o = object(element, "node");
        NodeMeta meta = meta(o);
        String kind = string(o, "kind");
        return switch (kind) {
            case "Var" -> new Var(string(o, "name"), meta);
            case "Literal" -> literal(o, meta);
            case "Interpolation" -> new Interpolation(nodes(o, "parts"), meta);
            case "Block" -> new Block(nodes(o, "statements"), meta);
            case "Match" -> new Match(pattern(o.get("pattern")), node(o.get("value")), meta);
            case "If" -> new If(node(o.get("condition")), node(o.get("then")), optionalNode(o, "else"), meta);
            case "Case" -> new Case(node(o.get("subject")), clauses(o, "clauses"), meta);
            case "CaseClause" -> caseClause(o);
            case "Fn" -> new Fn(list(o, "clauses", e -> fnClause(object(e, "FnClause"))), meta);
            case "FnClause" -> fnClause(o);
            case "Def" -> new Def(string(o, "name"), patterns(o, "params"), optionalNode(o, "guard"),
                    node(o.get("body")), o.has("private") && o.get("private").getAsBoolean(), meta);
            case "Call" -> new Call(string(o, "function"), nodes(o, "args"), meta);
            case "RemoteCall" -> new RemoteCall(node(o.get("target")), string(o, "function"), nodes(o, "args"), meta);
            case "ModuleRef" -> new ModuleRef(string(o, "name"), meta);
            case "FieldAccess" -> new FieldAccess(node(o.get("receiver")), string(o, "field"), meta);
            case "IndexAccess" -> new IndexAccess(node(o.get("receiver")), node(o.get("key")), meta);
            case "TupleLit" -> new TupleLit(nodes(o, "elements"), meta);
            case "ListLit" -> new ListLit(nodes(o, "elements"), optionalNode(o, "tail"), meta);
            case "MapLit" -> new MapLit(list(o, "entries", e -> {
                JsonObject entry = object(e, "map entry");
                return new MapLit.Entry(node(entry.get("key")), node(entry.get("value")));
            }), meta);
            case "StructLit" -> new StructLit(string(o, "module"), fieldValues(o), meta);
            case "StructUpdate" -> new StructUpdate(node(o.get("base")), fieldValues(o), meta);
            case "Pipe" -> new Pipe(node(o.get("left")), node(o.get("right")), meta);
            case "BinaryOp" -> new BinaryOp(string(o, "operator"), node(o.get("left")), node(o.get("right")), meta);
            case "UnaryOp" -> new UnaryOp(string(o, "operator"), node(o.get("operand")), meta);
            case "With" -> new With(list(o, "clauses", e -> withClause(object(e, "WithClause"))),
                    node(o.get("body")), clauses(o, "else"), meta);
            case "WithClause" -> withClause(o);
            case "Try" -> new Try(node(o.get("body")), clauses(o, "rescue"), clauses(o, "catch"),
                    optionalNode(o, "after"), meta);
            case "Receive" -> new Receive(clauses(o, "clauses"), optionalNode(o, "timeout"), optionalNode(o, "after"), meta);
            case "For" -> new For(list(o, "generators", e -> forGenerator(object(e, "ForGenerator"))),
                    nodes(o, "filters"), optionalNode(o, "into"), node(o.get("body")), meta);
            case "ForGenerator" -> forGenerator(o);
            case "ModuleDef" -> new ModuleDef(string(o, "name"), nodes(o, "body"), meta);
            case "Opaque" -> new Opaque(string(o, "text"), meta);
            default -> throw new IrFormatException("Unknown node kind: " + kind);
        };
    }

    private Literal literal(JsonObject o, NodeMeta meta) {
        LiteralKind kind = LiteralKind.valueOf(string(o, "literal"));
        return new Literal(kind, literalValue(kind, o.get("value")), meta);
    }

    private static Object literalValue(LiteralKind kind, JsonElement value) {
        if (kind == LiteralKind.NIL || value == null || value.isJsonNull()) {
            if (kind != LiteralKind.NIL) {
                throw new IrFormatException("Missing value for " + kind + " literal");
            }
            return null;
        }
        return switch (kind) {
            case INTEGER -> value.getAsLong();
            case FLOAT -> value.getAsDouble();
            case BOOLEAN -> value.getAsBoolean();
            case STRING, ATOM -> value.getAsString();
            case NIL -> null;
        };
    }

    private CaseClause caseClause(JsonObject o) {
        return new CaseClause(pattern(o.get("pattern")), optionalNode(o, "guard"), node(o.get("body")), meta(o));
    }

    private FnClause fnClause(JsonObject o) {
        return new FnClause(patterns(o, "params"), optionalNode(o, "guard"), node(o.get("body")), meta(o));
    }

    private WithClause withClause(JsonObject o) {
        return new WithClause(pattern(o.get("pattern")), node(o.get("value")), meta(o));
    }

    private ForGenerator forGenerator(JsonObject o) {
        return new ForGenerator(pattern(o.get("pattern")), node(o.get("enumerable")), meta(o));
    }

    private List<CaseClause> clauses(JsonObject o, String member) {
        return list(o, member, e -> caseClause(object(e, "CaseClause")));
    }

    private List<FieldValue> fieldValues(JsonObject o) {
        return list(o, "fields", e -> {
            JsonObject field = object(e, "field");
            return new FieldValue(string(field, "field"), node(field.get("value")));
        });
    }

    private List<IrNode> nodes(JsonObject o, String member) {
        return list(o, member, this::node);
    }

    private List<IrPattern> patterns(JsonObject o, String member) {
        return list(o, member, this::pattern);
    }

    private IrNode optionalNode(JsonObject o, String member) {
        JsonElement e = o.get(member);
        return e == null || e.isJsonNull() ? null : node(e);
    }

    private IrPattern pattern(JsonElement element) {
        JsonObject o = object(element, "pattern");
        String kind = string(o, "kind");
        return switch (kind) {
            case "BindPat" -> new BindPat(string(o, "name"));
            case "LitPat" -> {
                LiteralKind literal = LiteralKind.valueOf(string(o, "literal"));
                yield new LitPat(literal, literalValue(literal, o.get("value")));
            }
            case "TuplePat" -> new TuplePat(patterns(o, "elements"));
            case "ListPat" -> new ListPat(patterns(o, "elements"));
            case "ConsPat" -> new ConsPat(pattern(o.get("head")), pattern(o.get("tail")));
            case "MapPat" -> new MapPat(list(o, "entries", e -> {
                JsonObject entry = object(e, "map pattern entry");
                return new MapPatEntry(node(entry.get("key")), pattern(entry.get("value")));
            }));
            case "StructPat" -> new StructPat(string(o, "module"), list(o, "fields", e -> {
                JsonObject field = object(e, "field pattern");
                return new FieldPat(string(field, "field"), pattern(field.get("value")));
            }));
            case "PinPat" -> new PinPat(string(o, "name"));
            case "AliasPat" -> new AliasPat(pattern(o.get("pattern")), string(o, "name"));
            case "BinaryPat" -> new BinaryPat(list(o, "segments", e -> {
                JsonObject segment = object(e, "segment");
                JsonElement spec = segment.get("spec");
                return new Segment(pattern(segment.get("value")), spec == null || spec.isJsonNull() ? null : spec.getAsString());
            }));
            default -> throw new IrFormatException("Unknown pattern kind: " + kind);
        };
    }

    private static NodeMeta meta(JsonObject o) {
        Set<MetaFlag> flags = EnumSet.noneOf(MetaFlag.class);
        JsonElement flagsElement = o.get("flags");
        if (flagsElement != null && !flagsElement.isJsonNull()) {
            for (JsonElement flag : flagsElement.getAsJsonArray()) {
                flags.add(MetaFlag.valueOf(flag.getAsString()));
            }
        }
        SourceInfo source = SourceInfo.UNKNOWN;
        JsonElement sourceElement = o.get("source");
        if (sourceElement != null && !sourceElement.isJsonNull()) {
            JsonObject s = sourceElement.getAsJsonObject();
            source = new SourceInfo(string(s, "file"), s.get("line").getAsInt(), s.get("column").getAsInt());
        }
        return flags.isEmpty() && source == SourceInfo.UNKNOWN ? NodeMeta.EMPTY : new NodeMeta(flags, source);
    }

    private static <T> List<T> list(JsonObject o, String member, Function<JsonElement, T> decoder) {
        JsonElement e = o.get(member);
        if (e == null || e.isJsonNull()) {
            return List.of();
        }
        List<T> out = new ArrayList<>();
        for (JsonElement item : e.getAsJsonArray()) {
            out.add(decoder.apply(item));
        }
        return out;
    }

    private static JsonObject object(JsonElement element, String what) {
        if (element == null || !element.isJsonObject()) {
            throw new IrFormatException("Expected a " + what + " object but found " + element);
        }
        return element.getAsJsonObject();
    }

    private static String string(JsonObject o, String member) {
        JsonElement e = o.get(member);
        if (e == null || e.isJsonNull()) {
            throw new IrFormatException("Missing '" + member + "' in " + o);
        }
        return e.getAsString();
    }

    // ---- encoding ----

    /**
     * Encodes an IR node as a JSON object.
     * @param node The node; {@code null} encodes as JSON null.
     * @return The JSON element.
     */
    public JsonElement encode(IrNode node) {
        if (node == null) {
            return JsonNull.INSTANCE;
        }
        JsonObject o = new JsonObject();
        o.addProperty("kind", node.getClass().getSimpleName());
        if (node instanceof Var v) {
            o.addProperty("name", v.name());
        } else if (node instanceof Literal l) {
            o.addProperty("literal", l.kind().name());
            o.add("value", literalJson(l.value()));
        } else if (node instanceof Interpolation i) {
            o.add("parts", encodeAll(i.parts()));
        } else if (node instanceof Block b) {
            o.add("statements", encodeAll(b.statements()));
        } else if (node instanceof Match m) {
            o.add("pattern", encodePattern(m.pattern()));
            o.add("value", encode(m.value()));
        } else if (node instanceof If i) {
            o.add("condition", encode(i.condition()));
            o.add("then", encode(i.thenBranch()));
            o.add("else", encode(i.elseBranch()));
        } else if (node instanceof Case c) {
            o.add("subject", encode(c.subject()));
            o.add("clauses", encodeAll(c.clauses()));
        } else if (node instanceof CaseClause c) {
            o.add("pattern", encodePattern(c.pattern()));
            o.add("guard", encode(c.guard()));
            o.add("body", encode(c.body()));
        } else if (node instanceof Fn f) {
            o.add("clauses", encodeAll(f.clauses()));
        } else if (node instanceof FnClause c) {
            o.add("params", encodePatterns(c.params()));
            o.add("guard", encode(c.guard()));
            o.add("body", encode(c.body()));
        } else if (node instanceof Def d) {
            o.addProperty("name", d.name());
            o.add("params", encodePatterns(d.params()));
            o.add("guard", encode(d.guard()));
            o.add("body", encode(d.body()));
            o.addProperty("private", d.isPrivate());
        } else if (node instanceof Call c) {
            o.addProperty("function", c.function());
            o.add("args", encodeAll(c.args()));
        } else if (node instanceof RemoteCall c) {
            o.add("target", encode(c.target()));
            o.addProperty("function", c.function());
            o.add("args", encodeAll(c.args()));
        } else if (node instanceof ModuleRef r) {
            o.addProperty("name", r.name());
        } else if (node instanceof FieldAccess f) {
            o.add("receiver", encode(f.receiver()));
            o.addProperty("field", f.field());
        } else if (node instanceof IndexAccess i) {
            o.add("receiver", encode(i.receiver()));
            o.add("key", encode(i.key()));
        } else if (node instanceof TupleLit t) {
            o.add("elements", encodeAll(t.elements()));
        } else if (node instanceof ListLit l) {
            o.add("elements", encodeAll(l.elements()));
            o.add("tail", encode(l.tail()));
        } else if (node instanceof MapLit m) {
            JsonArray entries = new JsonArray();
            for (MapLit.Entry entry : m.entries()) {
                JsonObject e = new JsonObject();
                e.add("key", encode(entry.key()));
                e.add("value", encode(entry.value()));
                entries.add(e);
            }
            o.add("entries", entries);
        } else if (node instanceof StructLit s) {
            o.addProperty("module", s.module());
            o.add("fields", encodeFields(s.fields()));
        } else if (node instanceof StructUpdate s) {
            o.add("base", encode(s.base()));
            o.add("fields", encodeFields(s.fields()));
        } else if (node instanceof Pipe p) {
            o.add("left", encode(p.left()));
            o.add("right", encode(p.right()));
        } else if (node instanceof BinaryOp b) {
            o.addProperty("operator", b.operator());
            o.add("left", encode(b.left()));
            o.add("right", encode(b.right()));
        } else if (node instanceof UnaryOp u) {
            o.addProperty("operator", u.operator());
            o.add("operand", encode(u.operand()));
        } else if (node instanceof With w) {
            o.add("clauses", encodeAll(w.clauses()));
            o.add("body", encode(w.body()));
            o.add("else", encodeAll(w.elseClauses()));
        } else if (node instanceof WithClause w) {
            o.add("pattern", encodePattern(w.pattern()));
            o.add("value", encode(w.value()));
        } else if (node instanceof Try t) {
            o.add("body", encode(t.body()));
            o.add("rescue", encodeAll(t.rescueClauses()));
            o.add("catch", encodeAll(t.catchClauses()));
            o.add("after", encode(t.afterBody()));
        } else if (node instanceof Receive r) {
            o.add("clauses", encodeAll(r.clauses()));
            o.add("timeout", encode(r.timeout()));
            o.add("after", encode(r.afterBody()));
        } else if (node instanceof For f) {
            o.add("generators", encodeAll(f.generators()));
            o.add("filters", encodeAll(f.filters()));
            o.add("into", encode(f.into()));
            o.add("body", encode(f.body()));
        } else if (node instanceof ForGenerator g) {
            o.add("pattern", encodePattern(g.pattern()));
            o.add("enumerable", encode(g.enumerable()));
        } else if (node instanceof ModuleDef m) {
            o.addProperty("name", m.name());
            o.add("body", encodeAll(m.body()));
        } else if (node instanceof Opaque op) {
            o.addProperty("text", op.text());
        }
        encodeMeta(node.meta(), o);
        return o;
    }

    private JsonArray encodeAll(List<? extends IrNode> nodes) {
        JsonArray array = new JsonArray();
        nodes.forEach(n -> array.add(encode(n)));
        return array;
    }

    private JsonArray encodeFields(List<FieldValue> fields) {
        JsonArray array = new JsonArray();
        for (FieldValue field : fields) {
            JsonObject f = new JsonObject();
            f.addProperty("field", field.field());
            f.add("value", encode(field.value()));
            array.add(f);
        }
        return array;
    }

    private JsonArray encodePatterns(List<IrPattern> patterns) {
        JsonArray array = new JsonArray();
        patterns.forEach(p -> array.add(encodePattern(p)));
        return array;
    }

    /**
     * Encodes a pattern as a JSON object.
     * @param pattern The pattern.
     * @return The JSON element.
     */
    public JsonElement encodePattern(IrPattern pattern) {
        JsonObject o = new JsonObject();
        o.addProperty("kind", pattern.getClass().getSimpleName());
        if (pattern instanceof BindPat b) {
            o.addProperty("name", b.name());
        } else if (pattern instanceof LitPat l) {
            o.addProperty("literal", l.kind().name());
            o.add("value", literalJson(l.value()));
        } else if (pattern instanceof TuplePat t) {
            o.add("elements", encodePatterns(t.elements()));
        } else if (pattern instanceof ListPat l) {
            o.add("elements", encodePatterns(l.elements()));
        } else if (pattern instanceof ConsPat c) {
            o.add("head", encodePattern(c.head()));
            o.add("tail", encodePattern(c.tail()));
        } else if (pattern instanceof MapPat m) {
            JsonArray entries = new JsonArray();
            for (MapPatEntry entry : m.entries()) {
                JsonObject e = new JsonObject();
                e.add("key", encode(entry.key()));
                e.add("value", encodePattern(entry.value()));
                entries.add(e);
            }
            o.add("entries", entries);
        } else if (pattern instanceof StructPat s) {
            o.addProperty("module", s.module());
            JsonArray fields = new JsonArray();
            for (FieldPat field : s.fields()) {
                JsonObject f = new JsonObject();
                f.addProperty("field", field.field());
                f.add("value", encodePattern(field.value()));
                fields.add(f);
            }
            o.add("fields", fields);
        } else if (pattern instanceof PinPat p) {
            o.addProperty("name", p.name());
        } else if (pattern instanceof AliasPat a) {
            o.add("pattern", encodePattern(a.pattern()));
            o.addProperty("name", a.name());
        } else if (pattern instanceof BinaryPat b) {
            JsonArray segments = new JsonArray();
            for (Segment segment : b.segments()) {
                JsonObject s = new JsonObject();
                s.add("value", encodePattern(segment.value()));
                s.addProperty("spec", segment.spec());
                segments.add(s);
            }
            o.add("segments", segments);
        }
        return o;
    }

    private static JsonElement literalJson(Object value) {
        if (value == null) {
            return JsonNull.INSTANCE;
        }
        if (value instanceof Number n) {
            return new JsonPrimitive(n);
        }
        if (value instanceof Boolean b) {
            return new JsonPrimitive(b);
        }
        return new JsonPrimitive(value.toString());
    }

    private static void encodeMeta(NodeMeta meta, JsonObject o) {
        if (!meta.flags().isEmpty()) {
            JsonArray flags = new JsonArray();
            EnumSet.copyOf(meta.flags()).forEach(f -> flags.add(f.name()));
            o.add("flags", flags);
        }
        if (!SourceInfo.UNKNOWN.equals(meta.source())) {
            JsonObject source = new JsonObject();
            source.addProperty("file", meta.source().fileName());
            source.addProperty("line", meta.source().lineNumber());
            source.addProperty("column", meta.source().columnNumber());
            o.add("source", source);
        }
    }
}
