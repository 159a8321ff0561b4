package org.irnorm.compiler.codec;

import org.irnorm.compiler.analysis.ScopeWalker;
import org.irnorm.compiler.ir.BinaryOp;
import org.irnorm.compiler.ir.Call;
import org.irnorm.compiler.ir.Def;
import org.irnorm.compiler.ir.FieldAccess;
import org.irnorm.compiler.ir.IrNode;
import org.irnorm.compiler.ir.IrPattern;
import org.irnorm.compiler.ir.Literal;
import org.irnorm.compiler.ir.LiteralKind;
import org.irnorm.compiler.ir.ModuleDef;
import org.irnorm.compiler.ir.ModuleRef;
import org.irnorm.compiler.ir.Opaque;
import org.irnorm.compiler.ir.RemoteCall;
import org.irnorm.compiler.ir.StructLit;
import org.irnorm.compiler.ir.UnaryOp;
import org.irnorm.compiler.ir.Var;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders an IR tree as an indented S-expression for debugging and the {@code --dump} output.
 * The format is for humans only; nothing parses it back.
 */
public final class IrPrinter {

    private static final String INDENT = "  ";

    private IrPrinter() {}

    /**
     * @param node The tree, may be {@code null}.
     * @return The rendering.
     */
    public static String print(IrNode node) {
        StringBuilder sb = new StringBuilder();
        print(node, 0, sb);
        return sb.toString();
    }

    private static void print(IrNode node, int depth, StringBuilder sb) {
        sb.append(INDENT.repeat(depth));
        if (node == null) {
            sb.append("()");
            return;
        }
        sb.append('(').append(node.getClass().getSimpleName());
        String head = head(node);
        if (!head.isEmpty()) {
            sb.append(' ').append(head);
        }
        node.meta().flags().stream().sorted().forEach(f -> sb.append(" #").append(f.name().toLowerCase()));
        for (IrNode child : node.getChildren()) {
            sb.append('\n');
            print(child, depth + 1, sb);
        }
        sb.append(')');
    }

    private static String head(IrNode node) {
        if (node instanceof Var v) return v.name();
        if (node instanceof Literal l) return literal(l.kind(), l.value());
        if (node instanceof Call c) return c.function();
        if (node instanceof RemoteCall c) return "." + c.function();
        if (node instanceof BinaryOp b) return b.operator();
        if (node instanceof UnaryOp u) return u.operator();
        if (node instanceof FieldAccess f) return "." + f.field();
        if (node instanceof ModuleRef r) return r.name();
        if (node instanceof ModuleDef m) return m.name();
        if (node instanceof StructLit s) return "%" + s.module();
        if (node instanceof Opaque o) return quote(o.text());
        if (node instanceof Def d) {
            return (d.isPrivate() ? "defp " : "def ") + d.name() + " [" + join(d.params()) + "]";
        }
        List<IrPattern> patterns = ScopeWalker.patternsOf(node);
        return patterns.isEmpty() ? "" : "[" + join(patterns) + "]";
    }

    /**
     * @param pattern A pattern.
     * @return Its single-line rendering.
     */
    public static String pattern(IrPattern pattern) {
        if (pattern instanceof IrPattern.BindPat b) return b.name();
        if (pattern instanceof IrPattern.PinPat p) return "^" + p.name();
        if (pattern instanceof IrPattern.LitPat l) return literal(l.kind(), l.value());
        if (pattern instanceof IrPattern.AliasPat a) return pattern(a.pattern()) + " = " + a.name();
        if (pattern instanceof IrPattern.TuplePat t) return "{" + join(t.elements()) + "}";
        if (pattern instanceof IrPattern.ListPat l) return "[" + join(l.elements()) + "]";
        if (pattern instanceof IrPattern.ConsPat c) return "[" + pattern(c.head()) + " | " + pattern(c.tail()) + "]";
        if (pattern instanceof IrPattern.StructPat s) {
            return "%" + s.module() + "{" + s.fields().stream()
                    .map(f -> f.field() + ": " + pattern(f.value())).collect(Collectors.joining(", ")) + "}";
        }
        if (pattern instanceof IrPattern.MapPat m) {
            return "%{" + m.entries().stream()
                    .map(e -> print(e.key()) + " => " + pattern(e.value())).collect(Collectors.joining(", ")) + "}";
        }
        if (pattern instanceof IrPattern.BinaryPat b) {
            return "<<" + b.segments().stream()
                    .map(s -> s.spec() == null ? pattern(s.value()) : pattern(s.value()) + "::" + s.spec())
                    .collect(Collectors.joining(", ")) + ">>";
        }
        return pattern.toString();
    }

    private static String join(List<IrPattern> patterns) {
        return patterns.stream().map(IrPrinter::pattern).collect(Collectors.joining(", "));
    }

    private static String literal(LiteralKind kind, Object value) {
        return switch (kind) {
            case STRING -> quote(String.valueOf(value));
            case ATOM -> ":" + value;
            case NIL -> "nil";
            default -> String.valueOf(value);
        };
    }

    private static String quote(String text) {
        return '"' + text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + '"';
    }
}
