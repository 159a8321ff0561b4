package org.irnorm.compiler.analysis;

import org.irnorm.compiler.ir.BinaryOp;
import org.irnorm.compiler.ir.Call;
import org.irnorm.compiler.ir.FieldAccess;
import org.irnorm.compiler.ir.IndexAccess;
import org.irnorm.compiler.ir.IrNode;
import org.irnorm.compiler.ir.IrPattern;
import org.irnorm.compiler.ir.IrPattern.AliasPat;
import org.irnorm.compiler.ir.IrPattern.BinaryPat;
import org.irnorm.compiler.ir.IrPattern.BindPat;
import org.irnorm.compiler.ir.IrPattern.ListPat;
import org.irnorm.compiler.ir.IrPattern.MapPat;
import org.irnorm.compiler.ir.IrPattern.Segment;
import org.irnorm.compiler.ir.IrPattern.StructPat;
import org.irnorm.compiler.ir.IrPattern.TuplePat;
import org.irnorm.compiler.ir.ListLit;
import org.irnorm.compiler.ir.Literal;
import org.irnorm.compiler.ir.MapLit;
import org.irnorm.compiler.ir.Patterns;
import org.irnorm.compiler.ir.RemoteCall;
import org.irnorm.compiler.ir.StructLit;
import org.irnorm.compiler.ir.StructUpdate;
import org.irnorm.compiler.ir.TreeWalker;
import org.irnorm.compiler.ir.TupleLit;
import org.irnorm.compiler.ir.Var;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Classifies values as structured or scalar so the harmonizer never renames a binder onto a name
 * whose uses demand a different kind of value.
 */
public class ShapeClassifier {

    private static final Set<String> SCALAR_OPERATORS = Set.of(
            "+", "-", "*", "/", "<", ">", "<=", ">=", "div", "rem");

    /**
     * Derives a shape from how a name is used: as a field/index receiver or struct-update base
     * (structured) and as an arithmetic or ordering operand (scalar).
     * @param name The variable name.
     * @param scope The nodes the name is used in.
     * @return The joined shape of all uses.
     */
    public ValueShape usageShape(String name, List<? extends IrNode> scope) {
        ValueShape[] shape = {ValueShape.UNKNOWN};
        Consumer<IrNode> receiver = n -> {
            IrNode target = n instanceof FieldAccess f ? f.receiver()
                    : n instanceof IndexAccess i ? i.receiver()
                    : ((StructUpdate) n).base();
            if (isVar(target, name)) {
                shape[0] = shape[0].join(ValueShape.STRUCTURED);
            }
        };
        Consumer<IrNode> operator = n -> {
            BinaryOp op = (BinaryOp) n;
            if (SCALAR_OPERATORS.contains(op.operator()) && (isVar(op.left(), name) || isVar(op.right(), name))) {
                shape[0] = shape[0].join(ValueShape.SCALAR);
            }
        };
        TreeWalker walker = new TreeWalker(Map.of(
                FieldAccess.class, receiver,
                IndexAccess.class, receiver,
                StructUpdate.class, receiver,
                BinaryOp.class, operator));
        walker.walk(scope);
        return shape[0];
    }

    /**
     * Derives a shape from a value expression.
     * @param value The expression a binder is matched against.
     * @return STRUCTURED for aggregate literals, SCALAR for numbers and arithmetic, otherwise UNKNOWN.
     */
    public ValueShape valueShape(IrNode value) {
        if (value instanceof MapLit || value instanceof StructLit || value instanceof StructUpdate
                || value instanceof TupleLit || value instanceof ListLit) {
            return ValueShape.STRUCTURED;
        }
        if (value instanceof Literal literal && literal.kind().isNumeric()) {
            return ValueShape.SCALAR;
        }
        if (value instanceof BinaryOp op && SCALAR_OPERATORS.contains(op.operator())
                && !op.operator().startsWith("<") && !op.operator().startsWith(">")) {
            return ValueShape.SCALAR;
        }
        return ValueShape.UNKNOWN;
    }

    /**
     * Derives a binder's shape from its position: an alias over an aggregate pattern is structured,
     * a numeric bit segment is scalar.
     * @param patterns The patterns containing the binder.
     * @param binder The binder name.
     * @return The shape, UNKNOWN if the position says nothing.
     */
    public ValueShape binderShape(List<IrPattern> patterns, String binder) {
        ValueShape[] shape = {ValueShape.UNKNOWN};
        for (IrPattern pattern : patterns) {
            Patterns.forEach(pattern, p -> {
                if (p instanceof AliasPat alias && alias.name().equals(binder) && isAggregate(alias.pattern())) {
                    shape[0] = shape[0].join(ValueShape.STRUCTURED);
                } else if (p instanceof BinaryPat bits) {
                    for (Segment segment : bits.segments()) {
                        if (segment.value() instanceof BindPat bind && bind.name().equals(binder)
                                && isNumericSegment(segment.spec())) {
                            shape[0] = shape[0].join(ValueShape.SCALAR);
                        }
                    }
                }
            });
        }
        return shape[0];
    }

    /**
     * A rename from a binder of shape {@code binder} to a name used as {@code usage} is allowed
     * unless both are known and differ. Conflicting uses are never compatible.
     * @param binder The binder's shape.
     * @param usage The target name's usage shape.
     * @return {@code true} if the rename is shape-safe.
     */
    public boolean compatible(ValueShape binder, ValueShape usage) {
        if (usage == ValueShape.CONFLICT || binder == ValueShape.CONFLICT) {
            return false;
        }
        return binder == ValueShape.UNKNOWN || usage == ValueShape.UNKNOWN || binder == usage;
    }

    /**
     * @param name A variable name.
     * @param scope The nodes to search.
     * @return {@code true} if the name is used as a field/index receiver or as a call argument.
     */
    public boolean isReceiverOrArgument(String name, List<? extends IrNode> scope) {
        boolean[] found = {false};
        Consumer<IrNode> receiver = n -> {
            IrNode target = n instanceof FieldAccess f ? f.receiver() : ((IndexAccess) n).receiver();
            found[0] |= isVar(target, name);
        };
        Consumer<IrNode> call = n -> {
            List<IrNode> args = n instanceof Call c ? c.args() : ((RemoteCall) n).args();
            found[0] |= args.stream().anyMatch(a -> isVar(a, name));
        };
        new TreeWalker(Map.of(
                FieldAccess.class, receiver,
                IndexAccess.class, receiver,
                Call.class, call,
                RemoteCall.class, call)).walk(scope);
        return found[0];
    }

    private static boolean isAggregate(IrPattern pattern) {
        return pattern instanceof MapPat || pattern instanceof StructPat
                || pattern instanceof TuplePat || pattern instanceof ListPat;
    }

    private static boolean isNumericSegment(String spec) {
        return spec != null && (spec.contains("integer") || spec.contains("float"))
                && !spec.contains("binary");
    }

    private static boolean isVar(IrNode node, String name) {
        return node instanceof Var v && v.name().equals(name);
    }
}
