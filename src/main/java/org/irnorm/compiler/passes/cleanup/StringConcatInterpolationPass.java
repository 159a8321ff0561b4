package org.irnorm.compiler.passes.cleanup;

import org.irnorm.compiler.ir.BinaryOp;
import org.irnorm.compiler.ir.Call;
import org.irnorm.compiler.ir.Interpolation;
import org.irnorm.compiler.ir.IrNode;
import org.irnorm.compiler.ir.Literal;
import org.irnorm.compiler.ir.LiteralKind;
import org.irnorm.compiler.ir.NodeMeta;
import org.irnorm.compiler.ir.RemoteCall;
import org.irnorm.compiler.ir.TreeWalker;
import org.irnorm.compiler.passes.INormalizationPass;
import org.irnorm.compiler.passes.PassContext;
import org.irnorm.compiler.passes.PassTier;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites binary concatenation chains that mix string literals with expressions, such as
 * {@code "id: " <> to_string(id) <> "!"}, into a single interpolation. Explicit
 * {@code to_string} conversions are dropped since interpolation converts on its own.
 */
public class StringConcatInterpolationPass implements INormalizationPass {

    public static final String NAME = "string-concat-interpolation";
    private static final String CONCAT = "<>";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public PassTier tier() {
        return PassTier.CLEANUP;
    }

    @Override
    public IrNode run(IrNode root, PassContext context) {
        return new TreeWalker().rewriteTopDown(root, n -> n instanceof BinaryOp op && CONCAT.equals(op.operator())
                ? interpolate(op) : n);
    }

    private IrNode interpolate(BinaryOp chain) {
        List<IrNode> operands = new ArrayList<>();
        flatten(chain, operands);
        boolean hasString = operands.stream().anyMatch(StringConcatInterpolationPass::isString);
        boolean hasExpression = operands.stream().anyMatch(o -> !isString(o));
        if (!hasString || !hasExpression) {
            return chain;
        }
        List<IrNode> parts = new ArrayList<>(operands.size());
        for (IrNode operand : operands) {
            if (operand instanceof Interpolation nested) {
                nested.parts().forEach(p -> append(parts, p));
            } else {
                append(parts, unwrapToString(operand));
            }
        }
        return new Interpolation(parts, chain.meta());
    }

    private static void flatten(IrNode node, List<IrNode> out) {
        if (node instanceof BinaryOp op && CONCAT.equals(op.operator())) {
            flatten(op.left(), out);
            flatten(op.right(), out);
        } else {
            out.add(node);
        }
    }

    private static void append(List<IrNode> parts, IrNode part) {
        if (isString(part) && !parts.isEmpty() && isString(parts.get(parts.size() - 1))) {
            Literal previous = (Literal) parts.remove(parts.size() - 1);
            parts.add(new Literal(LiteralKind.STRING, previous.value() + String.valueOf(((Literal) part).value()),
                    NodeMeta.at(previous.source())));
        } else {
            parts.add(part);
        }
    }

    private static IrNode unwrapToString(IrNode operand) {
        if (operand instanceof Call call && "to_string".equals(call.function()) && call.args().size() == 1) {
            return call.args().get(0);
        }
        if (operand instanceof RemoteCall call && "Kernel.to_string".equals(call.qualifiedName()) && call.args().size() == 1) {
            return call.args().get(0);
        }
        return operand;
    }

    private static boolean isString(IrNode node) {
        return node instanceof Literal literal && literal.kind() == LiteralKind.STRING;
    }
}
