package org.irnorm.compiler.passes.structural;

import org.irnorm.compiler.ir.Block;
import org.irnorm.compiler.ir.CaseClause;
import org.irnorm.compiler.ir.Def;
import org.irnorm.compiler.ir.FnClause;
import org.irnorm.compiler.ir.If;
import org.irnorm.compiler.ir.IrNode;
import org.irnorm.compiler.ir.IrPattern.BindPat;
import org.irnorm.compiler.ir.Match;
import org.irnorm.compiler.ir.TreeWalker;
import org.irnorm.compiler.ir.Var;
import org.irnorm.compiler.passes.INormalizationPass;
import org.irnorm.compiler.passes.PassContext;
import org.irnorm.compiler.passes.PassTier;

import java.util.ArrayList;
import java.util.List;

/**
 * Inlines a trailing temporary: a body ending in {@code x = expr; x} ends in {@code expr}.
 * Only bodies whose bindings cannot leak are touched: definition, closure and clause bodies and
 * if branches.
 */
public class TempVariableInliningPass implements INormalizationPass {

    public static final String NAME = "temp-variable-inlining";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public PassTier tier() {
        return PassTier.STRUCTURAL;
    }

    @Override
    public IrNode run(IrNode root, PassContext context) {
        return new TreeWalker().rewriteBottomUp(root, n -> {
            if (n instanceof Def def) {
                IrNode body = inline(def.body());
                return body == def.body() ? def : def.withParamsAndBody(def.params(), def.guard(), body);
            }
            if (n instanceof FnClause clause) {
                IrNode body = inline(clause.body());
                return body == clause.body() ? clause : clause.withParamsAndBody(clause.params(), clause.guard(), body);
            }
            if (n instanceof CaseClause clause) {
                IrNode body = inline(clause.body());
                return body == clause.body() ? clause : clause.withPatternAndBody(clause.pattern(), clause.guard(), body);
            }
            if (n instanceof If branch) {
                IrNode thenBranch = inline(branch.thenBranch());
                IrNode elseBranch = inline(branch.elseBranch());
                if (thenBranch == branch.thenBranch() && elseBranch == branch.elseBranch()) {
                    return branch;
                }
                return new If(branch.condition(), thenBranch, elseBranch, branch.meta());
            }
            return n;
        });
    }

    private IrNode inline(IrNode body) {
        if (!(body instanceof Block block) || block.statements().size() < 2) {
            return body;
        }
        List<IrNode> statements = block.statements();
        int n = statements.size();
        if (statements.get(n - 1) instanceof Var result
                && statements.get(n - 2) instanceof Match match
                && match.pattern() instanceof BindPat bind
                && bind.name().equals(result.name())) {
            List<IrNode> out = new ArrayList<>(statements.subList(0, n - 2));
            out.add(match.value());
            return block.withStatements(out);
        }
        return body;
    }
}
