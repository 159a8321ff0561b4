package org.irnorm.compiler.passes.structural;

import org.irnorm.compiler.ir.Block;
import org.irnorm.compiler.ir.Case;
import org.irnorm.compiler.ir.CaseClause;
import org.irnorm.compiler.ir.Def;
import org.irnorm.compiler.ir.Fn;
import org.irnorm.compiler.ir.FnClause;
import org.irnorm.compiler.ir.If;
import org.irnorm.compiler.ir.Ir;
import org.irnorm.compiler.ir.IrNode;
import org.irnorm.compiler.ir.Match;
import org.irnorm.compiler.ir.MetaFlag;
import org.irnorm.compiler.ir.NodeMeta;
import org.irnorm.compiler.ir.TreeWalker;
import org.irnorm.compiler.passes.INormalizationPass;
import org.irnorm.compiler.passes.PassContext;
import org.irnorm.compiler.passes.PassTier;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns early returns into branch structure.
 * <p>
 * The target has no {@code return}: a statement that returns from the function in some paths
 * must instead carry the rest of the function body in its other paths. For an {@code if} without
 * an else branch the rest becomes the else branch; a branch that returns only in some nested
 * path gets the rest appended as its fallthrough continuation, and the same recursion handles
 * chains of early returns. Case statements distribute the rest into every clause that does not
 * always return. A binding whose value is such a branch is split: the binding moves into the
 * paths that produce a value and the rest of the body follows it there.
 * <p>
 * A return left in a position that cannot be restructured, such as a call argument, keeps its
 * flag and is reported as a warning.
 * <p>
 * Function and closure bodies are processed separately; a return inside a closure belongs to
 * the closure.
 */
public class EarlyReturnReconstructionPass implements INormalizationPass {

    public static final String NAME = "early-return-reconstruction";

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
                IrNode body = rewriteBody(def.body());
                reportResidual(body, def.name(), context);
                return body == def.body() ? def : def.withParamsAndBody(def.params(), def.guard(), body);
            }
            if (n instanceof FnClause clause) {
                IrNode body = rewriteBody(clause.body());
                reportResidual(body, "closure", context);
                return body == clause.body() ? clause : clause.withParamsAndBody(clause.params(), clause.guard(), body);
            }
            return n;
        });
    }

    private void reportResidual(IrNode body, String owner, PassContext context) {
        IrNode residual = findReturn(body);
        if (residual != null) {
            context.warning(this, "early return in " + owner + " could not be turned into a branch", residual.source());
        }
    }

    private static IrNode findReturn(IrNode node) {
        if (node == null || node instanceof Fn) {
            return null;
        }
        if (node.hasFlag(MetaFlag.EARLY_RETURN)) {
            return node;
        }
        for (IrNode child : node.getChildren()) {
            IrNode found = findReturn(child);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    private IrNode rewriteBody(IrNode body) {
        if (body instanceof Block block) {
            List<IrNode> statements = rewriteSequence(block.statements());
            return sameElements(statements, block.statements()) ? block : block.withStatements(statements);
        }
        return rewriteTerminal(body);
    }

    private List<IrNode> rewriteSequence(List<IrNode> statements) {
        int n = statements.size();
        List<IrNode> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            IrNode statement = statements.get(i);
            if (statement instanceof Match binding && !statement.hasFlag(MetaFlag.EARLY_RETURN)
                    && returnsFromValue(binding.value())) {
                out.add(splitBinding(binding, statements.subList(i + 1, n)));
                return out;
            }
            if (i == n - 1 || alwaysReturns(statement)) {
                out.add(rewriteTerminal(statement));
                return out;
            }
            if ((statement instanceof If || statement instanceof Case) && containsReturn(statement)) {
                out.add(distribute(statement, statements.subList(i + 1, n)));
                return out;
            }
            out.add(statement);
        }
        return out;
    }

    private IrNode distribute(IrNode statement, List<IrNode> rest) {
        if (statement instanceof If branch) {
            IrNode thenBranch = continueWith(branch.thenBranch(), rest);
            IrNode elseBranch = branch.elseBranch() == null
                    ? rewriteBody(new Block(rest, NodeMeta.EMPTY))
                    : continueWith(branch.elseBranch(), rest);
            return new If(branch.condition(), thenBranch, elseBranch, branch.meta().without(MetaFlag.EARLY_RETURN));
        }
        Case match = (Case) statement;
        List<CaseClause> clauses = new ArrayList<>(match.clauses().size());
        for (CaseClause clause : match.clauses()) {
            clauses.add(clause.withPatternAndBody(clause.pattern(), clause.guard(), continueWith(clause.body(), rest)));
        }
        return new Case(match.subject(), clauses, match.meta().without(MetaFlag.EARLY_RETURN));
    }

    private static boolean returnsFromValue(IrNode value) {
        return alwaysReturns(value) || ((value instanceof If || value instanceof Case) && containsReturn(value));
    }

    /**
     * Replaces {@code pattern = value; rest} by the value's branch structure, binding the
     * pattern to each branch result that does not return and running the rest after it.
     */
    private IrNode splitBinding(Match binding, List<IrNode> rest) {
        IrNode value = binding.value();
        if (value.hasFlag(MetaFlag.EARLY_RETURN)
                || (alwaysReturns(value) && !(value instanceof If) && !(value instanceof Case))) {
            return rewriteTerminal(value);
        }
        if (value instanceof If branch) {
            IrNode thenBranch = bindInto(branch.thenBranch(), binding, rest);
            IrNode elseBranch = bindInto(branch.elseBranch(), binding, rest);
            return new If(branch.condition(), thenBranch, elseBranch, branch.meta().without(MetaFlag.EARLY_RETURN));
        }
        Case match = (Case) value;
        List<CaseClause> clauses = new ArrayList<>(match.clauses().size());
        for (CaseClause clause : match.clauses()) {
            clauses.add(clause.withPatternAndBody(clause.pattern(), clause.guard(), bindInto(clause.body(), binding, rest)));
        }
        return new Case(match.subject(), clauses, match.meta().without(MetaFlag.EARLY_RETURN));
    }

    private IrNode bindInto(IrNode branch, Match binding, List<IrNode> rest) {
        if (alwaysReturns(branch)) {
            return rewriteBody(branch);
        }
        List<IrNode> merged = new ArrayList<>();
        IrNode result;
        if (branch instanceof Block block && !block.statements().isEmpty()) {
            merged.addAll(block.statements().subList(0, block.statements().size() - 1));
            result = block.last();
        } else if (branch == null || branch instanceof Block) {
            result = Ir.nil();
        } else {
            result = branch;
        }
        merged.add(new Match(binding.pattern(), result, binding.meta()));
        merged.addAll(rest);
        NodeMeta meta = branch instanceof Block ? branch.meta() : NodeMeta.EMPTY;
        return rewriteBody(new Block(merged, meta));
    }

    private IrNode continueWith(IrNode branch, List<IrNode> rest) {
        if (alwaysReturns(branch)) {
            return rewriteBody(branch);
        }
        List<IrNode> merged = new ArrayList<>();
        if (branch instanceof Block block) {
            merged.addAll(block.statements());
        } else {
            merged.add(branch);
        }
        merged.addAll(rest);
        NodeMeta meta = branch instanceof Block ? branch.meta() : NodeMeta.EMPTY;
        return rewriteBody(new Block(merged, meta));
    }

    private IrNode rewriteTerminal(IrNode statement) {
        IrNode node = strip(statement);
        if (node instanceof Block) {
            return rewriteBody(node);
        }
        if (node instanceof If branch) {
            IrNode thenBranch = rewriteBody(branch.thenBranch());
            IrNode elseBranch = branch.elseBranch() == null ? null : rewriteBody(branch.elseBranch());
            if (thenBranch == branch.thenBranch() && elseBranch == branch.elseBranch()) {
                return branch;
            }
            return new If(branch.condition(), thenBranch, elseBranch, branch.meta());
        }
        if (node instanceof Case match) {
            List<CaseClause> clauses = new ArrayList<>(match.clauses().size());
            boolean changed = false;
            for (CaseClause clause : match.clauses()) {
                IrNode body = rewriteBody(clause.body());
                changed |= body != clause.body();
                clauses.add(body == clause.body() ? clause : clause.withPatternAndBody(clause.pattern(), clause.guard(), body));
            }
            return changed ? new Case(match.subject(), clauses, match.meta()) : match;
        }
        return node;
    }

    private static IrNode strip(IrNode node) {
        return node.hasFlag(MetaFlag.EARLY_RETURN) ? node.withMeta(node.meta().without(MetaFlag.EARLY_RETURN)) : node;
    }

    /**
     * @return {@code true} if some path through the statement returns early (closures excluded).
     */
    static boolean containsReturn(IrNode node) {
        if (node == null) {
            return false;
        }
        if (node.hasFlag(MetaFlag.EARLY_RETURN)) {
            return true;
        }
        if (node instanceof Block block) {
            return block.statements().stream().anyMatch(EarlyReturnReconstructionPass::containsReturn);
        }
        if (node instanceof If branch) {
            return containsReturn(branch.thenBranch()) || containsReturn(branch.elseBranch());
        }
        if (node instanceof Case match) {
            return match.clauses().stream().anyMatch(c -> containsReturn(c.body()));
        }
        return false;
    }

    /**
     * @return {@code true} if every path through the statement returns early.
     */
    static boolean alwaysReturns(IrNode node) {
        if (node == null) {
            return false;
        }
        if (node.hasFlag(MetaFlag.EARLY_RETURN)) {
            return true;
        }
        if (node instanceof Block block) {
            return block.statements().stream().anyMatch(EarlyReturnReconstructionPass::alwaysReturns);
        }
        if (node instanceof If branch) {
            return branch.hasElse() && alwaysReturns(branch.thenBranch()) && alwaysReturns(branch.elseBranch());
        }
        if (node instanceof Case match) {
            return !match.clauses().isEmpty() && match.clauses().stream().allMatch(c -> alwaysReturns(c.body()));
        }
        return false;
    }

    private static boolean sameElements(List<IrNode> a, List<IrNode> b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            if (a.get(i) != b.get(i)) {
                return false;
            }
        }
        return true;
    }
}
