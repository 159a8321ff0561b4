package org.irnorm.compiler.ir;

import org.irnorm.compiler.ir.IrPattern.BindPat;
import org.irnorm.compiler.ir.IrPattern.LitPat;
import org.irnorm.compiler.ir.IrPattern.TuplePat;

import java.util.Arrays;
import java.util.List;

/**
 * Static factory methods for building IR trees with empty metadata.
 */
public final class Ir {

    private Ir() {}

    public static Var var(String name) {
        return new Var(name, NodeMeta.EMPTY);
    }

    public static Literal integer(long value) {
        return new Literal(LiteralKind.INTEGER, value, NodeMeta.EMPTY);
    }

    public static Literal str(String value) {
        return new Literal(LiteralKind.STRING, value, NodeMeta.EMPTY);
    }

    public static Literal atom(String value) {
        return new Literal(LiteralKind.ATOM, value, NodeMeta.EMPTY);
    }

    public static Literal bool(boolean value) {
        return new Literal(LiteralKind.BOOLEAN, value, NodeMeta.EMPTY);
    }

    public static Literal nil() {
        return new Literal(LiteralKind.NIL, null, NodeMeta.EMPTY);
    }

    public static Block block(IrNode... statements) {
        return new Block(Arrays.asList(statements), NodeMeta.EMPTY);
    }

    public static Block block(List<IrNode> statements) {
        return new Block(statements, NodeMeta.EMPTY);
    }

    public static Match match(IrPattern pattern, IrNode value) {
        return new Match(pattern, value, NodeMeta.EMPTY);
    }

    /** {@code name = value}. */
    public static Match assign(String name, IrNode value) {
        return new Match(new BindPat(name), value, NodeMeta.EMPTY);
    }

    public static If ifThen(IrNode condition, IrNode thenBranch) {
        return new If(condition, thenBranch, null, NodeMeta.EMPTY);
    }

    public static If ifElse(IrNode condition, IrNode thenBranch, IrNode elseBranch) {
        return new If(condition, thenBranch, elseBranch, NodeMeta.EMPTY);
    }

    public static Case caseOf(IrNode subject, CaseClause... clauses) {
        return new Case(subject, Arrays.asList(clauses), NodeMeta.EMPTY);
    }

    public static CaseClause clause(IrPattern pattern, IrNode body) {
        return new CaseClause(pattern, null, body, NodeMeta.EMPTY);
    }

    public static Fn fn(List<IrPattern> params, IrNode body) {
        return new Fn(List.of(new FnClause(params, null, body, NodeMeta.EMPTY)), NodeMeta.EMPTY);
    }

    public static Def def(String name, List<IrPattern> params, IrNode body) {
        return new Def(name, params, null, body, false, NodeMeta.EMPTY);
    }

    public static Call call(String function, IrNode... args) {
        return new Call(function, Arrays.asList(args), NodeMeta.EMPTY);
    }

    public static RemoteCall remote(String module, String function, IrNode... args) {
        return new RemoteCall(new ModuleRef(module, NodeMeta.EMPTY), function, Arrays.asList(args), NodeMeta.EMPTY);
    }

    public static TupleLit tuple(IrNode... elements) {
        return new TupleLit(Arrays.asList(elements), NodeMeta.EMPTY);
    }

    public static FieldAccess field(IrNode receiver, String field) {
        return new FieldAccess(receiver, field, NodeMeta.EMPTY);
    }

    public static BinaryOp binary(String operator, IrNode left, IrNode right) {
        return new BinaryOp(operator, left, right, NodeMeta.EMPTY);
    }

    public static ModuleDef module(String name, IrNode... body) {
        return new ModuleDef(name, Arrays.asList(body), NodeMeta.EMPTY);
    }

    /** Marks a node as standing for a host-language {@code return}. */
    public static IrNode returnOf(IrNode value) {
        return value.withMeta(value.meta().with(MetaFlag.EARLY_RETURN));
    }

    public static BindPat bind(String name) {
        return new BindPat(name);
    }

    public static LitPat atomPat(String value) {
        return new LitPat(LiteralKind.ATOM, value);
    }

    public static TuplePat tuplePat(IrPattern... elements) {
        return new TuplePat(Arrays.asList(elements));
    }

    /** {@code {:tag, binder}}. */
    public static TuplePat tagged(String tag, String binder) {
        return new TuplePat(List.of(atomPat(tag), new BindPat(binder)));
    }
}
