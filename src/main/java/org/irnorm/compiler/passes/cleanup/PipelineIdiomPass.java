package org.irnorm.compiler.passes.cleanup;

import org.irnorm.compiler.ir.Call;
import org.irnorm.compiler.ir.Fn;
import org.irnorm.compiler.ir.IrNode;
import org.irnorm.compiler.ir.NodeMeta;
import org.irnorm.compiler.ir.Pipe;
import org.irnorm.compiler.ir.RemoteCall;
import org.irnorm.compiler.ir.TreeWalker;
import org.irnorm.compiler.passes.INormalizationPass;
import org.irnorm.compiler.passes.PassContext;
import org.irnorm.compiler.passes.PassTier;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites nested calls that thread one value through their first arguments, at least two calls
 * deep, into a pipeline: {@code c(b(a(x), y))} becomes {@code x |> a() |> b(y) |> c()}.
 * The right-hand stages of an existing pipeline are never re-threaded.
 */
public class PipelineIdiomPass implements INormalizationPass {

    public static final String NAME = "pipeline-idiom";
    private static final int MIN_DEPTH = 2;

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
        return rewrite(root);
    }

    private IrNode rewrite(IrNode node) {
        if (node == null) {
            return null;
        }
        if (node instanceof Pipe pipe) {
            IrNode left = rewrite(pipe.left());
            IrNode right = rewriteArguments(pipe.right());
            return left == pipe.left() && right == pipe.right() ? pipe : new Pipe(left, right, pipe.meta());
        }
        List<IrNode> chain = new ArrayList<>();
        IrNode cursor = node;
        while (isCall(cursor) && !arguments(cursor).isEmpty()) {
            chain.add(cursor);
            cursor = arguments(cursor).get(0);
        }
        if (chain.size() >= MIN_DEPTH && !isCall(cursor) && !(cursor instanceof Pipe) && !(cursor instanceof Fn)) {
            IrNode piped = rewrite(cursor);
            for (int i = chain.size() - 1; i >= 0; i--) {
                IrNode stage = chain.get(i);
                piped = new Pipe(piped, rewriteArguments(dropFirstArgument(stage)), NodeMeta.at(stage.source()));
            }
            return piped;
        }
        return TreeWalker.rebuild(node, this::rewrite);
    }

    private IrNode rewriteArguments(IrNode stage) {
        return TreeWalker.rebuild(stage, this::rewrite);
    }

    private static boolean isCall(IrNode node) {
        return node instanceof Call || node instanceof RemoteCall;
    }

    private static List<IrNode> arguments(IrNode call) {
        return call instanceof Call local ? local.args() : ((RemoteCall) call).args();
    }

    private static IrNode dropFirstArgument(IrNode call) {
        if (call instanceof Call local) {
            return new Call(local.function(), local.args().subList(1, local.args().size()), local.meta());
        }
        RemoteCall remote = (RemoteCall) call;
        return new RemoteCall(remote.target(), remote.function(), remote.args().subList(1, remote.args().size()),
                remote.meta());
    }
}
