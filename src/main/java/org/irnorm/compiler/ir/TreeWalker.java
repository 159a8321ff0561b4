package org.irnorm.compiler.ir;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A generic class for traversing and rebuilding IR trees.
 * Instead of the Visitor pattern, this walker uses a handler-based system
 * to minimize coupling between passes and the IR structure.
 */
public class TreeWalker {

    private final Map<Class<? extends IrNode>, Consumer<IrNode>> handlers;

    /**
     * Constructs a new TreeWalker.
     * @param handlers A map from IR node classes to their corresponding handlers.
     */
    public TreeWalker(Map<Class<? extends IrNode>, Consumer<IrNode>> handlers) {
        this.handlers = handlers;
    }

    /**
     * Constructs a walker without handlers, for the rewrite methods only.
     */
    public TreeWalker() {
        this(Map.of());
    }

    /**
     * Walks a list of IR nodes.
     * @param nodes The list of nodes to walk.
     */
    public void walk(List<? extends IrNode> nodes) {
        for (IrNode node : nodes) {
            walk(node);
        }
    }

    /**
     * Walks a single IR node and its children recursively, pre-order.
     * @param node The node to walk; {@code null} slots are skipped.
     */
    public void walk(IrNode node) {
        if (node == null) {
            return;
        }

        handlers.getOrDefault(node.getClass(), n -> {}).accept(node);

        for (IrNode child : node.getChildren()) {
            walk(child);
        }
    }

    /**
     * Transforms a tree by replacing nodes according to a replacement map. Records compare by
     * value, so every occurrence equal to a key is replaced.
     * @param node The root node to transform.
     * @param replacements A map from old nodes to their replacements.
     * @return The transformed node (may be the same or a new node).
     */
    public IrNode transform(IrNode node, Map<IrNode, IrNode> replacements) {
        if (node == null) {
            return null;
        }

        IrNode replacement = replacements.get(node);
        if (replacement != null) {
            return replacement;
        }

        return rebuild(node, child -> transform(child, replacements));
    }

    /**
     * Rewrites a tree post-order: children first, then {@code rewriter} on the rebuilt parent.
     * @param node The root.
     * @param rewriter Returns its argument unchanged when it has nothing to do.
     * @return The rewritten tree; the same instance if nothing changed.
     */
    public IrNode rewriteBottomUp(IrNode node, UnaryOperator<IrNode> rewriter) {
        if (node == null) {
            return null;
        }
        IrNode rebuilt = rebuild(node, child -> rewriteBottomUp(child, rewriter));
        return rewriter.apply(rebuilt);
    }

    /**
     * Rewrites a tree pre-order: {@code rewriter} on the node, then on the children of the result.
     * @param node The root.
     * @param rewriter Returns its argument unchanged when it has nothing to do.
     * @return The rewritten tree; the same instance if nothing changed.
     */
    public IrNode rewriteTopDown(IrNode node, UnaryOperator<IrNode> rewriter) {
        if (node == null) {
            return null;
        }
        IrNode replaced = rewriter.apply(node);
        return rebuild(replaced, child -> rewriteTopDown(child, rewriter));
    }

    /**
     * Applies {@code childRewriter} to every child and reconstructs the node only if a child changed.
     * @param node The node.
     * @param childRewriter The per-child rewrite.
     * @return The original node or a reconstructed copy.
     */
    public static IrNode rebuild(IrNode node, UnaryOperator<IrNode> childRewriter) {
        List<IrNode> children = node.getChildren();
        if (children.isEmpty()) {
            return node;
        }
        List<IrNode> transformedChildren = new ArrayList<>(children.size());
        boolean childrenChanged = false;

        for (IrNode child : children) {
            IrNode transformedChild = child == null ? null : childRewriter.apply(child);
            if (transformedChild != child) {
                childrenChanged = true;
            }
            transformedChildren.add(transformedChild);
        }

        return childrenChanged ? node.reconstructWithChildren(transformedChildren) : node;
    }
}
