package org.irnorm.compiler.ir;

import org.irnorm.compiler.api.SourceInfo;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes of the IR tree.
 * <p>
 * Nodes are immutable. Generic traversal goes through {@link #getChildren()} and
 * {@link #reconstructWithChildren(List)}, so the {@link TreeWalker} can walk and rebuild any tree
 * without knowing the concrete variants. Patterns are not children; they live in {@link IrPattern}.
 */
public sealed interface IrNode permits Var, Literal, Interpolation, Block, Match, If, Case, CaseClause,
        Fn, FnClause, Def, Call, RemoteCall, ModuleRef, FieldAccess, IndexAccess, TupleLit, ListLit,
        MapLit, StructLit, StructUpdate, Pipe, BinaryOp, UnaryOp, With, WithClause, Try, Receive,
        For, ForGenerator, ModuleDef, Opaque {

    /**
     * @return The node's metadata; never null.
     */
    NodeMeta meta();

    /**
     * Returns a copy of this node carrying different metadata.
     * @param meta The new metadata.
     * @return The copy.
     */
    IrNode withMeta(NodeMeta meta);

    /**
     * Returns the direct child nodes in a fixed order. Optional children (an absent guard or
     * else branch) appear as {@code null} so positions stay stable.
     *
     * @return The children; empty for leaves.
     */
    default List<IrNode> getChildren() {
        return Collections.emptyList();
    }

    /**
     * Creates a new instance of this node with the given children, in the order
     * {@link #getChildren()} returns them.
     *
     * @param newChildren The new children.
     * @return A new node, or this node for leaves.
     */
    default IrNode reconstructWithChildren(List<IrNode> newChildren) {
        return this;
    }

    default SourceInfo source() {
        return meta().source();
    }

    default boolean hasFlag(MetaFlag flag) {
        return meta().has(flag);
    }
}
