package io.github.eutro.restruct.ast;

import io.github.eutro.restruct.graph.Node;
import org.jetbrains.annotations.Nullable;

/**
 * A node of an {@link AstTree}.
 */
public abstract class AstNode {
    /**
     * The variants of AST nodes.
     */
    public enum Kind {
        CODE,
        IF,
        IF_CHECK,
        SCS,
        SEQUENCE,
        SET,
        BREAK,
        CONTINUE,
    }

    final AstTree tree;
    @Nullable
    private final Node node;

    AstNode(AstTree tree, @Nullable Node node) {
        this.tree = tree;
        this.node = node;
    }

    public abstract Kind getKind();

    public abstract <R> R accept(AstVisitor<R> visitor);

    /**
     * Get the tree that owns this node.
     *
     * @return The tree.
     */
    public AstTree getTree() {
        return tree;
    }

    /**
     * Get the graph node this was built from.
     *
     * @return The graph node, or null for sequences.
     */
    @Nullable
    public Node getNode() {
        return node;
    }

    public String getName() {
        return node == null ? getKind().name().toLowerCase() : node.getName();
    }

    /**
     * Get the node that runs after this one, for variants that have one.
     *
     * @return The successor, or null.
     */
    @Nullable
    public AstNode getSuccessor() {
        return null;
    }

    /**
     * Set the node that runs after this one.
     *
     * @param successor The successor, or null.
     * @throws UnsupportedOperationException If this variant has no successor.
     */
    public void setSuccessor(@Nullable AstNode successor) {
        if (successor != null) {
            throw new UnsupportedOperationException(getKind() + " nodes have no successor");
        }
    }

    /**
     * Whether this node stands for no code at all.
     *
     * @return Whether this node is empty.
     */
    public boolean isEmpty() {
        return false;
    }

    @Override
    public String toString() {
        return getKind() + "(" + getName() + ")";
    }
}
