package io.github.eutro.restruct.ast;

import io.github.eutro.restruct.graph.Node;
import org.jetbrains.annotations.Nullable;

/**
 * A block of code, followed by an optional successor.
 */
public final class CodeNode extends AstNode {
    @Nullable
    private AstNode next;

    CodeNode(AstTree tree, Node node, @Nullable AstNode next) {
        super(tree, node);
        this.next = next;
    }

    @Override
    public Kind getKind() {
        return Kind.CODE;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitCode(this);
    }

    @Override
    public @Nullable AstNode getSuccessor() {
        return next;
    }

    @Override
    public void setSuccessor(@Nullable AstNode successor) {
        next = tree.checkOwned(successor);
    }

    @Override
    public boolean isEmpty() {
        Node node = getNode();
        return next == null && (node == null || node.isEmpty());
    }
}
