package io.github.eutro.restruct.ast;

import io.github.eutro.restruct.graph.Node;
import org.jetbrains.annotations.Nullable;

/**
 * An assignment to the state variable, followed by an optional successor.
 */
public final class SetNode extends AstNode {
    @Nullable
    private AstNode next;

    SetNode(AstTree tree, Node node, @Nullable AstNode next) {
        super(tree, node);
        this.next = next;
    }

    @Override
    public Kind getKind() {
        return Kind.SET;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitSet(this);
    }

    public int getStateVariableValue() {
        Node node = getNode();
        assert node != null;
        return node.getStateVariableValue();
    }

    @Override
    public @Nullable AstNode getSuccessor() {
        return next;
    }

    @Override
    public void setSuccessor(@Nullable AstNode successor) {
        next = tree.checkOwned(successor);
    }
}
