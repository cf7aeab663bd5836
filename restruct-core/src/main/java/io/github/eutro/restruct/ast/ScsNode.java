package io.github.eutro.restruct.ast;

import io.github.eutro.restruct.graph.Node;
import org.jetbrains.annotations.Nullable;

/**
 * A loop, whose body is the independent tree built from the region of a collapsed node.
 */
public final class ScsNode extends AstNode {
    private final AstTree body;
    @Nullable
    private AstNode follow;

    ScsNode(AstTree tree, Node node, AstTree body, @Nullable AstNode follow) {
        super(tree, node);
        this.body = body;
        this.follow = follow;
    }

    @Override
    public Kind getKind() {
        return Kind.SCS;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitScs(this);
    }

    public AstTree getBody() {
        return body;
    }

    @Override
    public @Nullable AstNode getSuccessor() {
        return follow;
    }

    @Override
    public void setSuccessor(@Nullable AstNode successor) {
        follow = tree.checkOwned(successor);
    }
}
