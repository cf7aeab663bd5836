package io.github.eutro.restruct.ast;

import io.github.eutro.restruct.graph.Node;
import org.jetbrains.annotations.Nullable;

/**
 * A conditional on a synthesized condition, with an optional follow node running after it.
 */
public class IfNode extends AstNode {
    @Nullable
    private final ExprNode condition;
    @Nullable
    private AstNode thenBranch;
    @Nullable
    private AstNode elseBranch;
    @Nullable
    private AstNode follow;

    IfNode(AstTree tree,
           Node node,
           @Nullable ExprNode condition,
           @Nullable AstNode thenBranch,
           @Nullable AstNode elseBranch,
           @Nullable AstNode follow) {
        super(tree, node);
        this.condition = condition;
        this.thenBranch = thenBranch;
        this.elseBranch = elseBranch;
        this.follow = follow;
    }

    @Override
    public Kind getKind() {
        return Kind.IF;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitIf(this);
    }

    /**
     * Get the condition of this if.
     *
     * @return The condition, or null for {@link IfCheckNode}s.
     */
    @Nullable
    public ExprNode getCondition() {
        return condition;
    }

    @Nullable
    public AstNode getThen() {
        return thenBranch;
    }

    public void setThen(@Nullable AstNode thenBranch) {
        this.thenBranch = tree.checkOwned(thenBranch);
    }

    @Nullable
    public AstNode getElse() {
        return elseBranch;
    }

    public void setElse(@Nullable AstNode elseBranch) {
        this.elseBranch = tree.checkOwned(elseBranch);
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
