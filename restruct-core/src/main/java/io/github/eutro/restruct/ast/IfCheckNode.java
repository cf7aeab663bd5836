package io.github.eutro.restruct.ast;

import io.github.eutro.restruct.graph.Node;
import org.jetbrains.annotations.Nullable;

/**
 * A conditional that dispatches on the true and false edges of a check node.
 */
public final class IfCheckNode extends IfNode {
    IfCheckNode(AstTree tree,
                Node node,
                @Nullable AstNode thenBranch,
                @Nullable AstNode elseBranch,
                @Nullable AstNode follow) {
        super(tree, node, null, thenBranch, elseBranch, follow);
    }

    @Override
    public Kind getKind() {
        return Kind.IF_CHECK;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitIfCheck(this);
    }
}
