package io.github.eutro.restruct.ast;

import io.github.eutro.restruct.graph.Node;
import org.jetbrains.annotations.Nullable;

public final class ContinueNode extends AstNode {
    ContinueNode(AstTree tree, @Nullable Node node) {
        super(tree, node);
    }

    @Override
    public Kind getKind() {
        return Kind.CONTINUE;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitContinue(this);
    }
}
