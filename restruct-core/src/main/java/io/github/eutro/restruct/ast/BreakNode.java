package io.github.eutro.restruct.ast;

import io.github.eutro.restruct.graph.Node;
import org.jetbrains.annotations.Nullable;

public final class BreakNode extends AstNode {
    BreakNode(AstTree tree, @Nullable Node node) {
        super(tree, node);
    }

    @Override
    public Kind getKind() {
        return Kind.BREAK;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBreak(this);
    }
}
