package io.github.eutro.restruct.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered list of statements.
 */
public final class SequenceNode extends AstNode {
    private final List<AstNode> children = new ArrayList<>();

    SequenceNode(AstTree tree) {
        super(tree, null);
    }

    @Override
    public Kind getKind() {
        return Kind.SEQUENCE;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitSequence(this);
    }

    public List<AstNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public int size() {
        return children.size();
    }

    public void addChild(AstNode child) {
        children.add(tree.checkOwned(child));
    }

    public void setChild(int i, AstNode child) {
        children.set(i, tree.checkOwned(child));
    }

    public void removeChild(int i) {
        children.remove(i);
    }
}
