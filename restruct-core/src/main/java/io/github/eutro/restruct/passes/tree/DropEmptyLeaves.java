package io.github.eutro.restruct.passes.tree;

import io.github.eutro.restruct.ast.*;
import io.github.eutro.restruct.passes.InPlaceIRPass;
import org.jetbrains.annotations.Nullable;

/**
 * Removes {@link AstNode#isEmpty() empty} children from every sequence.
 */
public class DropEmptyLeaves implements InPlaceIRPass<AstTree> {
    /**
     * A singleton instance of this pass.
     */
    public static final DropEmptyLeaves INSTANCE = new DropEmptyLeaves();

    @Override
    public void runInPlace(AstTree tree) {
        drop(tree.getRoot());
    }

    private static void drop(@Nullable AstNode node) {
        if (node instanceof SequenceNode) {
            SequenceNode seq = (SequenceNode) node;
            for (int i = seq.size() - 1; i >= 0; i--) {
                AstNode child = seq.getChildren().get(i);
                if (child.isEmpty()) {
                    seq.removeChild(i);
                } else {
                    drop(child);
                }
            }
        } else if (node instanceof IfNode) {
            drop(((IfNode) node).getThen());
            drop(((IfNode) node).getElse());
        }
    }
}
