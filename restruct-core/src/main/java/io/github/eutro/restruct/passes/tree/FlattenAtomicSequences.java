package io.github.eutro.restruct.passes.tree;

import io.github.eutro.restruct.ast.*;
import io.github.eutro.restruct.passes.InPlaceIRPass;
import org.jetbrains.annotations.Nullable;

/**
 * Replaces every sequence of one node with that node, and drops empty sequences.
 * <p>
 * An empty root is kept as an empty sequence.
 */
public class FlattenAtomicSequences implements InPlaceIRPass<AstTree> {
    /**
     * A singleton instance of this pass.
     */
    public static final FlattenAtomicSequences INSTANCE = new FlattenAtomicSequences();

    @Override
    public void runInPlace(AstTree tree) {
        AstNode root = tree.getRoot();
        if (root == null) return;
        AstNode flat = flatten(root);
        tree.setRoot(flat == null ? tree.addSequenceNode() : flat);
    }

    @Nullable
    private static AstNode flatten(@Nullable AstNode node) {
        if (node instanceof SequenceNode) {
            SequenceNode seq = (SequenceNode) node;
            for (int i = seq.size() - 1; i >= 0; i--) {
                AstNode child = flatten(seq.getChildren().get(i));
                if (child == null) seq.removeChild(i);
                else seq.setChild(i, child);
            }
            switch (seq.size()) {
                case 0:
                    return null;
                case 1:
                    return seq.getChildren().get(0);
                default:
                    return seq;
            }
        } else if (node instanceof IfNode) {
            IfNode ifNode = (IfNode) node;
            ifNode.setThen(flatten(ifNode.getThen()));
            ifNode.setElse(flatten(ifNode.getElse()));
        }
        return node;
    }
}
