package io.github.eutro.restruct.passes.tree;

import io.github.eutro.restruct.ast.*;
import io.github.eutro.restruct.passes.InPlaceIRPass;
import org.jetbrains.annotations.Nullable;

/**
 * Turns the root and every branch of every if into a {@link SequenceNode}, whose children are
 * the chain of nodes that follow one another, each detached from its successor.
 */
public class InsertSequences implements InPlaceIRPass<AstTree> {
    /**
     * A singleton instance of this pass.
     */
    public static final InsertSequences INSTANCE = new InsertSequences();

    @Override
    public void runInPlace(AstTree tree) {
        AstNode root = tree.getRoot();
        if (root != null) tree.setRoot(sequence(tree, root));
    }

    @Nullable
    private static AstNode sequenceOrNull(AstTree tree, @Nullable AstNode head) {
        return head == null ? null : sequence(tree, head);
    }

    private static SequenceNode sequence(AstTree tree, AstNode head) {
        SequenceNode seq;
        if (head instanceof SequenceNode) {
            seq = (SequenceNode) head;
        } else {
            seq = tree.addSequenceNode();
            AstNode current = head;
            while (current != null) {
                AstNode next = current.getSuccessor();
                current.setSuccessor(null);
                seq.addChild(current);
                current = next;
            }
        }
        for (AstNode child : seq.getChildren()) {
            if (child instanceof IfNode) {
                IfNode ifNode = (IfNode) child;
                ifNode.setThen(sequenceOrNull(tree, ifNode.getThen()));
                ifNode.setElse(sequenceOrNull(tree, ifNode.getElse()));
            }
        }
        return seq;
    }
}
