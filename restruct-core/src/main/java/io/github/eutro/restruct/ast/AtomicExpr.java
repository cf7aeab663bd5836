package io.github.eutro.restruct.ast;

import io.github.eutro.restruct.graph.Node;

/**
 * An opaque reference to the branch at the end of a block, resolved by whoever emits the code.
 */
public final class AtomicExpr extends ExprNode {
    private final Node block;

    public AtomicExpr(Node block) {
        this.block = block;
    }

    /**
     * Get the block whose branch this condition is.
     *
     * @return The block, the original of its equivalence class.
     */
    public Node getBlock() {
        return block;
    }

    @Override
    public String toString() {
        return block.getName();
    }
}
