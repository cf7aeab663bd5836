package io.github.eutro.restruct.ast;

import org.jetbrains.annotations.Nullable;

/**
 * A synthesized condition expression, owned by at most one {@link AstTree}.
 */
public abstract class ExprNode {
    @Nullable
    AstTree owner;

    @Nullable
    public AstTree getOwner() {
        return owner;
    }
}
