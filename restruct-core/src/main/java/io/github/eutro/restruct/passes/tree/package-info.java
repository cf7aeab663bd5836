/**
 * In-place simplifications of an {@link io.github.eutro.restruct.ast.AstTree}, run in order after it is built:
 * {@link io.github.eutro.restruct.passes.tree.InsertSequences},
 * {@link io.github.eutro.restruct.passes.tree.DropEmptyLeaves},
 * {@link io.github.eutro.restruct.passes.tree.FlattenAtomicSequences}.
 * <p>
 * None of them look into the bodies of loops, which are separate trees simplified when they are built.
 */
package io.github.eutro.restruct.passes.tree;
