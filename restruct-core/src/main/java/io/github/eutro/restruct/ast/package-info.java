/**
 * The tree-shaped, goto-free representation of a restructured region.
 * <p>
 * The node variants form a closed family. Consumers match over them with an
 * {@link io.github.eutro.restruct.ast.AstVisitor}, which has one method per variant.
 * Every node and condition expression is owned by exactly one {@link io.github.eutro.restruct.ast.AstTree}.
 */
package io.github.eutro.restruct.ast;
