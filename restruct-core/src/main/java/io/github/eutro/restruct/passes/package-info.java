/**
 * Passes over region graphs and ASTs, and their composition.
 * <p>
 * The usual entry point is {@link io.github.eutro.restruct.passes.Passes#restructure(io.github.eutro.restruct.conf.RestructureOptions)},
 * which inflates a region (untangling it first) and builds its AST.
 */
package io.github.eutro.restruct.passes;
