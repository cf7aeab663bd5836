/**
 * Exts: typed, named slots of data that can be attached to graphs and nodes.
 * <p>
 * A {@link io.github.eutro.restruct.ext.ExtContainer} maps each {@link io.github.eutro.restruct.ext.Ext}
 * to at most one value. Collaborators use exts to hang their own data (such as the instructions of a block)
 * off a {@link io.github.eutro.restruct.graph.Node} without the restructuring engine knowing about it.
 * Computed analyses are stored in exts too, with their validity tracked by
 * {@link io.github.eutro.restruct.ext.MetadataState}.
 */
package io.github.eutro.restruct.ext;
