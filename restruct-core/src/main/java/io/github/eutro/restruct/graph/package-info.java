/**
 * Region graphs: the control flow graphs that get restructured.
 */
package io.github.eutro.restruct.graph;
