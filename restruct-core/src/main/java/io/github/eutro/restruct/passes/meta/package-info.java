/**
 * Passes that compute analyses of a region graph, without changing it.
 */
package io.github.eutro.restruct.passes.meta;
