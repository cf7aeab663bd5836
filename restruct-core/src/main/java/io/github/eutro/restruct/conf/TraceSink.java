package io.github.eutro.restruct.conf;

import io.github.eutro.restruct.ast.AstTree;
import io.github.eutro.restruct.display.AstDisplay;
import io.github.eutro.restruct.display.GraphDisplay;
import io.github.eutro.restruct.graph.RegionGraph;

import java.nio.file.Path;

/**
 * Receives diagnostic dumps of graphs and trees at the named stages of restructuring.
 * <p>
 * Dumps are never part of the result. The pipeline asks {@link #isEnabled()} before
 * doing any work to produce one.
 */
public interface TraceSink {
    /**
     * A sink that drops everything.
     */
    TraceSink NONE = new TraceSink() {
        @Override
        public boolean isEnabled() {
            return false;
        }

        @Override
        public void dumpGraph(RegionGraph graph, String folder, String stage) {
        }

        @Override
        public void dumpAst(AstTree tree, RegionGraph graph, String folder, String stage) {
        }
    };

    boolean isEnabled();

    /**
     * Dump a region graph.
     *
     * @param graph  The graph.
     * @param folder The pass producing the dump.
     * @param stage  The stage of that pass.
     */
    void dumpGraph(RegionGraph graph, String folder, String stage);

    /**
     * Dump the AST of a region.
     *
     * @param tree   The tree.
     * @param graph  The graph the tree is built from.
     * @param folder The pass producing the dump.
     * @param stage  The stage of that pass.
     */
    void dumpAst(AstTree tree, RegionGraph graph, String folder, String stage);

    /**
     * Create a sink writing dot files under a directory, as
     * {@code <dir>/<folder>/<function>/Region-<region>-<stage>.dot}.
     *
     * @param dir The directory.
     * @return The sink.
     */
    static TraceSink toDirectory(Path dir) {
        return new TraceSink() {
            @Override
            public boolean isEnabled() {
                return true;
            }

            private Path file(RegionGraph graph, String folder, String stage) {
                String function = graph.getFunctionName().isEmpty() ? "unnamed" : graph.getFunctionName();
                return dir.resolve(folder)
                        .resolve(function)
                        .resolve("Region-" + graph.getRegionName() + "-" + stage + ".dot");
            }

            @Override
            public void dumpGraph(RegionGraph graph, String folder, String stage) {
                GraphDisplay.writeToFile(GraphDisplay.toDot(graph), file(graph, folder, stage));
            }

            @Override
            public void dumpAst(AstTree tree, RegionGraph graph, String folder, String stage) {
                GraphDisplay.writeToFile(AstDisplay.toDot(tree), file(graph, folder, stage));
            }
        };
    }
}
