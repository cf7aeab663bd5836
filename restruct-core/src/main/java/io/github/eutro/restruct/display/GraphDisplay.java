package io.github.eutro.restruct.display;

import io.github.eutro.restruct.graph.Node;
import io.github.eutro.restruct.graph.RegionGraph;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renders region graphs as GraphViz dot.
 */
public class GraphDisplay {
    /**
     * Render a graph as dot.
     * <p>
     * The entry is filled green, false edges of check nodes are red, and every other edge is green.
     *
     * @param graph The graph.
     * @return The dot source.
     */
    public static String toDot(RegionGraph graph) {
        StringBuilder sb = new StringBuilder("digraph CFGFunction {\n");
        Node entry = graph.size() == 0 ? null : graph.getEntry();
        for (Node node : graph) {
            sb.append("  \"").append(node.getId()).append("\" [label=\"ID: ").append(node.getId())
                    .append(" Name: ").append(escape(node.getName())).append('"');
            if (node == entry) sb.append(", fillcolor=green, style=filled");
            sb.append("];\n");
        }
        for (Node node : graph) {
            for (Node succ : node.getSuccessors()) {
                boolean falseEdge = node.isCheck() && node.getFalse() == succ;
                sb.append("  \"").append(node.getId()).append("\" -> \"").append(succ.getId())
                        .append("\" [color=").append(falseEdge ? "red" : "green").append("];\n");
            }
        }
        return sb.append("}\n").toString();
    }

    static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    /**
     * Write dot source to a file, creating its parent directories.
     *
     * @param dot  The dot source.
     * @param path The file to write.
     */
    public static void writeToFile(String dot, Path path) {
        try {
            Path parent = path.getParent();
            if (parent != null) Files.createDirectories(parent);
            try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
                writer.write(dot);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
