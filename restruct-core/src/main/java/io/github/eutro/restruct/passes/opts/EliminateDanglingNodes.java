package io.github.eutro.restruct.passes.opts;

import io.github.eutro.restruct.graph.Node;
import io.github.eutro.restruct.graph.RegionGraph;
import io.github.eutro.restruct.passes.InPlaceIRPass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes every node other than the entry that has no predecessors, until there are none left.
 */
public class EliminateDanglingNodes implements InPlaceIRPass<RegionGraph> {
    private static final Logger LOGGER = LoggerFactory.getLogger(EliminateDanglingNodes.class);

    /**
     * A singleton instance of this pass.
     */
    public static final EliminateDanglingNodes INSTANCE = new EliminateDanglingNodes();

    @Override
    public void runInPlace(RegionGraph graph) {
        eliminate(graph);
    }

    /**
     * Remove dangling nodes from a graph.
     *
     * @param graph The graph.
     * @return The removed nodes, in removal order.
     */
    public static List<Node> eliminate(RegionGraph graph) {
        List<Node> removed = new ArrayList<>();
        Node entry = graph.getEntry();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Node node : new ArrayList<>(graph.nodes())) {
                if (node != entry && node.getPredecessorCount() == 0) {
                    LOGGER.debug("Removing unreachable node {}", node);
                    graph.removeNode(node);
                    removed.add(node);
                    changed = true;
                }
            }
        }
        return removed;
    }
}
