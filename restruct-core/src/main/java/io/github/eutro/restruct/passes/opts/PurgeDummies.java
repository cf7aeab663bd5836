package io.github.eutro.restruct.passes.opts;

import io.github.eutro.restruct.graph.Edge;
import io.github.eutro.restruct.graph.Node;
import io.github.eutro.restruct.graph.RegionGraph;
import io.github.eutro.restruct.passes.InPlaceIRPass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes empty nodes with exactly one predecessor and one successor,
 * linking the predecessor straight to the successor.
 * <p>
 * If the predecessor already has an edge to the successor, the two edges merge.
 * The exception is a check predecessor, whose true and false edges must stay distinct,
 * so such a dummy is kept.
 */
public class PurgeDummies implements InPlaceIRPass<RegionGraph> {
    private static final Logger LOGGER = LoggerFactory.getLogger(PurgeDummies.class);

    /**
     * A singleton instance of this pass.
     */
    public static final PurgeDummies INSTANCE = new PurgeDummies();

    @Override
    public void runInPlace(RegionGraph graph) {
        purge(graph);
    }

    /**
     * Purge pass-through dummies from a graph.
     *
     * @param graph The graph.
     * @return The removed nodes, in removal order.
     */
    public static List<Node> purge(RegionGraph graph) {
        List<Node> removed = new ArrayList<>();
        Node dummy;
        while ((dummy = findPassThrough(graph)) != null) {
            Node pred = dummy.getPredecessors().iterator().next();
            Node succ = dummy.getSuccessor(0);
            LOGGER.debug("Purging dummy {} between {} and {}", dummy.getId(), pred, succ);
            graph.moveEdgeTarget(Edge.of(pred, dummy), succ);
            graph.removeNode(dummy);
            removed.add(dummy);
        }
        return removed;
    }

    private static Node findPassThrough(RegionGraph graph) {
        for (Node node : graph) {
            if (node.isEmpty()
                    && node.getPredecessorCount() == 1
                    && node.getSuccessorCount() == 1) {
                Node pred = node.getPredecessors().iterator().next();
                // a check cannot have its true and false edges on one target
                if (pred.isCheck() && pred.hasSuccessor(node.getSuccessor(0))) continue;
                return node;
            }
        }
        return null;
    }
}
