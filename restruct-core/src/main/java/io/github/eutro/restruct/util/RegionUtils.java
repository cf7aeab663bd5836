package io.github.eutro.restruct.util;

import io.github.eutro.restruct.graph.Node;

import java.util.*;

/**
 * Utilities for querying region graphs.
 */
public class RegionUtils {
    /**
     * Find the nodes reachable from {@code source} without going through {@code target}.
     * <p>
     * Both {@code source} and, if it is reached, {@code target} are included.
     *
     * @param source The node to start from.
     * @param target The node to stop at.
     * @return The reachable nodes, in discovery order.
     */
    public static Set<Node> findReachableNodes(Node source, Node target) {
        Set<Node> reached = new LinkedHashSet<>();
        Deque<Node> workList = new ArrayDeque<>();
        reached.add(source);
        workList.add(source);
        while (!workList.isEmpty()) {
            Node current = workList.pop();
            if (current == target) continue;
            for (Node succ : current.getSuccessors()) {
                if (reached.add(succ)) workList.add(succ);
            }
        }
        return reached;
    }

    public static int sumWeights(Collection<Node> nodes) {
        int total = 0;
        for (Node node : nodes) {
            total += node.getWeight();
        }
        return total;
    }

    /**
     * Check whether every predecessor of {@code node} is in {@code visited}.
     *
     * @param node    The node.
     * @param visited The visited nodes.
     * @return Whether all predecessors are visited.
     */
    public static boolean predecessorsVisited(Node node, Set<Node> visited) {
        for (Node pred : node.getPredecessors()) {
            if (!visited.contains(pred)) return false;
        }
        return true;
    }
}
