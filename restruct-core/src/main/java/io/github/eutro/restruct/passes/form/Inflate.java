package io.github.eutro.restruct.passes.form;

import io.github.eutro.restruct.conf.RestructureOptions;
import io.github.eutro.restruct.conf.TraceSink;
import io.github.eutro.restruct.graph.Edge;
import io.github.eutro.restruct.graph.Node;
import io.github.eutro.restruct.graph.RegionGraph;
import io.github.eutro.restruct.passes.InPlaceIRPass;
import io.github.eutro.restruct.passes.meta.DomTree;
import io.github.eutro.restruct.passes.opts.PurgeDummies;
import io.github.eutro.restruct.util.GraphWalker;
import io.github.eutro.restruct.util.RegionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Combs a region DAG, duplicating nodes and inserting dummy joins until every node
 * reached from inside a conditional is reached only from inside it.
 * <p>
 * Conditionals are processed from the last in reverse post-order to the first. For each one, the nodes
 * between it and its immediate post-dominator are walked in reverse post-order. A node that also has
 * predecessors from outside the conditional is cloned, and the clone takes those outside edges.
 * The post-dominator itself, when it joins more than two paths, instead gets a dummy node in front of it
 * that collects the edges from inside the conditional.
 * <p>
 * Conditionals whose arms reach disjoint sets of exits, and that dominate the exits of at least one arm,
 * are not combed.
 */
public class Inflate implements InPlaceIRPass<RegionGraph> {
    private static final Logger LOGGER = LoggerFactory.getLogger(Inflate.class);

    /**
     * An instance of this pass with the default options.
     */
    public static final Inflate INSTANCE = new Inflate(RestructureOptions.DEFAULT);

    private final RestructureOptions options;
    private final Untangle untangle;

    public Inflate(RestructureOptions options) {
        this.options = options;
        untangle = new Untangle(options);
    }

    @Override
    public void runInPlace(RegionGraph graph) {
        if (options.isUntangleEnabled()) untangle.runInPlace(graph);
        if (!graph.isDAG()) {
            throw new IllegalStateException("cannot inflate " + graph + ", it is not a DAG");
        }
        TraceSink trace = options.getTraceSink();

        List<Node> exits = graph.exitNodes();
        Map<Node, Set<Node>> reachableExits = new HashMap<>();
        for (Node exit : exits) {
            for (Node node : GraphWalker.predecessorWalker(exit).preOrder()) {
                reachableExits.computeIfAbsent(node, k -> new LinkedHashSet<>()).add(exit);
            }
        }

        if (trace.isEnabled()) trace.dumpGraph(graph, "inflate", "before-sink");
        Node sink = graph.addArtificialNode("sink");
        for (Node exit : exits) {
            graph.addEdge(exit, sink);
        }
        if (trace.isEnabled()) trace.dumpGraph(graph, "inflate", "after-sink");

        DomTree doms = DomTree.dominators(graph);
        List<Node> conditionals = new ArrayList<>();
        for (Node node : graph) {
            if (node.getSuccessorCount() > 2) {
                throw new IllegalStateException("node " + node + " has more than two successors");
            }
            if (node.getSuccessorCount() != 2) continue;
            Set<Node> thenExits = reachableExits.getOrDefault(node.getSuccessor(0), Collections.emptySet());
            Set<Node> elseExits = reachableExits.getOrDefault(node.getSuccessor(1), Collections.emptySet());
            boolean intersect = !Collections.disjoint(thenExits, elseExits);
            boolean thenDominated = dominatesAll(doms, node, thenExits);
            boolean elseDominated = dominatesAll(doms, node, elseExits);
            if (intersect || !(thenDominated || elseDominated)) {
                conditionals.add(node);
            } else {
                LOGGER.debug("Blacklisted conditional {}", node);
            }
        }

        Comb comb = new Comb(graph, sink, graph.orderNodes(conditionals, false));
        comb.run();

        if (trace.isEnabled()) trace.dumpGraph(graph, "inflate", "before-final-purge");
        PurgeDummies.purge(graph);
        graph.purgeVirtualSink(sink);
        if (trace.isEnabled()) trace.dumpGraph(graph, "inflate", "final");
    }

    private static boolean dominatesAll(DomTree doms, Node node, Set<Node> nodes) {
        for (Node other : nodes) {
            if (!doms.dominates(node, other)) return false;
        }
        return true;
    }

    private class Comb {
        final RegionGraph graph;
        final Node sink;
        final List<Node> conditionals;
        final Set<Node> allConditionals;
        final List<Node> order;
        final Map<Node, Node> postDominatorMap = new HashMap<>();
        final Map<Node, Set<Node>> equivalenceClasses = new HashMap<>();
        final Map<Node, Node> cloneToOriginal = new HashMap<>();
        int iteration = 0;

        Comb(RegionGraph graph, Node sink, List<Node> conditionals) {
            this.graph = graph;
            this.sink = sink;
            this.conditionals = conditionals;
            allConditionals = new HashSet<>(conditionals);
            order = graph.reversePostOrder();
            for (Node node : order) {
                equivalenceClasses.put(node, new HashSet<>(Collections.singleton(node)));
                cloneToOriginal.put(node, node);
            }
            DomTree postDoms = DomTree.postDominators(graph);
            for (Node conditional : conditionals) {
                Node postDom = postDoms.getIDom(conditional);
                if (postDom == null) {
                    throw new IllegalStateException("conditional " + conditional + " has no immediate post-dominator");
                }
                postDominatorMap.put(conditional, postDom);
            }
        }

        void run() {
            while (!conditionals.isEmpty()) {
                Node conditional = conditionals.remove(conditionals.size() - 1);
                LOGGER.debug("Combing conditional {}", conditional);
                comb(conditional);
            }
        }

        void comb(Node conditional) {
            Set<Node> workList = new HashSet<>(conditional.getSuccessors());
            Set<Node> visited = new HashSet<>();
            visited.add(conditional);
            int cursor = order.indexOf(conditional);
            if (cursor < 0) throw new IllegalStateException("conditional " + conditional + " is not in the ordering");

            while (!workList.isEmpty()) {
                Node postDom = postDominatorMap.get(conditional);
                Set<Node> postDomSet = equivalenceClasses.get(postDom);
                if (postDomSet == null) {
                    throw new IllegalStateException("no equivalence class for post-dominator " + postDom);
                }

                cursor++;
                if (cursor >= order.size()) {
                    throw new IllegalStateException("walked past the end of the ordering while combing " + conditional);
                }
                Node candidate = order.get(cursor);
                if (!workList.contains(candidate)) continue;

                boolean isPostDom = false;
                if (postDomSet.contains(candidate)) {
                    if (RegionUtils.predecessorsVisited(candidate, visited)) break;
                    isPostDom = true;
                    visited.add(candidate);
                    workList.remove(candidate);
                } else {
                    boolean allVisited = RegionUtils.predecessorsVisited(candidate, visited);
                    visited.add(candidate);
                    workList.remove(candidate);
                    workList.addAll(candidate.getSuccessors());
                    if (allVisited) continue;
                }

                if (isPostDom && candidate.getPredecessorCount() > 2) {
                    cursor = insertDummy(conditional, candidate, cursor, visited, workList);
                } else {
                    duplicate(candidate, cursor, visited);
                    cursor++;
                }

                TraceSink trace = options.getTraceSink();
                if (trace.isEnabled()) trace.dumpGraph(graph, "inflate", "before-purge-" + iteration);
                for (Node removed : PurgeDummies.purge(graph)) {
                    visited.remove(removed);
                    workList.remove(removed);
                    int index = order.indexOf(removed);
                    if (index >= 0) {
                        if (index <= cursor) cursor--;
                        order.remove(index);
                    }
                }
                if (trace.isEnabled()) trace.dumpGraph(graph, "inflate", "after-purge-" + iteration);
                iteration++;
            }
        }

        int insertDummy(Node conditional, Node candidate, int cursor, Set<Node> visited, Set<Node> workList) {
            Node dummy = graph.addArtificialNode();
            LOGGER.debug("Inserting dummy {} before post-dominator {} of {}", dummy.getId(), candidate, conditional);
            order.add(cursor, dummy);

            // the post-dominator comes back once the dummy is done
            visited.remove(candidate);
            workList.add(candidate);

            equivalenceClasses.put(dummy, new HashSet<>(Collections.singleton(dummy)));
            cloneToOriginal.put(dummy, dummy);
            if (!candidate.isEmpty() || candidate == sink) {
                postDominatorMap.put(conditional, dummy);
            }
            workList.add(dummy);

            for (Node pred : new ArrayList<>(candidate.getPredecessors())) {
                if (visited.contains(pred)) {
                    graph.moveEdgeTarget(Edge.of(pred, candidate), dummy);
                }
            }
            graph.addEdge(dummy, candidate);

            // step back so the next step lands on the dummy
            return cursor - 1;
        }

        void duplicate(Node candidate, int cursor, Set<Node> visited) {
            Node duplicated = graph.cloneNode(candidate);
            LOGGER.debug("Duplicating {} as node {}", candidate, duplicated.getId());
            order.add(cursor, duplicated);

            Node original = cloneToOriginal.get(candidate);
            if (original == null) throw new IllegalStateException("no original recorded for " + candidate);
            cloneToOriginal.put(duplicated, original);
            Set<Node> equivalenceClass = equivalenceClasses.get(original);
            if (equivalenceClass == null) {
                throw new IllegalStateException("no equivalence class for " + original);
            }
            equivalenceClass.add(duplicated);

            if (allConditionals.contains(candidate)) {
                conditionals.add(duplicated);
                allConditionals.add(duplicated);
                postDominatorMap.put(duplicated, postDominatorMap.get(candidate));
            }

            if (candidate.isCheck()) {
                Node t = candidate.getTrue();
                Node f = candidate.getFalse();
                if (t == null || f == null) {
                    throw new IllegalStateException("check node " + candidate + " is missing a true or false edge");
                }
                graph.setTrue(duplicated, t);
                graph.setFalse(duplicated, f);
            } else {
                for (Node succ : candidate.getSuccessors()) {
                    graph.addEdge(duplicated, succ);
                }
            }

            for (Node pred : new ArrayList<>(candidate.getPredecessors())) {
                if (!visited.contains(pred)) {
                    graph.moveEdgeTarget(Edge.of(pred, candidate), duplicated);
                }
            }
        }
    }
}
