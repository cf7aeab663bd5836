package io.github.eutro.restruct.passes.form;

import io.github.eutro.restruct.conf.RestructureOptions;
import io.github.eutro.restruct.conf.TraceSink;
import io.github.eutro.restruct.graph.Edge;
import io.github.eutro.restruct.graph.Node;
import io.github.eutro.restruct.graph.RegionGraph;
import io.github.eutro.restruct.passes.InPlaceIRPass;
import io.github.eutro.restruct.passes.meta.DomTree;
import io.github.eutro.restruct.util.RegionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Duplicates the continuation of a conditional when one side of it is much heavier than the other,
 * so the lighter side can keep the shared continuation and the heavier side gets its own.
 * <p>
 * For a conditional with immediate post-dominator {@code P}, let {@code then} and {@code else} be the weights
 * of the nodes of each arm that the conditional does not dominate, and {@code post} the weight of everything
 * from {@code P} to the exit. If {@code then + post} and {@code then + else} both exceed {@code else + post},
 * the edges into {@code P} coming from the else arm are moved to a copy of the subgraph from {@code P} down.
 * The symmetric case moves the edges of the then arm.
 * <p>
 * Conditionals whose arms overlap, or whose arms both have nodes they do not dominate, are left alone.
 */
public class Untangle implements InPlaceIRPass<RegionGraph> {
    private static final Logger LOGGER = LoggerFactory.getLogger(Untangle.class);

    /**
     * An instance of this pass with the default options.
     */
    public static final Untangle INSTANCE = new Untangle(RestructureOptions.DEFAULT);

    private final RestructureOptions options;

    public Untangle(RestructureOptions options) {
        this.options = options;
    }

    @Override
    public void runInPlace(RegionGraph graph) {
        if (!graph.isDAG()) {
            throw new IllegalStateException("cannot untangle " + graph + ", it is not a DAG");
        }
        TraceSink trace = options.getTraceSink();

        List<Node> conditionals = new ArrayList<>();
        for (Node node : graph) {
            if (node.getSuccessorCount() == 2) conditionals.add(node);
        }
        if (conditionals.isEmpty()) return;

        List<Node> exits = graph.exitNodes();
        Node sink = graph.addArtificialNode("sink");
        for (Node exit : exits) {
            graph.addEdge(exit, sink);
        }
        if (trace.isEnabled()) trace.dumpGraph(graph, "untangle", "initial-state");

        DomTree postDoms = DomTree.postDominators(graph);
        Map<Node, Node> postDominatorMap = new HashMap<>();
        for (Node conditional : conditionals) {
            Node postDom = postDoms.getIDom(conditional);
            if (postDom == null) {
                throw new IllegalStateException("conditional " + conditional + " has no immediate post-dominator");
            }
            postDominatorMap.put(conditional, postDom);
        }

        // last in reverse post-order first
        conditionals = graph.orderNodes(conditionals, false);
        int iteration = 0;
        while (!conditionals.isEmpty()) {
            Node conditional = conditionals.remove(conditionals.size() - 1);
            untangleConditional(graph, conditional, postDominatorMap.get(conditional), sink);
            if (trace.isEnabled()) trace.dumpGraph(graph, "untangle", "debug-" + iteration);
            iteration++;
        }

        if (trace.isEnabled()) trace.dumpGraph(graph, "untangle", "after-processing");
        graph.purgeVirtualSink(sink);
        if (trace.isEnabled()) trace.dumpGraph(graph, "untangle", "after-sink-removal");
    }

    private void untangleConditional(RegionGraph graph, Node conditional, Node postDominator, Node sink) {
        if (conditional.getSuccessorCount() != 2) {
            throw new IllegalStateException("conditional " + conditional + " does not have two successors");
        }
        DomTree doms = DomTree.dominators(graph);
        Node thenChild = conditional.getSuccessor(0);
        Node elseChild = conditional.getSuccessor(1);

        Set<Node> thenNodes = RegionUtils.findReachableNodes(thenChild, postDominator);
        Set<Node> elseNodes = RegionUtils.findReachableNodes(elseChild, postDominator);
        thenNodes.remove(postDominator);
        elseNodes.remove(postDominator);

        List<Node> notDominatedThen = notDominated(doms, conditional, thenNodes);
        List<Node> notDominatedElse = notDominated(doms, conditional, elseNodes);
        if (!notDominatedThen.isEmpty() && !notDominatedElse.isEmpty()) {
            LOGGER.debug("Not untangling {}: both arms have nodes it does not dominate", conditional);
            return;
        }
        if (!Collections.disjoint(thenNodes, elseNodes)) {
            LOGGER.debug("Not untangling {}: its arms overlap", conditional);
            return;
        }

        long thenWeight = RegionUtils.sumWeights(notDominatedThen);
        long elseWeight = RegionUtils.sumWeights(notDominatedElse);
        long postDominatorWeight = RegionUtils.sumWeights(RegionUtils.findReachableNodes(postDominator, sink));

        long armSum = thenWeight + elseWeight;
        long thenSide = thenWeight + postDominatorWeight;
        long elseSide = elseWeight + postDominatorWeight;
        LOGGER.debug("Untangle weights of {} (post-dominator {}): then side {}, else side {}, arms {}",
                conditional, postDominator, thenSide, elseSide, armSum);

        if (postDominator == sink) return;
        if (options.isGreater(thenSide, elseSide) && options.isGreater(armSum, elseSide)) {
            LOGGER.debug("Giving the else arm of {} its own copy of {}", conditional, postDominator);
            split(graph, doms, conditional, postDominator, sink, elseChild);
        } else if (options.isGreater(elseSide, thenSide) && options.isGreater(armSum, thenSide)) {
            LOGGER.debug("Giving the then arm of {} its own copy of {}", conditional, postDominator);
            split(graph, doms, conditional, postDominator, sink, thenChild);
        }
    }

    private static List<Node> notDominated(DomTree doms, Node conditional, Set<Node> nodes) {
        List<Node> ret = new ArrayList<>();
        for (Node node : nodes) {
            if (!doms.dominates(conditional, node)) ret.add(node);
        }
        return ret;
    }

    private static void split(RegionGraph graph,
                              DomTree doms,
                              Node conditional,
                              Node postDominator,
                              Node sink,
                              Node arm) {
        // query dominance before the graph changes
        List<Node> toMove = new ArrayList<>();
        for (Node pred : postDominator.getPredecessors()) {
            if (pred == conditional || doms.dominates(arm, pred)) toMove.add(pred);
        }
        Node clone = cloneUntilExit(graph, postDominator, sink);
        for (Node pred : toMove) {
            graph.moveEdgeTarget(Edge.of(pred, postDominator), clone);
        }
        if (clone.getPredecessorCount() == 0) {
            throw new IllegalStateException("untangling " + conditional + " moved no edges onto " + clone);
        }
    }

    /**
     * Clone every node reachable from {@code node}, stopping at the sink, with the edges between them.
     *
     * @param graph The graph.
     * @param node  The root of the subgraph to clone.
     * @param sink  The sink, which is not cloned.
     * @return The clone of {@code node}.
     */
    static Node cloneUntilExit(RegionGraph graph, Node node, Node sink) {
        Map<Node, Node> clones = new HashMap<>();
        Deque<Node> workList = new ArrayDeque<>();
        Node rootClone = graph.cloneNode(node);
        clones.put(node, rootClone);
        workList.add(node);
        while (!workList.isEmpty()) {
            Node current = workList.pop();
            Node currentClone = clones.get(current);
            List<Node> successors = new ArrayList<>(current.getSuccessors());
            for (Node succ : successors) {
                Node target;
                if (succ == sink) {
                    target = sink;
                } else {
                    target = clones.get(succ);
                    if (target == null) {
                        target = graph.cloneNode(succ);
                        clones.put(succ, target);
                        workList.add(succ);
                    }
                }
                if (current.isCheck()) {
                    if (current.getTrue() == succ) graph.setTrue(currentClone, target);
                    else graph.setFalse(currentClone, target);
                } else {
                    graph.addEdge(currentClone, target);
                }
            }
        }
        return rootClone;
    }
}
