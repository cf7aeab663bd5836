package io.github.eutro.restruct.passes.meta;

import io.github.eutro.restruct.ext.CommonExts;
import io.github.eutro.restruct.ext.MetadataState;
import io.github.eutro.restruct.graph.Node;
import io.github.eutro.restruct.graph.RegionGraph;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A dominator or post-dominator tree of a {@link RegionGraph}, as it was when the tree was computed.
 * <p>
 * Every query checks that the graph has not changed since; querying a stale tree
 * throws {@link IllegalStateException}.
 * <p>
 * A post-dominator tree of a graph with several exits is a forest, whose roots are
 * the children of a virtual root. Nodes whose immediate post-dominator is that virtual root
 * have no {@link #getIDom(Node) immediate dominator}.
 */
public final class DomTree {
    private final RegionGraph graph;
    private final int version;
    private final boolean post;
    private final List<Node> roots;
    private final Map<Node, Node> idoms;
    private final Map<Node, List<Node>> children;
    private final Map<Node, Integer> dfsIn = new HashMap<>();
    private final Map<Node, Integer> dfsOut = new HashMap<>();
    private final List<Node> finishOrder = new ArrayList<>();

    DomTree(RegionGraph graph,
            boolean post,
            List<Node> roots,
            Map<Node, Node> idoms,
            Map<Node, List<Node>> children) {
        this.graph = graph;
        this.version = graph.getVersion();
        this.post = post;
        this.roots = roots;
        this.idoms = idoms;
        this.children = children;
        number();
    }

    private void number() {
        int counter = 0;
        Deque<Node> stack = new ArrayDeque<>();
        Deque<Iterator<Node>> iters = new ArrayDeque<>();
        for (Node root : roots) {
            dfsIn.put(root, counter++);
            stack.push(root);
            iters.push(getChildren0(root).iterator());
            while (!stack.isEmpty()) {
                Iterator<Node> it = iters.peek();
                if (it.hasNext()) {
                    Node child = it.next();
                    dfsIn.put(child, counter++);
                    stack.push(child);
                    iters.push(getChildren0(child).iterator());
                } else {
                    iters.pop();
                    Node done = stack.pop();
                    dfsOut.put(done, counter++);
                    finishOrder.add(done);
                }
            }
        }
    }

    /**
     * Get the up-to-date dominator tree of a graph, computing it if needed.
     *
     * @param graph The graph.
     * @return The dominator tree.
     */
    public static DomTree dominators(RegionGraph graph) {
        graph.getExtOrThrow(CommonExts.METADATA_STATE).ensureValid(graph, MetadataState.DOMS);
        return graph.getExtOrThrow(CommonExts.DOM_TREE).checkFresh();
    }

    /**
     * Get the up-to-date post-dominator tree of a graph, computing it if needed.
     *
     * @param graph The graph.
     * @return The post-dominator tree.
     */
    public static DomTree postDominators(RegionGraph graph) {
        graph.getExtOrThrow(CommonExts.METADATA_STATE).ensureValid(graph, MetadataState.POST_DOMS);
        return graph.getExtOrThrow(CommonExts.POST_DOM_TREE).checkFresh();
    }

    /**
     * Whether the graph is unchanged since this tree was computed.
     *
     * @return Whether this tree can still be queried.
     */
    public boolean isFresh() {
        return graph.getVersion() == version;
    }

    private DomTree checkFresh() {
        if (!isFresh()) {
            throw new IllegalStateException((post ? "post-dominator" : "dominator")
                    + " tree of " + graph + " is stale, the graph changed after it was computed");
        }
        return this;
    }

    public boolean isPostDominatorTree() {
        return post;
    }

    /**
     * Get the root of this tree.
     *
     * @return The root, or null if the tree has a virtual root.
     */
    @Nullable
    public Node getRoot() {
        checkFresh();
        return roots.size() == 1 ? roots.get(0) : null;
    }

    public List<Node> getRoots() {
        checkFresh();
        return Collections.unmodifiableList(roots);
    }

    /**
     * Get the immediate (post-)dominator of a node.
     *
     * @param node The node.
     * @return The immediate dominator, or null for roots and unreachable nodes.
     */
    @Nullable
    public Node getIDom(Node node) {
        checkFresh();
        return idoms.get(node);
    }

    public List<Node> getChildren(Node node) {
        checkFresh();
        return Collections.unmodifiableList(getChildren0(node));
    }

    private List<Node> getChildren0(Node node) {
        List<Node> list = children.get(node);
        return list == null ? Collections.emptyList() : list;
    }

    /**
     * Whether a node is reachable from the root(s) of this tree.
     *
     * @param node The node.
     * @return Whether the node is in the tree.
     */
    public boolean contains(Node node) {
        checkFresh();
        return dfsIn.containsKey(node);
    }

    /**
     * Check whether {@code a} (post-)dominates {@code b}. Every node dominates itself,
     * and a node not in the tree is dominated by everything.
     *
     * @param a The dominating node.
     * @param b The dominated node.
     * @return Whether {@code a} dominates {@code b}.
     */
    public boolean dominates(Node a, Node b) {
        checkFresh();
        if (a == b) return true;
        Integer inB = dfsIn.get(b);
        if (inB == null) return true;
        Integer inA = dfsIn.get(a);
        if (inA == null) return false;
        return inA <= inB && dfsOut.get(b) <= dfsOut.get(a);
    }

    public int getDfsNumIn(Node node) {
        checkFresh();
        return dfsIn.get(node);
    }

    public int getDfsNumOut(Node node) {
        checkFresh();
        return dfsOut.get(node);
    }

    /**
     * Get the nodes of this tree in ascending order of DFS finish number,
     * so every node comes after all of its children.
     *
     * @return The nodes, in post-order.
     */
    public List<Node> finishOrder() {
        checkFresh();
        return Collections.unmodifiableList(finishOrder);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(post ? "PostDomTree" : "DomTree").append(" {");
        for (Node node : finishOrder) {
            sb.append("\n  ").append(node).append(" <- ").append(idoms.get(node));
        }
        return sb.append("\n}").toString();
    }
}
