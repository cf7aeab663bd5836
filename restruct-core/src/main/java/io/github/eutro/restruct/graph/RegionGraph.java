package io.github.eutro.restruct.graph;

import io.github.eutro.restruct.ext.CommonExts;
import io.github.eutro.restruct.ext.ExtHolder;
import io.github.eutro.restruct.ext.MetadataState;
import io.github.eutro.restruct.util.GraphWalker;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * The control flow graph of one region: a function, or the body of a collapsed loop.
 * <p>
 * The graph owns all of its nodes. Every mutation bumps the {@link #getVersion() version}
 * and invalidates the analyses recorded in the graph's {@link MetadataState}.
 */
public final class RegionGraph extends ExtHolder implements Iterable<Node> {
    private static final Logger LOGGER = LoggerFactory.getLogger(RegionGraph.class);

    private final List<Node> nodes = new ArrayList<>();
    private int nextId = 0;
    private int version = 0;
    @Nullable
    private Node entry;
    private String functionName = "";
    private String regionName = "";
    private boolean toInflate = true;

    public RegionGraph() {
        attachExt(CommonExts.METADATA_STATE, new MetadataState());
    }

    public RegionGraph(String functionName, String regionName) {
        this();
        this.functionName = functionName;
        this.regionName = regionName;
    }

    // region building

    private Node newNode(
            String name,
            NodeKind kind,
            int weight,
            int stateVariableValue,
            @Nullable RegionGraph collapsedGraph,
            @Nullable Node original
    ) {
        Node node = new Node(this, nextId++, name, kind, weight, stateVariableValue, collapsedGraph, original);
        nodes.add(node);
        if (entry == null) entry = node;
        graphChanged();
        return node;
    }

    public Node addCode(String name, int weight) {
        return newNode(name, NodeKind.CODE, weight, 0, null, null);
    }

    /**
     * Add a check on the state variable. Its targets are set with {@link #setTrue(Node, Node)}
     * and {@link #setFalse(Node, Node)}.
     *
     * @param name       The name of the node.
     * @param stateValue The state variable value that the check compares against.
     * @return The new node.
     */
    public Node addCheck(String name, int stateValue) {
        return newNode(name, NodeKind.CHECK, 0, stateValue, null, null);
    }

    public Node addArtificialNode(String name) {
        return newNode(name, NodeKind.ARTIFICIAL_DUMMY, 0, 0, null, null);
    }

    public Node addArtificialNode() {
        return addArtificialNode("dummy");
    }

    public Node addBreak() {
        return newNode("break", NodeKind.BREAK, 0, 0, null, null);
    }

    public Node addContinue() {
        return newNode("continue", NodeKind.CONTINUE, 0, 0, null, null);
    }

    public Node addSet(int stateValue) {
        return newNode("set " + stateValue, NodeKind.SET, 0, stateValue, null, null);
    }

    /**
     * Add a node standing for a loop whose body is the given region.
     * <p>
     * The weight of the node is the total weight of the body.
     *
     * @param name The name of the node.
     * @param body The loop body.
     * @return The new node.
     */
    public Node addCollapsed(String name, RegionGraph body) {
        if (body == this) throw new IllegalArgumentException("a region cannot contain itself");
        return newNode(name, NodeKind.COLLAPSED, body.totalWeight(), 0, body, null);
    }

    /**
     * Clone a node, copying its kind, weight and name but none of its edges.
     *
     * @param node The node to clone.
     * @return The clone.
     */
    public Node cloneNode(Node node) {
        checkOwned(node);
        Node clone = newNode(node.getName() + " cloned",
                node.getKind(),
                node.getWeight(),
                node.getStateVariableValue(),
                node.getCollapsedGraph(),
                node.getOriginal());
        LOGGER.trace("Cloned {} into node {}", node, clone.getId());
        return clone;
    }

    /**
     * Remove a node, detaching it from all of its predecessors and successors.
     * <p>
     * No replacement edges are added.
     *
     * @param node The node to remove.
     */
    public void removeNode(Node node) {
        checkOwned(node);
        for (Node pred : new ArrayList<>(node.getPredecessors())) {
            pred.removeSuccessor(node);
        }
        for (Node succ : new ArrayList<>(node.getSuccessors())) {
            succ.removePredecessor(node);
        }
        node.detachAll();
        nodes.remove(node);
        node.owner = null;
        if (entry == node) entry = null;
        graphChanged();
    }

    public void addEdge(Node source, Node target) {
        checkOwned(source);
        checkOwned(target);
        source.addSuccessor(target);
        target.addPredecessor(source);
        graphChanged();
    }

    public void addEdge(Edge edge) {
        addEdge(edge.source, edge.target);
    }

    public void setTrue(Node check, Node target) {
        setCheckTarget(check, target, true);
    }

    public void setFalse(Node check, Node target) {
        setCheckTarget(check, target, false);
    }

    private void setCheckTarget(Node check, Node target, boolean slot) {
        checkOwned(check);
        checkOwned(target);
        if (!check.isCheck()) throw new IllegalArgumentException(check + " is not a check node");
        Node old = slot ? check.getTrue() : check.getFalse();
        if (old == target) return;
        if (slot) check.setTrueTarget(target);
        else check.setFalseTarget(target);
        if (old != null && !check.hasSuccessor(old)) old.removePredecessor(check);
        target.addPredecessor(check);
        graphChanged();
    }

    public void removeEdge(Edge edge) {
        checkEdge(edge);
        edge.source.removeSuccessor(edge.target);
        edge.target.removePredecessor(edge.source);
        graphChanged();
    }

    /**
     * Repoint an edge to a new target, keeping its true/false slot if the source is a check node.
     * <p>
     * If a non-check source already has an edge to the new target, the two edges merge.
     *
     * @param edge      The edge.
     * @param newTarget The new target.
     */
    public void moveEdgeTarget(Edge edge, Node newTarget) {
        checkEdge(edge);
        checkOwned(newTarget);
        edge.source.replaceSuccessor(edge.target, newTarget);
        edge.target.removePredecessor(edge.source);
        newTarget.addPredecessor(edge.source);
        graphChanged();
    }

    private void checkEdge(Edge edge) {
        checkOwned(edge.source);
        checkOwned(edge.target);
        if (!edge.source.hasSuccessor(edge.target)) {
            throw new IllegalArgumentException("no edge " + edge);
        }
    }

    private void checkOwned(Node node) {
        if (node.owner != this) {
            throw new IllegalArgumentException(node.isRemoved()
                    ? "node " + node + " was removed"
                    : "node " + node + " belongs to another region");
        }
    }

    private void graphChanged() {
        version++;
        getExtOrThrow(CommonExts.METADATA_STATE).graphChanged();
        removeExt(CommonExts.DOM_TREE);
        removeExt(CommonExts.POST_DOM_TREE);
    }

    // endregion

    // region accessors

    @NotNull
    public Node getEntry() {
        if (entry == null) throw new IllegalStateException("region " + this + " has no entry");
        return entry;
    }

    public void setEntry(Node entry) {
        checkOwned(entry);
        this.entry = entry;
        graphChanged();
    }

    /**
     * Get a version number, incremented on every change to the graph.
     *
     * @return The version.
     */
    public int getVersion() {
        return version;
    }

    /**
     * Get the nodes of this graph, in the order they were added.
     *
     * @return An unmodifiable view of the nodes.
     */
    public List<Node> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    @NotNull
    @Override
    public Iterator<Node> iterator() {
        return nodes().iterator();
    }

    public int size() {
        return nodes.size();
    }

    public boolean contains(Node node) {
        return node.owner == this;
    }

    public String getFunctionName() {
        return functionName;
    }

    public void setFunctionName(String functionName) {
        this.functionName = functionName;
    }

    public String getRegionName() {
        return regionName;
    }

    public void setRegionName(String regionName) {
        this.regionName = regionName;
    }

    /**
     * Whether this region still has to be inflated before an AST can be built from it.
     *
     * @return Whether restructuring is pending.
     */
    public boolean isToInflate() {
        return toInflate;
    }

    public void setToInflate(boolean toInflate) {
        this.toInflate = toInflate;
    }

    public int totalWeight() {
        int total = 0;
        for (Node node : nodes) {
            total += node.getWeight();
        }
        return total;
    }

    /**
     * Get the nodes that share an original with the given node, in graph order.
     *
     * @param node The node.
     * @return The equivalence class of the node.
     */
    public List<Node> equivalenceClass(Node node) {
        List<Node> ret = new ArrayList<>();
        for (Node other : nodes) {
            if (other.getOriginal() == node.getOriginal()) ret.add(other);
        }
        return ret;
    }

    public List<Node> exitNodes() {
        List<Node> exits = new ArrayList<>();
        for (Node node : nodes) {
            if (node.getSuccessorCount() == 0) exits.add(node);
        }
        return exits;
    }

    // endregion

    // region queries

    /**
     * Check that this graph has no cycles, including self loops.
     *
     * @return Whether the graph is acyclic.
     */
    public boolean isDAG() {
        Set<Node> done = new HashSet<>();
        Set<Node> onStack = new HashSet<>();
        for (Node root : nodes) {
            if (done.contains(root)) continue;
            Deque<Node> stack = new ArrayDeque<>();
            Deque<Iterator<Node>> iters = new ArrayDeque<>();
            stack.push(root);
            iters.push(root.getSuccessors().iterator());
            onStack.add(root);
            while (!stack.isEmpty()) {
                Iterator<Node> it = iters.peek();
                if (it.hasNext()) {
                    Node next = it.next();
                    if (onStack.contains(next)) return false;
                    if (done.add(next)) {
                        stack.push(next);
                        iters.push(next.getSuccessors().iterator());
                        onStack.add(next);
                    }
                } else {
                    Node finished = stack.pop();
                    iters.pop();
                    onStack.remove(finished);
                    done.add(finished);
                }
            }
        }
        return true;
    }

    /**
     * Get the nodes reachable from the entry in reverse post-order, exploring successors in order.
     *
     * @return The nodes, in reverse post-order.
     */
    public List<Node> reversePostOrder() {
        List<Node> order = GraphWalker.successorWalker(getEntry()).postOrder().toList();
        Collections.reverse(order);
        return order;
    }

    /**
     * Sort some nodes of this graph in reverse post-order, or in post-order if {@code reverse} is set.
     *
     * @param toOrder The nodes to sort.
     * @param reverse Whether to sort in post-order instead.
     * @return The sorted nodes.
     */
    public List<Node> orderNodes(Collection<Node> toOrder, boolean reverse) {
        Set<Node> wanted = new HashSet<>(toOrder);
        List<Node> ret = new ArrayList<>();
        for (Node node : reversePostOrder()) {
            if (wanted.contains(node)) ret.add(node);
        }
        if (ret.size() != wanted.size()) {
            throw new IllegalStateException("some nodes to order are unreachable from the entry of " + this);
        }
        if (reverse) Collections.reverse(ret);
        return ret;
    }

    /**
     * Check whether another graph has the same shape as this one.
     *
     * @param other The other graph.
     * @return Whether the two are equivalent.
     */
    public boolean isTopologicallyEquivalent(RegionGraph other) {
        if (size() != other.size()) return false;
        if (entry == null || other.entry == null) return entry == other.entry;
        return entry.isEquivalentTo(other.entry);
    }

    // endregion

    // region bulk operations

    /**
     * Remove the virtual sink, along with every empty node above it that was left as an exit.
     *
     * @param sink The sink.
     */
    public void purgeVirtualSink(Node sink) {
        checkOwned(sink);
        Deque<Node> workList = new ArrayDeque<>();
        Set<Node> purge = new LinkedHashSet<>();
        workList.add(sink);
        while (!workList.isEmpty()) {
            Node current = workList.pop();
            if (current.isEmpty() && purge.add(current)) {
                workList.addAll(current.getPredecessors());
            }
        }
        for (Node node : purge) {
            LOGGER.trace("Purging {} with the virtual sink", node);
            removeNode(node);
        }
    }

    /**
     * Copy some nodes of another region into this empty region, with the edges between them.
     * <p>
     * Copies remember their source through {@link CommonExts#COPY_OF}.
     *
     * @param toCopy The nodes to copy.
     * @param head   The node whose copy becomes the entry.
     * @return A map from each copied node to its copy.
     */
    public Map<Node, Node> insertBulkNodes(Collection<Node> toCopy, Node head) {
        if (!nodes.isEmpty()) throw new IllegalStateException("bulk insertion into non-empty region " + this);
        Map<Node, Node> subMap = new LinkedHashMap<>();
        for (Node node : toCopy) {
            Node copy = newNode(node.getName(),
                    node.getKind(),
                    node.getWeight(),
                    node.getStateVariableValue(),
                    node.getCollapsedGraph(),
                    null);
            copy.attachExt(CommonExts.COPY_OF, node);
            subMap.put(node, copy);
        }
        Node newHead = subMap.get(head);
        if (newHead == null) throw new IllegalArgumentException("head " + head + " is not among the copied nodes");
        for (Map.Entry<Node, Node> e : subMap.entrySet()) {
            Node node = e.getKey();
            Node copy = e.getValue();
            if (node.isCheck()) {
                Node t = node.getTrue() == null ? null : subMap.get(node.getTrue());
                Node f = node.getFalse() == null ? null : subMap.get(node.getFalse());
                if (t != null) setTrue(copy, t);
                if (f != null) setFalse(copy, f);
            } else {
                for (Node succ : node.getSuccessors()) {
                    Node target = subMap.get(succ);
                    if (target != null) addEdge(copy, target);
                }
            }
        }
        setEntry(newHead);
        return subMap;
    }

    /**
     * Route each edge leaving a copied region to a fresh {@link NodeKind#BREAK} node.
     *
     * @param outgoing The edges leaving the region, in the graph the nodes were copied from.
     * @param subMap   The map returned by {@link #insertBulkNodes(Collection, Node)}.
     */
    public void connectBreakNode(Set<Edge> outgoing, Map<Node, Node> subMap) {
        for (Edge edge : outgoing) {
            Node source = subMap.get(edge.source);
            if (source == null) throw new IllegalArgumentException("edge " + edge + " does not leave the copied region");
            Node brk = addBreak();
            if (source.isCheck()) {
                if (edge.isFalseEdge()) setFalse(source, brk);
                else setTrue(source, brk);
            } else {
                addEdge(source, brk);
            }
        }
    }

    /**
     * Route each edge retreating to the entry to a fresh {@link NodeKind#CONTINUE} node.
     */
    public void connectContinueNode() {
        Node head = getEntry();
        for (Node pred : new ArrayList<>(head.getPredecessors())) {
            Node cont = addContinue();
            moveEdgeTarget(Edge.of(pred, head), cont);
        }
    }

    // endregion

    @Override
    public String toString() {
        return functionName.isEmpty() ? regionName : functionName + "/" + regionName;
    }
}
