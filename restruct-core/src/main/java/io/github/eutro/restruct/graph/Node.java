package io.github.eutro.restruct.graph;

import io.github.eutro.restruct.ext.ExtHolder;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A node of a {@link RegionGraph}.
 * <p>
 * Nodes are created and mutated only through their owning graph. A node removed from its graph
 * has no owner, and any graph will refuse to operate on it.
 * <p>
 * For {@link NodeKind#CHECK} nodes, the successor list is always {@code [true, false]},
 * leaving out whichever of the two targets is not set.
 */
public final class Node extends ExtHolder {
    private final int id;
    private String name;
    private final NodeKind kind;
    private final int weight;
    private final int stateVariableValue;
    @Nullable
    private final RegionGraph collapsedGraph;
    private final Node original;

    @Nullable
    RegionGraph owner;

    private final List<Node> successors = new ArrayList<>(2);
    private final Set<Node> predecessors = new LinkedHashSet<>();
    @Nullable
    private Node trueTarget;
    @Nullable
    private Node falseTarget;

    Node(
            RegionGraph owner,
            int id,
            String name,
            NodeKind kind,
            int weight,
            int stateVariableValue,
            @Nullable RegionGraph collapsedGraph,
            @Nullable Node original
    ) {
        if (weight < 0) throw new IllegalArgumentException("negative weight " + weight + " for " + name);
        this.owner = owner;
        this.id = id;
        this.name = name;
        this.kind = kind;
        this.weight = weight;
        this.stateVariableValue = stateVariableValue;
        this.collapsedGraph = collapsedGraph;
        this.original = original == null ? this : original;
    }

    /**
     * Get the id of this node, unique and stable within its graph.
     *
     * @return The id.
     */
    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public NodeKind getKind() {
        return kind;
    }

    /**
     * Get the weight of this node, the number of instructions it stands for.
     *
     * @return The weight.
     */
    public int getWeight() {
        return weight;
    }

    /**
     * Get the state variable value assigned by a {@link NodeKind#SET} node,
     * or tested by a {@link NodeKind#CHECK} node.
     *
     * @return The value.
     */
    public int getStateVariableValue() {
        return stateVariableValue;
    }

    /**
     * Get the loop body region of a {@link NodeKind#COLLAPSED} node.
     *
     * @return The body, or null if this is not a collapsed node.
     */
    @Nullable
    public RegionGraph getCollapsedGraph() {
        return collapsedGraph;
    }

    /**
     * Get the node this was (transitively) cloned from, or this node if it is not a clone.
     *
     * @return The original node.
     */
    @NotNull
    public Node getOriginal() {
        return original;
    }

    public boolean isClone() {
        return original != this;
    }

    /**
     * Get the graph that owns this node.
     *
     * @return The owner, or null if the node was removed.
     */
    @Nullable
    public RegionGraph getOwner() {
        return owner;
    }

    public boolean isRemoved() {
        return owner == null;
    }

    public boolean isCode() {
        return kind == NodeKind.CODE;
    }

    public boolean isCheck() {
        return kind == NodeKind.CHECK;
    }

    public boolean isCollapsed() {
        return kind == NodeKind.COLLAPSED;
    }

    /**
     * Whether this is an {@link NodeKind#ARTIFICIAL_DUMMY artificial} node, without any code.
     *
     * @return Whether this node is empty.
     */
    public boolean isEmpty() {
        return kind == NodeKind.ARTIFICIAL_DUMMY;
    }

    public boolean isBreak() {
        return kind == NodeKind.BREAK;
    }

    public boolean isContinue() {
        return kind == NodeKind.CONTINUE;
    }

    public boolean isSet() {
        return kind == NodeKind.SET;
    }

    public List<Node> getSuccessors() {
        return Collections.unmodifiableList(successors);
    }

    public Node getSuccessor(int i) {
        return successors.get(i);
    }

    public int getSuccessorCount() {
        return successors.size();
    }

    public boolean hasSuccessor(Node node) {
        return successors.contains(node);
    }

    public Set<Node> getPredecessors() {
        return Collections.unmodifiableSet(predecessors);
    }

    public int getPredecessorCount() {
        return predecessors.size();
    }

    public boolean hasPredecessor(Node node) {
        return predecessors.contains(node);
    }

    @Nullable
    public Node getTrue() {
        return trueTarget;
    }

    @Nullable
    public Node getFalse() {
        return falseTarget;
    }

    void addSuccessor(Node node) {
        if (isCheck()) throw new IllegalArgumentException("successors of check node " + this + " must be set as true or false");
        if (successors.contains(node)) return;
        if (successors.size() == 2) {
            throw new IllegalStateException("node " + this + " already has two successors");
        }
        successors.add(node);
    }

    void addPredecessor(Node node) {
        predecessors.add(node);
    }

    void removePredecessor(Node node) {
        predecessors.remove(node);
    }

    void setTrueTarget(@Nullable Node node) {
        trueTarget = node;
        syncCheckSuccessors();
    }

    void setFalseTarget(@Nullable Node node) {
        falseTarget = node;
        syncCheckSuccessors();
    }

    private void syncCheckSuccessors() {
        if (trueTarget != null && trueTarget == falseTarget) {
            throw new IllegalStateException("true and false edges of " + this + " both target " + trueTarget);
        }
        successors.clear();
        if (trueTarget != null) successors.add(trueTarget);
        if (falseTarget != null) successors.add(falseTarget);
    }

    void removeSuccessor(Node node) {
        if (isCheck()) {
            if (trueTarget == node) setTrueTarget(null);
            if (falseTarget == node) setFalseTarget(null);
        } else {
            successors.remove(node);
        }
    }

    void replaceSuccessor(Node oldTarget, Node newTarget) {
        if (isCheck()) {
            if (trueTarget == oldTarget) setTrueTarget(newTarget);
            else if (falseTarget == oldTarget) setFalseTarget(newTarget);
        } else {
            int i = successors.indexOf(oldTarget);
            if (successors.contains(newTarget)) {
                successors.remove(i);
            } else {
                successors.set(i, newTarget);
            }
        }
    }

    void detachAll() {
        successors.clear();
        predecessors.clear();
        trueTarget = falseTarget = null;
    }

    /**
     * Check whether the subgraph rooted at this node has the same shape as the one rooted at {@code other}:
     * same kinds, names, weights and state values, and equivalent successors in the same slots.
     *
     * @param other The other node.
     * @return Whether the two are equivalent.
     */
    public boolean isEquivalentTo(Node other) {
        return isEquivalentTo(other, new HashMap<>());
    }

    private boolean isEquivalentTo(Node other, Map<Node, Node> matched) {
        Node seen = matched.get(this);
        if (seen != null) return seen == other;
        if (kind != other.kind
                || weight != other.weight
                || stateVariableValue != other.stateVariableValue
                || !name.equals(other.name)
                || successors.size() != other.successors.size()) {
            return false;
        }
        matched.put(this, other);
        if (isCheck()) {
            return equivalentTargets(trueTarget, other.trueTarget, matched)
                    && equivalentTargets(falseTarget, other.falseTarget, matched);
        }
        for (int i = 0; i < successors.size(); i++) {
            if (!successors.get(i).isEquivalentTo(other.successors.get(i), matched)) return false;
        }
        return true;
    }

    private static boolean equivalentTargets(@Nullable Node a, @Nullable Node b, Map<Node, Node> matched) {
        if (a == null || b == null) return a == b;
        return a.isEquivalentTo(b, matched);
    }

    @Override
    public String toString() {
        return name;
    }
}
