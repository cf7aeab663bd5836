package io.github.eutro.restruct.graph;

import java.util.Objects;

/**
 * An edge between two nodes, identified by its source and target.
 */
public final class Edge {
    public final Node source;
    public final Node target;

    private Edge(Node source, Node target) {
        this.source = Objects.requireNonNull(source);
        this.target = Objects.requireNonNull(target);
    }

    public static Edge of(Node source, Node target) {
        return new Edge(source, target);
    }

    /**
     * Whether this is the false edge of a {@link NodeKind#CHECK} source.
     *
     * @return Whether this is a false edge.
     */
    public boolean isFalseEdge() {
        return source.isCheck() && source.getFalse() == target;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Edge)) return false;
        Edge edge = (Edge) o;
        return source == edge.source && target == edge.target;
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(source) + System.identityHashCode(target);
    }

    @Override
    public String toString() {
        return source + " -> " + target;
    }
}
