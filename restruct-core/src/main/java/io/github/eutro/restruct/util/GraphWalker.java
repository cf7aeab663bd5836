package io.github.eutro.restruct.util;

import io.github.eutro.restruct.graph.Node;

import java.util.*;
import java.util.function.Function;

/**
 * A class for walking a graph depth-first, in pre- or post-order.
 * <p>
 * Children are explored in the order the successor function yields them,
 * so the first child's subtree is finished before the second child is entered.
 *
 * @param <T> The type of a node in the graph.
 */
public class GraphWalker<T> {
    final List<T> roots;
    final Function<? super T, ? extends Iterable<? extends T>> getChildren;

    /**
     * Construct a graph walker from some roots and a successor function.
     *
     * @param roots       The roots to walk from, in order.
     * @param getChildren The successor function of the graph.
     */
    public GraphWalker(List<T> roots, Function<? super T, ? extends Iterable<? extends T>> getChildren) {
        this.roots = roots;
        this.getChildren = getChildren;
    }

    public GraphWalker(T root, Function<? super T, ? extends Iterable<? extends T>> getChildren) {
        this(Collections.singletonList(root), getChildren);
    }

    /**
     * Create a graph walker following successor edges.
     *
     * @param root The node to start from.
     * @return The graph walker.
     */
    public static GraphWalker<Node> successorWalker(Node root) {
        return new GraphWalker<>(root, Node::getSuccessors);
    }

    /**
     * Create a graph walker following predecessor edges.
     *
     * @param root The node to start from.
     * @return The graph walker.
     */
    public static GraphWalker<Node> predecessorWalker(Node root) {
        return new GraphWalker<>(root, Node::getPredecessors);
    }

    /**
     * An order in which nodes of a graph can be visited.
     *
     * @param <T> The type of nodes.
     */
    public interface Order<T> extends Iterable<T> {
        /**
         * Collect the nodes into a fresh, mutable list.
         *
         * @return The list.
         */
        default List<T> toList() {
            List<T> list = new ArrayList<>();
            for (T t : this) {
                list.add(t);
            }
            return list;
        }
    }

    public Order<T> preOrder() {
        return () -> walk(true).iterator();
    }

    public Order<T> postOrder() {
        return () -> walk(false).iterator();
    }

    private List<T> walk(boolean pre) {
        List<T> out = new ArrayList<>();
        Set<T> seen = new HashSet<>();
        Deque<T> stack = new ArrayDeque<>();
        Deque<Iterator<? extends T>> iters = new ArrayDeque<>();
        for (T root : roots) {
            if (!seen.add(root)) continue;
            if (pre) out.add(root);
            stack.push(root);
            iters.push(getChildren.apply(root).iterator());
            while (!stack.isEmpty()) {
                Iterator<? extends T> it = iters.peek();
                if (it.hasNext()) {
                    T next = it.next();
                    if (seen.add(next)) {
                        if (pre) out.add(next);
                        stack.push(next);
                        iters.push(getChildren.apply(next).iterator());
                    }
                } else {
                    iters.pop();
                    T done = stack.pop();
                    if (!pre) out.add(done);
                }
            }
        }
        return out;
    }
}
