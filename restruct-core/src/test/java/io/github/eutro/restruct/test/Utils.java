package io.github.eutro.restruct.test;

import io.github.eutro.restruct.ast.*;
import io.github.eutro.restruct.graph.Node;
import io.github.eutro.restruct.graph.NodeKind;
import io.github.eutro.restruct.graph.RegionGraph;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

public class Utils {
    public static RegionGraph graph() {
        return new RegionGraph("test", "root");
    }

    public static Node find(RegionGraph graph, String name) {
        for (Node node : graph) {
            if (node.getName().equals(name)) return node;
        }
        throw new AssertionError("no node named " + name + " in " + graph);
    }

    /**
     * {@code A(check) -> B, C; B -> D; C -> D; D -> E}, with B=1, C=100, D=1.
     */
    public static RegionGraph diamond() {
        RegionGraph g = graph();
        Node a = g.addCheck("A", 0);
        Node b = g.addCode("B", 1);
        Node c = g.addCode("C", 100);
        Node d = g.addCode("D", 1);
        Node e = g.addCode("E", 0);
        g.setTrue(a, b);
        g.setFalse(a, c);
        g.addEdge(b, d);
        g.addEdge(c, d);
        g.addEdge(d, e);
        return g;
    }

    /**
     * Two checks whose three paths all join at J: {@code A -> B, C; B -> D, J; C -> J; D -> J}.
     */
    public static RegionGraph fourWayJoin() {
        RegionGraph g = graph();
        Node a = g.addCheck("A", 0);
        Node b = g.addCheck("B", 1);
        Node c = g.addCode("C", 1);
        Node d = g.addCode("D", 1);
        Node j = g.addCode("J", 1);
        g.setTrue(a, b);
        g.setFalse(a, c);
        g.setTrue(b, d);
        g.setFalse(b, j);
        g.addEdge(c, j);
        g.addEdge(d, j);
        return g;
    }

    /**
     * E is reached from both arms of A: {@code A -> B, C; B -> D, E; C -> E; D -> F; E -> F}.
     */
    public static RegionGraph entangled() {
        RegionGraph g = graph();
        Node a = g.addCode("A", 1);
        Node b = g.addCode("B", 1);
        Node c = g.addCode("C", 1);
        Node d = g.addCode("D", 1);
        Node e = g.addCode("E", 1);
        Node f = g.addCode("F", 1);
        g.addEdge(a, b);
        g.addEdge(a, c);
        g.addEdge(b, d);
        g.addEdge(b, e);
        g.addEdge(c, e);
        g.addEdge(d, f);
        g.addEdge(e, f);
        return g;
    }

    /**
     * The else arm C of A is heavy and also reached from E0:
     * {@code E0 -> A, C; A -> B, C; B -> D; C -> D; D -> F}.
     */
    public static RegionGraph heavyElse() {
        RegionGraph g = graph();
        Node e0 = g.addCode("E0", 1);
        Node a = g.addCode("A", 1);
        Node b = g.addCode("B", 1);
        Node c = g.addCode("C", 10);
        Node d = g.addCode("D", 1);
        Node f = g.addCode("F", 1);
        g.addEdge(e0, a);
        g.addEdge(e0, c);
        g.addEdge(a, b);
        g.addEdge(a, c);
        g.addEdge(b, d);
        g.addEdge(c, d);
        g.addEdge(d, f);
        return g;
    }

    /**
     * A tree: {@code A -> B, C; B -> D}.
     */
    public static RegionGraph structured() {
        RegionGraph g = graph();
        Node a = g.addCode("A", 1);
        Node b = g.addCode("B", 1);
        Node c = g.addCode("C", 1);
        Node d = g.addCode("D", 1);
        g.addEdge(a, b);
        g.addEdge(a, c);
        g.addEdge(b, d);
        return g;
    }

    public static String lines(String... lines) {
        StringBuilder sb = new StringBuilder();
        for (String line : lines) {
            sb.append(line).append('\n');
        }
        return sb.toString();
    }

    /**
     * Collect the AST nodes reachable from the root of a tree, not looking into loop bodies.
     */
    public static List<AstNode> reachable(AstTree tree) {
        List<AstNode> out = new ArrayList<>();
        collect(tree.getRoot(), out);
        return out;
    }

    private static void collect(@Nullable AstNode node, List<AstNode> out) {
        if (node == null) return;
        out.add(node);
        if (node instanceof SequenceNode) {
            for (AstNode child : ((SequenceNode) node).getChildren()) {
                collect(child, out);
            }
        } else if (node instanceof IfNode) {
            collect(((IfNode) node).getThen(), out);
            collect(((IfNode) node).getElse(), out);
        }
        collect(node.getSuccessor(), out);
    }

    public static long count(AstTree tree, AstNode.Kind kind) {
        return reachable(tree).stream().filter(it -> it.getKind() == kind).count();
    }

    public static long countKind(RegionGraph graph, NodeKind kind) {
        long n = 0;
        for (Node node : graph) {
            if (node.getKind() == kind) n++;
        }
        return n;
    }
}
