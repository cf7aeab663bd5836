package io.github.eutro.restruct.test;

import io.github.eutro.restruct.display.GraphDisplay;
import io.github.eutro.restruct.ext.CommonExts;
import io.github.eutro.restruct.graph.Edge;
import io.github.eutro.restruct.graph.Node;
import io.github.eutro.restruct.graph.NodeKind;
import io.github.eutro.restruct.graph.RegionGraph;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.stream.Collectors;

import static io.github.eutro.restruct.test.Utils.find;
import static org.junit.jupiter.api.Assertions.*;

public class GraphTest {
    @Test
    void testIdsAndEntry() {
        RegionGraph g = Utils.graph();
        Node a = g.addCode("A", 3);
        Node b = g.addCode("B", 4);
        assertSame(a, g.getEntry());
        assertNotEquals(a.getId(), b.getId());
        assertEquals(Arrays.asList(a, b), g.nodes());
        assertEquals(7, g.totalWeight());
        assertSame(g, a.getOwner());
    }

    @Test
    void testEmptyGraphHasNoEntry() {
        assertThrows(IllegalStateException.class, () -> Utils.graph().getEntry());
    }

    @Test
    void testDuplicateEdgeIsIgnored() {
        RegionGraph g = Utils.graph();
        Node a = g.addCode("A", 1);
        Node b = g.addCode("B", 1);
        g.addEdge(a, b);
        g.addEdge(a, b);
        assertEquals(1, a.getSuccessorCount());
        assertEquals(1, b.getPredecessorCount());
    }

    @Test
    void testCheckSlots() {
        RegionGraph g = Utils.diamond();
        Node a = find(g, "A");
        Node b = find(g, "B");
        Node c = find(g, "C");
        Node d = find(g, "D");
        assertSame(b, a.getTrue());
        assertSame(c, a.getFalse());
        assertEquals(Arrays.asList(b, c), a.getSuccessors());
        assertThrows(IllegalArgumentException.class, () -> g.addEdge(a, d));

        g.moveEdgeTarget(Edge.of(a, c), d);
        assertSame(b, a.getTrue());
        assertSame(d, a.getFalse());
        assertFalse(c.hasPredecessor(a));
        assertTrue(d.hasPredecessor(a));
        assertTrue(Edge.of(a, d).isFalseEdge());
        assertFalse(Edge.of(a, b).isFalseEdge());
    }

    @Test
    void testSetTrueOnCodeNodeFails() {
        RegionGraph g = Utils.structured();
        assertThrows(IllegalArgumentException.class, () -> g.setTrue(find(g, "A"), find(g, "D")));
    }

    @Test
    void testRemoveNode() {
        RegionGraph g = Utils.structured();
        Node a = find(g, "A");
        Node b = find(g, "B");
        Node d = find(g, "D");
        int version = g.getVersion();
        g.removeNode(b);
        assertTrue(g.getVersion() > version);
        assertTrue(b.isRemoved());
        assertFalse(g.contains(b));
        assertFalse(a.hasSuccessor(b));
        assertEquals(0, d.getPredecessorCount());
        assertEquals(3, g.size());
        assertThrows(IllegalArgumentException.class, () -> g.addEdge(a, b));
        assertThrows(IllegalArgumentException.class, () -> g.cloneNode(b));
    }

    @Test
    void testForeignNodeRejected() {
        RegionGraph g = Utils.structured();
        RegionGraph other = Utils.structured();
        assertThrows(IllegalArgumentException.class, () -> g.addEdge(find(g, "A"), find(other, "B")));
        assertThrows(IllegalArgumentException.class, () -> g.removeEdge(Edge.of(find(g, "C"), find(g, "D"))));
    }

    @Test
    void testClones() {
        RegionGraph g = Utils.structured();
        Node b = find(g, "B");
        Node clone = g.cloneNode(b);
        Node cloneOfClone = g.cloneNode(clone);
        assertEquals("B cloned", clone.getName());
        assertEquals(b.getWeight(), clone.getWeight());
        assertEquals(0, clone.getSuccessorCount());
        assertEquals(0, clone.getPredecessorCount());
        assertTrue(clone.isClone());
        assertFalse(b.isClone());
        assertSame(b, clone.getOriginal());
        assertSame(b, cloneOfClone.getOriginal());
        assertEquals(Arrays.asList(b, clone, cloneOfClone), g.equivalenceClass(cloneOfClone));
    }

    @Test
    void testIsDAG() {
        assertTrue(Utils.entangled().isDAG());

        RegionGraph cycle = Utils.graph();
        Node a = cycle.addCode("A", 1);
        Node b = cycle.addCode("B", 1);
        cycle.addEdge(a, b);
        cycle.addEdge(b, a);
        assertFalse(cycle.isDAG());

        RegionGraph selfLoop = Utils.graph();
        Node s = selfLoop.addCode("S", 1);
        selfLoop.addEdge(s, s);
        assertFalse(selfLoop.isDAG());
    }

    @Test
    void testReversePostOrder() {
        RegionGraph g = Utils.entangled();
        assertEquals(Arrays.asList("A", "C", "B", "E", "D", "F"),
                g.reversePostOrder().stream().map(Node::getName).collect(Collectors.toList()));
        assertEquals(Arrays.asList(find(g, "A"), find(g, "B")),
                g.orderNodes(Arrays.asList(find(g, "B"), find(g, "A")), false));
        assertEquals(Arrays.asList(find(g, "B"), find(g, "A")),
                g.orderNodes(Arrays.asList(find(g, "A"), find(g, "B")), true));
    }

    @Test
    void testExitNodes() {
        RegionGraph g = Utils.structured();
        assertEquals(Arrays.asList(find(g, "C"), find(g, "D")), g.exitNodes());
    }

    @Test
    void testPurgeVirtualSink() {
        RegionGraph g = Utils.structured();
        Node c = find(g, "C");
        Node d = find(g, "D");
        Node empty = g.addArtificialNode();
        g.addEdge(d, empty);
        Node sink = g.addArtificialNode("sink");
        g.addEdge(c, sink);
        g.addEdge(empty, sink);
        g.purgeVirtualSink(sink);
        assertTrue(sink.isRemoved());
        assertTrue(empty.isRemoved());
        assertFalse(c.isRemoved());
        assertEquals(4, g.size());
        assertTrue(g.isTopologicallyEquivalent(Utils.structured()));
    }

    @Test
    void testTopologicalEquivalence() {
        assertTrue(Utils.entangled().isTopologicallyEquivalent(Utils.entangled()));
        assertFalse(Utils.entangled().isTopologicallyEquivalent(Utils.structured()));

        RegionGraph swapped = Utils.diamond();
        Node a = find(swapped, "A");
        Node b = find(swapped, "B");
        Node c = find(swapped, "C");
        swapped.setTrue(a, c);
        swapped.setFalse(a, b);
        assertFalse(swapped.isTopologicallyEquivalent(Utils.diamond()));
    }

    @Test
    void testCollapseLoop() {
        // P -> H; H -> Bd, X; Bd -> H
        RegionGraph function = Utils.graph();
        Node p = function.addCode("P", 1);
        Node h = function.addCode("H", 1);
        Node bd = function.addCode("Bd", 1);
        Node x = function.addCode("X", 1);
        function.addEdge(p, h);
        function.addEdge(h, bd);
        function.addEdge(h, x);
        function.addEdge(bd, h);

        RegionGraph body = new RegionGraph("test", "loop");
        Map<Node, Node> subMap = body.insertBulkNodes(Arrays.asList(h, bd), h);
        Node newHead = subMap.get(h);
        Node newBody = subMap.get(bd);
        assertSame(newHead, body.getEntry());
        assertSame(h, newHead.getExtOrThrow(CommonExts.COPY_OF));
        assertEquals(Collections.singletonList(newBody), newHead.getSuccessors());
        assertTrue(newBody.hasSuccessor(newHead));

        body.connectBreakNode(Collections.singleton(Edge.of(h, x)), subMap);
        body.connectContinueNode();
        assertTrue(body.isDAG());
        assertEquals(4, body.size());
        assertEquals(NodeKind.BREAK, newHead.getSuccessor(1).getKind());
        assertEquals(NodeKind.CONTINUE, newBody.getSuccessor(0).getKind());
        assertEquals(0, newHead.getPredecessorCount());

        assertThrows(IllegalStateException.class, () -> body.insertBulkNodes(Collections.singleton(p), p));
    }

    @Test
    void testDot() {
        String dot = GraphDisplay.toDot(Utils.diamond());
        assertTrue(dot.startsWith("digraph CFGFunction {"));
        assertTrue(dot.contains("Name: A\", fillcolor=green"));
        assertTrue(dot.contains("[color=red]"));
        assertTrue(dot.contains("[color=green]"));
    }
}
