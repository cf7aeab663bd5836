package io.github.eutro.restruct.test;

import io.github.eutro.restruct.conf.RestructureOptions;
import io.github.eutro.restruct.graph.Node;
import io.github.eutro.restruct.graph.RegionGraph;
import io.github.eutro.restruct.passes.form.Untangle;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static io.github.eutro.restruct.test.Utils.find;
import static org.junit.jupiter.api.Assertions.*;

public class UntangleTest {
    @Test
    void testBalancedDiamondUnchanged() {
        RegionGraph g = Utils.diamond();
        Untangle.INSTANCE.runInPlace(g);
        assertTrue(g.isTopologicallyEquivalent(Utils.diamond()));
    }

    @Test
    void testStructuredUnchanged() {
        RegionGraph g = Utils.structured();
        Untangle.INSTANCE.runInPlace(g);
        assertTrue(g.isTopologicallyEquivalent(Utils.structured()));
    }

    @Test
    void testOverlappingArmsUnchanged() {
        RegionGraph g = Utils.entangled();
        Untangle.INSTANCE.runInPlace(g);
        assertTrue(g.isTopologicallyEquivalent(Utils.entangled()));
    }

    @Test
    void testNoConditionals() {
        RegionGraph g = Utils.graph();
        Node a = g.addCode("A", 1);
        Node b = g.addCode("B", 1);
        g.addEdge(a, b);
        int version = g.getVersion();
        Untangle.INSTANCE.runInPlace(g);
        assertEquals(version, g.getVersion());
    }

    @Test
    void testHeavyArmSplit() {
        RegionGraph g = Utils.heavyElse();
        Map<Node, Integer> weights = new HashMap<>();
        for (Node node : g) weights.put(node, node.getWeight());
        Node b = find(g, "B");
        Node c = find(g, "C");
        Node d = find(g, "D");
        Node f = find(g, "F");

        Untangle.INSTANCE.runInPlace(g);

        assertTrue(g.isDAG());
        assertEquals(8, g.size());
        Node dClone = b.getSuccessor(0);
        assertTrue(dClone.isClone());
        assertSame(d, dClone.getOriginal());
        assertEquals("D cloned", dClone.getName());
        Node fClone = dClone.getSuccessor(0);
        assertSame(f, fClone.getOriginal());
        assertEquals(0, fClone.getSuccessorCount());

        assertEquals(Collections.singleton(c), d.getPredecessors());
        assertEquals(2, g.equivalenceClass(d).size());
        assertEquals(2, g.equivalenceClass(f).size());
        assertEquals(1, g.equivalenceClass(c).size());

        for (Map.Entry<Node, Integer> e : weights.entrySet()) {
            int classWeight = 0;
            for (Node member : g.equivalenceClass(e.getKey())) classWeight += member.getWeight();
            assertTrue(classWeight >= e.getValue());
        }
        for (Node node : g) {
            assertFalse(node.isEmpty(), "no sink left behind");
        }
    }

    @Test
    void testFactorSuppressesSplit() {
        RegionGraph g = Utils.heavyElse();
        new Untangle(RestructureOptions.builder().setUntangleFactor(10).build()).runInPlace(g);
        assertTrue(g.isTopologicallyEquivalent(Utils.heavyElse()));
    }

    @Test
    void testRejectsCycles() {
        RegionGraph g = Utils.graph();
        Node a = g.addCode("A", 1);
        Node b = g.addCode("B", 1);
        g.addEdge(a, b);
        g.addEdge(b, a);
        assertThrows(IllegalStateException.class, () -> Untangle.INSTANCE.runInPlace(g));
    }
}
