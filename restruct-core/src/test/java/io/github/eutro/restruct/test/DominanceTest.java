package io.github.eutro.restruct.test;

import io.github.eutro.restruct.graph.Node;
import io.github.eutro.restruct.graph.RegionGraph;
import io.github.eutro.restruct.passes.meta.DomTree;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static io.github.eutro.restruct.test.Utils.find;
import static org.junit.jupiter.api.Assertions.*;

public class DominanceTest {
    @Test
    void testDominators() {
        RegionGraph g = Utils.diamond();
        Node a = find(g, "A");
        Node b = find(g, "B");
        Node c = find(g, "C");
        Node d = find(g, "D");
        Node e = find(g, "E");

        DomTree doms = DomTree.dominators(g);
        assertSame(a, doms.getRoot());
        assertNull(doms.getIDom(a));
        assertSame(a, doms.getIDom(b));
        assertSame(a, doms.getIDom(c));
        assertSame(a, doms.getIDom(d));
        assertSame(d, doms.getIDom(e));
        assertEquals(Arrays.asList(b, c, d), doms.getChildren(a));

        assertTrue(doms.dominates(a, e));
        assertTrue(doms.dominates(d, d));
        assertFalse(doms.dominates(b, d));
        assertFalse(doms.dominates(e, a));
        assertSame(doms, DomTree.dominators(g));
    }

    @Test
    void testFinishOrder() {
        RegionGraph g = Utils.entangled();
        DomTree doms = DomTree.dominators(g);
        List<Node> order = doms.finishOrder();
        assertEquals(g.size(), order.size());
        for (Node node : order) {
            for (Node child : doms.getChildren(node)) {
                assertTrue(order.indexOf(child) < order.indexOf(node), child + " finishes before " + node);
                assertTrue(doms.getDfsNumIn(node) < doms.getDfsNumIn(child));
                assertTrue(doms.getDfsNumOut(child) < doms.getDfsNumOut(node));
            }
        }
        assertSame(g.getEntry(), order.get(order.size() - 1));
    }

    @Test
    void testPostDominators() {
        RegionGraph g = Utils.diamond();
        DomTree postDoms = DomTree.postDominators(g);
        assertTrue(postDoms.isPostDominatorTree());
        assertSame(find(g, "E"), postDoms.getRoot());
        assertSame(find(g, "D"), postDoms.getIDom(find(g, "A")));
        assertSame(find(g, "D"), postDoms.getIDom(find(g, "B")));
        assertTrue(postDoms.dominates(find(g, "D"), find(g, "C")));
        assertFalse(postDoms.dominates(find(g, "B"), find(g, "A")));
    }

    @Test
    void testPostDominatorsWithManyExits() {
        RegionGraph g = Utils.structured();
        Node a = find(g, "A");
        Node b = find(g, "B");
        Node c = find(g, "C");
        Node d = find(g, "D");
        DomTree postDoms = DomTree.postDominators(g);
        assertNull(postDoms.getRoot());
        assertEquals(Arrays.asList(c, d), postDoms.getRoots());
        assertNull(postDoms.getIDom(a));
        assertSame(d, postDoms.getIDom(b));
        assertFalse(postDoms.dominates(c, a));
    }

    @Test
    void testUnreachableNodes() {
        RegionGraph g = Utils.structured();
        Node orphan = g.addCode("orphan", 1);
        DomTree doms = DomTree.dominators(g);
        assertFalse(doms.contains(orphan));
        assertNull(doms.getIDom(orphan));
        assertTrue(doms.dominates(find(g, "B"), orphan));
        assertFalse(doms.dominates(orphan, find(g, "B")));
    }

    @Test
    void testStaleTree() {
        RegionGraph g = Utils.diamond();
        Node a = find(g, "A");
        Node e = find(g, "E");
        DomTree doms = DomTree.dominators(g);
        assertTrue(doms.isFresh());

        Node f = g.addCode("F", 1);
        g.addEdge(e, f);
        assertFalse(doms.isFresh());
        assertThrows(IllegalStateException.class, () -> doms.dominates(a, e));
        assertThrows(IllegalStateException.class, doms::finishOrder);

        DomTree recomputed = DomTree.dominators(g);
        assertNotSame(doms, recomputed);
        assertSame(e, recomputed.getIDom(f));
    }
}
