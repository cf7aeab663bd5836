package io.github.eutro.restruct.test;

import io.github.eutro.restruct.ast.AstTree;
import io.github.eutro.restruct.graph.Node;
import io.github.eutro.restruct.graph.RegionGraph;
import io.github.eutro.restruct.passes.Passes;
import io.github.eutro.restruct.passes.opts.EliminateDanglingNodes;
import io.github.eutro.restruct.passes.opts.PurgeDummies;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class PurgeDummiesTest {
    @Test
    void testPurgePassThrough() {
        RegionGraph g = Utils.graph();
        Node a = g.addCode("A", 1);
        Node dummy = g.addArtificialNode();
        Node b = g.addCode("B", 1);
        g.addEdge(a, dummy);
        g.addEdge(dummy, b);

        assertEquals(Collections.singletonList(dummy), PurgeDummies.purge(g));
        assertTrue(dummy.isRemoved());
        assertTrue(a.hasSuccessor(b));
        assertTrue(b.hasPredecessor(a));

        int version = g.getVersion();
        assertEquals(Collections.emptyList(), PurgeDummies.purge(g));
        assertEquals(version, g.getVersion());
    }

    @Test
    void testKeepsJoins() {
        RegionGraph g = Utils.graph();
        Node a = g.addCode("A", 1);
        Node b = g.addCode("B", 1);
        Node join = g.addArtificialNode();
        Node c = g.addCode("C", 1);
        g.addEdge(a, b);
        g.addEdge(a, join);
        g.addEdge(b, join);
        g.addEdge(join, c);

        assertEquals(Collections.emptyList(), PurgeDummies.purge(g));
        assertFalse(join.isRemoved());
    }

    @Test
    void testMergesShortcutEdges() {
        RegionGraph g = Utils.graph();
        Node x = g.addCode("X", 1);
        Node dummy = g.addArtificialNode();
        Node y = g.addCode("Y", 1);
        g.addEdge(x, dummy);
        g.addEdge(x, y);
        g.addEdge(dummy, y);

        assertEquals(Collections.singletonList(dummy), PurgeDummies.purge(g));
        assertTrue(dummy.isRemoved());
        assertEquals(Collections.singletonList(y), x.getSuccessors());
        assertEquals(Collections.singleton(x), y.getPredecessors());
    }

    @Test
    void testShortcutKeepsEveryPath() {
        RegionGraph g = Utils.graph();
        Node x = g.addCode("X", 1);
        Node dummy = g.addArtificialNode();
        Node y = g.addCode("Y", 1);
        g.addEdge(x, dummy);
        g.addEdge(x, y);
        g.addEdge(dummy, y);

        AstTree tree = Passes.RESTRUCTURE.run(g);
        assertEquals(Utils.lines("X;", "Y;"), tree.toString());
        assertEquals(2, g.size());
    }

    @Test
    void testKeepsCheckShortcut() {
        RegionGraph g = Utils.graph();
        Node k = g.addCheck("K", 0);
        Node dummy = g.addArtificialNode();
        Node y = g.addCode("Y", 1);
        g.setTrue(k, dummy);
        g.setFalse(k, y);
        g.addEdge(dummy, y);

        assertEquals(Collections.emptyList(), PurgeDummies.purge(g));
        assertFalse(dummy.isRemoved());
        assertSame(dummy, k.getTrue());
        assertSame(y, k.getFalse());
    }

    @Test
    void testPurgeThroughCheck() {
        RegionGraph g = Utils.graph();
        Node k = g.addCheck("K", 0);
        Node dummy = g.addArtificialNode();
        Node t = g.addCode("T", 1);
        Node f = g.addCode("F", 1);
        g.setTrue(k, t);
        g.setFalse(k, dummy);
        g.addEdge(dummy, f);

        PurgeDummies.INSTANCE.runInPlace(g);
        assertTrue(dummy.isRemoved());
        assertSame(t, k.getTrue());
        assertSame(f, k.getFalse());
    }

    @Test
    void testEliminateDanglingNodes() {
        RegionGraph g = Utils.structured();
        Node orphan = g.addCode("orphan", 1);
        Node entry = g.getEntry();
        assertEquals(Collections.singletonList(orphan), EliminateDanglingNodes.eliminate(g));
        assertTrue(orphan.isRemoved());
        assertFalse(entry.isRemoved());
        assertEquals(4, g.size());
    }
}
