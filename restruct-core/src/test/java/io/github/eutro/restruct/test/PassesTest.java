package io.github.eutro.restruct.test;

import io.github.eutro.restruct.graph.RegionGraph;
import io.github.eutro.restruct.passes.IRPass;
import io.github.eutro.restruct.passes.InPlaceIRPass;
import io.github.eutro.restruct.passes.opts.PurgeDummies;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PassesTest {
    @Test
    void testChainReportsFailingStage() {
        InPlaceIRPass<RegionGraph> failing = graph -> {
            throw new IllegalStateException("broken");
        };
        IRPass<RegionGraph, RegionGraph> chain = PurgeDummies.INSTANCE.then(failing);
        assertTrue(chain.isInPlace());

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> chain.run(Utils.structured()));
        assertEquals("broken", e.getMessage());
        assertEquals(1, e.getSuppressed().length);
        assertTrue(e.getSuppressed()[0].getMessage().startsWith("running pass"));
    }
}
