package io.github.eutro.restruct.test;

import io.github.eutro.restruct.ast.AstTree;
import io.github.eutro.restruct.conf.RestructureOptions;
import io.github.eutro.restruct.conf.TraceSink;
import io.github.eutro.restruct.graph.RegionGraph;
import io.github.eutro.restruct.passes.Passes;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TraceTest {
    static class RecordingSink implements TraceSink {
        final List<String> stages = new ArrayList<>();

        @Override
        public boolean isEnabled() {
            return true;
        }

        @Override
        public void dumpGraph(RegionGraph graph, String folder, String stage) {
            stages.add(folder + "/" + stage);
        }

        @Override
        public void dumpAst(AstTree tree, RegionGraph graph, String folder, String stage) {
            stages.add(folder + "/" + stage);
        }
    }

    @Test
    void testStages() {
        RecordingSink sink = new RecordingSink();
        RestructureOptions options = RestructureOptions.builder().setTraceSink(sink).build();
        AstTree traced = Passes.restructure(options).run(Utils.entangled());

        assertTrue(sink.stages.contains("restructure/before-inflate"));
        assertTrue(sink.stages.contains("untangle/initial-state"));
        assertTrue(sink.stages.contains("untangle/after-sink-removal"));
        assertTrue(sink.stages.contains("inflate/final"));
        assertTrue(sink.stages.contains("ast/first-draft"));
        assertEquals("ast/final", sink.stages.get(sink.stages.size() - 1));
        assertTrue(sink.stages.indexOf("untangle/initial-state") < sink.stages.indexOf("inflate/final"));

        AstTree untraced = Passes.RESTRUCTURE.run(Utils.entangled());
        assertEquals(untraced.toString(), traced.toString());
    }

    @Test
    void testDirectorySink(@TempDir Path dir) throws IOException {
        RegionGraph g = Utils.diamond();
        g.setFunctionName("f");
        g.setRegionName("r");
        RestructureOptions options = RestructureOptions.builder()
                .setTraceSink(TraceSink.toDirectory(dir))
                .build();
        Passes.restructure(options).run(g);

        Path graphDump = dir.resolve("inflate").resolve("f").resolve("Region-r-final.dot");
        Path astDump = dir.resolve("ast").resolve("f").resolve("Region-r-final.dot");
        assertTrue(Files.isRegularFile(graphDump));
        assertTrue(Files.isRegularFile(astDump));
        assertTrue(new String(Files.readAllBytes(graphDump)).startsWith("digraph CFGFunction"));
        assertTrue(new String(Files.readAllBytes(astDump)).startsWith("digraph AST"));
    }
}
