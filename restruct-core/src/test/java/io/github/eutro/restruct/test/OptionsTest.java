package io.github.eutro.restruct.test;

import io.github.eutro.restruct.conf.RestructureOptions;
import io.github.eutro.restruct.conf.TraceSink;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class OptionsTest {
    @Test
    void testDefaults() {
        RestructureOptions options = RestructureOptions.builder().setTraceSink(TraceSink.NONE).build();
        assertEquals(1, options.getUntangleFactor());
        assertTrue(options.isUntangleEnabled());
        assertSame(TraceSink.NONE, options.getTraceSink());
        assertTrue(options.isGreater(3, 2));
        assertFalse(options.isGreater(2, 2));
    }

    @Test
    void testFactor() {
        RestructureOptions options = RestructureOptions.builder().setUntangleFactor(3).build();
        assertTrue(options.isGreater(10, 3));
        assertFalse(options.isGreater(9, 3));
        assertThrows(IllegalArgumentException.class, () -> RestructureOptions.builder().setUntangleFactor(0));
    }
}
