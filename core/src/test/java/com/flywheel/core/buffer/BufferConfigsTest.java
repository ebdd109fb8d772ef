package com.flywheel.core.buffer;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BufferConfigsTest {

    @Test
    void testKnownTypePreset() {
        RingBufferConfig config = BufferConfigs.forType("agent:output");

        assertNotNull(config);
        assertEquals(10_000, config.getCapacity());
        assertEquals(300_000L, config.getTtlMs());
    }

    @Test
    void testUnknownTypeFallsBackToDefault() {
        assertNull(BufferConfigs.forType("custom:thing"));
        assertSame(BufferConfigs.DEFAULT, BufferConfigs.forTypeOrDefault("custom:thing"));
        assertEquals(1000, BufferConfigs.DEFAULT.getCapacity());
    }
}
