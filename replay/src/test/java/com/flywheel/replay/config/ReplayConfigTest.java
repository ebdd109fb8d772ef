package com.flywheel.replay.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReplayConfigTest {

    @Test
    void testBackendSelection() {
        ReplayConfig config = ReplayConfig.builder()
            .nodeId("replay-test")
            .storeBackend("MEMORY")
            .build();

        assertTrue(config.isMemoryBackend());
        assertFalse(config.toBuilder().storeBackend("redis").build().isMemoryBackend());
    }
}
