package com.flywheel.core.buffer;

import java.util.Map;

/**
 * Hot-tier buffer presets keyed by channel type (e.g. {@code agent:output}).
 * <p>
 * High-volume channels get large, short-lived buffers; low-volume state channels
 * keep a small history for longer.
 * </p>
 */
public final class BufferConfigs {
    private BufferConfigs() {
    }

    private static final long MINUTE_MS = 60_000L;
    private static final long HOUR_MS = 60 * MINUTE_MS;

    public static final RingBufferConfig DEFAULT = config(1000, 5 * MINUTE_MS);

    private static final Map<String, RingBufferConfig> BY_TYPE = Map.ofEntries(
        Map.entry("agent:output", config(10_000, 5 * MINUTE_MS)),
        Map.entry("agent:state", config(100, HOUR_MS)),
        Map.entry("agent:tools", config(500, 10 * MINUTE_MS)),
        Map.entry("workspace:agents", config(200, 30 * MINUTE_MS)),
        Map.entry("workspace:reservations", config(500, 30 * MINUTE_MS)),
        Map.entry("workspace:conflicts", config(500, 30 * MINUTE_MS)),
        Map.entry("user:mail", config(1000, 24 * HOUR_MS)),
        Map.entry("user:notifications", config(500, HOUR_MS)),
        Map.entry("system:health", config(60, MINUTE_MS)),
        Map.entry("system:metrics", config(120, 2 * MINUTE_MS))
    );

    /**
     * @param channelType Channel type prefix
     * @return Preset for the type, or null if none is registered
     */
    public static RingBufferConfig forType(String channelType) {
        return BY_TYPE.get(channelType);
    }

    /**
     * @return Preset for the type, or {@link #DEFAULT}
     */
    public static RingBufferConfig forTypeOrDefault(String channelType) {
        return BY_TYPE.getOrDefault(channelType, DEFAULT);
    }

    private static RingBufferConfig config(int capacity, long ttlMs) {
        return RingBufferConfig.builder().capacity(capacity).ttlMs(ttlMs).build();
    }
}
