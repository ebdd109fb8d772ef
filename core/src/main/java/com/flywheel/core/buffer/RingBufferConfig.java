package com.flywheel.core.buffer;

import lombok.Builder;
import lombok.Value;

/**
 * Sizing of a hot-tier ring buffer.
 */
@Value
@Builder(toBuilder = true)
public class RingBufferConfig {
    /**
     * Maximum number of entries held at once; must be at least 1.
     */
    int capacity;

    /**
     * Entry time-to-live in milliseconds; 0 disables TTL expiry.
     */
    long ttlMs;
}
