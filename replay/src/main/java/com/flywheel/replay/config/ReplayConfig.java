package com.flywheel.replay.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Configuration for a replay node, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class ReplayConfig {

    String nodeId;
    int httpPort;
    String redisUrl;

    /**
     * Store backend: {@code redis} or {@code memory}.
     */
    String storeBackend;

    // Channel policy cache
    Duration configCacheTtl;

    // Retention janitor
    Duration janitorInterval;
    Duration auditRetention;

    // Audit
    int auditQueueCapacity;

    public static ReplayConfig fromEnv() {
        return ReplayConfig.builder()
            .nodeId(getEnv("NODE_ID", "replay-node-1"))
            .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "8090")))
            .redisUrl(getEnv("REDIS_URL", "redis://localhost:6379"))
            .storeBackend(getEnv("STORE_BACKEND", "redis"))
            .configCacheTtl(Duration.ofMillis(Long.parseLong(getEnv("CONFIG_CACHE_TTL_MS", "60000"))))
            .janitorInterval(Duration.ofMillis(Long.parseLong(getEnv("JANITOR_INTERVAL_MS", "60000"))))
            .auditRetention(Duration.ofMillis(Long.parseLong(getEnv("AUDIT_RETENTION_MS", String.valueOf(Duration.ofDays(7).toMillis())))))
            .auditQueueCapacity(Integer.parseInt(getEnv("AUDIT_QUEUE_CAPACITY", "1024")))
            .build();
    }

    public boolean isMemoryBackend() {
        return "memory".equalsIgnoreCase(storeBackend);
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
