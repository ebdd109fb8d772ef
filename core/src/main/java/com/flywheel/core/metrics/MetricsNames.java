package com.flywheel.core.metrics;

/**
 * Micrometer metric names used across the system.
 * <p>
 * <b>Naming convention:</b> {@code replay.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: Replay calls served.
     * <p>
     * Tags: node_id, outcome (served/rate_limited/failed)
     * </p>
     */
    public static final String REPLAY_REQUESTS_TOTAL = "replay.coordinator.requests.total";

    /**
     * Counter: Messages returned by replay.
     */
    public static final String REPLAY_MESSAGES_TOTAL = "replay.coordinator.messages.total";

    /**
     * Counter: Replays whose cursor was stale or malformed.
     */
    public static final String REPLAY_CURSOR_EXPIRED_TOTAL = "replay.coordinator.cursor.expired.total";

    /**
     * Timer: Replay call duration.
     */
    public static final String REPLAY_LATENCY = "replay.coordinator.latency";

    /**
     * Counter: Durable log writes.
     * <p>
     * Tags: node_id, outcome (persisted/skipped/failed)
     * </p>
     */
    public static final String EVENTS_PERSIST_TOTAL = "replay.log.persist.total";

    /**
     * Counter: Audit entries not written.
     * <p>
     * Tags: node_id, reason (overflow/store_error)
     * </p>
     */
    public static final String AUDIT_DROPS_TOTAL = "replay.audit.drops.total";

    /**
     * Counter: Rows and entries deleted by the retention janitor.
     * <p>
     * Tags: node_id, phase (expired/trim/audit/hot)
     * </p>
     */
    public static final String JANITOR_DELETED_TOTAL = "replay.janitor.deleted.total";

    /**
     * Counter: Janitor phases that failed.
     * <p>
     * Tags: node_id, phase
     * </p>
     */
    public static final String JANITOR_FAILURES_TOTAL = "replay.janitor.failures.total";

    /**
     * Gauge: Connections holding a replay rate-limit bucket.
     */
    public static final String RATE_LIMIT_TRACKED_CONNECTIONS = "replay.ratelimit.tracked.connections";
}
