package com.flywheel.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for node identifier.
     */
    public static final String NODE_ID = "node_id";

    /**
     * Tag key for the result of an operation (served/rate_limited/persisted/skipped/failed).
     */
    public static final String OUTCOME = "outcome";

    /**
     * Tag key for failure/drop reason.
     */
    public static final String REASON = "reason";

    /**
     * Tag key for janitor phase.
     */
    public static final String PHASE = "phase";
}
