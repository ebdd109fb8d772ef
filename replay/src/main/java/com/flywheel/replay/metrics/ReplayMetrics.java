package com.flywheel.replay.metrics;

import com.flywheel.core.metrics.MetricsNames;
import com.flywheel.core.metrics.MetricsTags;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics for the replay node.
 */
public class ReplayMetrics {

    private final MeterRegistry registry;
    private final String nodeId;

    // Replay
    private final Counter replayServed;
    private final Counter replayRateLimited;
    private final Counter replayFailed;
    private final Counter replayMessages;
    private final Counter cursorExpired;
    private final Timer replayLatency;

    // Durable log
    private final Counter persisted;
    private final Counter persistSkipped;
    private final Counter persistFailed;

    // Audit
    private final Counter auditOverflow;
    private final Counter auditStoreError;

    public ReplayMetrics(MeterRegistry registry, String nodeId) {
        this.registry = registry;
        this.nodeId = nodeId;

        replayServed = outcomeCounter(MetricsNames.REPLAY_REQUESTS_TOTAL, "served", "Replay calls answered from the durable log");
        replayRateLimited = outcomeCounter(MetricsNames.REPLAY_REQUESTS_TOTAL, "rate_limited", "Replay calls denied by the per-connection limiter");
        replayFailed = outcomeCounter(MetricsNames.REPLAY_REQUESTS_TOTAL, "failed", "Replay calls whose durable query failed");

        replayMessages = Counter.builder(MetricsNames.REPLAY_MESSAGES_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Messages returned by replay")
            .register(registry);

        cursorExpired = Counter.builder(MetricsNames.REPLAY_CURSOR_EXPIRED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Replays that fell back to the earliest retained event")
            .register(registry);

        replayLatency = Timer.builder(MetricsNames.REPLAY_LATENCY)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Replay call duration")
            .publishPercentileHistogram()
            .serviceLevelObjectives(
                Duration.ofMillis(5),
                Duration.ofMillis(20),
                Duration.ofMillis(50),
                Duration.ofMillis(100),
                Duration.ofMillis(250)
            )
            .register(registry);

        persisted = outcomeCounter(MetricsNames.EVENTS_PERSIST_TOTAL, "persisted", "Events written to the durable log");
        persistSkipped = outcomeCounter(MetricsNames.EVENTS_PERSIST_TOTAL, "skipped", "Events on channels with persistence disabled");
        persistFailed = outcomeCounter(MetricsNames.EVENTS_PERSIST_TOTAL, "failed", "Events lost to storage errors");

        auditOverflow = Counter.builder(MetricsNames.AUDIT_DROPS_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.REASON, "overflow")
            .description("Audit entries dropped because the queue was full")
            .register(registry);

        auditStoreError = Counter.builder(MetricsNames.AUDIT_DROPS_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.REASON, "store_error")
            .description("Audit entries lost to storage errors")
            .register(registry);
    }

    public void recordReplayServed(int messages, boolean expired, Duration duration) {
        replayServed.increment();
        replayMessages.increment(messages);
        if (expired) {
            cursorExpired.increment();
        }
        replayLatency.record(duration);
    }

    public void recordReplayRateLimited() {
        replayRateLimited.increment();
    }

    public void recordReplayFailed() {
        replayFailed.increment();
    }

    public void recordPersisted(int count) {
        persisted.increment(count);
    }

    public void recordPersistSkipped(int count) {
        persistSkipped.increment(count);
    }

    public void recordPersistFailed(int count) {
        persistFailed.increment(count);
    }

    public void recordAuditOverflow() {
        auditOverflow.increment();
    }

    public void recordAuditStoreError() {
        auditStoreError.increment();
    }

    public void recordJanitorDeleted(String phase, long count) {
        if (count <= 0) {
            return;
        }
        Counter.builder(MetricsNames.JANITOR_DELETED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.PHASE, phase)
            .register(registry)
            .increment(count);
    }

    public void recordJanitorFailure(String phase) {
        Counter.builder(MetricsNames.JANITOR_FAILURES_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.PHASE, phase)
            .register(registry)
            .increment();
    }

    public void registerTrackedConnectionsGauge(Supplier<Number> trackedConnections) {
        Gauge.builder(MetricsNames.RATE_LIMIT_TRACKED_CONNECTIONS, trackedConnections)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Connections holding a replay rate-limit bucket")
            .register(registry);
    }

    private Counter outcomeCounter(String name, String outcome, String description) {
        return Counter.builder(name)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.OUTCOME, outcome)
            .description(description)
            .register(registry);
    }
}
