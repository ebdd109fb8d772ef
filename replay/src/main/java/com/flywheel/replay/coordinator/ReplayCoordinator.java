package com.flywheel.replay.coordinator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.flywheel.core.cursor.CursorCodec;
import com.flywheel.core.cursor.CursorData;
import com.flywheel.core.model.AuditEntry;
import com.flywheel.core.model.ChannelConfig;
import com.flywheel.core.model.EventLogStats;
import com.flywheel.core.model.EventMetadata;
import com.flywheel.core.model.HubMessage;
import com.flywheel.core.model.PersistedEvent;
import com.flywheel.core.model.ReplayRequest;
import com.flywheel.core.model.ReplayResult;
import com.flywheel.core.util.JsonUtils;
import com.flywheel.replay.audit.AuditLog;
import com.flywheel.replay.config.ChannelConfigProvider;
import com.flywheel.replay.eventlog.DurableEventLog;
import com.flywheel.replay.eventlog.ReplayPage;
import com.flywheel.replay.metrics.ReplayMetrics;
import com.flywheel.replay.ratelimit.ReplayRateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Serves replay requests of reconnecting clients from the durable log.
 * <p>
 * <b>Start bound:</b>
 * <ul>
 *   <li>No cursor: earliest retained event.</li>
 *   <li>Cursor older than the channel's retention, or not decodable: earliest retained
 *       event with {@code cursorExpired = true}. A stale cursor is a permanent miss,
 *       not a client error.</li>
 *   <li>Otherwise: events with a sequence greater than the cursor's.</li>
 * </ul>
 * </p>
 * <p>
 * <b>Side effects:</b> one rate-limiter update and one audit entry per served call.
 * The durable log is only read.
 * </p>
 */
public class ReplayCoordinator {
    private static final Logger log = LoggerFactory.getLogger(ReplayCoordinator.class);

    /**
     * Page size used by callers that do not choose one.
     */
    public static final int DEFAULT_LIMIT = 100;

    private final DurableEventLog eventLog;
    private final ChannelConfigProvider configProvider;
    private final ReplayRateLimiter rateLimiter;
    private final AuditLog auditLog;
    private final ReplayMetrics metrics;
    private final Clock clock;

    public ReplayCoordinator(DurableEventLog eventLog,
                             ChannelConfigProvider configProvider,
                             ReplayRateLimiter rateLimiter,
                             AuditLog auditLog,
                             ReplayMetrics metrics,
                             Clock clock) {
        this.eventLog = eventLog;
        this.configProvider = configProvider;
        this.rateLimiter = rateLimiter;
        this.auditLog = auditLog;
        this.metrics = metrics;
        this.clock = clock;
    }

    public Mono<ReplayResult> replay(ReplayRequest request) {
        return replay(request, DEFAULT_LIMIT);
    }

    /**
     * Replays one page of a channel.
     * <p>
     * The limit is used as given; callers clamp it to a sane maximum.
     * </p>
     *
     * @param request Replay request
     * @param limit   Page size
     * @return Mono of the page; never errors
     */
    public Mono<ReplayResult> replay(ReplayRequest request, int limit) {
        return Mono.defer(() -> {
            long startedAt = clock.millis();

            return configProvider.resolve(request.getChannel()).flatMap(config -> {
                if (!rateLimiter.tryAcquire(request.getConnectionId(), config.getMaxReplayRequestsPerMinute())) {
                    log.warn("Replay request rate limited: connectionId={}, channel={}",
                        request.getConnectionId(), request.getChannel());
                    metrics.recordReplayRateLimited();
                    return Mono.just(ReplayResult.empty());
                }

                StartBound bound = resolveStart(request.getFromCursor(), config, startedAt);

                return eventLog.queryForReplay(request.getChannel(), bound.afterSequence(), limit)
                    .onErrorResume(err -> {
                        log.error("Replay query failed: connectionId={}, channel={}",
                            request.getConnectionId(), request.getChannel(), err);
                        metrics.recordReplayFailed();
                        return Mono.just(ReplayPage.empty());
                    })
                    .map(page -> toResult(page, bound.cursorExpired()))
                    .doOnNext(result -> {
                        long durationMs = clock.millis() - startedAt;
                        metrics.recordReplayServed(result.getMessages().size(), result.isCursorExpired(),
                            Duration.ofMillis(durationMs));
                        auditLog.record(auditEntry(request, result, startedAt, durationMs));
                        log.debug("Replayed {} messages: connectionId={}, channel={}, hasMore={}, cursorExpired={}",
                            result.getMessages().size(), request.getConnectionId(), request.getChannel(),
                            result.isHasMore(), result.isCursorExpired());
                    });
            });
        });
    }

    /**
     * @return Durable log occupancy
     */
    public Mono<EventLogStats> getStats() {
        return eventLog.getStats();
    }

    /**
     * Connection-teardown hook; must be called by the socket layer on disconnect.
     */
    public void clearConnectionRateLimits(String connectionId) {
        rateLimiter.clearConnection(connectionId);
    }

    StartBound resolveStart(String fromCursor, ChannelConfig config, long nowMs) {
        if (fromCursor == null) {
            return StartBound.EARLIEST;
        }
        Optional<CursorData> decoded = CursorCodec.decode(fromCursor);
        if (decoded.isEmpty()) {
            return StartBound.EXPIRED;
        }
        CursorData cursor = decoded.get();
        if (config.getRetentionMs() > 0 && nowMs - cursor.getTimestamp() > config.getRetentionMs()) {
            return StartBound.EXPIRED;
        }
        return new StartBound(cursor.getSequence(), false);
    }

    private ReplayResult toResult(ReplayPage page, boolean cursorExpired) {
        List<HubMessage> messages = new ArrayList<>(page.rows().size());
        for (PersistedEvent row : page.rows()) {
            messages.add(toMessage(row));
        }
        String lastCursor = messages.isEmpty() ? null : messages.get(messages.size() - 1).getCursor();

        return ReplayResult.builder()
            .messages(messages)
            .lastCursor(lastCursor)
            .hasMore(page.hasMore())
            .cursorExpired(cursorExpired)
            .usedSnapshot(false)
            .build();
    }

    static HubMessage toMessage(PersistedEvent row) {
        EventMetadata metadata = EventMetadata.builder()
            .correlationId(row.getCorrelationId())
            .agentId(row.getAgentId())
            .workspaceId(row.getWorkspaceId())
            .build();

        return HubMessage.builder()
            .id(row.getId())
            .cursor(row.getCursor())
            .timestamp(Instant.ofEpochMilli(row.getCreatedAt()).toString())
            .channel(row.getChannel())
            .type(row.getMessageType())
            .payload(parsePayload(row))
            .metadata(metadata.isEmpty() ? null : metadata)
            .build();
    }

    private static JsonNode parsePayload(PersistedEvent row) {
        try {
            return JsonUtils.readTree(row.getPayload());
        } catch (IllegalStateException e) {
            log.warn("Stored payload of event {} is not valid JSON, returning it as text", row.getId());
            return TextNode.valueOf(row.getPayload());
        }
    }

    private static AuditEntry auditEntry(ReplayRequest request, ReplayResult result, long requestedAt, long durationMs) {
        return AuditEntry.builder()
            .id(UUID.randomUUID().toString())
            .connectionId(request.getConnectionId())
            .userId(request.getUserId())
            .channel(request.getChannel())
            .fromCursor(request.getFromCursor())
            .toCursor(result.getLastCursor())
            .messagesReplayed(result.getMessages().size())
            .cursorExpired(result.isCursorExpired())
            .usedSnapshot(result.isUsedSnapshot())
            .requestedAt(requestedAt)
            .durationMs(durationMs)
            .correlationId(request.getCorrelationId())
            .build();
    }

    /**
     * Exclusive sequence bound of a replay query; null means the earliest retained event.
     */
    record StartBound(Long afterSequence, boolean cursorExpired) {
        static final StartBound EARLIEST = new StartBound(null, false);
        static final StartBound EXPIRED = new StartBound(null, true);
    }
}
