package com.flywheel.replay.eventlog;

import com.flywheel.core.model.ChannelConfig;
import com.flywheel.core.model.EventLogStats;
import com.flywheel.core.model.EventMetadata;
import com.flywheel.core.model.PersistableEvent;
import com.flywheel.core.model.PersistedEvent;
import com.flywheel.core.util.JsonUtils;
import com.flywheel.replay.config.ChannelConfigProvider;
import com.flywheel.replay.metrics.ReplayMetrics;
import com.flywheel.replay.store.CreatedAtRange;
import com.flywheel.replay.store.IEventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Cold-tier event log: persistence, replay queries and retention primitives.
 * <p>
 * <b>Failure policy:</b> the publish path must never block or fail because of the
 * log. Write, cleanup, trim and stats failures are logged and reported as a benign
 * negative result ({@code false}, {@code 0}, empty stats). Replay queries propagate
 * errors so the coordinator can account for them.
 * </p>
 */
public class DurableEventLog {
    private static final Logger log = LoggerFactory.getLogger(DurableEventLog.class);

    /**
     * Upper bound of ids deleted per store call when trimming a channel.
     */
    public static final int TRIM_BATCH_SIZE = 1000;

    private final IEventStore store;
    private final ChannelConfigProvider configProvider;
    private final ReplayMetrics metrics;
    private final Clock clock;

    public DurableEventLog(IEventStore store, ChannelConfigProvider configProvider, ReplayMetrics metrics, Clock clock) {
        this.store = store;
        this.configProvider = configProvider;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Persists one event if its channel's policy allows it.
     *
     * @param event Event with cursor and sequence already assigned
     * @return true if stored; false if persistence is disabled for the channel or the write failed
     */
    public Mono<Boolean> persistEvent(PersistableEvent event) {
        return configProvider.resolve(event.getChannel())
            .flatMap(config -> {
                if (!config.isPersistEvents()) {
                    metrics.recordPersistSkipped(1);
                    return Mono.just(false);
                }
                PersistedEvent row = toRow(event, config, clock.millis());
                return store.insert(List.of(row))
                    .doOnSuccess(v -> metrics.recordPersisted(1))
                    .thenReturn(true);
            })
            .onErrorResume(err -> {
                log.error("Failed to persist event {} on channel {}", event.getId(), event.getChannel(), err);
                metrics.recordPersistFailed(1);
                return Mono.just(false);
            });
    }

    /**
     * Persists events grouped by channel; each group is checked against its own
     * policy and a failing group does not abort the others.
     *
     * @return Number of events stored
     */
    public Mono<Integer> persistEventBatch(List<PersistableEvent> events) {
        if (events.isEmpty()) {
            return Mono.just(0);
        }

        Map<String, List<PersistableEvent>> byChannel = new LinkedHashMap<>();
        for (PersistableEvent event : events) {
            byChannel.computeIfAbsent(event.getChannel(), c -> new ArrayList<>()).add(event);
        }

        long now = clock.millis();
        return Flux.fromIterable(byChannel.entrySet())
            .concatMap(group -> persistGroup(group.getKey(), group.getValue(), now))
            .reduce(0, Integer::sum);
    }

    private Mono<Integer> persistGroup(String channel, List<PersistableEvent> events, long now) {
        return configProvider.resolve(channel)
            .flatMap(config -> {
                if (!config.isPersistEvents()) {
                    metrics.recordPersistSkipped(events.size());
                    return Mono.just(0);
                }
                List<PersistedEvent> rows = new ArrayList<>(events.size());
                for (PersistableEvent event : events) {
                    rows.add(toRow(event, config, now));
                }
                return store.insert(rows)
                    .doOnSuccess(v -> metrics.recordPersisted(rows.size()))
                    .thenReturn(rows.size());
            })
            .onErrorResume(err -> {
                log.error("Failed to persist batch of {} events on channel {}", events.size(), channel, err);
                metrics.recordPersistFailed(events.size());
                return Mono.just(0);
            });
    }

    /**
     * Reads the next replay page of a channel.
     * <p>
     * Fetches {@code limit + 1} non-expired rows so {@link ReplayPage#hasMore()} is known
     * without a second query.
     * </p>
     *
     * @param channel       Channel name
     * @param afterSequence Exclusive lower bound, or null for the earliest retained row
     * @param limit         Page size
     */
    public Mono<ReplayPage> queryForReplay(String channel, Long afterSequence, int limit) {
        int pageSize = Math.max(limit, 0);
        int lookahead = ReplayPage.lookahead(pageSize);
        return Mono.defer(() -> store.findAfter(channel, afterSequence, clock.millis(), lookahead)
            .collectList()
            .map(rows -> ReplayPage.fromLookahead(rows, pageSize)));
    }

    /**
     * Deletes rows whose expiry has passed, across all channels.
     *
     * @return Rows deleted; 0 on failure
     */
    public Mono<Long> cleanupExpiredEvents() {
        return Mono.defer(() -> store.deleteExpired(clock.millis()))
            .doOnNext(deleted -> {
                if (deleted > 0) {
                    log.info("Cleaned up {} expired events", deleted);
                }
            })
            .onErrorResume(err -> {
                log.error("Failed to clean up expired events", err);
                return Mono.just(0L);
            });
    }

    /**
     * Deletes the oldest rows of a channel until at most {@code maxEvents} remain.
     * Deletion runs in batches of {@link #TRIM_BATCH_SIZE} ids.
     *
     * @return Rows deleted; 0 on failure
     */
    public Mono<Long> trimChannelEvents(String channel) {
        return configProvider.resolve(channel)
            .flatMap(config -> store.count(channel)
                .flatMap(count -> {
                    long excess = count - config.getMaxEvents();
                    if (excess <= 0) {
                        return Mono.just(0L);
                    }
                    return store.findOldestIds(channel, (int) Math.min(excess, Integer.MAX_VALUE))
                        .buffer(TRIM_BATCH_SIZE)
                        .concatMap(batch -> store.deleteByIds(channel, batch))
                        .reduce(0L, Long::sum);
                }))
            .doOnNext(deleted -> {
                if (deleted > 0) {
                    log.info("Trimmed {} events from channel {}", deleted, channel);
                }
            })
            .onErrorResume(err -> {
                log.error("Failed to trim events of channel {}", channel, err);
                return Mono.just(0L);
            });
    }

    /**
     * @return Channels currently holding rows; errors propagate
     */
    public Flux<String> channels() {
        return store.channels();
    }

    /**
     * @return Occupancy snapshot; empty stats on failure
     */
    public Mono<EventLogStats> getStats() {
        return Mono.zip(
                store.countsByChannel(),
                store.createdAtRange().map(Optional::of).defaultIfEmpty(Optional.empty()))
            .map(tuple -> {
                Map<String, Long> counts = tuple.getT1();
                long total = counts.values().stream().mapToLong(Long::longValue).sum();
                long now = clock.millis();
                Optional<CreatedAtRange> range = tuple.getT2();
                return EventLogStats.builder()
                    .totalEvents(total)
                    .eventsByChannel(counts)
                    .oldestEventAge(range.map(r -> now - r.oldest()).orElse(null))
                    .newestEventAge(range.map(r -> now - r.newest()).orElse(null))
                    .build();
            })
            .onErrorResume(err -> {
                log.error("Failed to compute event log stats", err);
                return Mono.just(EventLogStats.empty());
            });
    }

    private static PersistedEvent toRow(PersistableEvent event, ChannelConfig config, long now) {
        EventMetadata metadata = event.getMetadata();
        return PersistedEvent.builder()
            .id(event.getId())
            .channel(event.getChannel())
            .cursor(event.getCursor())
            .sequence(event.getSequence())
            .messageType(event.getMessageType())
            .payload(JsonUtils.writeValueAsString(event.getPayload()))
            .correlationId(metadata != null ? metadata.getCorrelationId() : null)
            .agentId(metadata != null ? metadata.getAgentId() : null)
            .workspaceId(metadata != null ? metadata.getWorkspaceId() : null)
            .createdAt(now)
            .expiresAt(config.getRetentionMs() > 0 ? now + config.getRetentionMs() : null)
            .build();
    }
}
