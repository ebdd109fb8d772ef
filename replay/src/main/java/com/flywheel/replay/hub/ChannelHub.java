package com.flywheel.replay.hub;

import com.flywheel.core.buffer.BufferConfigs;
import com.flywheel.core.buffer.RingBuffer;
import com.flywheel.core.channel.ChannelNames;
import com.flywheel.core.cursor.CursorCodec;
import com.flywheel.core.cursor.CursorData;
import com.flywheel.core.model.EventMetadata;
import com.flywheel.core.model.HubMessage;
import com.flywheel.core.model.PersistableEvent;
import com.flywheel.core.util.JsonUtils;
import com.flywheel.replay.eventlog.DurableEventLog;
import com.flywheel.replay.eventlog.ReplayPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hot tier of the channel fan-out: one bounded ring buffer per channel, backed by the
 * durable log for clients that fall out of the buffer.
 * <p>
 * Buffers are created lazily on first publish, sized by the channel's type prefix.
 * </p>
 */
public class ChannelHub {
    private static final Logger log = LoggerFactory.getLogger(ChannelHub.class);

    private final DurableEventLog eventLog;
    private final Clock clock;
    private final Map<String, RingBuffer<HubMessage>> buffers = new ConcurrentHashMap<>();

    public ChannelHub(DurableEventLog eventLog, Clock clock) {
        this.eventLog = eventLog;
        this.clock = clock;
    }

    /**
     * Publishes a message to a channel.
     * <p>
     * The message is buffered and assigned its cursor first, then handed to the durable
     * log. A durable write failure is logged by the log and never fails the publish.
     * </p>
     *
     * @param channel  Channel name
     * @param type     Message type
     * @param payload  Any JSON-serializable payload
     * @param metadata Optional metadata, may be null
     * @return Mono of the buffered message carrying its cursor
     */
    public Mono<HubMessage> publish(String channel, String type, Object payload, EventMetadata metadata) {
        return Mono.defer(() -> {
            HubMessage message = HubMessage.builder()
                .id(UUID.randomUUID().toString())
                .timestamp(Instant.ofEpochMilli(clock.millis()).toString())
                .channel(channel)
                .type(type)
                .payload(JsonUtils.valueToTree(payload))
                .metadata(metadata == null || metadata.isEmpty() ? null : metadata)
                .build();

            RingBuffer<HubMessage> buffer = bufferFor(channel);
            synchronized (buffer) {
                message.setCursor(buffer.push(message));
            }

            long sequence = CursorCodec.decode(message.getCursor())
                .map(CursorData::getSequence)
                .orElseThrow();

            PersistableEvent event = PersistableEvent.builder()
                .id(message.getId())
                .channel(channel)
                .cursor(message.getCursor())
                .sequence(sequence)
                .messageType(type)
                .payload(message.getPayload())
                .metadata(metadata)
                .build();

            return eventLog.persistEvent(event)
                .onErrorResume(err -> {
                    log.error("Durable write of message {} on channel {} failed", message.getId(), channel, err);
                    return Mono.just(false);
                })
                .thenReturn(message);
        });
    }

    /**
     * Serves catch-up from the hot tier.
     *
     * @param channel Channel name
     * @param cursor  Last cursor the client saw, or null for everything buffered
     * @param limit   Page size
     */
    public HotReplay replay(String channel, String cursor, int limit) {
        RingBuffer<HubMessage> buffer = buffers.get(channel);
        if (buffer == null) {
            return HotReplay.empty();
        }

        int pageSize = Math.max(limit, 0);
        int lookahead = ReplayPage.lookahead(pageSize);
        List<HubMessage> fetched;
        boolean expired;
        synchronized (buffer) {
            if (cursor == null) {
                fetched = buffer.getAll(lookahead);
                expired = false;
            } else if (buffer.isValidCursor(cursor)) {
                fetched = buffer.slice(cursor, lookahead);
                expired = false;
            } else {
                fetched = buffer.getAll(lookahead);
                expired = true;
            }
        }

        boolean hasMore = fetched.size() > pageSize;
        List<HubMessage> page = hasMore ? List.copyOf(fetched.subList(0, pageSize)) : List.copyOf(fetched);
        return HotReplay.builder()
            .messages(page)
            .hasMore(hasMore)
            .lastCursor(page.isEmpty() ? null : page.get(page.size() - 1).getCursor())
            .expired(expired)
            .build();
    }

    /**
     * Removes TTL-expired entries from every buffer.
     *
     * @return Total entries removed
     */
    public int pruneBuffers() {
        int removed = 0;
        for (RingBuffer<HubMessage> buffer : buffers.values()) {
            removed += buffer.prune();
        }
        if (removed > 0) {
            log.debug("Pruned {} expired hot-tier entries", removed);
        }
        return removed;
    }

    /**
     * @return Occupancy per channel, sorted by channel name
     */
    public Map<String, BufferStats> bufferStats() {
        Map<String, BufferStats> stats = new TreeMap<>();
        buffers.forEach((channel, buffer) -> stats.put(channel, BufferStats.builder()
            .size(buffer.size())
            .validSize(buffer.validSize())
            .capacity(buffer.getCapacity())
            .utilization(buffer.utilization())
            .build()));
        return stats;
    }

    private RingBuffer<HubMessage> bufferFor(String channel) {
        return buffers.computeIfAbsent(channel, name ->
            new RingBuffer<>(BufferConfigs.forTypeOrDefault(ChannelNames.typePrefix(name)), clock));
    }
}
