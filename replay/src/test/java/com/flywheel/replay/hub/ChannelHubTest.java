package com.flywheel.replay.hub;

import com.flywheel.core.cursor.CursorCodec;
import com.flywheel.core.model.ChannelConfig;
import com.flywheel.core.model.EventMetadata;
import com.flywheel.core.model.HubMessage;
import com.flywheel.core.model.PersistedEvent;
import com.flywheel.replay.MutableClock;
import com.flywheel.replay.config.ChannelConfigProvider;
import com.flywheel.replay.eventlog.DurableEventLog;
import com.flywheel.replay.metrics.ReplayMetrics;
import com.flywheel.replay.store.memory.InMemoryChannelConfigStore;
import com.flywheel.replay.store.memory.InMemoryEventStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ChannelHubTest {

    private static final long NOW = 1_700_000_000_000L;

    private MutableClock clock;
    private SwitchableEventStore eventStore;
    private DurableEventLog eventLog;
    private ChannelHub hub;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        InMemoryChannelConfigStore configStore = new InMemoryChannelConfigStore();
        configStore.save("user:notifications:*", ChannelConfig.GLOBAL_DEFAULT.withPersistEvents(false)).block();

        eventStore = new SwitchableEventStore();
        ChannelConfigProvider provider = new ChannelConfigProvider(configStore, clock, Duration.ofMinutes(1));
        eventLog = new DurableEventLog(eventStore, provider, new ReplayMetrics(new SimpleMeterRegistry(), "replay-test"), clock);
        hub = new ChannelHub(eventLog, clock);
    }

    private List<HubMessage> publishAll(String channel, int count) {
        List<HubMessage> published = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            published.add(hub.publish(channel, "output", Map.of("n", i), null).block());
        }
        return published;
    }

    @Test
    @DisplayName("Publish assigns increasing cursors and writes through to the durable log")
    void testPublishWritesThrough() {
        List<HubMessage> published = publishAll("agent:output:run-1", 3);

        for (int i = 0; i < 3; i++) {
            assertEquals(i, CursorCodec.decode(published.get(i).getCursor()).orElseThrow().getSequence());
        }

        List<PersistedEvent> rows = eventLog.queryForReplay("agent:output:run-1", null, 10).block().rows();
        assertEquals(3, rows.size());
        assertEquals(published.get(2).getCursor(), rows.get(2).getCursor());
        assertEquals(published.get(2).getId(), rows.get(2).getId());
        assertEquals("{\"n\":2}", rows.get(2).getPayload());
    }

    @Test
    @DisplayName("Published message carries timestamp, type and only non-empty metadata")
    void testPublishedMessageShape() {
        HubMessage plain = hub.publish("agent:output:run-1", "output", "hello", EventMetadata.builder().build()).block();
        HubMessage tagged = hub.publish("agent:output:run-1", "output", "hello",
            EventMetadata.builder().workspaceId("ws-1").build()).block();

        assertNotNull(plain.getId());
        assertEquals("2023-11-14T22:13:20Z", plain.getTimestamp());
        assertEquals("hello", plain.getPayload().asText());
        assertNull(plain.getMetadata());
        assertEquals("ws-1", tagged.getMetadata().getWorkspaceId());
    }

    @Test
    @DisplayName("A durable write failure never fails the publish")
    void testPersistFailureDoesNotFailPublish() {
        eventStore.failInserts = true;

        StepVerifier.create(hub.publish("agent:output:run-1", "output", Map.of(), null))
            .assertNext(message -> assertNotNull(message.getCursor()))
            .verifyComplete();

        assertEquals(1, hub.replay("agent:output:run-1", null, 10).getMessages().size());
    }

    @Test
    @DisplayName("Channels with persistence disabled stay hot-only")
    void testHotOnlyChannel() {
        publishAll("user:notifications:u1", 2);

        assertEquals(2, hub.replay("user:notifications:u1", null, 10).getMessages().size());
        assertTrue(eventLog.queryForReplay("user:notifications:u1", null, 10).block().rows().isEmpty());
    }

    @Test
    @DisplayName("Hot replay resumes after a live cursor")
    void testHotReplayAfterCursor() {
        List<HubMessage> published = publishAll("agent:output:run-1", 5);

        HotReplay replay = hub.replay("agent:output:run-1", published.get(1).getCursor(), 2);

        assertFalse(replay.isExpired());
        assertEquals(List.of(published.get(2).getId(), published.get(3).getId()),
            List.of(replay.getMessages().get(0).getId(), replay.getMessages().get(1).getId()));
        assertTrue(replay.isHasMore());
        assertEquals(published.get(3).getCursor(), replay.getLastCursor());
    }

    @Test
    @DisplayName("An evicted cursor returns everything buffered, flagged as expired")
    void testHotReplayEvictedCursor() {
        // Given: system:health buffers keep 60 entries
        List<HubMessage> published = publishAll("system:health:node-1", 61);

        HotReplay replay = hub.replay("system:health:node-1", published.get(0).getCursor(), 100);

        assertTrue(replay.isExpired());
        assertEquals(60, replay.getMessages().size());
        assertEquals(published.get(1).getId(), replay.getMessages().get(0).getId());
        assertFalse(replay.isHasMore());
    }

    @Test
    @DisplayName("Hot replay with an unbounded or empty page size")
    void testHotReplayLimitBounds() {
        List<HubMessage> published = publishAll("agent:output:run-1", 4);

        HotReplay all = hub.replay("agent:output:run-1", null, Integer.MAX_VALUE);
        assertEquals(4, all.getMessages().size());
        assertFalse(all.isHasMore());

        HotReplay after = hub.replay("agent:output:run-1", published.get(0).getCursor(), Integer.MAX_VALUE);
        assertEquals(3, after.getMessages().size());

        HotReplay none = hub.replay("agent:output:run-1", null, 0);
        assertTrue(none.getMessages().isEmpty());
        assertTrue(none.isHasMore());
    }

    @Test
    void testHotReplayUnknownChannel() {
        HotReplay replay = hub.replay("agent:output:nobody", CursorCodec.create(1, NOW), 10);

        assertTrue(replay.getMessages().isEmpty());
        assertFalse(replay.isExpired());
        assertNull(replay.getLastCursor());
    }

    @Test
    @DisplayName("Pruning removes TTL-expired entries and stats reflect each buffer")
    void testPruneAndStats() {
        publishAll("system:health:node-1", 3);
        publishAll("agent:output:run-1", 2);

        // system:health entries live for one minute
        clock.advance(60_001);

        Map<String, BufferStats> before = hub.bufferStats();
        assertEquals(3, before.get("system:health:node-1").getSize());
        assertEquals(0, before.get("system:health:node-1").getValidSize());
        assertEquals(60, before.get("system:health:node-1").getCapacity());

        assertEquals(3, hub.pruneBuffers());

        Map<String, BufferStats> after = hub.bufferStats();
        assertEquals(0, after.get("system:health:node-1").getSize());
        assertEquals(2, after.get("agent:output:run-1").getSize());
        assertEquals(0.02, after.get("agent:output:run-1").getUtilization(), 0.0001);
    }

    private static class SwitchableEventStore extends InMemoryEventStore {
        boolean failInserts;

        @Override
        public Mono<Void> insert(List<PersistedEvent> rows) {
            if (failInserts) {
                return Mono.error(new IllegalStateException("event store unavailable"));
            }
            return super.insert(rows);
        }
    }
}
