package com.flywheel.replay.config;

import com.flywheel.core.model.ChannelConfig;
import com.flywheel.replay.MutableClock;
import com.flywheel.replay.store.IChannelConfigStore;
import com.flywheel.replay.store.memory.InMemoryChannelConfigStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ChannelConfigProviderTest {

    private static final Duration CACHE_TTL = Duration.ofSeconds(60);

    private MutableClock clock;
    private TestConfigStore store;
    private ChannelConfigProvider provider;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_700_000_000_000L);
        store = new TestConfigStore();
        provider = new ChannelConfigProvider(store, clock, CACHE_TTL);
    }

    private static ChannelConfig withMaxEvents(int maxEvents) {
        return ChannelConfig.GLOBAL_DEFAULT.withMaxEvents(maxEvents);
    }

    @Test
    @DisplayName("Exact match beats any wildcard")
    void testExactBeatsWildcard() {
        store.save("agent:output:run-1", withMaxEvents(1)).block();
        store.save("agent:output:*", withMaxEvents(2)).block();

        StepVerifier.create(provider.resolve("agent:output:run-1"))
            .assertNext(config -> assertEquals(1, config.getMaxEvents()))
            .verifyComplete();
    }

    @Test
    @DisplayName("Longest matching wildcard prefix wins regardless of insertion order")
    void testLongestWildcardWins() {
        store.save("agent:*", withMaxEvents(10)).block();
        store.save("agent:output:*", withMaxEvents(20)).block();
        store.save("*", withMaxEvents(30)).block();

        assertEquals(20, provider.resolve("agent:output:run-7").block().getMaxEvents());
        assertEquals(10, provider.resolve("agent:state:run-7").block().getMaxEvents());
        assertEquals(30, provider.resolve("user:mail:u1").block().getMaxEvents());
    }

    @Test
    @DisplayName("Without overrides the channel type preset supplies retention and max events")
    void testTypeDefault() {
        ChannelConfig config = provider.resolve("agent:state:run-1").block();

        assertNotNull(config);
        assertEquals(3_600_000L, config.getRetentionMs());
        assertEquals(100, config.getMaxEvents());
        assertTrue(config.isPersistEvents());
        assertEquals(ChannelConfig.GLOBAL_DEFAULT.getMaxReplayRequestsPerMinute(), config.getMaxReplayRequestsPerMinute());
    }

    @Test
    @DisplayName("Unknown channel types get the global default")
    void testGlobalDefault() {
        assertEquals(ChannelConfig.GLOBAL_DEFAULT, provider.resolve("custom").block());
    }

    @Test
    @DisplayName("Overrides are cached until the TTL passes")
    void testCacheTtl() {
        // Given: an initial resolve loads an empty override set
        provider.resolve("custom:a").block();
        assertEquals(1, store.loads.get());

        // When: an override is added but the cache is fresh
        store.save("custom:a", withMaxEvents(7)).block();
        clock.advance(CACHE_TTL.toMillis());

        // Then: the cached snapshot is still served
        assertEquals(ChannelConfig.GLOBAL_DEFAULT.getMaxEvents(), provider.resolve("custom:a").block().getMaxEvents());
        assertEquals(1, store.loads.get());

        // When: the TTL is exceeded
        clock.advance(1);

        // Then: the next resolve reloads
        assertEquals(7, provider.resolve("custom:a").block().getMaxEvents());
        assertEquals(2, store.loads.get());
    }

    @Test
    @DisplayName("A failed refresh keeps the previous snapshot and still advances the refresh time")
    void testFailedRefreshKeepsSnapshot() {
        store.save("custom:a", withMaxEvents(7)).block();
        provider.refresh().block();
        long firstRefresh = provider.getLastRefreshMs();

        store.failing.set(true);
        clock.advance(CACHE_TTL.toMillis() + 1);

        StepVerifier.create(provider.resolve("custom:a"))
            .assertNext(config -> assertEquals(7, config.getMaxEvents()))
            .verifyComplete();

        assertTrue(provider.getLastRefreshMs() > firstRefresh);
        assertFalse(provider.isStale());
    }

    @Test
    void testStaleBeforeFirstRefresh() {
        assertTrue(provider.isStale());
        provider.refresh().block();
        assertFalse(provider.isStale());
    }

    /**
     * In-memory store that counts loads and can be switched to fail.
     */
    private static class TestConfigStore implements IChannelConfigStore {
        private final InMemoryChannelConfigStore delegate = new InMemoryChannelConfigStore();
        final AtomicInteger loads = new AtomicInteger();
        final AtomicBoolean failing = new AtomicBoolean(false);

        @Override
        public Mono<Map<String, ChannelConfig>> loadAll() {
            loads.incrementAndGet();
            if (failing.get()) {
                return Mono.error(new IllegalStateException("config store unavailable"));
            }
            return delegate.loadAll();
        }

        @Override
        public Mono<Void> save(String channelPattern, ChannelConfig config) {
            return delegate.save(channelPattern, config);
        }
    }
}
