package com.flywheel.replay.config;

import com.flywheel.core.buffer.BufferConfigs;
import com.flywheel.core.buffer.RingBufferConfig;
import com.flywheel.core.channel.ChannelNames;
import com.flywheel.core.model.ChannelConfig;
import com.flywheel.replay.store.IChannelConfigStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Resolves the effective {@link ChannelConfig} of a channel.
 * <p>
 * <b>Resolution order:</b>
 * <ol>
 *   <li>Exact channel-name override</li>
 *   <li>Wildcard override ({@code prefix*}); the longest matching prefix wins,
 *       equal-length prefixes are ordered by pattern text</li>
 *   <li>Channel-type default derived from the hot-tier buffer preset</li>
 *   <li>Global default</li>
 * </ol>
 * </p>
 * <p>
 * <b>Caching:</b> the override set is loaded from {@link IChannelConfigStore} and kept
 * for {@code cacheTtl}. A refresh builds a new immutable snapshot and swaps it in whole.
 * A failed refresh keeps serving the previous snapshot and still advances the refresh
 * time, so the store is not hammered while it is down.
 * </p>
 */
public class ChannelConfigProvider {
    private static final Logger log = LoggerFactory.getLogger(ChannelConfigProvider.class);

    private static final long NEVER = Long.MIN_VALUE;

    private final IChannelConfigStore store;
    private final Clock clock;
    private final long cacheTtlMs;
    private final ChannelConfig globalDefault;

    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>(Snapshot.EMPTY);
    private final AtomicBoolean refreshing = new AtomicBoolean(false);
    private volatile long lastRefreshMs = NEVER;

    public ChannelConfigProvider(IChannelConfigStore store, Clock clock, Duration cacheTtl) {
        this(store, clock, cacheTtl, ChannelConfig.GLOBAL_DEFAULT);
    }

    public ChannelConfigProvider(IChannelConfigStore store, Clock clock, Duration cacheTtl, ChannelConfig globalDefault) {
        this.store = store;
        this.clock = clock;
        this.cacheTtlMs = cacheTtl.toMillis();
        this.globalDefault = globalDefault;
    }

    /**
     * Resolves the config of a channel, refreshing the override cache first when stale.
     *
     * @param channel Channel name
     * @return Mono of the effective config; never errors
     */
    public Mono<ChannelConfig> resolve(String channel) {
        return refreshIfStale().then(Mono.fromSupplier(() -> resolveCached(channel)));
    }

    /**
     * Resolves against the current snapshot without touching the store.
     */
    public ChannelConfig resolveCached(String channel) {
        Snapshot current = snapshot.get();

        ChannelConfig exact = current.exact.get(channel);
        if (exact != null) {
            return exact;
        }

        for (WildcardRule rule : current.wildcards) {
            if (channel.startsWith(rule.prefix())) {
                return rule.config();
            }
        }

        RingBufferConfig typeDefault = BufferConfigs.forType(ChannelNames.typePrefix(channel));
        if (typeDefault != null) {
            return globalDefault.toBuilder()
                .retentionMs(typeDefault.getTtlMs())
                .maxEvents(typeDefault.getCapacity())
                .build();
        }

        return globalDefault;
    }

    /**
     * Reloads the override set unconditionally.
     *
     * @return Mono completing when the snapshot is swapped or the failure is logged; never errors
     */
    public Mono<Void> refresh() {
        return Mono.defer(store::loadAll)
            .doOnNext(overrides -> {
                snapshot.set(Snapshot.of(overrides));
                log.debug("Channel config cache refreshed with {} overrides", overrides.size());
            })
            .doOnError(err -> log.error("Failed to refresh channel config cache, serving previous snapshot", err))
            .onErrorResume(err -> Mono.empty())
            .then(Mono.fromRunnable(() -> lastRefreshMs = clock.millis()));
    }

    public boolean isStale() {
        long last = lastRefreshMs;
        return last == NEVER || clock.millis() - last > cacheTtlMs;
    }

    public long getLastRefreshMs() {
        return lastRefreshMs;
    }

    /**
     * Only one refresh runs at a time; callers arriving meanwhile read the current snapshot.
     */
    private Mono<Void> refreshIfStale() {
        return Mono.defer(() -> {
            if (!isStale() || !refreshing.compareAndSet(false, true)) {
                return Mono.empty();
            }
            return refresh().doFinally(signal -> refreshing.set(false));
        });
    }

    private record WildcardRule(String pattern, String prefix, ChannelConfig config) {
    }

    private static final class Snapshot {
        static final Snapshot EMPTY = new Snapshot(Map.of(), List.of());

        final Map<String, ChannelConfig> exact;
        final List<WildcardRule> wildcards;

        private Snapshot(Map<String, ChannelConfig> exact, List<WildcardRule> wildcards) {
            this.exact = exact;
            this.wildcards = wildcards;
        }

        static Snapshot of(Map<String, ChannelConfig> overrides) {
            Map<String, ChannelConfig> exact = new HashMap<>();
            List<WildcardRule> wildcards = new ArrayList<>();
            overrides.forEach((pattern, config) -> {
                if (ChannelNames.isWildcard(pattern)) {
                    wildcards.add(new WildcardRule(pattern, ChannelNames.wildcardPrefix(pattern), config));
                } else {
                    exact.put(pattern, config);
                }
            });
            wildcards.sort(Comparator
                .comparingInt((WildcardRule rule) -> rule.prefix().length()).reversed()
                .thenComparing(WildcardRule::pattern));
            return new Snapshot(Map.copyOf(exact), List.copyOf(wildcards));
        }
    }
}
