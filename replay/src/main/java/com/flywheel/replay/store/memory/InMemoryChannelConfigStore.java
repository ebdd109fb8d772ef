package com.flywheel.replay.store.memory;

import com.flywheel.core.model.ChannelConfig;
import com.flywheel.replay.store.IChannelConfigStore;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local channel policy overrides.
 */
public class InMemoryChannelConfigStore implements IChannelConfigStore {

    private final Map<String, ChannelConfig> overrides = new ConcurrentHashMap<>();

    @Override
    public Mono<Map<String, ChannelConfig>> loadAll() {
        return Mono.fromSupplier(() -> Map.copyOf(overrides));
    }

    @Override
    public Mono<Void> save(String channelPattern, ChannelConfig config) {
        return Mono.fromRunnable(() -> overrides.put(channelPattern, config));
    }
}
