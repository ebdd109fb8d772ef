package com.flywheel.replay.store;

import com.flywheel.core.model.ChannelConfig;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Persisted channel policy overrides, keyed by exact channel name or {@code prefix*} pattern.
 */
public interface IChannelConfigStore {

    /**
     * Loads the full override set.
     */
    Mono<Map<String, ChannelConfig>> loadAll();

    Mono<Void> save(String channelPattern, ChannelConfig config);
}
