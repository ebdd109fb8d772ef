package com.flywheel.replay.redis;

import com.flywheel.core.model.ChannelConfig;
import com.flywheel.core.redis.Keys;
import com.flywheel.core.util.JsonUtils;
import com.flywheel.replay.store.IChannelConfigStore;
import io.lettuce.core.KeyValue;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Channel policy overrides stored in the {@code ws:channel-config} hash.
 */
public class RedisChannelConfigStore implements IChannelConfigStore {
    private static final Logger log = LoggerFactory.getLogger(RedisChannelConfigStore.class);

    private final RedisReactiveCommands<String, String> commands;

    public RedisChannelConfigStore(RedisService redisService) {
        this.commands = redisService.commands();
    }

    @Override
    public Mono<Map<String, ChannelConfig>> loadAll() {
        return commands.hgetall(Keys.channelConfig())
            .collectMap(KeyValue::getKey, kv -> JsonUtils.readValue(kv.getValue(), ChannelConfig.class));
    }

    @Override
    public Mono<Void> save(String channelPattern, ChannelConfig config) {
        return commands.hset(Keys.channelConfig(), channelPattern, JsonUtils.writeValueAsString(config))
            .then()
            .doOnError(err -> log.error("Failed to save channel config for {}", channelPattern, err));
    }
}
