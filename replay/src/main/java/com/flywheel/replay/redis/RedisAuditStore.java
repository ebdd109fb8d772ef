package com.flywheel.replay.redis;

import com.flywheel.core.model.AuditEntry;
import com.flywheel.core.redis.Keys;
import com.flywheel.core.util.JsonUtils;
import com.flywheel.replay.store.IAuditStore;
import io.lettuce.core.Range;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Replay audit trail in the {@code replay:audit} sorted set, scored by request time.
 */
public class RedisAuditStore implements IAuditStore {

    private final RedisReactiveCommands<String, String> commands;

    public RedisAuditStore(RedisService redisService) {
        this.commands = redisService.commands();
    }

    @Override
    public Mono<Void> append(AuditEntry entry) {
        return commands.zadd(Keys.replayAudit(), (double) entry.getRequestedAt(), JsonUtils.writeValueAsString(entry))
            .then();
    }

    @Override
    public Mono<Long> deleteOlderThan(long cutoffMs) {
        return commands.zremrangebyscore(Keys.replayAudit(),
            Range.from(Range.Boundary.<Long>unbounded(), Range.Boundary.excluding(cutoffMs)));
    }

    @Override
    public Flux<AuditEntry> findRecent(int limit) {
        if (limit <= 0) {
            return Flux.empty();
        }
        return commands.zrevrange(Keys.replayAudit(), 0, limit - 1L)
            .map(json -> JsonUtils.readValue(json, AuditEntry.class));
    }
}
