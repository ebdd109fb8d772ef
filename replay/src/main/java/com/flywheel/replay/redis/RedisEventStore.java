package com.flywheel.replay.redis;

import com.flywheel.core.model.PersistedEvent;
import com.flywheel.core.redis.Keys;
import com.flywheel.core.util.JsonUtils;
import com.flywheel.replay.store.CreatedAtRange;
import com.flywheel.replay.store.IEventStore;
import io.lettuce.core.KeyValue;
import io.lettuce.core.Limit;
import io.lettuce.core.Range;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Durable event rows in Redis.
 * <p>
 * <b>Layout per channel</b> (see {@link Keys}):
 * <ul>
 *   <li>{@code evt:idx:{channel}} sequence index (ZSET)</li>
 *   <li>{@code evt:row:{channel}} row bodies (HASH)</li>
 *   <li>{@code evt:exp:{channel}} expiry index (ZSET), rows with an expiry only</li>
 * </ul>
 * plus the {@code evt:channels} registry used for enumeration.
 * </p>
 * <p>
 * Expired rows may still sit in the sequence index until the janitor deletes them,
 * so replay reads page through the index and filter by {@code expiresAt}.
 * </p>
 */
public class RedisEventStore implements IEventStore {
    private static final Logger log = LoggerFactory.getLogger(RedisEventStore.class);

    private static final int SCAN_PAGE_MIN = 64;

    private final RedisReactiveCommands<String, String> commands;

    public RedisEventStore(RedisService redisService) {
        this.commands = redisService.commands();
    }

    @Override
    public Mono<Void> insert(List<PersistedEvent> rows) {
        return Flux.fromIterable(rows)
            .concatMap(this::insertRow)
            .then();
    }

    private Mono<Void> insertRow(PersistedEvent row) {
        String channel = row.getChannel();
        String json = JsonUtils.writeValueAsString(row);

        Mono<Long> expiryIndex = row.getExpiresAt() == null
            ? Mono.just(0L)
            : commands.zadd(Keys.eventExpiry(channel), (double) row.getExpiresAt(), row.getId());

        // Body before index so a concurrent reader never finds an id without a row
        return commands.hset(Keys.eventRows(channel), row.getId(), json)
            .then(commands.zadd(Keys.eventIndex(channel), (double) row.getSequence(), row.getId()))
            .then(expiryIndex)
            .then(commands.sadd(Keys.eventChannels(), channel))
            .then();
    }

    @Override
    public Flux<PersistedEvent> findAfter(String channel, Long afterSequence, long nowMs, int limit) {
        if (limit <= 0) {
            return Flux.empty();
        }
        int pageSize = Math.max(limit, SCAN_PAGE_MIN);
        return collectLive(channel, afterSequence, nowMs, limit, pageSize, 0, new ArrayList<>())
            .flatMapMany(Flux::fromIterable);
    }

    private Mono<List<PersistedEvent>> collectLive(String channel,
                                                   Long afterSequence,
                                                   long nowMs,
                                                   int limit,
                                                   int pageSize,
                                                   long offset,
                                                   List<PersistedEvent> acc) {
        Range<Long> range = afterSequence == null
            ? Range.unbounded()
            : Range.from(Range.Boundary.excluding(afterSequence), Range.Boundary.unbounded());

        return commands.zrangebyscore(Keys.eventIndex(channel), range, Limit.create(offset, pageSize))
            .collectList()
            .flatMap(ids -> {
                if (ids.isEmpty()) {
                    return Mono.just(acc);
                }
                return loadRows(channel, ids).flatMap(rows -> {
                    for (PersistedEvent row : rows) {
                        if (acc.size() >= limit) {
                            break;
                        }
                        if (!row.isExpiredAt(nowMs)) {
                            acc.add(row);
                        }
                    }
                    if (acc.size() >= limit || ids.size() < pageSize) {
                        return Mono.just(acc);
                    }
                    return collectLive(channel, afterSequence, nowMs, limit, pageSize, offset + ids.size(), acc);
                });
            });
    }

    /**
     * Loads row bodies preserving the order of {@code ids}; ids without a body are skipped.
     */
    private Mono<List<PersistedEvent>> loadRows(String channel, List<String> ids) {
        return commands.hmget(Keys.eventRows(channel), ids.toArray(new String[0]))
            .filter(KeyValue::hasValue)
            .map(kv -> JsonUtils.readValue(kv.getValue(), PersistedEvent.class))
            .collectList();
    }

    @Override
    public Mono<Long> deleteExpired(long nowMs) {
        return channels()
            .concatMap(channel -> commands.zrangebyscore(Keys.eventExpiry(channel), Range.from(Range.Boundary.<Long>unbounded(), Range.Boundary.including(nowMs)))
                .collectList()
                .flatMap(ids -> ids.isEmpty() ? Mono.just(0L) : deleteByIds(channel, ids)))
            .reduce(0L, Long::sum);
    }

    @Override
    public Mono<Long> count(String channel) {
        return commands.zcard(Keys.eventIndex(channel));
    }

    @Override
    public Flux<String> findOldestIds(String channel, int limit) {
        if (limit <= 0) {
            return Flux.empty();
        }
        return commands.zrange(Keys.eventIndex(channel), 0, limit - 1L);
    }

    @Override
    public Mono<Long> deleteByIds(String channel, List<String> ids) {
        if (ids.isEmpty()) {
            return Mono.just(0L);
        }
        String[] members = ids.toArray(new String[0]);
        return commands.zrem(Keys.eventIndex(channel), members)
            .flatMap(removed -> commands.hdel(Keys.eventRows(channel), members)
                .then(commands.zrem(Keys.eventExpiry(channel), members))
                .then(forgetChannelIfEmpty(channel))
                .thenReturn(removed))
            .doOnError(err -> log.error("Failed to delete {} rows from channel {}", ids.size(), channel, err));
    }

    private Mono<Void> forgetChannelIfEmpty(String channel) {
        return commands.zcard(Keys.eventIndex(channel))
            .flatMap(remaining -> remaining == 0
                ? commands.srem(Keys.eventChannels(), channel).then()
                : Mono.empty());
    }

    @Override
    public Flux<String> channels() {
        return commands.smembers(Keys.eventChannels());
    }

    @Override
    public Mono<Map<String, Long>> countsByChannel() {
        return channels()
            .flatMap(channel -> count(channel).map(count -> Map.entry(channel, count)))
            .filter(entry -> entry.getValue() > 0)
            .collectMap(Map.Entry::getKey, Map.Entry::getValue);
    }

    /**
     * Approximates the range from the lowest and highest sequence row of each channel;
     * exact as long as rows are written in sequence order.
     */
    @Override
    public Mono<CreatedAtRange> createdAtRange() {
        return channels()
            .flatMap(channel -> Flux.concat(
                    commands.zrange(Keys.eventIndex(channel), 0, 0),
                    commands.zrange(Keys.eventIndex(channel), -1, -1))
                .distinct()
                .collectList()
                .flatMapMany(ids -> ids.isEmpty() ? Flux.<PersistedEvent>empty() : loadRows(channel, ids).flatMapMany(Flux::fromIterable)))
            .map(PersistedEvent::getCreatedAt)
            .collectList()
            .flatMap(times -> {
                if (times.isEmpty()) {
                    return Mono.empty();
                }
                long oldest = times.stream().mapToLong(Long::longValue).min().getAsLong();
                long newest = times.stream().mapToLong(Long::longValue).max().getAsLong();
                return Mono.just(new CreatedAtRange(oldest, newest));
            });
    }
}
