package com.flywheel.replay.store.memory;

import com.flywheel.core.model.PersistedEvent;
import com.flywheel.replay.store.CreatedAtRange;
import com.flywheel.replay.store.IEventStore;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;

/**
 * Process-local event store for single-node runs ({@code STORE_BACKEND=memory}) and tests.
 * <p>
 * Rows of a channel are kept in a map ordered by sequence; a row inserted with an
 * existing sequence replaces the previous one. Not durable across restarts.
 * </p>
 */
public class InMemoryEventStore implements IEventStore {

    private final Map<String, NavigableMap<Long, PersistedEvent>> rowsByChannel = new HashMap<>();

    @Override
    public Mono<Void> insert(List<PersistedEvent> rows) {
        return Mono.fromRunnable(() -> {
            synchronized (this) {
                for (PersistedEvent row : rows) {
                    rowsByChannel.computeIfAbsent(row.getChannel(), c -> new TreeMap<>())
                        .put(row.getSequence(), row);
                }
            }
        });
    }

    @Override
    public Flux<PersistedEvent> findAfter(String channel, Long afterSequence, long nowMs, int limit) {
        return Flux.defer(() -> {
            List<PersistedEvent> page = new ArrayList<>();
            synchronized (this) {
                NavigableMap<Long, PersistedEvent> rows = rowsByChannel.get(channel);
                if (rows == null) {
                    return Flux.empty();
                }
                NavigableMap<Long, PersistedEvent> tail = afterSequence == null ? rows : rows.tailMap(afterSequence, false);
                for (PersistedEvent row : tail.values()) {
                    if (page.size() >= limit) {
                        break;
                    }
                    if (!row.isExpiredAt(nowMs)) {
                        page.add(row);
                    }
                }
            }
            return Flux.fromIterable(page);
        });
    }

    @Override
    public Mono<Long> deleteExpired(long nowMs) {
        return Mono.fromCallable(() -> {
            long deleted = 0;
            synchronized (this) {
                for (NavigableMap<Long, PersistedEvent> rows : rowsByChannel.values()) {
                    Iterator<PersistedEvent> it = rows.values().iterator();
                    while (it.hasNext()) {
                        if (it.next().isExpiredAt(nowMs)) {
                            it.remove();
                            deleted++;
                        }
                    }
                }
                rowsByChannel.values().removeIf(Map::isEmpty);
            }
            return deleted;
        });
    }

    @Override
    public Mono<Long> count(String channel) {
        return Mono.fromCallable(() -> {
            synchronized (this) {
                NavigableMap<Long, PersistedEvent> rows = rowsByChannel.get(channel);
                return rows == null ? 0L : (long) rows.size();
            }
        });
    }

    @Override
    public Flux<String> findOldestIds(String channel, int limit) {
        return Flux.defer(() -> {
            List<String> ids = new ArrayList<>();
            synchronized (this) {
                NavigableMap<Long, PersistedEvent> rows = rowsByChannel.get(channel);
                if (rows != null) {
                    for (PersistedEvent row : rows.values()) {
                        if (ids.size() >= limit) {
                            break;
                        }
                        ids.add(row.getId());
                    }
                }
            }
            return Flux.fromIterable(ids);
        });
    }

    @Override
    public Mono<Long> deleteByIds(String channel, List<String> ids) {
        return Mono.fromCallable(() -> {
            Set<String> targets = new HashSet<>(ids);
            synchronized (this) {
                NavigableMap<Long, PersistedEvent> rows = rowsByChannel.get(channel);
                if (rows == null) {
                    return 0L;
                }
                int before = rows.size();
                rows.values().removeIf(row -> targets.contains(row.getId()));
                long deleted = before - rows.size();
                if (rows.isEmpty()) {
                    rowsByChannel.remove(channel);
                }
                return deleted;
            }
        });
    }

    @Override
    public Flux<String> channels() {
        return Flux.defer(() -> {
            synchronized (this) {
                return Flux.fromIterable(new ArrayList<>(rowsByChannel.keySet()));
            }
        });
    }

    @Override
    public Mono<Map<String, Long>> countsByChannel() {
        return Mono.fromCallable(() -> {
            Map<String, Long> counts = new LinkedHashMap<>();
            synchronized (this) {
                rowsByChannel.forEach((channel, rows) -> counts.put(channel, (long) rows.size()));
            }
            return counts;
        });
    }

    @Override
    public Mono<CreatedAtRange> createdAtRange() {
        return Mono.fromCallable(() -> {
            long oldest = Long.MAX_VALUE;
            long newest = Long.MIN_VALUE;
            synchronized (this) {
                for (NavigableMap<Long, PersistedEvent> rows : rowsByChannel.values()) {
                    for (PersistedEvent row : rows.values()) {
                        oldest = Math.min(oldest, row.getCreatedAt());
                        newest = Math.max(newest, row.getCreatedAt());
                    }
                }
            }
            return oldest == Long.MAX_VALUE ? null : new CreatedAtRange(oldest, newest);
        });
    }
}
