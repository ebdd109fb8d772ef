package com.flywheel.core.buffer;

import com.flywheel.core.cursor.CursorCodec;
import com.flywheel.core.cursor.CursorData;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Bounded in-memory buffer with cursor-based access (hot tier).
 * <p>
 * <b>Eviction axes:</b>
 * <ul>
 *   <li>Capacity: pushing into a full buffer drops the single oldest entry.</li>
 *   <li>TTL: entries older than {@code ttlMs} become invisible to reads immediately,
 *       but stay counted by {@link #size()} until {@link #prune()} or capacity eviction
 *       physically removes them.</li>
 * </ul>
 * </p>
 * <p>
 * <b>Thread-safety:</b> every public method holds the instance monitor, so eviction,
 * sequence assignment and insert happen as one step.
 * </p>
 *
 * @param <T> Item type
 */
public class RingBuffer<T> {

    private final int capacity;
    private final long ttlMs;
    private final Clock clock;
    private final Deque<Entry<T>> entries;
    private long nextSequence = 0;

    public RingBuffer(RingBufferConfig config) {
        this(config, Clock.systemUTC());
    }

    public RingBuffer(RingBufferConfig config, Clock clock) {
        if (config.getCapacity() < 1) {
            throw new IllegalArgumentException("Ring buffer capacity must be at least 1, got " + config.getCapacity());
        }
        this.capacity = config.getCapacity();
        this.ttlMs = Math.max(0, config.getTtlMs());
        this.clock = clock;
        this.entries = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    /**
     * Appends an item, evicting the oldest entry first when full.
     *
     * @param item Item to store
     * @return Cursor identifying the new entry
     */
    public synchronized String push(T item) {
        long now = clock.millis();
        long sequence = nextSequence++;
        String cursor = CursorCodec.create(sequence, now);

        if (entries.size() >= capacity) {
            entries.pollFirst();
        }
        entries.addLast(new Entry<>(item, cursor, now, sequence));
        return cursor;
    }

    /**
     * Looks up an item by its cursor.
     *
     * @return The item, or empty if the cursor is malformed, evicted or expired
     */
    public synchronized Optional<T> get(String cursor) {
        return findLive(cursor).map(Entry::item);
    }

    /**
     * Returns live items strictly after the cursor, oldest first.
     *
     * @param cursor Exclusive start cursor
     * @param limit  Maximum items to return, or null for no limit
     * @return Items after the cursor; empty for an invalid cursor or a limit below one
     */
    public synchronized List<T> slice(String cursor, Integer limit) {
        Optional<CursorData> from = CursorCodec.decode(cursor);
        if (from.isEmpty() || (limit != null && limit <= 0)) {
            return Collections.emptyList();
        }

        long afterSequence = from.get().getSequence();
        long now = clock.millis();
        List<T> results = new ArrayList<>();
        for (Entry<T> entry : entries) {
            if (entry.sequence() <= afterSequence || isExpired(entry, now)) {
                continue;
            }
            results.add(entry.item());
            if (limit != null && results.size() >= limit) {
                break;
            }
        }
        return results;
    }

    public List<T> slice(String cursor) {
        return slice(cursor, null);
    }

    /**
     * Returns all live items, oldest first.
     *
     * @param limit Maximum items to return, or null for no limit; below one gives an empty list
     */
    public synchronized List<T> getAll(Integer limit) {
        if (limit != null && limit <= 0) {
            return Collections.emptyList();
        }
        long now = clock.millis();
        List<T> results = new ArrayList<>();
        for (Entry<T> entry : entries) {
            if (isExpired(entry, now)) {
                continue;
            }
            results.add(entry.item());
            if (limit != null && results.size() >= limit) {
                break;
            }
        }
        return results;
    }

    public List<T> getAll() {
        return getAll(null);
    }

    /**
     * @return Cursor of the newest live entry, or empty
     */
    public synchronized Optional<String> getLatestCursor() {
        long now = clock.millis();
        Iterator<Entry<T>> it = entries.descendingIterator();
        while (it.hasNext()) {
            Entry<T> entry = it.next();
            if (!isExpired(entry, now)) {
                return Optional.of(entry.cursor());
            }
        }
        return Optional.empty();
    }

    /**
     * @return Cursor of the oldest live entry, or empty
     */
    public synchronized Optional<String> getOldestCursor() {
        long now = clock.millis();
        for (Entry<T> entry : entries) {
            if (!isExpired(entry, now)) {
                return Optional.of(entry.cursor());
            }
        }
        return Optional.empty();
    }

    /**
     * True only for a decodable cursor issued by this buffer whose entry is
     * neither evicted nor expired.
     */
    public synchronized boolean isValidCursor(String cursor) {
        return findLive(cursor).isPresent();
    }

    /**
     * Physically removes TTL-expired entries.
     *
     * @return Number of entries removed; always 0 when TTL is disabled
     */
    public synchronized int prune() {
        if (ttlMs == 0) {
            return 0;
        }
        long now = clock.millis();
        int before = entries.size();
        entries.removeIf(entry -> isExpired(entry, now));
        return before - entries.size();
    }

    /**
     * Drops all entries. The sequence counter keeps counting.
     */
    public synchronized void clear() {
        entries.clear();
    }

    /**
     * @return Physical entry count, including expired entries not yet pruned
     */
    public synchronized int size() {
        return entries.size();
    }

    /**
     * @return Number of entries that would survive {@link #prune()}
     */
    public synchronized int validSize() {
        if (ttlMs == 0) {
            return entries.size();
        }
        long now = clock.millis();
        int count = 0;
        for (Entry<T> entry : entries) {
            if (!isExpired(entry, now)) {
                count++;
            }
        }
        return count;
    }

    /**
     * @return Fill level as a percentage of capacity (0-100)
     */
    public synchronized double utilization() {
        return (double) entries.size() / capacity * 100;
    }

    public int getCapacity() {
        return capacity;
    }

    public long getTtlMs() {
        return ttlMs;
    }

    private Optional<Entry<T>> findLive(String cursor) {
        Optional<CursorData> data = CursorCodec.decode(cursor);
        if (data.isEmpty()) {
            return Optional.empty();
        }
        long sequence = data.get().getSequence();
        long timestamp = data.get().getTimestamp();
        long now = clock.millis();

        for (Entry<T> entry : entries) {
            if (entry.sequence() == sequence && entry.timestamp() == timestamp) {
                return isExpired(entry, now) ? Optional.empty() : Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    private boolean isExpired(Entry<T> entry, long now) {
        return ttlMs > 0 && now - entry.timestamp() > ttlMs;
    }

    private record Entry<T>(T item, String cursor, long timestamp, long sequence) {
    }
}
