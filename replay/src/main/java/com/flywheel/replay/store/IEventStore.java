package com.flywheel.replay.store;

import com.flywheel.core.model.PersistedEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Storage seam of the durable event log (cold tier).
 * <p>
 * Implementations only store and query rows; retention policy lives in
 * {@code DurableEventLog}.
 * </p>
 */
public interface IEventStore {

    /**
     * Inserts rows. Rows may belong to different channels.
     */
    Mono<Void> insert(List<PersistedEvent> rows);

    /**
     * Reads non-expired rows of a channel in ascending sequence order.
     *
     * @param channel       Channel name
     * @param afterSequence Exclusive lower bound, or null to start at the oldest row
     * @param nowMs         Rows with {@code expiresAt <= nowMs} are skipped
     * @param limit         Maximum rows to return
     */
    Flux<PersistedEvent> findAfter(String channel, Long afterSequence, long nowMs, int limit);

    /**
     * Deletes rows with a non-null {@code expiresAt <= nowMs} across all channels.
     *
     * @return Number of rows deleted
     */
    Mono<Long> deleteExpired(long nowMs);

    Mono<Long> count(String channel);

    /**
     * @return Ids of the lowest-sequence rows of a channel, oldest first
     */
    Flux<String> findOldestIds(String channel, int limit);

    /**
     * @return Number of rows deleted
     */
    Mono<Long> deleteByIds(String channel, List<String> ids);

    /**
     * @return Distinct channels holding rows
     */
    Flux<String> channels();

    Mono<Map<String, Long>> countsByChannel();

    /**
     * @return Creation time range of stored rows, or empty when there are none
     */
    Mono<CreatedAtRange> createdAtRange();
}
