package com.flywheel.replay.store;

import com.flywheel.core.model.AuditEntry;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Append-only store of replay audit entries.
 */
public interface IAuditStore {

    Mono<Void> append(AuditEntry entry);

    /**
     * Deletes entries with {@code requestedAt < cutoffMs}.
     *
     * @return Number of entries deleted
     */
    Mono<Long> deleteOlderThan(long cutoffMs);

    /**
     * @return Most recent entries, newest first
     */
    Flux<AuditEntry> findRecent(int limit);
}
