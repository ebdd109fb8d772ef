package com.flywheel.replay.audit;

import com.flywheel.core.model.AuditEntry;
import com.flywheel.replay.metrics.ReplayMetrics;
import com.flywheel.replay.store.IAuditStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.util.concurrent.Queues;

/**
 * Asynchronous writer of replay audit entries.
 * <p>
 * <b>Queue policy:</b> entries go through a bounded queue drained one write at a time.
 * When the queue is full the entry is dropped; when a write fails the entry is lost.
 * Both cases are visible only in logs and the {@code replay.audit.drops.total}
 * counter, never to the replay caller.
 * </p>
 */
public class AuditLog implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AuditLog.class);

    private final IAuditStore store;
    private final ReplayMetrics metrics;
    private final Sinks.Many<AuditEntry> queue;
    private final Disposable writer;

    /**
     * @param store     Audit storage
     * @param metrics   Drop counters
     * @param capacity  Queue capacity (rounded up to a power of two)
     * @param scheduler Scheduler the writes run on
     */
    public AuditLog(IAuditStore store, ReplayMetrics metrics, int capacity, Scheduler scheduler) {
        this.store = store;
        this.metrics = metrics;
        this.queue = Sinks.many().unicast().onBackpressureBuffer(Queues.<AuditEntry>get(capacity).get());
        this.writer = queue.asFlux()
            .concatMap(entry -> write(entry).subscribeOn(scheduler), 0)
            .subscribe(
                v -> { },
                err -> log.error("Audit writer terminated unexpectedly", err));
    }

    /**
     * Enqueues an entry. Never throws and never blocks.
     *
     * @return true if the entry was queued
     */
    public boolean record(AuditEntry entry) {
        Sinks.EmitResult result;
        synchronized (queue) {
            result = queue.tryEmitNext(entry);
        }
        if (result.isFailure()) {
            metrics.recordAuditOverflow();
            log.warn("Dropped replay audit entry for connection {} on channel {}: {}",
                entry.getConnectionId(), entry.getChannel(), result);
            return false;
        }
        return true;
    }

    /**
     * Deletes entries requested before the cutoff. Errors propagate to the caller.
     */
    public Mono<Long> pruneOlderThan(long cutoffMs) {
        return store.deleteOlderThan(cutoffMs)
            .doOnNext(deleted -> {
                if (deleted > 0) {
                    log.info("Cleaned up {} old replay audit entries", deleted);
                }
            });
    }

    public Flux<AuditEntry> recent(int limit) {
        return store.findRecent(limit);
    }

    /**
     * Stops accepting entries; queued entries are still written.
     */
    @Override
    public void close() {
        synchronized (queue) {
            queue.tryEmitComplete();
        }
    }

    public boolean isWriterRunning() {
        return !writer.isDisposed();
    }

    private Mono<Void> write(AuditEntry entry) {
        return Mono.defer(() -> store.append(entry))
            .onErrorResume(err -> {
                metrics.recordAuditStoreError();
                log.error("Failed to write replay audit entry for connection {}", entry.getConnectionId(), err);
                return Mono.empty();
            });
    }
}
