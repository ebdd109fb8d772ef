package com.flywheel.replay.store.memory;

import com.flywheel.core.model.AuditEntry;
import com.flywheel.replay.store.IAuditStore;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Process-local audit trail, oldest entry first.
 */
public class InMemoryAuditStore implements IAuditStore {

    private final List<AuditEntry> entries = new ArrayList<>();

    @Override
    public Mono<Void> append(AuditEntry entry) {
        return Mono.fromRunnable(() -> {
            synchronized (entries) {
                entries.add(entry);
            }
        });
    }

    @Override
    public Mono<Long> deleteOlderThan(long cutoffMs) {
        return Mono.fromCallable(() -> {
            synchronized (entries) {
                int before = entries.size();
                entries.removeIf(entry -> entry.getRequestedAt() < cutoffMs);
                return (long) (before - entries.size());
            }
        });
    }

    @Override
    public Flux<AuditEntry> findRecent(int limit) {
        return Flux.defer(() -> {
            List<AuditEntry> recent = new ArrayList<>();
            synchronized (entries) {
                for (int i = entries.size() - 1; i >= 0 && recent.size() < limit; i--) {
                    recent.add(entries.get(i));
                }
            }
            return Flux.fromIterable(recent);
        });
    }
}
