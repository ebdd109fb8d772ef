package com.flywheel.replay.retention;

import com.flywheel.replay.audit.AuditLog;
import com.flywheel.replay.eventlog.DurableEventLog;
import com.flywheel.replay.hub.ChannelHub;
import com.flywheel.replay.metrics.ReplayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * Periodic retention enforcement.
 * <p>
 * Each run executes these phases in order, and a failing phase never stops the next:
 * <ol>
 *   <li>{@value #PHASE_EXPIRED}: delete durable events past their expiry</li>
 *   <li>{@value #PHASE_TRIM}: trim every channel to its max events, oldest first</li>
 *   <li>{@value #PHASE_AUDIT}: delete audit entries older than the audit horizon</li>
 *   <li>{@value #PHASE_HOT}: prune TTL-expired hot-tier entries</li>
 * </ol>
 * </p>
 * <p>
 * Ticks run on the parallel scheduler, whose daemon threads never keep the JVM alive.
 * A tick arriving while a run is in progress is dropped.
 * </p>
 */
public class RetentionJanitor {
    private static final Logger log = LoggerFactory.getLogger(RetentionJanitor.class);

    public static final Duration DEFAULT_INTERVAL = Duration.ofMinutes(1);
    public static final Duration DEFAULT_AUDIT_RETENTION = Duration.ofDays(7);

    static final String PHASE_EXPIRED = "expired";
    static final String PHASE_TRIM = "trim";
    static final String PHASE_AUDIT = "audit";
    static final String PHASE_HOT = "hot";

    private final DurableEventLog eventLog;
    private final AuditLog auditLog;
    private final ChannelHub hub;
    private final ReplayMetrics metrics;
    private final Clock clock;
    private final Duration interval;
    private final Duration auditRetention;

    private Disposable task;

    /**
     * @param hub Hot tier to prune, or null when this node has none
     */
    public RetentionJanitor(DurableEventLog eventLog,
                            AuditLog auditLog,
                            ChannelHub hub,
                            ReplayMetrics metrics,
                            Clock clock,
                            Duration interval,
                            Duration auditRetention) {
        this.eventLog = eventLog;
        this.auditLog = auditLog;
        this.hub = hub;
        this.metrics = metrics;
        this.clock = clock;
        this.interval = interval;
        this.auditRetention = auditRetention;
    }

    /**
     * Starts the periodic runs. Calling it again while running has no effect.
     */
    public synchronized void start() {
        if (isRunning()) {
            return;
        }
        task = Flux.interval(interval, interval, Schedulers.parallel())
            .onBackpressureDrop(tick -> log.debug("Janitor run still in progress, skipping tick {}", tick))
            .flatMap(tick -> runOnce(), 1)
            .subscribe(
                report -> {
                    if (!report.isClean()) {
                        log.warn("Janitor run finished with failed phases: {}", report.getFailedPhases());
                    }
                },
                err -> log.error("Janitor stopped unexpectedly", err)
            );
        log.info("Retention janitor started, interval={}", interval);
    }

    public synchronized void stop() {
        if (task != null) {
            task.dispose();
            task = null;
            log.info("Retention janitor stopped");
        }
    }

    public synchronized boolean isRunning() {
        return task != null && !task.isDisposed();
    }

    /**
     * Executes one full retention pass.
     *
     * @return Mono of the run's report; never errors
     */
    public Mono<JanitorReport> runOnce() {
        return Mono.defer(() -> {
            JanitorReport.JanitorReportBuilder report = JanitorReport.builder();

            return phase(PHASE_EXPIRED, eventLog::cleanupExpiredEvents, report)
                .doOnNext(report::expiredDeleted)
                .then(phase(PHASE_TRIM, this::trimAllChannels, report))
                .doOnNext(report::trimmedDeleted)
                .then(phase(PHASE_AUDIT, this::pruneAudit, report))
                .doOnNext(report::auditDeleted)
                .then(phase(PHASE_HOT, this::pruneHotTier, report))
                .doOnNext(count -> report.hotPruned(count.intValue()))
                .then(Mono.fromSupplier(report::build))
                .doOnNext(this::logReport);
        });
    }

    private Mono<Long> phase(String name, Supplier<Mono<Long>> work, JanitorReport.JanitorReportBuilder report) {
        return Mono.defer(work)
            .defaultIfEmpty(0L)
            .doOnNext(count -> metrics.recordJanitorDeleted(name, count))
            .onErrorResume(err -> {
                log.error("Janitor phase '{}' failed", name, err);
                metrics.recordJanitorFailure(name);
                report.failedPhase(name);
                return Mono.just(0L);
            });
    }

    private Mono<Long> trimAllChannels() {
        return eventLog.channels()
            .concatMap(channel -> eventLog.trimChannelEvents(channel)
                .onErrorResume(err -> {
                    log.error("Failed to trim channel {}", channel, err);
                    metrics.recordJanitorFailure(PHASE_TRIM);
                    return Mono.just(0L);
                }))
            .reduce(0L, Long::sum);
    }

    private Mono<Long> pruneAudit() {
        return auditLog.pruneOlderThan(clock.millis() - auditRetention.toMillis());
    }

    private Mono<Long> pruneHotTier() {
        if (hub == null) {
            return Mono.just(0L);
        }
        return Mono.fromCallable(() -> (long) hub.pruneBuffers());
    }

    private void logReport(JanitorReport report) {
        long total = report.getExpiredDeleted() + report.getTrimmedDeleted() + report.getAuditDeleted();
        if (total > 0 || report.getHotPruned() > 0) {
            log.info("Janitor run: expired={}, trimmed={}, audit={}, hotPruned={}",
                report.getExpiredDeleted(), report.getTrimmedDeleted(), report.getAuditDeleted(),
                report.getHotPruned());
        } else {
            log.debug("Janitor run: nothing to delete");
        }
    }
}
