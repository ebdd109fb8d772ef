package com.flywheel.replay;

import com.flywheel.replay.audit.AuditLog;
import com.flywheel.replay.config.ChannelConfigProvider;
import com.flywheel.replay.config.ReplayConfig;
import com.flywheel.replay.coordinator.ReplayCoordinator;
import com.flywheel.replay.eventlog.DurableEventLog;
import com.flywheel.replay.http.HttpServer;
import com.flywheel.replay.hub.ChannelHub;
import com.flywheel.replay.metrics.PrometheusMetricsExporter;
import com.flywheel.replay.metrics.ReplayMetrics;
import com.flywheel.replay.ratelimit.ReplayRateLimiter;
import com.flywheel.replay.redis.RedisAuditStore;
import com.flywheel.replay.redis.RedisChannelConfigStore;
import com.flywheel.replay.redis.RedisEventStore;
import com.flywheel.replay.redis.RedisService;
import com.flywheel.replay.retention.RetentionJanitor;
import com.flywheel.replay.store.IAuditStore;
import com.flywheel.replay.store.IChannelConfigStore;
import com.flywheel.replay.store.IEventStore;
import com.flywheel.replay.store.memory.InMemoryAuditStore;
import com.flywheel.replay.store.memory.InMemoryChannelConfigStore;
import com.flywheel.replay.store.memory.InMemoryEventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;

/**
 * Main entry point for a replay node.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Hold the hot tier and the durable event log for every channel</li>
 *   <li>Serve cursor-based replay to reconnecting clients</li>
 *   <li>Enforce retention on a fixed interval</li>
 *   <li>Expose /healthz, /metrics and /stats endpoints</li>
 * </ul>
 * </p>
 */
public class ReplayApp {
    private static final Logger log = LoggerFactory.getLogger(ReplayApp.class);

    public static void main(String[] args) {
        ReplayConfig config = ReplayConfig.fromEnv();
        MDC.put("nodeId", config.getNodeId());

        log.info("Starting replay node: {}", config.getNodeId());
        log.info("  Store backend: {}", config.getStoreBackend());
        if (!config.isMemoryBackend()) {
            log.info("  Redis: {}", config.getRedisUrl());
        }

        Clock clock = Clock.systemUTC();
        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getNodeId());
        ReplayMetrics metrics = new ReplayMetrics(metricsExporter.getRegistry(), config.getNodeId());

        RedisService redisService = config.isMemoryBackend() ? null : new RedisService(config);
        IEventStore eventStore;
        IChannelConfigStore configStore;
        IAuditStore auditStore;
        if (redisService == null) {
            eventStore = new InMemoryEventStore();
            configStore = new InMemoryChannelConfigStore();
            auditStore = new InMemoryAuditStore();
        } else {
            eventStore = new RedisEventStore(redisService);
            configStore = new RedisChannelConfigStore(redisService);
            auditStore = new RedisAuditStore(redisService);
        }

        ChannelConfigProvider configProvider = new ChannelConfigProvider(configStore, clock, config.getConfigCacheTtl());
        DurableEventLog eventLog = new DurableEventLog(eventStore, configProvider, metrics, clock);
        ReplayRateLimiter rateLimiter = new ReplayRateLimiter(clock);
        metrics.registerTrackedConnectionsGauge(rateLimiter::trackedConnections);
        AuditLog auditLog = new AuditLog(auditStore, metrics, config.getAuditQueueCapacity(), Schedulers.boundedElastic());
        ReplayCoordinator coordinator = new ReplayCoordinator(
            eventLog, configProvider, rateLimiter, auditLog, metrics, clock
        );
        ChannelHub hub = new ChannelHub(eventLog, clock);
        RetentionJanitor janitor = new RetentionJanitor(
            eventLog, auditLog, hub, metrics, clock, config.getJanitorInterval(), config.getAuditRetention()
        );

        // Warm the channel policy cache before serving
        configProvider.refresh().block(Duration.ofSeconds(10));
        janitor.start();

        HttpServer httpServer = new HttpServer(config, coordinator, hub, rateLimiter, janitor, metricsExporter);
        httpServer.start();

        log.info("Replay node {} is ready", config.getNodeId());

        handleShutdown(config, janitor, httpServer, auditLog, redisService);

        // Keep the application running until shutdown signal
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }

    private static void handleShutdown(ReplayConfig config,
                                       RetentionJanitor janitor,
                                       HttpServer httpServer,
                                       AuditLog auditLog,
                                       RedisService redisService) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received, initiating graceful shutdown...");
            MDC.put("nodeId", config.getNodeId());

            janitor.stop();
            httpServer.stop();
            auditLog.close();

            if (redisService != null) {
                redisService.close();
            }

            log.info("Shutdown complete");
        }));
    }
}
