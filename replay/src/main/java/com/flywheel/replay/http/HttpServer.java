package com.flywheel.replay.http;

import com.flywheel.core.model.EventLogStats;
import com.flywheel.core.util.JsonUtils;
import com.flywheel.replay.config.ReplayConfig;
import com.flywheel.replay.coordinator.ReplayCoordinator;
import com.flywheel.replay.hub.ChannelHub;
import com.flywheel.replay.metrics.PrometheusMetricsExporter;
import com.flywheel.replay.ratelimit.ReplayRateLimiter;
import com.flywheel.replay.retention.RetentionJanitor;
import io.netty.channel.ChannelOption;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP server for health checks, metrics and buffer statistics.
 */
@RequiredArgsConstructor
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final ReplayConfig config;
    private final ReplayCoordinator coordinator;
    private final ChannelHub hub;
    private final ReplayRateLimiter rateLimiter;
    private final RetentionJanitor janitor;
    private final PrometheusMetricsExporter metricsExporter;
    private DisposableServer server;

    /**
     * Starts the HTTP server, blocking until it is bound.
     */
    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .option(ChannelOption.SO_REUSEADDR, true)
            .route(routes -> routes
                .get("/healthz", (req, res) -> {
                    if (!janitor.isRunning()) {
                        return res.status(503).sendString(Mono.just("Janitor stopped"));
                    }
                    return res.status(200).sendString(Mono.just("OK"));
                })
                .get("/metrics", (req, res) ->
                    res.header("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                        .sendString(Mono.just(metricsExporter.scrape()))
                )
                // Durable and hot tier occupancy
                .get("/stats", (req, res) -> res.status(200)
                    .header("Content-Type", "application/json")
                    .sendString(stats()))
            )
            .bind()
            .doOnNext(bound -> log.info("HTTP server started on port {}", bound.port()))
            .doOnError(err -> log.error("Failed to start HTTP server", err))
            .block(Duration.ofSeconds(45));

        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(30));
        }
    }

    Mono<String> stats() {
        return coordinator.getStats()
            .defaultIfEmpty(EventLogStats.empty())
            .map(durable -> {
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("nodeId", config.getNodeId());
                body.put("durable", durable);
                body.put("hot", hub.bufferStats());
                body.put("trackedConnections", rateLimiter.trackedConnections());
                return JsonUtils.writeValueAsString(body);
            });
    }
}
