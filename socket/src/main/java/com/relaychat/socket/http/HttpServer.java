package com.relaychat.socket.http;

import com.relaychat.socket.config.SocketConfig;
import com.relaychat.socket.metrics.MetricsService;
import com.relaychat.socket.metrics.PrometheusMetricsExporter;
import com.relaychat.socket.pipeline.MessagePipeline;
import com.relaychat.socket.registry.IConnectionRegistry;
import com.relaychat.socket.ws.WebSocketUpgradeHandler;
import io.netty.channel.ChannelOption;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;

import java.time.Duration;
import java.util.function.Function;

/**
 * HTTP server for health checks, metrics, and WebSocket upgrades.
 */
@RequiredArgsConstructor
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final SocketConfig config;
    private final IConnectionRegistry registry;
    private final MessagePipeline pipeline;
    private final MetricsService metricsService;
    private final PrometheusMetricsExporter metricsExporter;
    private DisposableServer server;

    /**
     * Binds the server and blocks until it is listening.
     */
    public DisposableServer start() {
        WebSocketUpgradeHandler upgradeHandler = new WebSocketUpgradeHandler(
            config, registry, pipeline, metricsService
        );

        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .option(ChannelOption.SO_REUSEADDR, true)
            .metrics(true, Function.identity())
            .route(routes -> routes
                // Liveness
                .get("/healthz", (req, res) -> res.status(200).sendString(Mono.just("OK")))
                // Readiness - fails while shutting down
                .get("/readyz", (req, res) -> {
                    if (!registry.isAccepting()) {
                        return res.status(503).sendString(Mono.just("Not Ready - Shutting down"));
                    }
                    return res.status(200).sendString(Mono.just("Ready"));
                })
                .get("/metrics", (req, res) ->
                    res.header("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                        .sendString(Mono.just(metricsExporter.scrape()))
                )
                .get("/ws", upgradeHandler::handle)
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
            log.info("HTTP server stopped");
        }
    }
}
