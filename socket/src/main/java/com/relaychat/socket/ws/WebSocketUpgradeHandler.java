package com.relaychat.socket.ws;

import com.relaychat.socket.config.SocketConfig;
import com.relaychat.socket.metrics.MetricsService;
import com.relaychat.socket.pipeline.MessagePipeline;
import com.relaychat.socket.registry.IConnectionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;

/**
 * Upgrades {@code GET /ws} requests, refusing them once the node is shutting down.
 */
public class WebSocketUpgradeHandler {
    private static final Logger log = LoggerFactory.getLogger(WebSocketUpgradeHandler.class);

    private final WebSocketHandler wsHandler;
    private final IConnectionRegistry registry;

    public WebSocketUpgradeHandler(
            SocketConfig config,
            IConnectionRegistry registry,
            MessagePipeline pipeline,
            MetricsService metricsService
    ) {
        this.wsHandler = new WebSocketHandler(config, registry, pipeline, metricsService);
        this.registry = registry;
    }

    /**
     * Handles WebSocket upgrade request.
     *
     * @param req HTTP request
     * @param res HTTP response
     * @return Mono for upgrade
     */
    public Mono<Void> handle(HttpServerRequest req, HttpServerResponse res) {
        if (!registry.isAccepting()) {
            log.warn("Rejecting new WebSocket connection - node is shutting down");
            return res.status(503)
                .sendString(Mono.just("Service unavailable - node is shutting down"))
                .then();
        }

        return res.sendWebsocket(wsHandler::handle);
    }
}
