package com.relaychat.socket.bus;

import com.relaychat.core.error.BusException;
import com.relaychat.core.msg.BusMessage;
import com.relaychat.core.util.JsonUtils;
import com.relaychat.socket.config.SocketConfig;
import com.relaychat.socket.metrics.MetricsService;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisClient;
import io.lettuce.core.TimeoutOptions;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import io.lettuce.core.pubsub.StatefulRedisPubSubConnection;
import io.lettuce.core.pubsub.api.reactive.RedisPubSubReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * Broadcast bus backed by Redis pub/sub.
 * <p>
 * Every payload is tagged with this node's id. Since the node subscribes to the channel it
 * publishes on, Redis echoes its own messages back; those are dropped on receipt because
 * the local broadcast already reached this node's connections.
 * </p>
 * <p>
 * Uses two connections: PUBLISH is not allowed on a connection in subscriber mode.
 * </p>
 * <p>
 * While Redis is unreachable, publishes are rejected instead of queued for reconnect, and a
 * publish that gets no reply within the configured timeout fails. Both count as bus failures.
 * </p>
 */
public class RedisBroadcastBus implements IBroadcastBus {
    private static final Logger log = LoggerFactory.getLogger(RedisBroadcastBus.class);

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;
    private final StatefulRedisPubSubConnection<String, String> pubSubConnection;
    private final RedisReactiveCommands<String, String> commands;
    private final RedisPubSubReactiveCommands<String, String> pubSubCommands;
    private final String nodeId;
    private final Duration publishTimeout;
    private final MetricsService metricsService;

    public RedisBroadcastBus(SocketConfig config, MetricsService metricsService) {
        this.nodeId = config.getNodeId();
        this.metricsService = metricsService;
        this.publishTimeout = config.getBusPublishTimeout();
        this.client = RedisClient.create(config.getRedisUrl());
        client.setOptions(ClientOptions.builder()
            .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
            .timeoutOptions(TimeoutOptions.enabled(publishTimeout))
            .build());
        this.connection = client.connect();
        this.pubSubConnection = client.connectPubSub();
        this.commands = connection.reactive();
        this.pubSubCommands = pubSubConnection.reactive();
        log.info("Connected to Redis bus: {}", config.getRedisUrl());
    }

    @Override
    public Mono<Void> publish(String channel, String message) {
        return Mono.fromCallable(() -> JsonUtils.writeValueAsString(new BusMessage(message, nodeId)))
            .flatMap(payload -> commands.publish(channel, payload))
            .timeout(publishTimeout)
            .doOnNext(receivers -> {
                metricsService.recordBusPublished();
                log.debug("Published to {} ({} subscribers)", channel, receivers);
            })
            .onErrorResume(err -> {
                BusException failure = new BusException("Publish to " + channel + " failed", err);
                metricsService.recordBusFailed();
                log.warn("{}: {}, relay limited to this node", failure.getMessage(), err.getMessage());
                return Mono.empty();
            })
            .then();
    }

    @Override
    public Disposable subscribe(String channel, Consumer<String> handler) {
        Disposable deliveries = pubSubCommands.observeChannels()
            .filter(received -> channel.equals(received.getChannel()))
            .subscribe(
                received -> handle(received.getMessage(), handler),
                err -> log.error("Bus delivery stream for {} terminated", channel, err)
            );

        pubSubCommands.subscribe(channel)
            .doOnSuccess(v -> log.info("Subscribed to bus channel {}", channel))
            .doOnError(err -> log.error("Failed to subscribe to bus channel {}", channel, err))
            .subscribe();

        return () -> {
            deliveries.dispose();
            pubSubCommands.unsubscribe(channel)
                .doOnError(err -> log.warn("Failed to unsubscribe from {}: {}", channel, err.getMessage()))
                .subscribe();
        };
    }

    private void handle(String payload, Consumer<String> handler) {
        BusMessage busMessage;
        try {
            busMessage = JsonUtils.readValue(payload, BusMessage.class);
        } catch (IllegalArgumentException e) {
            log.warn("Dropping malformed bus payload: {}", e.getMessage());
            return;
        }

        if (nodeId.equals(busMessage.getOrigin())) {
            metricsService.recordBusEchoFiltered();
            return;
        }

        metricsService.recordBusReceived();
        try {
            handler.accept(busMessage.getMessage());
        } catch (RuntimeException e) {
            log.error("Bus handler failed for message from node {}", busMessage.getOrigin(), e);
        }
    }

    @Override
    public void close() {
        pubSubConnection.close();
        connection.close();
        client.shutdown();
        log.info("Redis bus connections closed");
    }
}
