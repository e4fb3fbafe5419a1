package com.relaychat.socket.bus;

import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.util.function.Consumer;

/**
 * Cross-node, best-effort relay of live messages.
 * <p>
 * Nothing published here is durable: a node that is down or partitioned from the bus simply
 * misses the message. Durability is the durable log's job.
 * </p>
 */
public interface IBroadcastBus {

    /**
     * Publishes a message to every node subscribed to the channel.
     * <p>
     * Never fails: an unreachable bus is logged and the returned Mono completes empty.
     * </p>
     *
     * @param channel Channel name
     * @param message Message text
     * @return Mono completing once the publish was attempted
     */
    Mono<Void> publish(String channel, String message);

    /**
     * Registers a handler for messages published by other nodes on the channel.
     *
     * @param channel Channel name
     * @param handler Invoked once per received message text
     * @return Disposable cancelling the subscription
     */
    Disposable subscribe(String channel, Consumer<String> handler);

    /**
     * Closes bus connections.
     */
    void close();
}
