package com.relaychat.socket.pipeline;

import com.relaychat.core.error.AppendException;
import com.relaychat.core.msg.ChatMessage;
import com.relaychat.core.msg.ClientFrame;
import com.relaychat.core.msg.Topics;
import com.relaychat.socket.bus.IBroadcastBus;
import com.relaychat.socket.config.SocketConfig;
import com.relaychat.socket.kafka.IDurableProducer;
import com.relaychat.socket.registry.IConnectionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

/**
 * Ingress coordinator.
 * <p>
 * A submitted message takes two independent paths at once:
 * <ul>
 *   <li>live: local rebroadcast to every other connection, plus a best-effort bus publish
 *       for connections on other nodes</li>
 *   <li>durable: append to the log, from where the consumer persists it</li>
 * </ul>
 * The live path never waits for the durable one, not even across consecutive messages. An append failure cannot undo a broadcast
 * that already happened; it is handled by the configured {@link SocketConfig.AppendFailurePolicy}.
 * </p>
 */
public class MessagePipeline {
    private static final Logger log = LoggerFactory.getLogger(MessagePipeline.class);

    private final SocketConfig config;
    private final IConnectionRegistry registry;
    private final IBroadcastBus bus;
    private final IDurableProducer producer;

    private Disposable busSubscription;

    public MessagePipeline(SocketConfig config, IConnectionRegistry registry, IBroadcastBus bus,
                           IDurableProducer producer) {
        this.config = config;
        this.registry = registry;
        this.bus = bus;
        this.producer = producer;
    }

    /**
     * Starts relaying bus messages from other nodes to local connections.
     */
    public void start() {
        busSubscription = bus.subscribe(config.getBusChannel(), this::relay);
        log.info("Message pipeline listening on bus channel {}", config.getBusChannel());
    }

    private void relay(String text) {
        int delivered = registry.broadcastAll(ChatMessage.relayed(text));
        log.debug("Relayed bus message to {} local connections", delivered);
    }

    /**
     * Accepts a message from a client.
     * <p>
     * The returned Mono completes once the live path ran. The durable append is subscribed
     * separately, so a slow or unreachable log never delays the sender's next message.
     * </p>
     *
     * @param senderId Connection the message came from
     * @param text     Message text
     * @return Mono completing after the local broadcast and the bus publish were issued
     */
    public Mono<Void> submit(String senderId, String text) {
        return Mono.fromRunnable(() -> {
            long ts = System.currentTimeMillis();
            ChatMessage message = ChatMessage.builder().text(text).ts(ts).senderId(senderId).build();

            int delivered = registry.broadcastExceptSender(message, senderId);
            log.debug("Message from {} delivered to {} local connections", senderId, delivered);
            bus.publish(config.getBusChannel(), text).subscribe();

            record(senderId, text, Topics.correlationKeyFor(ts));
        });
    }

    private void record(String senderId, String text, String correlationKey) {
        producer.append(config.getChatTopic(), correlationKey, text)
            .doOnNext(ack -> log.debug("Message {} recorded at {}-{}@{}",
                correlationKey, ack.getTopic(), ack.getPartition(), ack.getOffset()))
            .then()
            .onErrorResume(AppendException.class, e -> onAppendFailed(senderId, text, e))
            .subscribe(
                null,
                err -> log.error("Unexpected failure recording message {} from {}", correlationKey, senderId, err)
            );
    }

    private Mono<Void> onAppendFailed(String senderId, String text, AppendException e) {
        if (config.getAppendFailurePolicy() == SocketConfig.AppendFailurePolicy.REJECT) {
            log.warn("Message {} from {} not recorded, notifying sender: {}",
                e.getCorrelationKey(), senderId, e.getMessage());
            registry.sendTo(senderId, ClientFrame.rejected(text));
        } else {
            log.warn("Message {} from {} not recorded, dropping: {}",
                e.getCorrelationKey(), senderId, e.getMessage());
        }
        return Mono.empty();
    }

    public void stop() {
        if (busSubscription != null) {
            busSubscription.dispose();
            busSubscription = null;
        }
        log.info("Message pipeline stopped");
    }
}
