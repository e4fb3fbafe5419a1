package com.relaychat.socket.kafka;

import com.relaychat.core.model.AppendAck;
import reactor.core.publisher.Mono;

/**
 * Appends inbound messages to the durable, partitioned log.
 */
public interface IDurableProducer {

    /**
     * Prepares the log (creates the topic if missing).
     *
     * @return Mono completing when the producer can append
     */
    Mono<Void> start();

    /**
     * Appends one event.
     * <p>
     * Events sharing a correlation key land on the same partition, in append order.
     * </p>
     *
     * @param topic          Log topic
     * @param correlationKey Event key ({@code message-<ts>})
     * @param payload        Raw message text
     * @return Mono emitting the log position, or failing with
     * {@link com.relaychat.core.error.AppendException}
     */
    Mono<AppendAck> append(String topic, String correlationKey, String payload);

    /**
     * Releases producer resources.
     *
     * @return Mono completing when stopped
     */
    Mono<Void> stop();
}
