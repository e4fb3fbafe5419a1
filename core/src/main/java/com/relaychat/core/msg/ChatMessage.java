package com.relaychat.core.msg;

import lombok.Builder;
import lombok.Value;

/**
 * A message accepted at ingress.
 * <p>
 * {@code senderId} is only used to exclude the sender from the local rebroadcast. It never
 * leaves the node: it is not published on the bus and not persisted.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class ChatMessage {
    /**
     * Payload text. Emptiness is not validated.
     */
    String text;

    /**
     * Ingress timestamp (epoch millis).
     */
    long ts;

    /**
     * Originating connection, or null for messages relayed from another node.
     */
    String senderId;

    public static ChatMessage relayed(String text) {
        return new ChatMessage(text, System.currentTimeMillis(), null);
    }
}
