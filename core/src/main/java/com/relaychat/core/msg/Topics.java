package com.relaychat.core.msg;

/**
 * Names shared by every node: the durable log topic, its consumer group and the bus channel.
 */
public final class Topics {
    private Topics() {
    }

    /**
     * Durable log topic carrying every accepted message.
     * Key: correlation key, value: raw message text.
     */
    public static final String CHAT_MESSAGES = "chat-messages";

    /**
     * Consumer group shared by all persisting consumers for work distribution.
     */
    public static final String PERSISTER_GROUP = "chat-persisters";

    /**
     * Redis pub/sub channel for live cross-node relay.
     */
    public static final String BROADCAST_CHANNEL = "chat:broadcast";

    private static final String CORRELATION_KEY_PREFIX = "message-";

    /**
     * Correlation key for a message accepted at the given ingress time.
     *
     * @param ingressTs ingress timestamp (epoch millis)
     * @return {@code message-<ingressTs>}
     */
    public static String correlationKeyFor(long ingressTs) {
        return CORRELATION_KEY_PREFIX + ingressTs;
    }
}
