package com.relaychat.socket.consumer;

/**
 * Per-partition state of the durable consumer.
 */
public enum ConsumerState {
    /**
     * Assigned, nothing handed to the accumulator yet.
     */
    IDLE,
    /**
     * Events are handed to the accumulator in offset order.
     */
    CONSUMING,
    /**
     * The accumulator refused an event; fetching is suspended until the resume deadline.
     */
    PAUSED,
    /**
     * The consumer shut down.
     */
    STOPPED
}
