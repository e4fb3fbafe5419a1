package com.relaychat.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * A message as it sits in the durable log.
 * <p>
 * The offset is assigned by the log on append and is strictly increasing within a partition.
 * Events are immutable once appended.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class ChatEvent {
    String topic;
    int partition;
    long offset;

    /**
     * Producer-assigned correlation key ({@code message-<ingress ts>}), may be null.
     */
    String key;

    /**
     * Raw message text.
     */
    String payload;

    /**
     * Log append time (epoch millis).
     */
    long timestamp;
}
