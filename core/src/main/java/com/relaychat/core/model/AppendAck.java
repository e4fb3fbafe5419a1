package com.relaychat.core.model;

import lombok.Value;

/**
 * Acknowledgement of a successful append to the durable log.
 */
@Value
public class AppendAck {
    String topic;
    int partition;
    long offset;
}
