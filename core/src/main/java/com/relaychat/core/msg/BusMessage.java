package com.relaychat.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Payload published on the broadcast bus.
 * <p>
 * {@code origin} tags the publishing node so that a node subscribed to its own channel can
 * drop the echo of a message it already delivered locally.
 * </p>
 */
@Value
public class BusMessage {
    @JsonProperty("message")
    String message;

    @JsonProperty("origin")
    String origin;

    @JsonCreator
    public BusMessage(
        @JsonProperty("message") String message,
        @JsonProperty("origin") String origin
    ) {
        this.message = message;
        this.origin = origin;
    }
}
