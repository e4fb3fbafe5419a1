package com.relaychat.core.msg;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Frame exchanged with clients over the WebSocket channel.
 * <p>
 * Protocol (client → server):
 * <ul>
 *   <li>{@code submit message}: {message}</li>
 * </ul>
 * Protocol (server → client):
 * <ul>
 *   <li>{@code connected}: {connectionId}, sent once after the upgrade</li>
 *   <li>{@code message received}: {message}</li>
 *   <li>{@code message rejected}: {message}, only when the node rejects messages it could not append</li>
 * </ul>
 * </p>
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ClientFrame {
    public static final String SUBMIT_MESSAGE = "submit message";
    public static final String MESSAGE_RECEIVED = "message received";
    public static final String MESSAGE_REJECTED = "message rejected";
    public static final String CONNECTED = "connected";

    /**
     * Event name, one of the constants above.
     */
    private String type;

    /**
     * Message text. Absent on {@code connected}.
     */
    private String message;

    /**
     * Assigned connection identifier, for diagnostic display only.
     */
    private String connectionId;

    public static ClientFrame received(String message) {
        return ClientFrame.builder().type(MESSAGE_RECEIVED).message(message).build();
    }

    public static ClientFrame rejected(String message) {
        return ClientFrame.builder().type(MESSAGE_REJECTED).message(message).build();
    }

    public static ClientFrame connected(String connectionId) {
        return ClientFrame.builder().type(CONNECTED).connectionId(connectionId).build();
    }
}
