package com.relaychat.core.error;

/**
 * Send or receive failure on a single client connection.
 */
public class TransportException extends PipelineException {
    private final String connectionId;

    public TransportException(String connectionId, String message, Throwable cause) {
        super(message, cause);
        this.connectionId = connectionId;
    }

    public String getConnectionId() {
        return connectionId;
    }
}
