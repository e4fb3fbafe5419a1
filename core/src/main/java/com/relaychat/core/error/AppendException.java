package com.relaychat.core.error;

/**
 * An event could not be appended to the durable log (broker unreachable or ack timeout).
 */
public class AppendException extends PipelineException {
    private final String correlationKey;

    public AppendException(String correlationKey, String message, Throwable cause) {
        super(message, cause);
        this.correlationKey = correlationKey;
    }

    public String getCorrelationKey() {
        return correlationKey;
    }
}
