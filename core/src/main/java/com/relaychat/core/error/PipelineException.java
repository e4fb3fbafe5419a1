package com.relaychat.core.error;

/**
 * Base class for failures raised by the delivery pipeline.
 * <p>
 * Each tier has its own subtype so callers can apply the tier's propagation policy:
 * <ul>
 *   <li>{@link TransportException}: one client connection, never fatal</li>
 *   <li>{@link BusException}: ephemeral relay, logged and swallowed</li>
 *   <li>{@link AppendException}: durable log, surfaced to the ingress policy</li>
 *   <li>{@link IngestException}: accumulator refused an event, consumer pauses the partition</li>
 *   <li>{@link StoreException}: persistent store write, retried by the accumulator</li>
 *   <li>{@link FlushExhaustedException}: retries exhausted, reported as fatal</li>
 * </ul>
 * </p>
 */
public abstract class PipelineException extends RuntimeException {

    protected PipelineException(String message) {
        super(message);
    }

    protected PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
