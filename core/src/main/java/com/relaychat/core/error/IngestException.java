package com.relaychat.core.error;

/**
 * The accumulator did not absorb an event.
 * <p>
 * A retryable failure (buffer at capacity) means the same event may be offered again later.
 * A non-retryable failure means the accumulator is closed.
 * </p>
 */
public class IngestException extends PipelineException {
    private final boolean retryable;

    public IngestException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public static IngestException bufferFull(int buffered, int capacity) {
        return new IngestException(
            String.format("Accumulator buffer full (%d buffered, capacity %d)", buffered, capacity), true
        );
    }

    public static IngestException closed() {
        return new IngestException("Accumulator is closed", false);
    }

    public boolean isRetryable() {
        return retryable;
    }
}
