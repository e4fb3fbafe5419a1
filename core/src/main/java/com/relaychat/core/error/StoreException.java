package com.relaychat.core.error;

/**
 * A bulk write to the persistent store failed and was rolled back.
 */
public class StoreException extends PipelineException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
