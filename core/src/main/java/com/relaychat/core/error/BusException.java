package com.relaychat.core.error;

/**
 * The broadcast bus could not be reached.
 */
public class BusException extends PipelineException {

    public BusException(String message, Throwable cause) {
        super(message, cause);
    }
}
