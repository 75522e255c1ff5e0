package com.assistrelay.shared.error;

/**
 * Base of the failures the relay knows how to report back into a thread.
 */
public abstract class RelayException extends RuntimeException {

    protected RelayException(String message) {
        super(message);
    }

    protected RelayException(String message, Throwable cause) {
        super(message, cause);
    }
}
