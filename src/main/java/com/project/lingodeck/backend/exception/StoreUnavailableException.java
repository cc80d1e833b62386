package com.project.lingodeck.backend.exception;

/**
 * Transient failure of the session store. The whole operation may be retried.
 */
public class StoreUnavailableException extends RuntimeException {
    public StoreUnavailableException(ExceptionMessage message) {
        super(message.toString());
    }

    public StoreUnavailableException(ExceptionMessage message, Throwable cause) {
        super(message + ": " + cause.getMessage(), cause);
    }
}
