package com.project.lingodeck.backend.exception;

/**
 * A session transition was requested from a mode that does not allow it,
 * or for a card that is not the active one. Usually a stale or duplicated
 * client message; callers can ignore it.
 */
public class InvalidStateException extends RuntimeException {
    public InvalidStateException(String message) {
        super(message);
    }

    public InvalidStateException(ExceptionMessage message) {
        super(message.toString());
    }
}
