package com.project.lingodeck.backend.exception;

public class InvalidArgumentException extends RuntimeException {
    public InvalidArgumentException(String message) {
        super(message);
    }

    public InvalidArgumentException(ExceptionMessage message) {
        super(message.toString());
    }
}
