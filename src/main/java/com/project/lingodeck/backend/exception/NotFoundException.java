package com.project.lingodeck.backend.exception;

public class NotFoundException extends RuntimeException {
    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(ExceptionMessage message, String id) {
        super(message + ": " + id);
    }
}
