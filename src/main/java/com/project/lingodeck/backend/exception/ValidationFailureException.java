package com.project.lingodeck.backend.exception;

import lombok.Getter;
import org.springframework.validation.Errors;
import org.springframework.validation.FieldError;

import java.util.stream.Collectors;

@Getter
public class ValidationFailureException extends RuntimeException {
    final private String message;
    final private Errors errors;

    public ValidationFailureException(ExceptionMessage message, Errors errors) {
        this.message = message.toString();
        this.errors = errors;
    }

    /** "field: reason" pairs of every rejected field, comma separated. */
    public String describeFieldErrors() {
        return errors.getFieldErrors().stream()
                .map(FieldError::getField)
                .distinct()
                .map(field -> field + ": " + errors.getFieldError(field).getDefaultMessage())
                .collect(Collectors.joining(", "));
    }
}
