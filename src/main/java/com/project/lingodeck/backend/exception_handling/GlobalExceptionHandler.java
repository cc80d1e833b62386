package com.project.lingodeck.backend.exception_handling;

import com.project.lingodeck.backend.exception.InvalidArgumentException;
import com.project.lingodeck.backend.exception.InvalidStateException;
import com.project.lingodeck.backend.exception.NotFoundException;
import com.project.lingodeck.backend.exception.StoreUnavailableException;
import com.project.lingodeck.backend.exception.ValidationFailureException;
import com.project.lingodeck.backend.response.ApiResponse;
import com.project.lingodeck.backend.response.ResponseMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Maps engine exceptions to {@link ApiResponse} bodies.
 *
 * <pre>
 *  InvalidStateException     → 409, stale or duplicated client message
 *  NotFoundException         → 404
 *  validation / bad argument → 400
 *  StoreUnavailableException → 503, the caller may retry
 * </pre>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidStateException.class)
    public ResponseEntity<ApiResponse> handleInvalidState(InvalidStateException e) {
        log.warn("{}: {}", ResponseMessage.INVALID_STATE, e.getMessage());
        return respond(HttpStatus.CONFLICT, ResponseMessage.INVALID_STATE, e.getMessage());
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiResponse> handleNotFound(NotFoundException e) {
        log.warn("{}: {}", ResponseMessage.NOT_FOUND, e.getMessage());
        return respond(HttpStatus.NOT_FOUND, ResponseMessage.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(ValidationFailureException.class)
    public ResponseEntity<ApiResponse> handleValidationFailure(ValidationFailureException e) {
        String detail = e.describeFieldErrors();
        log.warn("{}: {}", e.getMessage(), detail);
        return respond(HttpStatus.BAD_REQUEST, ResponseMessage.INVALID_REQUEST, detail);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse> handleInvalidRequestBody(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining(", "));
        log.warn("{}: {}", ResponseMessage.INVALID_REQUEST, detail);
        return respond(HttpStatus.BAD_REQUEST, ResponseMessage.INVALID_REQUEST, detail);
    }

    @ExceptionHandler({InvalidArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ApiResponse> handleInvalidArgument(Exception e) {
        log.warn("{}: {}", ResponseMessage.INVALID_REQUEST, e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ResponseMessage.INVALID_REQUEST, e.getMessage());
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ApiResponse> handleStoreUnavailable(StoreUnavailableException e) {
        log.error("{}: {}", ResponseMessage.SERVICE_UNAVAILABLE, e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ResponseMessage.SERVICE_UNAVAILABLE, e.getMessage());
    }

    private ResponseEntity<ApiResponse> respond(HttpStatus status, ResponseMessage message, String detail) {
        return new ResponseEntity<>(ApiResponse.error(message, detail), status);
    }
}
