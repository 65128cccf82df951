package com.nicolaswinsten.lootsync.web;

import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import com.nicolaswinsten.lootsync.error.ErrorKind;
import com.nicolaswinsten.lootsync.error.WorldStateException;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Renders {@link WorldStateException}s and malformed requests as {@link ApiError} bodies.
 * The HTTP status follows the {@link ErrorKind}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private final Clock clock;

    public ApiExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(WorldStateException.class)
    public ResponseEntity<ApiError> handleWorldState(WorldStateException ex, HttpServletRequest request) {
        HttpStatus status = statusFor(ex.getKind());
        if (status.is5xxServerError()) {
            LOGGER.warn("{} {} failed: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        } else {
            LOGGER.debug("{} {} rejected: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        }
        return respond(status, ex.getKind(), ex.getMessage(), request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        LOGGER.debug("Unreadable body on {} {}: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ErrorKind.VALIDATION_ERROR, "Malformed or missing JSON body", request);
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ApiError> handleBadParameter(Exception ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, ErrorKind.VALIDATION_ERROR, ex.getMessage(), request);
    }

    static HttpStatus statusFor(ErrorKind kind) {
        switch (kind) {
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case CONFLICT:
                return HttpStatus.CONFLICT;
            case VALIDATION_ERROR:
                return HttpStatus.BAD_REQUEST;
            case TRANSIENT_STORAGE_BUSY:
                return HttpStatus.SERVICE_UNAVAILABLE;
            default:
                throw new IllegalArgumentException("Unmapped error kind " + kind);
        }
    }

    private ResponseEntity<ApiError> respond(HttpStatus status, ErrorKind kind, String message, HttpServletRequest request) {
        ApiError body = new ApiError(kind, message, status.value(), clock.instant(), request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }
}
