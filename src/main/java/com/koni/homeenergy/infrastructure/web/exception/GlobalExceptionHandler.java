package com.koni.homeenergy.infrastructure.web.exception;

import com.koni.homeenergy.domain.exception.BatchInsertFailedException;
import com.koni.homeenergy.domain.exception.NoValidRecordsException;
import com.koni.homeenergy.domain.exception.RateLimitedException;
import com.koni.homeenergy.domain.exception.StorageUnavailableException;
import com.koni.homeenergy.domain.exception.UnknownDeviceException;
import com.koni.homeenergy.domain.exception.ValidationException;
import com.koni.homeenergy.infrastructure.web.dto.ErrorResponse;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Clock;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API endpoints.
 * Provides consistent error responses and appropriate HTTP status codes.
 * 
 */
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final Clock clock;

    /**
     * Handle business-rule violations.
     * Returns 400 Bad Request.
     * 
     */
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(ValidationException ex) {
        log.warn("Validation error [{}]: {}", ex.getViolation(), ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    /**
     * Handle bean validation failures on request bodies.
     * Returns 400 Bad Request listing the offending fields.
     * 
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        log.warn("Request validation failed: {}", message);
        return error(HttpStatus.BAD_REQUEST, message);
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class
    })
    public ResponseEntity<ErrorResponse> handleMalformedRequest(Exception ex) {
        log.warn("Malformed request: {}", ex.getMessage());
        String message = ex instanceof HttpMessageNotReadableException
                ? "Malformed request body"
                : ex.getMessage();
        return error(HttpStatus.BAD_REQUEST, message);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        return error(HttpStatus.METHOD_NOT_ALLOWED, ex.getMessage());
    }

    /**
     * Handle samples referencing a device that is not registered.
     * Returns 404 Not Found.
     * 
     */
    @ExceptionHandler(UnknownDeviceException.class)
    public ResponseEntity<ErrorResponse> handleUnknownDevice(UnknownDeviceException ex) {
        log.warn("Unknown device: {}", ex.getDeviceId());
        return error(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(NoValidRecordsException.class)
    public ResponseEntity<ErrorResponse> handleNoValidRecords(NoValidRecordsException ex) {
        log.warn("Batch rejected: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    /**
     * Handle batches where some records could not be stored.
     * Returns 400 Bad Request with the combined failure reasons; the stored records stay stored.
     * 
     */
    @ExceptionHandler(BatchInsertFailedException.class)
    public ResponseEntity<ErrorResponse> handleBatchInsertFailed(BatchInsertFailedException ex) {
        log.error("Partial batch failure: inserted={}, failed={}", ex.getInsertedCount(), ex.getFailedCount());
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    /**
     * Handle admission control rejections.
     * Returns 429 Too Many Requests with a Retry-After header in seconds.
     * 
     */
    @ExceptionHandler(RateLimitedException.class)
    public ResponseEntity<ErrorResponse> handleRateLimited(RateLimitedException ex) {
        long retryAfterSeconds = Math.max(1, (ex.getRetryAfter().toMillis() + 999) / 1000);
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds))
                .body(body(HttpStatus.TOO_MANY_REQUESTS, ex.getMessage()));
    }

    /**
     * Handle store unavailability.
     * Returns 503 Service Unavailable; the caller may retry.
     * 
     */
    @ExceptionHandler(StorageUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleStorageUnavailable(StorageUnavailableException ex) {
        log.error("Storage unavailable: {}", ex.getMessage(), ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Service temporarily unavailable");
    }

    /**
     * Handle all other unexpected exceptions.
     * Returns 500 Internal Server Error for unhandled exceptions.
     * 
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error occurred: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private ResponseEntity<ErrorResponse> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(body(status, message));
    }

    private ErrorResponse body(HttpStatus status, String message) {
        return new ErrorResponse(status.value(), status.getReasonPhrase(), message, clock.instant());
    }
}
