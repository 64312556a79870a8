package com.di.tablenova.exception;

import com.di.tablenova.platform.PlatformException;
import com.di.tablenova.resilience.ErrorCategory;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Maps exceptions escaping the controllers to an {@link ErrorResponse}, classified with
 * {@link ErrorCategory}:
 * <ul>
 *   <li>{@link JobNotFoundException} → 404</li>
 *   <li>{@link JobNotCompletedException}, bad input and validation errors → 400</li>
 *   <li>{@link PlatformException} → 502</li>
 *   <li>anything else → 500</li>
 * </ul>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleJobNotFound(JobNotFoundException e) {
        log.warn("[API] {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, e, e.getMessage());
    }

    @ExceptionHandler(JobNotCompletedException.class)
    public ResponseEntity<ErrorResponse> handleJobNotCompleted(JobNotCompletedException e) {
        log.info("[API] {}", e.getMessage());
        ResponseEntity<ErrorResponse> response = respond(HttpStatus.BAD_REQUEST, e, e.getMessage());
        response.getBody().addDetail("jobState", e.getState().getValue());
        return response;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(GlobalExceptionHandler::describe)
                .collect(Collectors.joining("; "));
        log.warn("[API] Validation failed: {}", message);
        return respond(HttpStatus.BAD_REQUEST, e, message.isEmpty() ? "Validation failed" : message);
    }

    @ExceptionHandler({
            IllegalArgumentException.class,
            ConstraintViolationException.class,
            HandlerMethodValidationException.class,
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        log.warn("[API] Bad request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, e, messageOf(e));
    }

    @ExceptionHandler(PlatformException.class)
    public ResponseEntity<ErrorResponse> handlePlatform(PlatformException e) {
        log.error("[API] Platform failure: {}", e.getMessage(), e);
        ResponseEntity<ErrorResponse> response = respond(HttpStatus.BAD_GATEWAY, e, e.getMessage());
        response.getBody().addDetail("tool", e.getTool());
        return response;
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleUnavailable(IllegalStateException e) {
        log.error("[API] {}", e.getMessage(), e);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, e, e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        log.error("[API] Unhandled exception: {} [{}]", e.getClass().getSimpleName(), category.getName(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e, messageOf(e));
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, Throwable exception, String message) {
        ErrorCategory category = ErrorCategory.categorize(exception);
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(message);
        response.setErrorCategory(category.getValue());
        response.setErrorCategoryName(category.getName());
        response.setErrorCategoryDescription(category.getDescription());
        response.setPath(requestPath());
        response.addDetail("exceptionType", exception.getClass().getName());

        Throwable rootCause = rootCause(exception);
        if (rootCause != exception) {
            response.addDetail("rootCauseType", rootCause.getClass().getName());
            response.addDetail("rootCauseMessage", rootCause.getMessage());
        }
        return ResponseEntity.status(status).body(response);
    }

    private static String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static Throwable rootCause(Throwable exception) {
        Throwable current = exception;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }

    private static String requestPath() {
        String path = MDC.get("requestPath");
        return path != null ? path : "/unknown";
    }
}
