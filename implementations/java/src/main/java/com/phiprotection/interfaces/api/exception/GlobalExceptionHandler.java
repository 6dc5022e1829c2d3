package com.phiprotection.interfaces.api.exception;

import com.phiprotection.application.exceptions.ConcurrentRecordModificationException;
import com.phiprotection.application.exceptions.RecordNotFoundException;
import com.phiprotection.application.exceptions.RecordOperationException;
import com.phiprotection.infrastructure.audit.AuditSinkFailureException;
import com.phiprotection.infrastructure.crypto.EncryptionFailureException;
import com.phiprotection.infrastructure.security.TrustedAccessKernel;
import com.phiprotection.interfaces.api.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API.
 *
 * Provides centralized exception handling with:
 * - Generic messages only (no record content, no stack traces)
 * - Standard error format
 * - Validation error details without rejected values
 * - Proper HTTP status codes
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * Handle validation errors from @Valid annotation.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationErrors(
            MethodArgumentNotValidException ex,
            HttpServletRequest request) {

        List<ErrorResponse.ValidationError> validationErrors = ex.getBindingResult()
            .getAllErrors()
            .stream()
            .map(error -> ErrorResponse.ValidationError.builder()
                .field(error instanceof FieldError ? ((FieldError) error).getField() : error.getObjectName())
                .message(error.getDefaultMessage())
                .build())
            .collect(Collectors.toList());

        if (log.isWarnEnabled()) {
            log.warn("Validation error: {} validation failures on {}",
                validationErrors.size(), Encode.forJava(request.getRequestURI()));
        }

        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "Invalid request parameters",
            request, validationErrors);
    }

    /**
     * Handle constraint violations on request parameters.
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex,
            HttpServletRequest request) {

        List<ErrorResponse.ValidationError> validationErrors = ex.getConstraintViolations()
            .stream()
            .map(violation -> ErrorResponse.ValidationError.builder()
                .field(violation.getPropertyPath().toString())
                .message(violation.getMessage())
                .build())
            .collect(Collectors.toList());

        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "Invalid request parameters",
            request, validationErrors);
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleUnreadableRequest(
            Exception ex,
            HttpServletRequest request) {

        if (log.isWarnEnabled()) {
            log.warn("Unreadable request on {}: {}",
                Encode.forJava(request.getRequestURI()), ex.getClass().getSimpleName());
        }

        return respond(HttpStatus.BAD_REQUEST, "Bad Request", "Malformed request", request, null);
    }

    /**
     * Routing failures keep the status the framework assigned them.
     */
    @ExceptionHandler({
        NoHandlerFoundException.class,
        NoResourceFoundException.class,
        HttpRequestMethodNotSupportedException.class,
        HttpMediaTypeNotSupportedException.class
    })
    public ResponseEntity<ErrorResponse> handleRoutingFailure(
            Exception ex,
            HttpServletRequest request) {

        HttpStatusCode statusCode = ((org.springframework.web.ErrorResponse) ex).getStatusCode();
        HttpStatus status = HttpStatus.valueOf(statusCode.value());

        return respond(status, status.getReasonPhrase(), status.getReasonPhrase(), request, null);
    }

    /**
     * Handle ownership denials from the AccessKernel.
     */
    @ExceptionHandler(TrustedAccessKernel.AccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDenied(
            TrustedAccessKernel.AccessDeniedException ex,
            HttpServletRequest request) {

        if (log.isWarnEnabled()) {
            log.warn("Access denied on {}", Encode.forJava(request.getRequestURI()));
        }

        return respond(HttpStatus.FORBIDDEN, "Access Denied",
            "You do not have permission to access this resource", request, null);
    }

    @ExceptionHandler(RecordNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(
            RecordNotFoundException ex,
            HttpServletRequest request) {

        return respond(HttpStatus.NOT_FOUND, "Not Found", "Record not found", request, null);
    }

    /**
     * Handle optimistic locking failures.
     */
    @ExceptionHandler(ConcurrentRecordModificationException.class)
    public ResponseEntity<ErrorResponse> handleConcurrentModification(
            ConcurrentRecordModificationException ex,
            HttpServletRequest request) {

        if (log.isWarnEnabled()) {
            log.warn("Optimistic lock exception on {}", Encode.forJava(request.getRequestURI()));
        }

        return respond(HttpStatus.CONFLICT, "Concurrent Modification",
            "The resource was modified by another request. Please retry.", request, null);
    }

    /**
     * Handle illegal argument exceptions. Messages are fixed strings from this codebase.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            IllegalArgumentException ex,
            HttpServletRequest request) {

        if (log.isWarnEnabled()) {
            log.warn("Illegal argument on {}: {}",
                Encode.forJava(request.getRequestURI()), Encode.forJava(String.valueOf(ex.getMessage())));
        }

        return respond(HttpStatus.BAD_REQUEST, "Bad Request", "Invalid request: " + ex.getMessage(), request, null);
    }

    /**
     * The audit trail could not record the operation, so the operation was rejected.
     */
    @ExceptionHandler(AuditSinkFailureException.class)
    public ResponseEntity<ErrorResponse> handleAuditSinkFailure(
            AuditSinkFailureException ex,
            HttpServletRequest request) {

        log.error("Operation rejected, audit trail unavailable: {}", Encode.forJava(request.getRequestURI()));

        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable",
            "The operation could not be recorded and was not performed", request, null);
    }

    @ExceptionHandler(RecordOperationException.class)
    public ResponseEntity<ErrorResponse> handleRecordOperation(
            RecordOperationException ex,
            HttpServletRequest request) {

        log.error("Record operation failed on {}: {}", Encode.forJava(request.getRequestURI()), ex.getMessage());

        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", ex.getMessage(), request, null);
    }

    @ExceptionHandler(EncryptionFailureException.class)
    public ResponseEntity<ErrorResponse> handleEncryptionFailure(
            EncryptionFailureException ex,
            HttpServletRequest request) {

        log.error("Encryption failure on {}", Encode.forJava(request.getRequestURI()));

        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
            EncryptionFailureException.MESSAGE, request, null);
    }

    /**
     * Handle security exceptions.
     */
    /**
     * Handle failed logins. The response does not say whether the account exists.
     */
    @ExceptionHandler(AuthenticationException.class)
    public ResponseEntity<ErrorResponse> handleAuthenticationFailure(
            AuthenticationException ex,
            HttpServletRequest request) {

        if (log.isWarnEnabled()) {
            log.warn("Authentication failed: {} on {}", ex.getClass().getSimpleName(),
                Encode.forJava(request.getRequestURI()));
        }

        return respond(HttpStatus.UNAUTHORIZED, "Unauthorized", "Authentication failed", request, null);
    }

    @ExceptionHandler(SecurityException.class)
    public ResponseEntity<ErrorResponse> handleSecurityException(
            SecurityException ex,
            HttpServletRequest request) {

        if (log.isErrorEnabled()) {
            log.error("Security exception: {} on {}", ex.getMessage(), Encode.forJava(request.getRequestURI()));
        }

        return respond(HttpStatus.FORBIDDEN, "Security Violation", "Security policy violation detected", request, null);
    }

    /**
     * Handle all other exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            HttpServletRequest request) {

        if (log.isErrorEnabled()) {
            log.error("Unhandled exception on {}: {}",
                Encode.forJava(request.getRequestURI()), ex.getClass().getName());
        }

        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
            "An unexpected error occurred. Please contact support.", request, null);
    }

    private static ResponseEntity<ErrorResponse> respond(
            HttpStatus status,
            String error,
            String message,
            HttpServletRequest request,
            List<ErrorResponse.ValidationError> validationErrors) {

        ErrorResponse errorResponse = ErrorResponse.builder()
            .requestId(UUID.randomUUID())
            .timestamp(Instant.now())
            .status(status.value())
            .error(error)
            .message(message)
            .path(request.getRequestURI())
            .validationErrors(validationErrors)
            .build();

        return ResponseEntity.status(status).body(errorResponse);
    }
}
