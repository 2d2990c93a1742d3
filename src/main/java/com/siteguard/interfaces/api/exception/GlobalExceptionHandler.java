package com.siteguard.interfaces.api.exception;

import com.siteguard.application.exceptions.CatalogConflictException;
import com.siteguard.application.exceptions.FieldViolation;
import com.siteguard.application.exceptions.InvalidQueryParameterException;
import com.siteguard.application.exceptions.ManifestValidationException;
import com.siteguard.application.exceptions.ModuleNotFoundException;
import com.siteguard.application.exceptions.SiteAccessDeniedException;
import com.siteguard.application.exceptions.SiteNotFoundException;
import com.siteguard.application.exceptions.TransientStorageException;
import com.siteguard.interfaces.api.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API.
 *
 * Provides centralized exception handling with:
 * - Standard error format
 * - Field-level validation details for rejected submissions
 * - Retry hints for transient storage failures
 * - No internal details (SQL, stack traces) in responses
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    static final String RETRY_AFTER_SECONDS = "5";

    /**
     * Handle rejected manifests and catalog release lists. Nothing was written.
     */
    @ExceptionHandler(ManifestValidationException.class)
    public ResponseEntity<ErrorResponse> handleManifestValidation(
            ManifestValidationException ex,
            HttpServletRequest request) {

        List<ErrorResponse.ValidationError> validationErrors = ex.getViolations().stream()
            .map(GlobalExceptionHandler::toValidationError)
            .collect(Collectors.toList());

        ErrorResponse errorResponse = baseResponse(HttpStatus.BAD_REQUEST, "Validation Failed", ex.getMessage(), request)
            .validationErrors(validationErrors.isEmpty() ? null : validationErrors)
            .build();

        if (log.isWarnEnabled()) {
            log.warn("Submission rejected: {} ({} violations) on {}",
                ex.getMessage(), validationErrors.size(), request.getRequestURI());
        }

        return ResponseEntity.badRequest().body(errorResponse);
    }

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
            .map(error -> {
                String fieldName = error instanceof FieldError
                    ? ((FieldError) error).getField()
                    : error.getObjectName();
                Object rejectedValue = error instanceof FieldError
                    ? ((FieldError) error).getRejectedValue()
                    : null;

                return ErrorResponse.ValidationError.builder()
                    .field(fieldName)
                    .message(error.getDefaultMessage())
                    .rejectedValue(rejectedValue)
                    .build();
            })
            .collect(Collectors.toList());

        ErrorResponse errorResponse = baseResponse(HttpStatus.BAD_REQUEST, "Validation Failed",
                "Invalid request parameters", request)
            .validationErrors(validationErrors)
            .build();

        if (log.isWarnEnabled()) {
            log.warn("Validation error: {} validation failures on {}",
                validationErrors.size(), request.getRequestURI());
        }

        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MethodArgumentTypeMismatchException.class,
        MissingServletRequestParameterException.class
    })
    public ResponseEntity<ErrorResponse> handleMalformedRequest(
            Exception ex,
            HttpServletRequest request) {

        if (log.isWarnEnabled()) {
            log.warn("Malformed request on {}: {}", request.getRequestURI(), ex.getClass().getSimpleName());
        }

        return ResponseEntity.badRequest().body(
            baseResponse(HttpStatus.BAD_REQUEST, "Bad Request", "Malformed request", request).build());
    }

    /**
     * Handle rejected query parameters (unknown category or sort field).
     */
    @ExceptionHandler(InvalidQueryParameterException.class)
    public ResponseEntity<ErrorResponse> handleInvalidQueryParameter(
            InvalidQueryParameterException ex,
            HttpServletRequest request) {

        if (log.isWarnEnabled()) {
            log.warn("Invalid query parameter: {} on {}", ex.getMessage(), request.getRequestURI());
        }

        return ResponseEntity.badRequest().body(
            baseResponse(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), request).build());
    }

    /**
     * Handle paging bounds rejected by method validation. Only the constraint messages are returned.
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex,
            HttpServletRequest request) {

        String detail = ex.getConstraintViolations().stream()
            .map(violation -> lastNode(violation.getPropertyPath().toString()) + " " + violation.getMessage())
            .sorted()
            .collect(Collectors.joining(", "));

        if (log.isWarnEnabled()) {
            log.warn("Constraint violation: {} on {}", detail, request.getRequestURI());
        }

        return ResponseEntity.badRequest().body(
            baseResponse(HttpStatus.BAD_REQUEST, "Bad Request", "Invalid request: " + detail, request).build());
    }

    /**
     * Handle access denied decisions from SecurityKernel.
     */
    @ExceptionHandler(SiteAccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDenied(
            SiteAccessDeniedException ex,
            HttpServletRequest request) {

        if (log.isWarnEnabled()) {
            log.warn("Access denied: {} on {}", ex.getMessage(), request.getRequestURI());
        }

        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(
            baseResponse(HttpStatus.FORBIDDEN, "Access Denied",
                "You do not have permission to access this resource", request).build());
    }

    @ExceptionHandler({SiteNotFoundException.class, ModuleNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(
            RuntimeException ex,
            HttpServletRequest request) {

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(
            baseResponse(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), request).build());
    }

    /**
     * Handle catalog rows that could not be reconciled under concurrent inserts.
     */
    @ExceptionHandler(CatalogConflictException.class)
    public ResponseEntity<ErrorResponse> handleCatalogConflict(
            CatalogConflictException ex,
            HttpServletRequest request) {

        if (log.isErrorEnabled()) {
            log.error("Catalog conflict on {}: {}", request.getRequestURI(), ex.getMessage());
        }

        return ResponseEntity.status(HttpStatus.CONFLICT).body(
            baseResponse(HttpStatus.CONFLICT, "Conflict",
                "Concurrent catalog update could not be reconciled", request)
                .retryable(true)
                .build());
    }

    /**
     * Handle storage unavailability and synchronization timeouts. Nothing was applied.
     */
    @ExceptionHandler(TransientStorageException.class)
    public ResponseEntity<ErrorResponse> handleTransientStorage(
            TransientStorageException ex,
            HttpServletRequest request) {

        if (log.isWarnEnabled()) {
            log.warn("Transient storage failure on {}: {}", request.getRequestURI(), ex.getMessage());
        }

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
            .body(baseResponse(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable", ex.getMessage(), request)
                .retryable(true)
                .build());
    }

    /**
     * Handle security exceptions.
     */
    @ExceptionHandler(SecurityException.class)
    public ResponseEntity<ErrorResponse> handleSecurityException(
            SecurityException ex,
            HttpServletRequest request) {

        if (log.isErrorEnabled()) {
            log.error("Security exception: {} on {}", ex.getMessage(), request.getRequestURI());
        }

        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(
            baseResponse(HttpStatus.FORBIDDEN, "Security Violation",
                "Security policy violation detected", request).build());
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
                request.getRequestURI(), ex.getMessage(), ex);
        }

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(
            baseResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please contact support.", request).build());
    }

    private static ErrorResponse.ErrorResponseBuilder baseResponse(HttpStatus status, String error,
                                                                   String message, HttpServletRequest request) {
        return ErrorResponse.builder()
            .requestId(UUID.randomUUID())
            .timestamp(Instant.now())
            .status(status.value())
            .error(error)
            .message(message)
            .path(request.getRequestURI());
    }

    private static ErrorResponse.ValidationError toValidationError(FieldViolation violation) {
        return ErrorResponse.ValidationError.builder()
            .field(violation.field())
            .message(violation.message())
            .rejectedValue(violation.rejectedValue())
            .build();
    }

    private static String lastNode(String path) {
        int dot = path.lastIndexOf('.');
        return dot < 0 ? path : path.substring(dot + 1);
    }
}
