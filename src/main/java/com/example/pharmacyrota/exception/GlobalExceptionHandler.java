package com.example.pharmacyrota.exception;

import com.example.pharmacyrota.common.error.ErrorLogBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final ErrorLogBuffer errorLogBuffer;

    public GlobalExceptionHandler(ErrorLogBuffer errorLogBuffer) {
        this.errorLogBuffer = errorLogBuffer;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach((error) -> {
            String fieldName = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });

        ErrorResponse errorResponse = new ErrorResponse(
                "VALIDATION_ERROR",
                "Request payload is invalid",
                errors,
                LocalDateTime.now()
        );

        logger.warn("Validation failed: {}", errors);
        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception ex) {
        logger.warn("Malformed request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(
                "MALFORMED_REQUEST", "Request could not be read", null, LocalDateTime.now()));
    }

    @ExceptionHandler(RotaPreconditionException.class)
    public ResponseEntity<ErrorResponse> handlePrecondition(RotaPreconditionException ex) {
        logger.warn("Precondition failed: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(from(ex));
    }

    @ExceptionHandler(RotaNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(RotaNotFoundException ex) {
        logger.warn("Not found: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(from(ex));
    }

    @ExceptionHandler({RotaStateException.class, StaleReferenceException.class})
    public ResponseEntity<ErrorResponse> handleConflict(BusinessException ex) {
        logger.warn("Rejected by rota state: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(from(ex));
    }

    @ExceptionHandler(StoredDataException.class)
    public ResponseEntity<ErrorResponse> handleStoredData(StoredDataException ex) {
        logger.error("Stored rota data is unreadable: {}", ex.getMessage(), ex);
        errorLogBuffer.addError(ex.getMessage(), ex.getCause());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(from(ex));
    }

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse> handleBusiness(BusinessException ex) {
        logger.error("Business rule failed: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(from(ex));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException ex) {
        ErrorResponse errorResponse = new ErrorResponse(
                "ARGUMENT_ERROR",
                ex.getMessage(),
                null,
                LocalDateTime.now()
        );

        logger.warn("Invalid argument: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        ErrorResponse errorResponse = new ErrorResponse(
                "INTERNAL_ERROR",
                "An unexpected error occurred",
                null,
                LocalDateTime.now()
        );

        logger.error("Unexpected error", ex);
        errorLogBuffer.addError("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    private static ErrorResponse from(BusinessException ex) {
        return new ErrorResponse(ex.getErrorCode(), ex.getMessage(), null, LocalDateTime.now());
    }

    public record ErrorResponse(
            String error,
            String message,
            Map<String, String> details,
            LocalDateTime timestamp
    ) {}
}
