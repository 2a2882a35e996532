package com.example.pharmacyrota.exception;

/**
 * Root of the rota engine's business failures. The error code is what
 * {@link GlobalExceptionHandler} puts on the wire.
 */
public class BusinessException extends RuntimeException {

    private final String errorCode;

    public BusinessException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
