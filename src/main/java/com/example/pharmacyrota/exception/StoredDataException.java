package com.example.pharmacyrota.exception;

/**
 * Persisted rota data could not be read back. Nothing the caller sent can fix it,
 * so it maps to a server error.
 */
public class StoredDataException extends BusinessException {

    public StoredDataException(String message, Throwable cause) {
        super("STORED_DATA_UNREADABLE", message, cause);
    }
}
