package com.example.pharmacyrota.exception;

public class RotaNotFoundException extends BusinessException {

    public RotaNotFoundException(String resource, Object resourceId) {
        super("NOT_FOUND", resource + " not found: " + resourceId);
    }

    public RotaNotFoundException(String message) {
        super("NOT_FOUND", message);
    }
}
