package com.example.pharmacyrota.exception;

/**
 * A reassignment addressed a slot whose stored shape no longer matches the window
 * the caller assumed.
 */
public class StaleReferenceException extends BusinessException {

    private final String location;

    public StaleReferenceException(String message, String location) {
        super("STALE_REFERENCE", message);
        this.location = location;
    }

    public String getLocation() {
        return location;
    }
}
