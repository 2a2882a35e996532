package com.example.pharmacyrota.exception;

/**
 * The lifecycle does not allow the requested action on the document or week in
 * its current status.
 */
public class RotaStateException extends BusinessException {

    public RotaStateException(String message) {
        super("ROTA_STATE", message);
    }
}
