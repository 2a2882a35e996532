package com.example.pharmacyrota.exception;

/**
 * Generation input that can never produce a rota (no staff, no weekday, a week key
 * that is not a Monday). Raised before anything is written.
 */
public class RotaPreconditionException extends BusinessException {

    public RotaPreconditionException(String message) {
        super("ROTA_PRECONDITION", message);
    }
}
