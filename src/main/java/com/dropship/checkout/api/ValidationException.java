package com.dropship.checkout.api;

/**
 * Thrown when a checkout request is malformed or economically invalid (empty cart,
 * zero total, supplier cost above price). Handler returns HTTP 400; the caller must fix the input.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
