package com.dropship.checkout.api;

/**
 * Thrown when a credential or secret the operation needs is not configured.
 * Handler returns HTTP 500; only an operator can fix it.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
