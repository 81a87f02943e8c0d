package com.dropship.checkout.api;

/**
 * Thrown when a gateway or rate provider call fails: transport error, timeout,
 * non-success response or open circuit. Handler returns HTTP 500. The caller may retry the
 * whole checkout; nothing is rolled back locally.
 */
public class UpstreamException extends RuntimeException {

    public UpstreamException(String message) {
        super(message);
    }

    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
