package com.dropship.checkout.api;

/**
 * Thrown when a webhook payload fails signature verification. Handler returns
 * HTTP 400 and no order state is touched.
 */
public class WebhookSignatureException extends RuntimeException {

    public WebhookSignatureException(String message) {
        super(message);
    }

    public WebhookSignatureException(String message, Throwable cause) {
        super(message, cause);
    }
}
