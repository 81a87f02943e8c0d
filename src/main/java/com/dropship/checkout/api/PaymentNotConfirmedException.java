package com.dropship.checkout.api;

/**
 * Thrown when a gateway verify call reports that a payment did not succeed.
 * Handler returns HTTP 400 and the order stays pending.
 */
public class PaymentNotConfirmedException extends RuntimeException {

    public PaymentNotConfirmedException(String message) {
        super(message);
    }

    public PaymentNotConfirmedException(String message, Throwable cause) {
        super(message, cause);
    }
}
