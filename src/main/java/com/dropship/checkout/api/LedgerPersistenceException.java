package com.dropship.checkout.api;

/**
 * Thrown when the order ledger cannot be written or read. Handler returns HTTP 500.
 */
public class LedgerPersistenceException extends RuntimeException {

    public LedgerPersistenceException(String message) {
        super(message);
    }

    public LedgerPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
