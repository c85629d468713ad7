package com.requirement.sync.api;

/**
 * Base class of errors that abort the reconciliation of one module.
 */
public class ReconciliationException extends RuntimeException {

    public ReconciliationException(String message) {
        super(message);
    }

    public ReconciliationException(String message, Throwable cause) {
        super(message, cause);
    }
}
