package com.di.ledger.exception;

/**
 * Thrown when a required precondition is not met, e.g. creating a file
 * before its algorithm or dataset path has been set, or adding a lineage
 * edge that would make a file its own ancestor.
 */
public class ValidationException extends LedgerException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
