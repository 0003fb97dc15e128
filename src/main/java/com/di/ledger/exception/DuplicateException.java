package com.di.ledger.exception;

/**
 * Thrown when creating a record whose unique identity (LFN) already exists.
 */
public class DuplicateException extends LedgerException {

    public DuplicateException(String message) {
        super(message);
    }

    public DuplicateException(String message, Throwable cause) {
        super(message, cause);
    }
}
