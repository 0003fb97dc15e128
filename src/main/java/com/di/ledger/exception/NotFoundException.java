package com.di.ledger.exception;

/**
 * Thrown when an operation references a file or block that does not exist
 * in the state visible to the caller's transaction scope.
 */
public class NotFoundException extends LedgerException {

    public NotFoundException(String message) {
        super(message);
    }
}
