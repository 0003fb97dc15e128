package com.di.ledger.exception;

/**
 * The underlying storage call failed for reasons outside the ledger's control
 * (connectivity, lock timeout, broken connection). Never retried by the core;
 * retry policy belongs to the caller.
 */
public class TransientStoreException extends LedgerException {

    private final ErrorCategory category;

    public TransientStoreException(String message, Throwable cause) {
        super(message, cause);
        this.category = ErrorCategory.categorize(cause);
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
