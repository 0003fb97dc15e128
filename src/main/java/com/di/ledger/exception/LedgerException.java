package com.di.ledger.exception;

/**
 * Base class of every failure raised by the ledger core.
 *
 * <p>Callers are expected to roll back the enclosing transaction scope on any
 * {@code LedgerException}; the store is then unchanged from before the unit of work began.
 */
public abstract class LedgerException extends RuntimeException {

    protected LedgerException(String message) {
        super(message);
    }

    protected LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
