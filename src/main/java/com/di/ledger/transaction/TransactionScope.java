package com.di.ledger.transaction;

import java.sql.Connection;
import java.util.function.Supplier;

/**
 * Transaction boundary and live connection handle for one logical operation.
 *
 * <p>Every ledger call receives its scope explicitly; nothing is bound to the calling thread.
 * Outside {@link #begin()}/{@link #commit()} the scope runs in auto-commit mode, so each
 * statement is committed as soon as it completes. Inside a transaction, reads through the
 * same scope observe its own uncommitted writes.
 *
 * <p>Scopes are not thread-safe and must not be shared between threads.
 */
public interface TransactionScope extends AutoCloseable {

    /**
     * Opens a transaction.
     *
     * @throws IllegalStateException if a transaction is already active (no nesting)
     */
    void begin();

    void commit();

    void rollback();

    boolean isActive();

    /** The connection all queries of this scope run on. Never cache it beyond the call. */
    Connection connection();

    /**
     * Runs {@code work} as one atomic unit. Without an active transaction, a transaction is
     * opened and committed (or rolled back) around the work. Inside the caller's transaction
     * a savepoint is used instead, so a failure undoes only the work's own writes and the
     * caller keeps control of its transaction.
     */
    <T> T atomically(Supplier<T> work);

    default void atomically(Runnable work) {
        atomically(() -> {
            work.run();
            return null;
        });
    }

    /** Rolls back an active transaction, then releases the connection. */
    @Override
    void close();
}
