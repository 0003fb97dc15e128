package com.di.ledger.transaction;

import com.di.ledger.exception.TransientStoreException;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.util.function.Supplier;

/**
 * {@link TransactionScope} over a single JDBC connection that the scope owns.
 * The connection is switched to auto-commit on construction and back after every
 * successful commit or rollback. A connection whose transaction could not be ended is
 * discarded and the scope closed.
 */
@Slf4j
public class JdbcTransactionScope implements TransactionScope {

    private final Connection connection;
    private boolean active;
    private boolean closed;

    public JdbcTransactionScope(Connection connection) {
        if (connection == null) {
            throw new IllegalArgumentException("connection cannot be null");
        }
        this.connection = connection;
        try {
            connection.setAutoCommit(true);
        } catch (SQLException e) {
            throw new TransientStoreException("Failed to prepare connection for transaction scope", e);
        }
    }

    @Override
    public void begin() {
        ensureOpen();
        if (active) {
            throw new IllegalStateException("Transaction already active; nested transactions are not supported");
        }
        try {
            connection.setAutoCommit(false);
            active = true;
            log.debug("[TX] begin");
        } catch (SQLException e) {
            throw new TransientStoreException("Failed to begin transaction", e);
        }
    }

    @Override
    public void commit() {
        ensureOpen();
        if (!active) {
            throw new IllegalStateException("No active transaction to commit");
        }
        try {
            connection.commit();
        } catch (SQLException e) {
            TransientStoreException failure = new TransientStoreException("Failed to commit transaction", e);
            abandonTransaction(failure);
            throw failure;
        }
        log.debug("[TX] commit");
        endTransaction();
    }

    /**
     * Rolls back the open transaction. If the driver cannot roll back, the connection is
     * discarded with auto-commit left off and the scope is closed: restoring auto-commit
     * would commit the work being undone.
     */
    @Override
    public void rollback() {
        ensureOpen();
        if (!active) {
            throw new IllegalStateException("No active transaction to roll back");
        }
        try {
            connection.rollback();
        } catch (SQLException e) {
            TransientStoreException failure = new TransientStoreException("Failed to roll back transaction", e);
            discardConnection(failure);
            throw failure;
        }
        log.debug("[TX] rollback");
        endTransaction();
    }

    @Override
    public boolean isActive() {
        return active;
    }

    @Override
    public Connection connection() {
        ensureOpen();
        return connection;
    }

    @Override
    public <T> T atomically(Supplier<T> work) {
        ensureOpen();
        if (!active) {
            begin();
            try {
                T result = work.get();
                commit();
                return result;
            } catch (RuntimeException e) {
                rollbackQuietly(e);
                throw e;
            }
        }

        Savepoint savepoint;
        try {
            savepoint = connection.setSavepoint();
        } catch (SQLException e) {
            throw new TransientStoreException("Failed to set savepoint", e);
        }
        try {
            T result = work.get();
            connection.releaseSavepoint(savepoint);
            return result;
        } catch (SQLException e) {
            throw new TransientStoreException("Failed to release savepoint", e);
        } catch (RuntimeException e) {
            try {
                connection.rollback(savepoint);
                log.debug("[TX] rolled back to savepoint after {}", e.getClass().getSimpleName());
            } catch (SQLException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
            }
            throw e;
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        if (active) {
            log.warn("[TX] scope closed with an open transaction; rolling back");
            try {
                connection.rollback();
                active = false;
            } catch (SQLException e) {
                discardConnection(new TransientStoreException("Failed to roll back transaction on close", e));
                return;
            }
        }
        try {
            connection.setAutoCommit(true);
        } catch (SQLException e) {
            log.warn("[TX] failed to reset connection on close: {}", e.getMessage());
        } finally {
            closed = true;
            try {
                connection.close();
            } catch (SQLException e) {
                log.warn("[TX] failed to release connection: {}", e.getMessage());
            }
        }
    }

    private void rollbackQuietly(RuntimeException cause) {
        if (!active || closed) {
            return;
        }
        try {
            rollback();
        } catch (RuntimeException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
        }
    }

    /** After a failed commit the transaction is still open on the connection; undo it. */
    private void abandonTransaction(TransientStoreException failure) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            failure.addSuppressed(e);
            discardConnection(failure);
            return;
        }
        try {
            endTransaction();
        } catch (TransientStoreException e) {
            failure.addSuppressed(e);
        }
    }

    /**
     * Gives up on a connection whose transaction state is unknown. Auto-commit is not touched;
     * the connection is aborted, then closed, so the store drops the uncommitted work and the
     * pool does not hand the connection out again.
     */
    private void discardConnection(TransientStoreException failure) {
        log.error("[TX] discarding connection after failed transaction end ({}): {}",
                failure.getCategory(), failure.getMessage());
        active = false;
        closed = true;
        try {
            connection.abort(Runnable::run);
        } catch (SQLException e) {
            failure.addSuppressed(e);
        }
        try {
            connection.close();
        } catch (SQLException e) {
            failure.addSuppressed(e);
        }
    }

    private void endTransaction() {
        active = false;
        try {
            connection.setAutoCommit(true);
        } catch (SQLException e) {
            throw new TransientStoreException("Failed to restore auto-commit", e);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Transaction scope is closed");
        }
    }
}
