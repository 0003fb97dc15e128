package com.di.ledger.transaction;

import com.di.ledger.exception.TransientStoreException;
import lombok.RequiredArgsConstructor;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.util.function.Function;

/**
 * Opens one {@link TransactionScope} per logical operation from the ledger's pool.
 * Callers own the returned scope and must close it.
 */
@RequiredArgsConstructor
public class TransactionScopes {

    private final DataSource dataSource;

    public TransactionScope open() {
        try {
            return new JdbcTransactionScope(dataSource.getConnection());
        } catch (SQLException e) {
            throw new TransientStoreException("Failed to obtain a connection from the ledger pool", e);
        }
    }

    /**
     * Runs {@code work} in a fresh scope inside one transaction: committed when the work
     * returns, rolled back when it throws.
     */
    public <T> T inTransaction(Function<TransactionScope, T> work) {
        try (TransactionScope scope = open()) {
            return scope.atomically(() -> work.apply(scope));
        }
    }
}
