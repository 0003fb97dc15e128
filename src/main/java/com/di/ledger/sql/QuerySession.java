package com.di.ledger.sql;

import com.di.ledger.exception.DuplicateException;
import com.di.ledger.exception.ErrorCategory;
import com.di.ledger.exception.LedgerException;
import com.di.ledger.exception.TransientStoreException;
import com.di.ledger.exception.ValidationException;
import com.di.ledger.transaction.TransactionScope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Named queries of a {@link QueryCatalog} bound to the connection of one {@link TransactionScope}.
 *
 * <p>Short-lived: create one per ledger call via {@link QueryCatalog#bind(TransactionScope)} and
 * drop it when the call returns. All Spring {@link DataAccessException}s are translated here
 * into the ledger's exception taxonomy.
 */
@Slf4j
public final class QuerySession {

    private final QueryCatalog catalog;
    private final JdbcTemplate jdbc;

    QuerySession(QueryCatalog catalog, TransactionScope scope) {
        this.catalog = catalog;
        // suppressClose: the scope owns the connection and decides when it is released
        this.jdbc = new JdbcTemplate(new SingleConnectionDataSource(scope.connection(), true));
    }

    public int update(QueryOperation op, Object... args) {
        return run(op, () -> jdbc.update(catalog.sql(op), args));
    }

    public int[] batchUpdate(QueryOperation op, List<Object[]> batchArgs) {
        if (batchArgs.isEmpty()) {
            return new int[0];
        }
        return run(op, () -> jdbc.batchUpdate(catalog.sql(op), batchArgs));
    }

    public <T> List<T> query(QueryOperation op, RowMapper<T> mapper, Object... args) {
        return run(op, () -> jdbc.query(catalog.sql(op), mapper, args));
    }

    public <T> Optional<T> queryForOptional(QueryOperation op, RowMapper<T> mapper, Object... args) {
        List<T> rows = query(op, mapper, args);
        return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
    }

    public long count(QueryOperation op, Object... args) {
        Long value = run(op, () -> jdbc.queryForObject(catalog.sql(op), Long.class, args));
        return value == null ? 0L : value;
    }

    private <T> T run(QueryOperation op, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            throw translate(op, e);
        }
    }

    static LedgerException translate(QueryOperation op, DataAccessException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        String detail = e.getMostSpecificCause().getMessage();
        if (e instanceof DuplicateKeyException) {
            log.debug("[LEDGER] {} hit a unique constraint: {}", op.getOperationName(), detail);
            return new DuplicateException(op.getOperationName() + " violated a unique constraint", e);
        }
        if (e instanceof DataIntegrityViolationException) {
            log.warn("[LEDGER] {} rejected by the store (category={}): {}", op.getOperationName(), category, detail);
            return new ValidationException(op.getOperationName() + " rejected by the store: " + detail, e);
        }
        log.warn("[LEDGER] {} failed (category={}): {}", op.getOperationName(), category, detail);
        return new TransientStoreException(op.getOperationName() + " failed: " + detail, e);
    }
}
