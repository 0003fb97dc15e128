package com.di.ledger.exception;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Categories of store failures, used when logging and when translating
 * driver errors into the ledger's exception taxonomy.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>The cause chain is searched for the first {@link SQLException}; its SQL state
 * decides the category. Other throwables fall through to {@link #MATCHERS}.
 */
public enum ErrorCategory {

    CONNECTION_ERROR("Database connection error", "Failed to establish or maintain database connection"),
    CONSTRAINT_VIOLATION("Database constraint violation", "Unique, foreign key or check constraint failed"),
    SQL_SYNTAX_ERROR("SQL syntax error", "Invalid SQL for the configured dialect"),
    TRANSACTION_ROLLBACK("Transaction rollback", "Transaction was rolled back by the store (deadlock, serialization)"),
    LOCK_TIMEOUT("Lock timeout", "Timed out waiting for a row or table lock"),
    NETWORK_ERROR("Network error", "Network communication failure"),
    TIMEOUT_ERROR("Timeout error", "Operation exceeded maximum time limit"),
    DATABASE_ERROR("Database error", "General database operation error"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Order matters: first match wins. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(ErrorCategory::isNetworkError, NETWORK_ERROR);
        MATCHERS.put(ErrorCategory::isTimeoutError, TIMEOUT_ERROR);
    }

    private static final Map<String, ErrorCategory> SQL_STATE_PREFIX = Map.of(
            "08", CONNECTION_ERROR,
            "23", CONSTRAINT_VIOLATION,
            "42", SQL_SYNTAX_ERROR,
            "40", TRANSACTION_ROLLBACK
    );

    /** Exact states checked before the class prefix: H2 lock timeout, PostgreSQL lock_not_available. */
    private static final Map<String, ErrorCategory> SQL_STATE_EXACT = Map.of(
            "HYT00", LOCK_TIMEOUT,
            "55P03", LOCK_TIMEOUT
    );

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        SQLException sqlEx = findSqlException(exception);
        if (sqlEx != null) {
            return categorizeSqlException(sqlEx);
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return UNKNOWN;
    }

    private static SQLException findSqlException(Throwable t) {
        Throwable current = t;
        int depth = 0;
        while (current != null && depth++ < 16) {
            if (current instanceof SQLException sql) {
                return sql;
            }
            current = current.getCause();
        }
        return null;
    }

    private static ErrorCategory categorizeSqlException(SQLException sqlEx) {
        String sqlState = sqlEx.getSQLState();
        if (sqlState != null && SQL_STATE_EXACT.containsKey(sqlState)) {
            return SQL_STATE_EXACT.get(sqlState);
        }
        if (sqlState != null && sqlState.length() >= 2) {
            ErrorCategory byState = SQL_STATE_PREFIX.get(sqlState.substring(0, 2));
            if (byState != null) {
                return byState;
            }
        }
        String msg = sqlEx.getMessage();
        if (msg != null) {
            String lower = msg.toLowerCase();
            if (containsAny(lower, "lock", "timeout")) return LOCK_TIMEOUT;
            if (containsAny(lower, "connection", "refused", "closed")) return CONNECTION_ERROR;
            if (containsAny(lower, "constraint", "unique", "foreign key")) return CONSTRAINT_VIOLATION;
            if (containsAny(lower, "syntax", "parse error")) return SQL_SYNTAX_ERROR;
        }
        return DATABASE_ERROR;
    }

    private static boolean isNetworkError(Throwable t) {
        return t instanceof java.net.SocketException
                || t instanceof java.net.UnknownHostException;
    }

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof java.util.concurrent.TimeoutException
                || t instanceof java.net.SocketTimeoutException;
    }

    private static boolean containsAny(String text, String... keywords) {
        if (text == null) return false;
        for (String k : keywords) {
            if (text.contains(k)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return name();
    }
}
