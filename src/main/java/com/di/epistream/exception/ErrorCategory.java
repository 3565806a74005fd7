package com.di.epistream.exception;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.transaction.TransactionException;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Classification attached to every partition failure in the run summary.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * The cause chain is walked; the first {@link SQLException} found decides by SQL state.
 */
public enum ErrorCategory {

    CONNECTION_ERROR("Database connection error", "Failed to establish or keep the store connection"),
    CONSTRAINT_VIOLATION("Database constraint violation", "A row broke a key, not-null or foreign-key constraint"),
    SQL_SYNTAX_ERROR("SQL syntax error", "Invalid SQL or unknown column"),
    TRANSACTION_ROLLBACK("Transaction rollback", "The partition transaction was rolled back by the database"),
    PERMISSION_ERROR("Permission denied", "Insufficient privileges on the store"),
    DATABASE_ERROR("Database error", "General store error"),
    TIMEOUT_ERROR("Timeout error", "Operation exceeded its time limit"),
    VALIDATION_ERROR("Validation error", "Malformed record reached the loader"),
    APPLICATION_ERROR("Application error", "General application error"),
    UNKNOWN("Unknown error", "Unclassified error");

    private static final Map<String, ErrorCategory> SQL_STATE_PREFIX = Map.of(
            "08", CONNECTION_ERROR,
            "23", CONSTRAINT_VIOLATION,
            "42", SQL_SYNTAX_ERROR,
            "40", TRANSACTION_ROLLBACK,
            "28", PERMISSION_ERROR,
            "57", TIMEOUT_ERROR
    );

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

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        SQLException sql = findSqlException(exception);
        if (sql != null) {
            return categorizeSqlException(sql);
        }
        List<Throwable> chain = causeChain(exception);
        if (anyInstance(chain, DataIntegrityViolationException.class)) return CONSTRAINT_VIOLATION;
        if (anyInstance(chain, QueryTimeoutException.class, TimeoutException.class, SocketTimeoutException.class)) return TIMEOUT_ERROR;
        if (anyInstance(chain, TransientDataAccessResourceException.class, ConnectException.class)) return CONNECTION_ERROR;
        if (anyInstance(chain, TransactionException.class)) return TRANSACTION_ROLLBACK;
        if (anyInstance(chain, IllegalArgumentException.class, IllegalStateException.class, NullPointerException.class)) return VALIDATION_ERROR;
        return APPLICATION_ERROR;
    }

    private static SQLException findSqlException(Throwable exception) {
        for (Throwable t : causeChain(exception)) {
            if (t instanceof SQLException sqlEx) return sqlEx;
        }
        return null;
    }

    private static List<Throwable> causeChain(Throwable exception) {
        List<Throwable> chain = new ArrayList<>();
        for (Throwable t = exception; t != null && !chain.contains(t); t = t.getCause()) {
            chain.add(t);
        }
        return chain;
    }

    @SafeVarargs
    private static boolean anyInstance(List<Throwable> chain, Class<? extends Throwable>... types) {
        for (Throwable t : chain) {
            for (Class<? extends Throwable> type : types) {
                if (type.isInstance(t)) return true;
            }
        }
        return false;
    }

    private static ErrorCategory categorizeSqlException(SQLException sqlEx) {
        String sqlState = sqlEx.getSQLState();
        if (sqlState != null && sqlState.length() >= 2) {
            ErrorCategory byState = SQL_STATE_PREFIX.get(sqlState.substring(0, 2));
            if (byState != null) {
                return byState;
            }
        }
        String msg = sqlEx.getMessage();
        if (msg != null) {
            String lower = msg.toLowerCase();
            if (containsAny(lower, "connection", "refused", "closed")) return CONNECTION_ERROR;
            if (containsAny(lower, "timeout", "timed out")) return TIMEOUT_ERROR;
            if (containsAny(lower, "permission", "access denied")) return PERMISSION_ERROR;
            if (containsAny(lower, "constraint", "unique", "foreign key", "not-null", "null value")) return CONSTRAINT_VIOLATION;
            if (containsAny(lower, "syntax", "parse error")) return SQL_SYNTAX_ERROR;
        }
        return DATABASE_ERROR;
    }

    private static boolean containsAny(String text, String... keywords) {
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
