package com.stockscan.db;

import java.sql.SQLException;

/**
 * Store operation failed. CONSTRAINT_VIOLATION means a logic bug upstream and must never be retried.
 */
public class StoreException extends Exception {
    private final StoreError error;

    public StoreException(StoreError error, String message) {
        super(message);
        this.error = error;
    }

    public StoreException(StoreError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public StoreError error() {
        return error;
    }

    public boolean isRetryable() {
        return error == StoreError.UNAVAILABLE;
    }

    /**
     * SQLState class 23 (integrity constraint violation) maps to CONSTRAINT_VIOLATION; anything else is UNAVAILABLE.
     */
    public static StoreException fromSql(String action, SQLException e) {
        String state = e.getSQLState();
        StoreError kind = state != null && state.startsWith("23")
                ? StoreError.CONSTRAINT_VIOLATION
                : StoreError.UNAVAILABLE;
        return new StoreException(kind, action + " failed: sqlstate=" + state + ", cause=" + e.getMessage(), e);
    }
}
