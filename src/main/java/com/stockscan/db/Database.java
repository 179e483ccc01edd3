package com.stockscan.db;

import com.stockscan.config.Config;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.postgresql.ds.PGSimpleDataSource;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Locale;

/**
 * Where the market store gets its PostgreSQL connections. The configured schema is the connection's
 * current schema, and a failed connect surfaces as a retryable {@link StoreException}.
 */
public final class Database {
    private static final Logger LOG = LogManager.getLogger(Database.class);
    private static final Logger SQL_LOG = LogManager.getLogger("SQL");
    private static final String DEFAULT_SCHEMA = "stockscan";

    private final PGSimpleDataSource dataSource;
    private final String jdbcUrl;
    private final String schema;
    private final boolean sqlLogEnabled;

    public Database(String jdbcUrl, String user, String pass, String schema, boolean sqlLogEnabled) {
        String url = jdbcUrl == null ? "" : jdbcUrl.trim();
        if (!url.toLowerCase(Locale.ROOT).startsWith("jdbc:postgresql:")) {
            throw new IllegalArgumentException("db.url must be a PostgreSQL JDBC URL (jdbc:postgresql://...), got '" + url + "'");
        }
        this.jdbcUrl = url;
        this.schema = normalizeSchema(schema);
        this.sqlLogEnabled = sqlLogEnabled;

        dataSource = new PGSimpleDataSource();
        dataSource.setUrl(url);
        if (user != null && !user.isBlank()) {
            dataSource.setUser(user.trim());
        }
        if (pass != null) {
            dataSource.setPassword(pass);
        }
        dataSource.setCurrentSchema(this.schema);
        dataSource.setApplicationName("stockscan");
    }

    public static Database fromConfig(Config config) {
        return new Database(
                config.requireString("db.url"),
                config.getString("db.user"),
                config.getString("db.pass"),
                config.getString("db.schema", DEFAULT_SCHEMA),
                config.getBoolean("db.sql_log.enabled", false)
        );
    }

    /**
     * Opens a connection for one store operation; {@code action} only labels the failure.
     */
    Connection open(String action) throws StoreException {
        try {
            Connection raw = dataSource.getConnection();
            return sqlLogEnabled ? SqlLogProxy.wrapConnection(raw, SQL_LOG) : raw;
        } catch (SQLException e) {
            StoreException failure = connectFailure(action, maskedJdbcUrl(), e);
            LOG.error(failure.getMessage());
            throw failure;
        }
    }

    public String schema() {
        return schema;
    }

    public String maskedJdbcUrl() {
        return jdbcUrl
                .replaceAll("(?i)(password=)[^&]+", "$1***")
                .replaceAll("(://[^:/@]+:)[^@]+(@)", "$1***$2");
    }

    static StoreException connectFailure(String action, String maskedUrl, SQLException e) {
        return new StoreException(StoreError.UNAVAILABLE,
                action + " failed: db connect url=" + maskedUrl
                        + " reason=" + connectFailureReason(e.getSQLState())
                        + " sqlstate=" + e.getSQLState()
                        + " cause=" + e.getMessage(), e);
    }

    // SQLState classes: 08 connection, 28 authorization, 3D catalog, 42501 privilege.
    static String connectFailureReason(String sqlState) {
        if (sqlState == null) {
            return "connection_error";
        }
        if (sqlState.startsWith("08")) {
            return "unreachable";
        }
        if (sqlState.startsWith("28")) {
            return "auth";
        }
        if (sqlState.startsWith("3D")) {
            return "missing_database";
        }
        if ("42501".equals(sqlState)) {
            return "permission";
        }
        return "connection_error";
    }

    static String normalizeSchema(String raw) {
        String value = raw == null || raw.isBlank() ? DEFAULT_SCHEMA : raw.trim();
        if (!value.matches("[A-Za-z_][A-Za-z0-9_]*")) {
            throw new IllegalArgumentException("invalid db.schema '" + value + "', allowed pattern: [A-Za-z_][A-Za-z0-9_]*");
        }
        return value;
    }
}
