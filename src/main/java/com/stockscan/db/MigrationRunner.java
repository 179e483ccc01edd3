package com.stockscan.db;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Idempotent PostgreSQL schema migration runner.
 */
public final class MigrationRunner {
    private static final Logger LOG = LogManager.getLogger(MigrationRunner.class);
    static final int TARGET_VERSION = 1;

    public void run(Database database) throws StoreException {
        String schema = database.schema();
        try (Connection conn = database.open("migrate schema " + schema); Statement st = conn.createStatement()) {
            st.execute("CREATE SCHEMA IF NOT EXISTS " + schema);
            st.execute("SET search_path TO " + schema + ", public");
            st.execute("CREATE TABLE IF NOT EXISTS metadata (" +
                    "meta_key TEXT PRIMARY KEY," +
                    "meta_value TEXT NOT NULL," +
                    "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                    ")");

            int currentVersion = readSchemaVersion(conn);
            String lastSql = "";
            try {
                for (String sql : buildStatements()) {
                    lastSql = sql;
                    st.execute(sql);
                }
                writeSchemaVersion(conn, TARGET_VERSION);
                LOG.info("schema ready schema={} version {} -> {}", schema, currentVersion, TARGET_VERSION);
            } catch (SQLException e) {
                String detail = "migration_failed: schema_version=" + currentVersion
                        + ", target_version=" + TARGET_VERSION
                        + ", failed_sql=" + summarizeSql(lastSql)
                        + ", cause=" + safe(e.getMessage());
                LOG.error(detail);
                throw new StoreException(StoreError.UNAVAILABLE, detail, e);
            }
        } catch (SQLException e) {
            throw StoreException.fromSql("migrate schema " + schema, e);
        }
    }

    static List<String> buildStatements() {
        List<String> sqls = new ArrayList<>();
        sqls.add("CREATE TABLE IF NOT EXISTS universe (" +
                "code TEXT PRIMARY KEY," +
                "name TEXT NOT NULL," +
                "status TEXT NOT NULL," +
                "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS bars_daily (" +
                "id BIGSERIAL PRIMARY KEY," +
                "code TEXT NOT NULL," +
                "trade_date DATE NOT NULL," +
                "open DOUBLE PRECISION NOT NULL," +
                "high DOUBLE PRECISION NOT NULL," +
                "low DOUBLE PRECISION NOT NULL," +
                "close DOUBLE PRECISION NOT NULL," +
                "volume DOUBLE PRECISION NOT NULL," +
                "created_at TIMESTAMPTZ NOT NULL DEFAULT now()," +
                "UNIQUE (code, trade_date)" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS indicators_daily (" +
                "id BIGSERIAL PRIMARY KEY," +
                "code TEXT NOT NULL," +
                "trade_date DATE NOT NULL," +
                "name TEXT NOT NULL," +
                "value DOUBLE PRECISION NULL," +
                "UNIQUE (code, trade_date, name)" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS strategy_results (" +
                "id BIGSERIAL PRIMARY KEY," +
                "trade_date DATE NOT NULL," +
                "strategy TEXT NOT NULL," +
                "code TEXT NOT NULL," +
                "score DOUBLE PRECISION NOT NULL," +
                "params_json TEXT NOT NULL," +
                "created_at TIMESTAMPTZ NOT NULL DEFAULT now()," +
                "UNIQUE (trade_date, strategy, code)" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS date_runs (" +
                "trade_date DATE PRIMARY KEY," +
                "state TEXT NOT NULL," +
                "cause TEXT NULL," +
                "universe_size INTEGER NOT NULL DEFAULT 0," +
                "fetched INTEGER NOT NULL DEFAULT 0," +
                "fetch_failed INTEGER NOT NULL DEFAULT 0," +
                "matches INTEGER NOT NULL DEFAULT 0," +
                "strategy_failures INTEGER NOT NULL DEFAULT 0," +
                "message TEXT NULL," +
                "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                ")");

        sqls.add("CREATE INDEX IF NOT EXISTS idx_bars_daily_date ON bars_daily(trade_date)");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_bars_daily_code_date ON bars_daily(code, trade_date DESC)");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_indicators_daily_date ON indicators_daily(trade_date)");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_strategy_results_date ON strategy_results(trade_date, strategy)");
        return sqls;
    }

    private int readSchemaVersion(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT meta_value FROM metadata WHERE meta_key='schema_version'");
             ResultSet rs = ps.executeQuery()) {
            if (rs.next()) {
                String value = rs.getString(1);
                if (value != null && value.trim().matches("\\d+")) {
                    return Integer.parseInt(value.trim());
                }
            }
        }
        return 0;
    }

    private void writeSchemaVersion(Connection conn, int version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO metadata(meta_key, meta_value, updated_at) VALUES('schema_version', ?, now()) " +
                        "ON CONFLICT(meta_key) DO UPDATE SET meta_value=excluded.meta_value, updated_at=excluded.updated_at"
        )) {
            ps.setString(1, Integer.toString(version));
            ps.executeUpdate();
        }
    }

    private String summarizeSql(String sql) {
        if (sql == null || sql.trim().isEmpty()) {
            return "-";
        }
        String oneLine = sql.replace('\n', ' ').replace('\r', ' ').replaceAll("\\s+", " ").trim();
        if (oneLine.length() <= 180) {
            return oneLine;
        }
        return oneLine.substring(0, 177) + "...";
    }

    private String safe(String value) {
        return value == null ? "" : value;
    }
}
