package com.stockscan.db;

import org.apache.logging.log4j.Logger;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.Statement;
import java.util.Locale;
import java.util.Set;

/**
 * JDBC dynamic proxies that log every executed statement to the SQL logger.
 */
final class SqlLogProxy {
    private static final Set<String> EXECUTE_METHODS = Set.of(
            "execute", "executeQuery", "executeUpdate", "executeLargeUpdate", "executeBatch", "executeLargeBatch"
    );
    private static final int MAX_SQL_CHARS = 800;

    private SqlLogProxy() {
    }

    static Connection wrapConnection(Connection delegate, Logger logger) {
        return proxy(Connection.class, (self, method, args) -> {
            Object out = invoke(delegate, method, args);
            String name = method.getName();
            if ("prepareStatement".equals(name) && out instanceof PreparedStatement && args[0] instanceof String) {
                return proxy(PreparedStatement.class, new StatementHandler(out, (String) args[0], logger));
            }
            if ("createStatement".equals(name) && out instanceof Statement) {
                return proxy(Statement.class, new StatementHandler(out, null, logger));
            }
            return out;
        });
    }

    private static <T> T proxy(Class<T> type, InvocationHandler handler) {
        return type.cast(Proxy.newProxyInstance(type.getClassLoader(), new Class<?>[]{type}, handler));
    }

    private static Object invoke(Object target, Method method, Object[] args) throws Throwable {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            throw e.getTargetException();
        }
    }

    /**
     * Handles both plain and prepared statements; {@code preparedSql} is null for plain ones.
     */
    private static final class StatementHandler implements InvocationHandler {
        private final Object delegate;
        private final String preparedSql;
        private final Logger logger;
        private int pendingBatch;

        private StatementHandler(Object delegate, String preparedSql, Logger logger) {
            this.delegate = delegate;
            this.preparedSql = preparedSql;
            this.logger = logger;
        }

        @Override
        public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
            String name = method.getName();
            if ("addBatch".equals(name)) {
                pendingBatch++;
            }
            if (!EXECUTE_METHODS.contains(name)) {
                return SqlLogProxy.invoke(delegate, method, args);
            }
            String sql = preparedSql;
            if (sql == null) {
                sql = args != null && args.length > 0 && args[0] instanceof String ? (String) args[0] : "";
            }
            if (name.endsWith("Batch")) {
                sql = sql + " [batched_statements=" + pendingBatch + "]";
                pendingBatch = 0;
            }
            long started = System.nanoTime();
            try {
                Object out = SqlLogProxy.invoke(delegate, method, args);
                if (logger.isInfoEnabled()) {
                    logger.info("SQL ok method={} elapsed_ms={}{} sql={}", name, millis(started), summary(out), compact(sql));
                }
                return out;
            } catch (Throwable t) {
                logger.warn("SQL fail method={} elapsed_ms={} err={} sql={}", name, millis(started), t.getMessage(), compact(sql));
                throw t;
            }
        }
    }

    private static String millis(long startedNanos) {
        return String.format(Locale.US, "%.3f", (System.nanoTime() - startedNanos) / 1_000_000.0);
    }

    private static String summary(Object result) {
        if (result instanceof Integer || result instanceof Long) {
            return " rows=" + result;
        }
        if (result instanceof int[]) {
            return " batch_size=" + ((int[]) result).length;
        }
        if (result instanceof long[]) {
            return " batch_size=" + ((long[]) result).length;
        }
        return "";
    }

    private static String compact(String sql) {
        String normalized = sql == null ? "" : sql.replaceAll("\\s+", " ").trim();
        return normalized.length() <= MAX_SQL_CHARS ? normalized : normalized.substring(0, MAX_SQL_CHARS) + "...";
    }
}
