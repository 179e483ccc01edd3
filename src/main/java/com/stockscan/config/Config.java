package com.stockscan.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * 模块说明：Config（class）。
 * 主要职责：分层读取配置，优先级为 本地 config.properties &gt; classpath config.properties &gt; 内置默认值。
 * 使用建议：新增配置键时同步补充 buildDefaults，保证无配置文件时也能运行。
 */
public final class Config {

    private static final Map<String, String> DEFAULTS = buildDefaults();
    private static final Map<String, String> ENV_KEYS = Map.of(
            "db.url", "STOCKSCAN_DB_URL",
            "db.user", "STOCKSCAN_DB_USER",
            "db.pass", "STOCKSCAN_DB_PASS"
    );

    private final Properties props = new Properties();
    private final Properties resourceProps = new Properties();
    private final Properties overrideProps = new Properties();
    private final Map<String, String> env;
    private final Path workingDir;

    private Config(Path workingDir, Map<String, String> env) {
        this.workingDir = workingDir;
        this.env = env == null ? Map.of() : env;
    }

    /**
     * 方法说明：load，按 classpath、工作目录的顺序叠加 config.properties。
     */
    public static Config load(Path workingDir) throws IOException {
        Config config = new Config(workingDir, System.getenv());

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                config.resourceProps.load(in);
                config.props.putAll(config.resourceProps);
            }
        }

        Path local = workingDir.resolve("config.properties");
        if (Files.exists(local)) {
            try (InputStream in = Files.newInputStream(local)) {
                config.overrideProps.load(in);
                config.props.putAll(config.overrideProps);
            } catch (IOException e) {
                throw new IOException("failed to read " + local.toAbsolutePath() + ": " + e.getMessage(), e);
            }
        }

        return config;
    }

    /**
     * Config backed only by defaults plus the given overrides. No files or environment are read.
     */
    public static Config of(Path workingDir, Map<String, String> overrides) {
        Config config = new Config(workingDir, Map.of());
        if (overrides != null) {
            config.overrideProps.putAll(overrides);
            config.props.putAll(overrides);
        }
        return config;
    }

    public Path workingDir() {
        return workingDir;
    }

    public String getString(String key) {
        String envName = ENV_KEYS.get(key);
        if (envName != null) {
            String fromEnv = nonBlank(env.get(envName));
            if (!fromEnv.isEmpty()) {
                return fromEnv;
            }
        }
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return value;
    }

    public boolean getBoolean(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return false;
        }
        return "true".equalsIgnoreCase(value)
                || "1".equals(value)
                || "yes".equalsIgnoreCase(value)
                || "y".equalsIgnoreCase(value);
    }

    public boolean getBoolean(String key, boolean fallback) {
        if (getString(key).isEmpty()) {
            return fallback;
        }
        return getBoolean(key);
    }

    public int getInt(String key) {
        return getInt(key, parseInt(DEFAULTS.get(key), 0));
    }

    public int getInt(String key, int fallback) {
        return parseInt(getString(key), fallback);
    }

    public long getLong(String key, long fallback) {
        String value = getString(key);
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    public double getDouble(String key) {
        return getDouble(key, parseDouble(DEFAULTS.get(key), 0.0));
    }

    public double getDouble(String key, double fallback) {
        return parseDouble(getString(key), fallback);
    }

    /**
     * Resolves against the working directory; empty when the key is unset.
     */
    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return null;
        }
        return workingDir.resolve(value).normalize();
    }

    public List<String> getList(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String token : value.split("[,;]")) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    public String requireString(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            throw new IllegalArgumentException("missing required config: " + key);
        }
        return value;
    }

    public Map<String, String> defaults() {
        return DEFAULTS;
    }

    public ResolvedValue resolve(String key) {
        return new ResolvedValue(key == null ? "" : key, getString(key), sourceOf(key));
    }

    public String sourceOf(String key) {
        if (key == null || key.trim().isEmpty()) {
            return "default";
        }
        String envName = ENV_KEYS.get(key);
        if (envName != null && !nonBlank(env.get(envName)).isEmpty()) {
            return "env";
        }
        if (!nonBlank(overrideProps.getProperty(key)).isEmpty()) {
            return "override";
        }
        if (!nonBlank(resourceProps.getProperty(key)).isEmpty()) {
            return "resource";
        }
        return "default";
    }

    private static String nonBlank(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.trim();
    }

    private static int parseInt(String value, int fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    private static double parseDouble(String value, double fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("outputs.dir", "outputs");
        defaults.put("app.zone", "Asia/Shanghai");

        defaults.put("db.url", "jdbc:postgresql://localhost:5432/stockscan");
        defaults.put("db.user", "stockscan");
        defaults.put("db.pass", "stockscan");
        defaults.put("db.schema", "stockscan");
        defaults.put("db.sql_log.enabled", "false");
        defaults.put("store.type", "postgres");
        defaults.put("store.commit.max_retries", "2");
        defaults.put("store.commit.retry_sleep_ms", "500");

        defaults.put("fetch.workers", "8");
        defaults.put("fetch.max_attempts", "4");
        defaults.put("fetch.backoff_base_ms", "500");
        defaults.put("fetch.backoff_max_ms", "8000");
        defaults.put("fetch.rotate_after_rate_limits", "2");
        defaults.put("fetch.request_timeout_sec", "20");
        defaults.put("fetch.request_pause_ms", "0");
        defaults.put("fetch.history_days", "500");
        defaults.put("fetch.base_url", "https://stooq.com/q/d/l/?s=%s&i=d&d1=%s&d2=%s");
        defaults.put("fetch.symbol_format", "%s");
        defaults.put("fetch.auth_header", "Cookie");
        defaults.put("fetch.credential.bench_after", "3");
        defaults.put("fetch.credential.cooldown_ms", "60000");
        defaults.put("fetch.credential.checkout_timeout_ms", "30000");

        defaults.put("indicator.threads", "4");
        defaults.put("strategy.threads", "4");
        defaults.put("strategy.min_amount", "200000000");

        defaults.put("job.date_workers", "1");
        defaults.put("job.commit_in_order", "true");
        defaults.put("job.progress.log_every", "200");

        defaults.put("backtest.horizons", "1,3,5,10");
        defaults.put("backtest.lookback_days", "90");

        return Collections.unmodifiableMap(defaults);
    }

    public static final class ResolvedValue {
        public final String key;
        public final String value;
        public final String source;

        public ResolvedValue(String key, String value, String source) {
            this.key = key == null ? "" : key;
            this.value = value == null ? "" : value;
            this.source = source == null ? "default" : source;
        }
    }
}
