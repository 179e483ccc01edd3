package com.stockscan.data;

import com.stockscan.config.Config;
import com.stockscan.model.BarDaily;
import com.stockscan.model.FetchFailure;
import com.stockscan.model.Instrument;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 模块说明：StooqDailySource（class）。
 * 主要职责：按日期区间下载 Stooq 日线 CSV，并把 HTTP 状态与报文内容归类为 FetchFailure。
 * 使用建议：重试与退避由 MarketDataFetcher 负责，这里每次调用只发一次请求。
 */
public final class StooqDailySource implements UpstreamSource {
    private static final Logger LOG = LogManager.getLogger(StooqDailySource.class);
    private static final DateTimeFormatter RANGE_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;
    private static final String EXPECTED_HEADER = "date,open,high,low,close,volume";

    private final String baseUrl;
    private final String symbolFormat;
    private final String authHeader;
    private final int timeoutSec;
    private final long requestPauseMs;
    private final int historyDays;
    private final Map<String, HttpClient> clients = new ConcurrentHashMap<>();
    private final AtomicLong lastRequestAtNanos = new AtomicLong(0L);

    public StooqDailySource(Config config) {
        this.baseUrl = config.getString("fetch.base_url", "https://stooq.com/q/d/l/?s=%s&i=d&d1=%s&d2=%s");
        this.symbolFormat = config.getString("fetch.symbol_format", "%s");
        this.authHeader = config.getString("fetch.auth_header", "Cookie");
        this.timeoutSec = Math.max(3, config.getInt("fetch.request_timeout_sec", 20));
        this.requestPauseMs = Math.max(0L, config.getLong("fetch.request_pause_ms", 0L));
        this.historyDays = Math.max(30, config.getInt("fetch.history_days", 500));
    }

    @Override
    public DailyHistory fetchDaily(Instrument instrument, LocalDate date, Credential credential)
            throws UpstreamException, InterruptedException {
        String url = buildUrl(instrument.code, date);
        throttleRequest(requestPauseMs);
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("User-Agent", "stockscan/1.0")
                .timeout(Duration.ofSeconds(timeoutSec))
                .GET();
        if (credential.hasToken()) {
            builder.header(authHeader, credential.token);
        }

        HttpResponse<String> response;
        try {
            response = clientFor(credential).send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new UpstreamException(FetchFailure.TRANSIENT, "timeout code=" + instrument.code, e);
        } catch (IOException e) {
            String msg = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            throw new UpstreamException(FetchFailure.TRANSIENT, "io_error code=" + instrument.code + " " + msg, e);
        }

        int status = response.statusCode();
        if (status / 100 != 2) {
            throw new UpstreamException(classifyStatus(status), "http status=" + status + " code=" + instrument.code);
        }
        return parseCsv(instrument.code, response.body(), date);
    }

    String buildUrl(String code, LocalDate date) {
        String symbol = String.format(symbolFormat, code.trim()).toLowerCase(Locale.ROOT);
        return String.format(
                baseUrl,
                URLEncoder.encode(symbol, StandardCharsets.UTF_8),
                date.minusDays(historyDays).format(RANGE_FORMAT),
                date.format(RANGE_FORMAT)
        );
    }

    static FetchFailure classifyStatus(int status) {
        if (status == 404 || status == 410) {
            return FetchFailure.NOT_FOUND;
        }
        if (status == 429 || status == 403) {
            return FetchFailure.RATE_LIMITED;
        }
        return FetchFailure.TRANSIENT;
    }

    /**
     * Parses a Stooq CSV body; rows after {@code date} are dropped, duplicates keep the last row.
     */
    static DailyHistory parseCsv(String code, String body, LocalDate date) throws UpstreamException {
        String text = body == null ? "" : body.trim();
        if (text.isEmpty() || text.equalsIgnoreCase("No data")) {
            throw new UpstreamException(FetchFailure.NOT_FOUND, "no_data code=" + code);
        }
        if (text.toLowerCase(Locale.ROOT).contains("exceeded the daily hits limit")) {
            throw new UpstreamException(FetchFailure.RATE_LIMITED, "daily_hits_limit code=" + code);
        }

        String[] lines = text.split("\\r?\\n");
        String header = lines[0].trim().toLowerCase(Locale.ROOT);
        if (!header.startsWith(EXPECTED_HEADER)) {
            String sample = text.length() > 120 ? text.substring(0, 120) : text;
            throw new UpstreamException(FetchFailure.MALFORMED_PAYLOAD, "unexpected_payload:" + sample);
        }

        TreeMap<LocalDate, BarDaily> byDate = new TreeMap<>();
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty()) {
                continue;
            }
            String[] cols = line.split(",");
            if (cols.length < 6) {
                throw new UpstreamException(FetchFailure.MALFORMED_PAYLOAD, "short_row line=" + (i + 1) + " code=" + code);
            }
            BarDaily bar;
            try {
                bar = new BarDaily(
                        code,
                        LocalDate.parse(cols[0].trim()),
                        parseDouble(cols[1]),
                        parseDouble(cols[2]),
                        parseDouble(cols[3]),
                        parseDouble(cols[4]),
                        parseDouble(cols[5])
                );
            } catch (DateTimeParseException | NumberFormatException e) {
                throw new UpstreamException(
                        FetchFailure.MALFORMED_PAYLOAD,
                        "bad_row line=" + (i + 1) + " code=" + code + " " + e.getMessage(),
                        e
                );
            }
            if (bar.close <= 0 || bar.tradeDate.isAfter(date)) {
                continue;
            }
            byDate.put(bar.tradeDate, bar);
        }
        return new DailyHistory(code, new ArrayList<>(byDate.values()));
    }

    private HttpClient clientFor(Credential credential) {
        return clients.computeIfAbsent(credential.id, id -> {
            HttpClient.Builder builder = HttpClient.newBuilder()
                    .connectTimeout(Duration.ofSeconds(timeoutSec))
                    .followRedirects(HttpClient.Redirect.NORMAL);
            if (credential.hasProxy()) {
                builder.proxy(ProxySelector.of(new InetSocketAddress(credential.proxyHost, credential.proxyPort)));
                LOG.debug("http client via proxy {}", credential.id);
            }
            return builder.build();
        });
    }

    private void throttleRequest(long pauseMs) throws InterruptedException {
        if (pauseMs <= 0L) {
            return;
        }
        long pauseNanos = pauseMs * 1_000_000L;
        while (true) {
            long prev = lastRequestAtNanos.get();
            long now = System.nanoTime();
            long nextAllowed = prev + pauseNanos;
            if (now < nextAllowed) {
                TimeUnit.NANOSECONDS.sleep(nextAllowed - now);
                continue;
            }
            if (lastRequestAtNanos.compareAndSet(prev, now)) {
                return;
            }
        }
    }

    private static double parseDouble(String input) {
        String v = input == null ? "" : input.trim();
        if (v.isEmpty() || v.equalsIgnoreCase("null")) {
            return 0.0;
        }
        return Double.parseDouble(v);
    }
}
