package com.stockscan.db;

import com.stockscan.db.mybatis.BarDailyMapper;
import com.stockscan.db.mybatis.BarDailyRow;
import com.stockscan.db.mybatis.DateRunMapper;
import com.stockscan.db.mybatis.DateRunRow;
import com.stockscan.db.mybatis.IndicatorValueMapper;
import com.stockscan.db.mybatis.IndicatorValueRow;
import com.stockscan.db.mybatis.StrategyResultMapper;
import com.stockscan.db.mybatis.StrategyResultRow;
import com.stockscan.db.mybatis.UniverseMapper;
import com.stockscan.db.mybatis.UniverseRow;
import com.stockscan.model.BarDaily;
import com.stockscan.model.DateRunRecord;
import com.stockscan.model.DateState;
import com.stockscan.model.IndicatorRow;
import com.stockscan.model.Instrument;
import com.stockscan.model.ListingStatus;
import com.stockscan.model.OrchestrationError;
import com.stockscan.model.StrategyResult;
import org.apache.ibatis.exceptions.PersistenceException;
import org.apache.ibatis.session.Configuration;
import org.apache.ibatis.session.SqlSession;
import org.apache.ibatis.session.SqlSessionFactory;
import org.apache.ibatis.session.SqlSessionFactoryBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONStringer;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Consumer;

/**
 * 模块说明：PostgresMarketStore（class）。
 * 主要职责：用 MyBatis 注解 Mapper 落库；commitDate 在一个事务内先删除该交易日分区再整体写入。
 * 使用建议：表结构由 MigrationRunner 负责，启动时先执行迁移。
 */
public final class PostgresMarketStore implements MarketStore {
    private static final Logger LOG = LogManager.getLogger(PostgresMarketStore.class);
    private static final int INSERT_CHUNK = 1000;

    private final Database database;
    private final SqlSessionFactory sessions;

    public PostgresMarketStore(Database database) {
        this.database = database;
        this.sessions = new SqlSessionFactoryBuilder().build(mapperConfiguration());
    }

    /**
     * Every store table has one annotation mapper; snake_case columns map onto the row classes.
     */
    static Configuration mapperConfiguration() {
        Configuration config = new Configuration();
        config.setMapUnderscoreToCamelCase(true);
        config.addMapper(UniverseMapper.class);
        config.addMapper(BarDailyMapper.class);
        config.addMapper(IndicatorValueMapper.class);
        config.addMapper(StrategyResultMapper.class);
        config.addMapper(DateRunMapper.class);
        return config;
    }

    @Override
    public void commitDate(DateBatch batch) throws StoreException {
        batch.validate();
        List<BarDailyRow> bars = new ArrayList<>(batch.bars.size());
        for (BarDaily bar : batch.bars) {
            bars.add(new BarDailyRow(bar.code, bar.tradeDate, bar.open, bar.high, bar.low, bar.close, bar.volume));
        }
        List<IndicatorValueRow> values = new ArrayList<>();
        for (IndicatorRow row : batch.indicatorRows) {
            for (Map.Entry<String, Double> e : row.asMap().entrySet()) {
                values.add(new IndicatorValueRow(row.code, row.tradeDate, e.getKey(), e.getValue()));
            }
        }
        List<StrategyResultRow> results = new ArrayList<>(batch.results.size());
        for (StrategyResult result : batch.results) {
            results.add(new StrategyResultRow(
                    result.tradeDate, result.strategy, result.code, result.score, toJson(result.params)));
        }

        int replaced = inTransaction("commit date " + batch.date, session -> {
            BarDailyMapper barMapper = session.getMapper(BarDailyMapper.class);
            IndicatorValueMapper valueMapper = session.getMapper(IndicatorValueMapper.class);
            StrategyResultMapper resultMapper = session.getMapper(StrategyResultMapper.class);

            int deleted = resultMapper.deleteByDate(batch.date)
                    + valueMapper.deleteByDate(batch.date)
                    + barMapper.deleteByDate(batch.date);
            inChunks(bars, barMapper::insertBars);
            inChunks(values, valueMapper::insertValues);
            inChunks(results, resultMapper::insertResults);
            session.getMapper(DateRunMapper.class).upsert(toRow(batch.run));
            return deleted;
        });
        LOG.debug("committed date={} bars={} indicator_values={} results={} replaced_rows={}",
                batch.date, bars.size(), values.size(), results.size(), replaced);
    }

    @Override
    public void recordFailedDate(LocalDate date, OrchestrationError cause, String message) throws StoreException {
        DateRunRow row = DateRunRow.builder()
                .tradeDate(date)
                .state(DateState.FAILED.name())
                .cause(cause.name())
                .message(message)
                .updatedAt(OffsetDateTime.now(ZoneOffset.UTC))
                .build();
        withSession("record failed date " + date, session -> session.getMapper(DateRunMapper.class).upsert(row));
    }

    @Override
    public List<BarDaily> getBars(String code, LocalDate from, LocalDate to) throws StoreException {
        return withSession("get bars " + code,
                session -> toBars(session.getMapper(BarDailyMapper.class).selectRange(code, from, to)));
    }

    @Override
    public List<BarDaily> getRecentBars(String code, LocalDate before, int limit) throws StoreException {
        List<BarDaily> desc = withSession("get recent bars " + code, session -> toBars(
                session.getMapper(BarDailyMapper.class).selectRecentBefore(code, before, Math.max(1, limit))));
        List<BarDaily> asc = new ArrayList<>(desc.size());
        for (int i = desc.size() - 1; i >= 0; i--) {
            asc.add(desc.get(i));
        }
        return asc;
    }

    @Override
    public Map<String, List<BarDaily>> getRecentBars(Collection<String> codes, LocalDate before, int limit)
            throws StoreException {
        Map<String, List<BarDaily>> out = new LinkedHashMap<>();
        for (String code : codes) {
            out.put(code, new ArrayList<>());
        }
        if (out.isEmpty()) {
            return out;
        }
        List<String> all = new ArrayList<>(out.keySet());
        withSession("get recent bars for " + all.size() + " codes", session -> {
            BarDailyMapper mapper = session.getMapper(BarDailyMapper.class);
            for (int i = 0; i < all.size(); i += INSERT_CHUNK) {
                List<String> chunk = all.subList(i, Math.min(all.size(), i + INSERT_CHUNK));
                for (BarDaily bar : toBars(mapper.selectRecentBeforeForCodes(chunk, before, Math.max(1, limit)))) {
                    out.get(bar.code).add(bar);
                }
            }
            return null;
        });
        return out;
    }

    @Override
    public Optional<IndicatorRow> getIndicators(String code, LocalDate date) throws StoreException {
        List<IndicatorValueRow> rows = withSession("get indicators " + code,
                session -> session.getMapper(IndicatorValueMapper.class).selectByCodeAndDate(code, date));
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        Map<String, Double> values = new LinkedHashMap<>();
        for (IndicatorValueRow row : rows) {
            values.put(row.getName(), row.getValue());
        }
        return Optional.of(new IndicatorRow(code, date, values));
    }

    @Override
    public List<StrategyResult> getStrategyResults(LocalDate date, Optional<String> strategy) throws StoreException {
        return toResults(withSession("get strategy results " + date,
                session -> session.getMapper(StrategyResultMapper.class).selectByDate(date, strategy.orElse(null))));
    }

    @Override
    public List<StrategyResult> getStrategyResults(LocalDate from, LocalDate to) throws StoreException {
        return toResults(withSession("get strategy results " + from + ".." + to,
                session -> session.getMapper(StrategyResultMapper.class).selectRange(from, to)));
    }

    @Override
    public Optional<DateRunRecord> getDateRun(LocalDate date) throws StoreException {
        DateRunRow row = withSession("get date run " + date,
                session -> session.getMapper(DateRunMapper.class).selectByDate(date));
        if (row == null) {
            return Optional.empty();
        }
        return Optional.of(new DateRunRecord(
                row.getTradeDate(),
                DateState.valueOf(row.getState()),
                row.getCause(),
                row.getUniverseSize(),
                row.getFetched(),
                row.getFetchFailed(),
                row.getMatches(),
                row.getStrategyFailures(),
                row.getMessage() == null ? "" : row.getMessage()
        ));
    }

    @Override
    public List<Instrument> listUniverse() throws StoreException {
        List<UniverseRow> rows = withSession("list universe", session -> session.getMapper(UniverseMapper.class).listAll());
        List<Instrument> out = new ArrayList<>(rows.size());
        for (UniverseRow row : rows) {
            out.add(new Instrument(row.getCode(), row.getName(), ListingStatus.fromLabel(row.getStatus())));
        }
        return out;
    }

    @Override
    public void replaceUniverse(List<Instrument> instruments) throws StoreException {
        List<UniverseRow> rows = new ArrayList<>(instruments.size());
        for (Instrument instrument : instruments) {
            rows.add(new UniverseRow(instrument.code, instrument.name, instrument.status.label()));
        }
        inTransaction("replace universe", session -> {
            UniverseMapper mapper = session.getMapper(UniverseMapper.class);
            mapper.deleteAll();
            inChunks(rows, mapper::insertAll);
            return rows.size();
        });
        LOG.info("universe replaced size={}", rows.size());
    }

    @FunctionalInterface
    private interface SessionWork<T> {
        T apply(SqlSession session) throws StoreException;
    }

    /**
     * Runs {@code work} on a fresh auto-commit connection.
     */
    private <T> T withSession(String action, SessionWork<T> work) throws StoreException {
        try (Connection conn = database.open(action);
             SqlSession session = sessions.openSession(conn)) {
            return work.apply(session);
        } catch (SQLException | PersistenceException e) {
            throw translate(action, e);
        }
    }

    /**
     * Runs {@code work} in one transaction; any failure rolls everything back.
     */
    private <T> T inTransaction(String action, SessionWork<T> work) throws StoreException {
        try (Connection conn = database.open(action);
             SqlSession session = sessions.openSession(conn)) {
            conn.setAutoCommit(false);
            try {
                T out = work.apply(session);
                conn.commit();
                return out;
            } catch (StoreException e) {
                rollbackQuietly(conn, action);
                throw e;
            } catch (SQLException | PersistenceException e) {
                rollbackQuietly(conn, action);
                throw translate(action, e);
            }
        } catch (SQLException e) {
            throw StoreException.fromSql(action, e);
        }
    }

    static String toJson(Map<String, Double> params) {
        JSONStringer out = new JSONStringer();
        out.object();
        for (Map.Entry<String, Double> e : new TreeMap<>(params).entrySet()) {
            Double v = e.getValue();
            out.key(e.getKey());
            if (v == null || !Double.isFinite(v)) {
                out.value(JSONObject.NULL);
            } else {
                out.value(v.doubleValue());
            }
        }
        out.endObject();
        return out.toString();
    }

    static Map<String, Double> fromJson(String text) {
        Map<String, Double> out = new TreeMap<>();
        if (text == null || text.isBlank()) {
            return out;
        }
        JSONObject json = new JSONObject(text);
        for (String key : json.keySet()) {
            out.put(key, json.isNull(key) ? Double.NaN : json.getDouble(key));
        }
        return out;
    }

    private static <T> void inChunks(List<T> rows, Consumer<List<T>> insert) {
        for (int i = 0; i < rows.size(); i += INSERT_CHUNK) {
            insert.accept(rows.subList(i, Math.min(rows.size(), i + INSERT_CHUNK)));
        }
    }

    private static List<BarDaily> toBars(List<BarDailyRow> rows) {
        List<BarDaily> out = new ArrayList<>(rows.size());
        for (BarDailyRow row : rows) {
            out.add(new BarDaily(
                    row.getCode(),
                    row.getTradeDate(),
                    row.getOpen(),
                    row.getHigh(),
                    row.getLow(),
                    row.getClose(),
                    row.getVolume()
            ));
        }
        return out;
    }

    private static List<StrategyResult> toResults(List<StrategyResultRow> rows) throws StoreException {
        List<StrategyResult> out = new ArrayList<>(rows.size());
        for (StrategyResultRow row : rows) {
            Map<String, Double> params;
            try {
                params = fromJson(row.getParamsJson());
            } catch (JSONException e) {
                throw new StoreException(StoreError.CONSTRAINT_VIOLATION,
                        "bad params_json for " + row.getStrategy() + "/" + row.getCode() + ": " + e.getMessage(), e);
            }
            out.add(new StrategyResult(row.getStrategy(), row.getCode(), row.getTradeDate(), row.getScore(), params));
        }
        return out;
    }

    private static DateRunRow toRow(DateRunRecord record) {
        return DateRunRow.builder()
                .tradeDate(record.tradeDate)
                .state(record.state.name())
                .cause(record.cause)
                .universeSize(record.universeSize)
                .fetched(record.fetched)
                .fetchFailed(record.fetchFailed)
                .matches(record.matches)
                .strategyFailures(record.strategyFailures)
                .message(record.message)
                .updatedAt(OffsetDateTime.now(ZoneOffset.UTC))
                .build();
    }

    private static StoreException translate(String action, Exception e) {
        Throwable cursor = e;
        while (cursor != null) {
            if (cursor instanceof SQLException) {
                return StoreException.fromSql(action, (SQLException) cursor);
            }
            cursor = cursor.getCause();
        }
        return new StoreException(StoreError.UNAVAILABLE, action + " failed: " + e.getMessage(), e);
    }

    private static void rollbackQuietly(Connection conn, String action) {
        try {
            conn.rollback();
        } catch (SQLException rollbackError) {
            LOG.warn("rollback failed action={} err={}", action, rollbackError.getMessage());
        }
    }
}
