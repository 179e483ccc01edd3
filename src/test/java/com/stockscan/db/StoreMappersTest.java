package com.stockscan.db;

import com.stockscan.db.mybatis.BarDailyMapper;
import com.stockscan.db.mybatis.BarDailyRow;
import com.stockscan.db.mybatis.DateRunMapper;
import com.stockscan.db.mybatis.IndicatorValueMapper;
import com.stockscan.db.mybatis.StrategyResultMapper;
import com.stockscan.db.mybatis.UniverseMapper;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;
import org.apache.ibatis.mapping.BoundSql;
import org.apache.ibatis.session.Configuration;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StoreMappersTest {

    private static final LocalDate D = LocalDate.of(2024, 3, 29);
    private static final Configuration CONFIG = PostgresMarketStore.mapperConfiguration();

    @Test
    void selectRecentBefore_shouldSendPlainLessThan() {
        String sql = boundSql("selectRecentBefore");

        assertTrue(sql.contains("WHERE code=? AND trade_date<? ORDER BY trade_date DESC LIMIT ?"), sql);
    }

    @Test
    void selectRecentBeforeForCodes_shouldExpandCodesAndDecodeComparisons() {
        BoundSql bound = bound("selectRecentBeforeForCodes");
        String sql = normalize(bound.getSql());

        assertTrue(sql.contains("trade_date < ?"), sql);
        assertTrue(sql.contains("rn <= ?"), sql);
        // before, two codes, limit
        assertEquals(4, bound.getParameterMappings().size());
    }

    @Test
    void barDailyMapper_shouldRenderEveryStatementWithoutXmlEntities() {
        for (Method method : BarDailyMapper.class.getDeclaredMethods()) {
            if (method.isSynthetic()) {
                continue;
            }
            String sql = boundSql(method.getName());
            assertFalse(sql.contains("&lt;") || sql.contains("&gt;") || sql.contains("&amp;"),
                    method.getName() + ": " + sql);
            assertTrue(sql.contains("bars_daily"), method.getName() + ": " + sql);
        }
        assertEquals(7, bound("insertBars").getParameterMappings().size());
        assertEquals(3, bound("selectRange").getParameterMappings().size());
    }

    @Test
    void mapperAnnotations_shouldOnlyEscapeInsideScripts() {
        List<Class<?>> mappers = List.of(BarDailyMapper.class, DateRunMapper.class, IndicatorValueMapper.class,
                StrategyResultMapper.class, UniverseMapper.class);
        for (Class<?> mapper : mappers) {
            for (Method method : mapper.getDeclaredMethods()) {
                if (method.isSynthetic()) {
                    continue;
                }
                String text = annotationSql(method);
                if (!text.startsWith("<script>")) {
                    assertFalse(text.contains("&lt;") || text.contains("&gt;") || text.contains("&amp;"),
                            mapper.getSimpleName() + "." + method.getName() + ": " + text);
                }
            }
        }
    }

    private static String boundSql(String statement) {
        return normalize(bound(statement).getSql());
    }

    private static BoundSql bound(String statement) {
        Map<String, Object> params = new HashMap<>();
        params.put("code", "A");
        params.put("codes", List.of("A", "B"));
        params.put("tradeDate", D);
        params.put("from", D.minusDays(10));
        params.put("to", D);
        params.put("before", D);
        params.put("limit", 5);
        params.put("rows", List.of(new BarDailyRow("A", D, 10.0, 11.0, 9.5, 10.5, 1000.0)));
        return CONFIG.getMappedStatement(BarDailyMapper.class.getName() + "." + statement).getBoundSql(params);
    }

    private static String annotationSql(Method method) {
        String[] parts = new String[0];
        if (method.isAnnotationPresent(Select.class)) {
            parts = method.getAnnotation(Select.class).value();
        } else if (method.isAnnotationPresent(Insert.class)) {
            parts = method.getAnnotation(Insert.class).value();
        } else if (method.isAnnotationPresent(Update.class)) {
            parts = method.getAnnotation(Update.class).value();
        } else if (method.isAnnotationPresent(Delete.class)) {
            parts = method.getAnnotation(Delete.class).value();
        }
        return String.join(" ", parts).trim();
    }

    private static String normalize(String sql) {
        return sql.replaceAll("\\s+", " ").trim();
    }
}
