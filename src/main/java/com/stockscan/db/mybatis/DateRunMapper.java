package com.stockscan.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.LocalDate;

public interface DateRunMapper {
    @Insert("INSERT INTO date_runs(trade_date, state, cause, universe_size, fetched, fetch_failed, matches, " +
            "strategy_failures, message, updated_at) " +
            "VALUES(#{tradeDate}, #{state}, #{cause,jdbcType=VARCHAR}, #{universeSize}, #{fetched}, #{fetchFailed}, " +
            "#{matches}, #{strategyFailures}, #{message,jdbcType=VARCHAR}, #{updatedAt}) " +
            "ON CONFLICT(trade_date) DO UPDATE SET " +
            "state=excluded.state, cause=excluded.cause, universe_size=excluded.universe_size, " +
            "fetched=excluded.fetched, fetch_failed=excluded.fetch_failed, matches=excluded.matches, " +
            "strategy_failures=excluded.strategy_failures, message=excluded.message, updated_at=excluded.updated_at")
    int upsert(DateRunRow row);

    @Select("SELECT trade_date, state, cause, universe_size, fetched, fetch_failed, matches, strategy_failures, " +
            "message, updated_at FROM date_runs WHERE trade_date=#{tradeDate}")
    DateRunRow selectByDate(@Param("tradeDate") LocalDate tradeDate);
}
