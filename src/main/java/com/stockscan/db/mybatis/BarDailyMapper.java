package com.stockscan.db.mybatis;

import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.LocalDate;
import java.util.List;

public interface BarDailyMapper {
    @Delete("DELETE FROM bars_daily WHERE trade_date=#{tradeDate}")
    int deleteByDate(@Param("tradeDate") LocalDate tradeDate);

    @Insert({
            "<script>",
            "INSERT INTO bars_daily(code, trade_date, open, high, low, close, volume) VALUES ",
            "<foreach collection='rows' item='r' separator=','>",
            "(#{r.code}, #{r.tradeDate}, #{r.open}, #{r.high}, #{r.low}, #{r.close}, #{r.volume})",
            "</foreach>",
            "</script>"
    })
    int insertBars(@Param("rows") List<BarDailyRow> rows);

    @Select("SELECT code, trade_date, open, high, low, close, volume FROM bars_daily " +
            "WHERE code=#{code} AND trade_date BETWEEN #{from} AND #{to} ORDER BY trade_date ASC")
    List<BarDailyRow> selectRange(
            @Param("code") String code,
            @Param("from") LocalDate from,
            @Param("to") LocalDate to
    );

    @Select("SELECT code, trade_date, open, high, low, close, volume FROM bars_daily " +
            "WHERE code=#{code} AND trade_date<#{before} ORDER BY trade_date DESC LIMIT #{limit}")
    List<BarDailyRow> selectRecentBefore(
            @Param("code") String code,
            @Param("before") LocalDate before,
            @Param("limit") int limit
    );

    @Select({
            "<script>",
            "SELECT code, trade_date, open, high, low, close, volume FROM (",
            "SELECT b.*, ROW_NUMBER() OVER (PARTITION BY code ORDER BY trade_date DESC) AS rn",
            "FROM bars_daily b WHERE trade_date &lt; #{before} AND code IN ",
            "<foreach collection='codes' item='code' open='(' separator=',' close=')'>",
            "#{code}",
            "</foreach>",
            ") t WHERE rn &lt;= #{limit} ORDER BY code ASC, trade_date ASC",
            "</script>"
    })
    List<BarDailyRow> selectRecentBeforeForCodes(
            @Param("codes") List<String> codes,
            @Param("before") LocalDate before,
            @Param("limit") int limit
    );
}
