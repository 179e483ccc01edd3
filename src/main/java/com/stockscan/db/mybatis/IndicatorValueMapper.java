package com.stockscan.db.mybatis;

import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.LocalDate;
import java.util.List;

public interface IndicatorValueMapper {
    @Delete("DELETE FROM indicators_daily WHERE trade_date=#{tradeDate}")
    int deleteByDate(@Param("tradeDate") LocalDate tradeDate);

    @Insert({
            "<script>",
            "INSERT INTO indicators_daily(code, trade_date, name, value) VALUES ",
            "<foreach collection='rows' item='r' separator=','>",
            "(#{r.code}, #{r.tradeDate}, #{r.name}, #{r.value,jdbcType=DOUBLE})",
            "</foreach>",
            "</script>"
    })
    int insertValues(@Param("rows") List<IndicatorValueRow> rows);

    @Select("SELECT code, trade_date, name, value FROM indicators_daily " +
            "WHERE code=#{code} AND trade_date=#{tradeDate} ORDER BY id ASC")
    List<IndicatorValueRow> selectByCodeAndDate(@Param("code") String code, @Param("tradeDate") LocalDate tradeDate);
}
