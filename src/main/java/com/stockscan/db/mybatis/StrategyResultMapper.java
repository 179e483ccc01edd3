package com.stockscan.db.mybatis;

import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.LocalDate;
import java.util.List;

public interface StrategyResultMapper {
    @Delete("DELETE FROM strategy_results WHERE trade_date=#{tradeDate}")
    int deleteByDate(@Param("tradeDate") LocalDate tradeDate);

    @Insert({
            "<script>",
            "INSERT INTO strategy_results(trade_date, strategy, code, score, params_json) VALUES ",
            "<foreach collection='rows' item='r' separator=','>",
            "(#{r.tradeDate}, #{r.strategy}, #{r.code}, #{r.score}, #{r.paramsJson})",
            "</foreach>",
            "</script>"
    })
    int insertResults(@Param("rows") List<StrategyResultRow> rows);

    @Select({
            "<script>",
            "SELECT trade_date, strategy, code, score, params_json FROM strategy_results",
            "WHERE trade_date=#{tradeDate}",
            "<if test='strategy != null'> AND strategy=#{strategy}</if>",
            "ORDER BY strategy ASC, code ASC",
            "</script>"
    })
    List<StrategyResultRow> selectByDate(@Param("tradeDate") LocalDate tradeDate, @Param("strategy") String strategy);

    @Select("SELECT trade_date, strategy, code, score, params_json FROM strategy_results " +
            "WHERE trade_date BETWEEN #{from} AND #{to} ORDER BY trade_date ASC, strategy ASC, code ASC")
    List<StrategyResultRow> selectRange(@Param("from") LocalDate from, @Param("to") LocalDate to);
}
