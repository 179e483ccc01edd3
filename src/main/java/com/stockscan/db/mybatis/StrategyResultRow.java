package com.stockscan.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StrategyResultRow {
    private LocalDate tradeDate;
    private String strategy;
    private String code;
    private Double score;
    private String paramsJson;
}
