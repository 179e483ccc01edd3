package com.stockscan.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * One (code, date, indicator) cell; a null value is an undefined indicator.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IndicatorValueRow {
    private String code;
    private LocalDate tradeDate;
    private String name;
    private Double value;
}
