package com.stockscan.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DateRunRow {
    private LocalDate tradeDate;
    private String state;
    private String cause;
    private int universeSize;
    private int fetched;
    private int fetchFailed;
    private int matches;
    private int strategyFailures;
    private String message;
    private OffsetDateTime updatedAt;
}
