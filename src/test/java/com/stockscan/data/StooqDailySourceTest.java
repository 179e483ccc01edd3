package com.stockscan.data;

import com.stockscan.model.FetchFailure;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StooqDailySourceTest {

    private static final LocalDate DATE = LocalDate.of(2024, 6, 14);

    @Test
    void parseCsv_shouldKeepRowsUpToDateInOrder() throws Exception {
        String body = "Date,Open,High,Low,Close,Volume\n"
                + "2024-06-12,10,11,9,10.5,1000\n"
                + "2024-06-14,11,12,10,11.5,3000\n"
                + "2024-06-13,10.5,11.5,10,11,2000\n"
                + "2024-06-17,12,13,11,12.5,4000\n";

        DailyHistory history = StooqDailySource.parseCsv("AAPL.US", body, DATE);

        assertEquals(3, history.bars.size());
        assertEquals(LocalDate.of(2024, 6, 12), history.bars.get(0).tradeDate);
        assertEquals(11.5, history.barOn(DATE).orElseThrow().close, 1e-9);
        assertTrue(history.barOn(LocalDate.of(2024, 6, 17)).isEmpty());
    }

    @Test
    void parseCsv_shouldSkipNonPositiveCloseAndTolerateMissingVolume() throws Exception {
        String body = "Date,Open,High,Low,Close,Volume\r\n"
                + "2024-06-13,0,0,0,0,0\r\n"
                + "2024-06-14,11,12,10,11.5,\r\n";

        DailyHistory history = StooqDailySource.parseCsv("X", body, DATE);

        assertEquals(1, history.bars.size());
        assertEquals(0.0, history.bars.get(0).volume, 1e-9);
    }

    @Test
    void parseCsv_shouldClassifyNoDataAndHitsLimit() {
        UpstreamException noData = assertThrows(UpstreamException.class,
                () -> StooqDailySource.parseCsv("X", "No data", DATE));
        UpstreamException limited = assertThrows(UpstreamException.class,
                () -> StooqDailySource.parseCsv("X", "Exceeded the daily hits limit", DATE));

        assertEquals(FetchFailure.NOT_FOUND, noData.failure());
        assertEquals(FetchFailure.RATE_LIMITED, limited.failure());
    }

    @Test
    void parseCsv_shouldReportMalformedPayload() {
        UpstreamException html = assertThrows(UpstreamException.class,
                () -> StooqDailySource.parseCsv("X", "<html>maintenance</html>", DATE));
        UpstreamException shortRow = assertThrows(UpstreamException.class,
                () -> StooqDailySource.parseCsv("X", "Date,Open,High,Low,Close,Volume\n2024-06-14,1,2", DATE));
        UpstreamException badNumber = assertThrows(UpstreamException.class,
                () -> StooqDailySource.parseCsv("X", "Date,Open,High,Low,Close,Volume\n2024-06-14,a,2,1,1,1", DATE));

        assertEquals(FetchFailure.MALFORMED_PAYLOAD, html.failure());
        assertTrue(html.getMessage().startsWith("unexpected_payload:"));
        assertEquals(FetchFailure.MALFORMED_PAYLOAD, shortRow.failure());
        assertEquals(FetchFailure.MALFORMED_PAYLOAD, badNumber.failure());
    }

    @Test
    void classifyStatus_shouldMapHttpCodes() {
        assertEquals(FetchFailure.NOT_FOUND, StooqDailySource.classifyStatus(404));
        assertEquals(FetchFailure.RATE_LIMITED, StooqDailySource.classifyStatus(429));
        assertEquals(FetchFailure.RATE_LIMITED, StooqDailySource.classifyStatus(403));
        assertEquals(FetchFailure.TRANSIENT, StooqDailySource.classifyStatus(502));
    }
}
