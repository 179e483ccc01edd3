package com.stockscan.runner;

import com.stockscan.config.Config;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TradingCalendarTest {

    @TempDir
    Path tempDir;

    @Test
    void isTradingDay_shouldExcludeWeekendsAndHolidays() {
        TradingCalendar calendar = new TradingCalendar(List.of(LocalDate.of(2024, 10, 1)));

        assertTrue(calendar.isTradingDay(LocalDate.of(2024, 9, 30)));
        assertFalse(calendar.isTradingDay(LocalDate.of(2024, 10, 1)));
        assertFalse(calendar.isTradingDay(LocalDate.of(2024, 10, 5)));
    }

    @Test
    void tradingDays_shouldListRangeInclusive() {
        List<LocalDate> days = TradingCalendar.weekdays().tradingDays(LocalDate.of(2024, 6, 7), LocalDate.of(2024, 6, 11));

        assertEquals(List.of(LocalDate.of(2024, 6, 7), LocalDate.of(2024, 6, 10), LocalDate.of(2024, 6, 11)), days);
        assertThrows(IllegalArgumentException.class,
                () -> TradingCalendar.weekdays().tradingDays(LocalDate.of(2024, 6, 11), LocalDate.of(2024, 6, 7)));
    }

    @Test
    void latestTradingDay_shouldStepBackOverWeekend() {
        assertEquals(LocalDate.of(2024, 6, 14), TradingCalendar.weekdays().latestTradingDay(LocalDate.of(2024, 6, 16)));
        assertEquals(LocalDate.of(2024, 6, 14), TradingCalendar.weekdays().latestTradingDay(LocalDate.of(2024, 6, 14)));
    }

    @Test
    void fromConfig_shouldMergeInlineAndFileHolidays() throws Exception {
        Path file = tempDir.resolve("holidays.txt");
        Files.writeString(file, "# national day\n2024-10-02\n\n2024-10-03\n");
        Config config = Config.of(tempDir, Map.of(
                "calendar.holidays", "2024-10-01",
                "calendar.holidays.file", "holidays.txt"));

        TradingCalendar calendar = TradingCalendar.fromConfig(config);

        assertEquals(List.of(LocalDate.of(2024, 10, 4)),
                calendar.tradingDays(LocalDate.of(2024, 10, 1), LocalDate.of(2024, 10, 4)));
    }

    @Test
    void fromConfig_shouldRejectBadDate() {
        Config config = Config.of(tempDir, Map.of("calendar.holidays", "2024-13-01"));

        assertThrows(IllegalArgumentException.class, () -> TradingCalendar.fromConfig(config));
    }
}
