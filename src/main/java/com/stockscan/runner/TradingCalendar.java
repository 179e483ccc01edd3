package com.stockscan.runner;

import com.stockscan.config.Config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Weekdays minus configured holidays.
 */
public final class TradingCalendar {
    private final Set<LocalDate> holidays;

    public TradingCalendar(Collection<LocalDate> holidays) {
        this.holidays = Set.copyOf(new TreeSet<>(holidays));
    }

    public static TradingCalendar weekdays() {
        return new TradingCalendar(List.of());
    }

    /**
     * Reads {@code calendar.holidays} and the optional {@code calendar.holidays.file} (one ISO date per line, '#' comments).
     */
    public static TradingCalendar fromConfig(Config config) throws IOException {
        List<LocalDate> out = new ArrayList<>();
        for (String item : config.getList("calendar.holidays")) {
            out.add(parseDate(item, "calendar.holidays"));
        }
        Path file = config.getPath("calendar.holidays.file");
        if (file != null) {
            int lineNo = 0;
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                lineNo++;
                String text = line.trim();
                if (text.isEmpty() || text.startsWith("#")) {
                    continue;
                }
                out.add(parseDate(text, file + ":" + lineNo));
            }
        }
        return new TradingCalendar(out);
    }

    public boolean isTradingDay(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        return dow != DayOfWeek.SATURDAY && dow != DayOfWeek.SUNDAY && !holidays.contains(date);
    }

    /**
     * Trading days in {@code [from, to]}, ascending.
     */
    public List<LocalDate> tradingDays(LocalDate from, LocalDate to) {
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("range end " + to + " is before start " + from);
        }
        List<LocalDate> out = new ArrayList<>();
        for (LocalDate d = from; !d.isAfter(to); d = d.plusDays(1)) {
            if (isTradingDay(d)) {
                out.add(d);
            }
        }
        return out;
    }

    public LocalDate latestTradingDay(LocalDate onOrBefore) {
        LocalDate d = onOrBefore;
        for (int i = 0; i < 366; i++) {
            if (isTradingDay(d)) {
                return d;
            }
            d = d.minusDays(1);
        }
        throw new IllegalStateException("no trading day within a year before " + onOrBefore);
    }

    private static LocalDate parseDate(String text, String source) {
        try {
            return LocalDate.parse(text.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("bad holiday date '" + text + "' in " + source, e);
        }
    }
}
