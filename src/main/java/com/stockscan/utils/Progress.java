package com.stockscan.utils;

import java.util.Locale;

public final class Progress {
    private Progress() {
    }

    public static boolean shouldLog(int completed, int total, int logEvery) {
        if (completed >= total) {
            return true;
        }
        if (logEvery <= 0) {
            return false;
        }
        return completed % logEvery == 0;
    }

    /**
     * "done=12/40 (30.0%) elapsed=00:00:05 eta=00:00:12"
     */
    public static String describe(int completed, int total, long startedNanos) {
        long elapsedSec = Math.max(0L, Math.round((System.nanoTime() - startedNanos) / 1_000_000_000.0));
        int remaining = Math.max(0, total - completed);
        long etaSec = completed <= 0 ? 0L : Math.round(elapsedSec * (remaining / (double) completed));
        double pct = total <= 0 ? 100.0 : completed * 100.0 / total;
        return String.format(
                Locale.US,
                "done=%d/%d (%.1f%%) elapsed=%s eta=%s",
                completed,
                total,
                pct,
                formatSeconds(elapsedSec),
                formatSeconds(etaSec)
        );
    }

    public static String formatSeconds(long seconds) {
        long sec = Math.max(0L, seconds);
        long h = sec / 3600;
        long m = (sec % 3600) / 60;
        long s = sec % 60;
        return String.format(Locale.US, "%02d:%02d:%02d", h, m, s);
    }
}
