package com.stockscan.data;

import com.stockscan.model.Instrument;

import java.time.LocalDate;

/**
 * Raw daily data provider. Implementations must bound every network call with a timeout.
 */
public interface UpstreamSource {

    /**
     * Bars for the instrument up to and including {@code date}, within the source's look-back.
     */
    DailyHistory fetchDaily(Instrument instrument, LocalDate date, Credential credential)
            throws UpstreamException, InterruptedException;
}
