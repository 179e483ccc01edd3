package com.stockscan.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * A tradable security identified by its stable code.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public class Instrument {
    public final String code;
    public final String name;
    public final ListingStatus status;

    public static Instrument active(String code, String name) {
        return new Instrument(code, name, ListingStatus.ACTIVE);
    }

    public boolean isEligible() {
        return status != null && status.tradable();
    }
}
