package com.stockscan.model;

import java.util.Locale;

public enum ListingStatus {
    ACTIVE("active"),
    SUSPENDED("suspended"),
    DELISTED("delisted");

    private final String label;

    ListingStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean tradable() {
        return this == ACTIVE;
    }

    public static ListingStatus fromLabel(String value) {
        if (value == null || value.trim().isEmpty()) {
            return ACTIVE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ListingStatus status : values()) {
            if (status.label.equals(normalized) || status.name().equalsIgnoreCase(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("unknown listing status: " + value);
    }
}
