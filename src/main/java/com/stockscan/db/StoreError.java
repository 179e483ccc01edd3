package com.stockscan.db;

public enum StoreError {
    UNAVAILABLE,
    CONSTRAINT_VIOLATION
}
