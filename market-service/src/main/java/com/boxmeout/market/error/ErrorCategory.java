package com.boxmeout.market.error;

public enum ErrorCategory {
    VALIDATION,
    NOT_FOUND,
    SECURITY,
    ECONOMIC,
    LEDGER
}
