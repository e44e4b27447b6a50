package com.boxmeout.market.error;

public enum ErrorCode {
    VALIDATION_ERROR(ErrorCategory.VALIDATION),
    INVALID_OUTCOME(ErrorCategory.VALIDATION),
    INVALID_AMOUNT(ErrorCategory.VALIDATION),
    MARKET_NOT_OPEN(ErrorCategory.VALIDATION),
    INVALID_TRANSITION(ErrorCategory.VALIDATION),
    DUPLICATE_POOL(ErrorCategory.VALIDATION),
    DUPLICATE_TRANSACTION(ErrorCategory.VALIDATION),
    CANNOT_CANCEL_RESOLVED(ErrorCategory.VALIDATION),
    NOTHING_TO_CLAIM(ErrorCategory.VALIDATION),

    NOT_FOUND(ErrorCategory.NOT_FOUND),
    USER_NOT_FOUND(ErrorCategory.NOT_FOUND),

    INVALID_SIGNATURE(ErrorCategory.SECURITY),
    MALFORMED_ENVELOPE(ErrorCategory.SECURITY),
    NOT_MARKET_CREATOR(ErrorCategory.SECURITY),

    INSUFFICIENT_BALANCE(ErrorCategory.ECONOMIC),
    INSUFFICIENT_SHARES(ErrorCategory.ECONOMIC),
    SLIPPAGE_EXCEEDED(ErrorCategory.ECONOMIC),

    BLOCKCHAIN_ERROR(ErrorCategory.LEDGER);

    private final ErrorCategory category;

    ErrorCode(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory category() {
        return category;
    }
}
