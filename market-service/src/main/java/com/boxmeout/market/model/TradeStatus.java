package com.boxmeout.market.model;

/**
 * PENDING rows carry the hash of a submitted ledger transaction whose effects are not applied yet.
 */
public enum TradeStatus {
    PENDING,
    CONFIRMED,
    FAILED
}
