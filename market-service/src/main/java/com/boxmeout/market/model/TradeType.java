package com.boxmeout.market.model;

public enum TradeType {
    BUY,
    SELL
}
