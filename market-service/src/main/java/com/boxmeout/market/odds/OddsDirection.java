package com.boxmeout.market.odds;

public enum OddsDirection {
    YES,
    NO,
    UNCHANGED
}
