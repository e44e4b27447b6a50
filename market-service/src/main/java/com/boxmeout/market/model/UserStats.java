package com.boxmeout.market.model;

import java.math.BigDecimal;

public record UserStats(
        String userId,
        int marketsSettled,
        int wins,
        int losses,
        BigDecimal totalPnl
) {
}
