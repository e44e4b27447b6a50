package com.boxmeout.market.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A user's holding of one outcome of one market. Quantity never goes negative; a fully sold position
 * stays as a zero row so its realized PnL is kept.
 */
public record Position(
        String id,
        String userId,
        String marketId,
        int outcome,
        BigDecimal quantity,
        BigDecimal costBasis,
        BigDecimal entryPrice,
        BigDecimal currentValue,
        BigDecimal unrealizedPnl,
        BigDecimal realizedPnl,
        BigDecimal soldQuantity,
        Instant soldAt,
        Boolean winner,
        BigDecimal settlementPnl,
        Instant settledAt,
        Instant claimedAt
) {

    public boolean isOpen() {
        return quantity.signum() > 0;
    }
}
