package com.boxmeout.market.model;

import java.math.BigDecimal;
import java.time.Instant;

public record Trade(
        String id,
        String userId,
        String marketId,
        TradeType type,
        int outcome,
        BigDecimal quantity,
        BigDecimal pricePerUnit,
        BigDecimal totalAmount,
        BigDecimal feeAmount,
        String txHash,
        TradeStatus status,
        String failureReason,
        Instant createdAt,
        Instant confirmedAt
) {
}
