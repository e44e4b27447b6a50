package com.boxmeout.market.model;

import java.math.BigDecimal;
import java.time.Instant;

public record Market(
        String id,
        String contractAddress,
        String title,
        String description,
        String category,
        String creatorId,
        String outcomeA,
        String outcomeB,
        MarketStatus status,
        BigDecimal yesLiquidity,
        BigDecimal noLiquidity,
        BigDecimal totalVolume,
        String poolTxHash,
        String creationTxHash,
        Instant closingAt,
        Instant resolutionTime,
        Instant closedAt,
        Instant resolvedAt,
        Instant cancelledAt,
        Integer winningOutcome,
        String resolutionSource,
        Instant createdAt
) {

    public boolean hasPool() {
        return yesLiquidity.signum() != 0 || noLiquidity.signum() != 0;
    }
}
