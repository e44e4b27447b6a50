package com.boxmeout.market.trading;

import java.math.BigDecimal;

/**
 * Pool odds. The percentages are whole numbers that always add up to 100.
 */
public record MarketOdds(
        String marketId,
        double yesOdds,
        double noOdds,
        int yesPercentage,
        int noPercentage,
        BigDecimal yesLiquidity,
        BigDecimal noLiquidity,
        BigDecimal totalLiquidity
) {
}
