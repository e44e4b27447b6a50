package com.boxmeout.market.lifecycle;

import java.math.BigDecimal;

/**
 * @param amount settlement value of the claimed winning positions
 */
public record Claim(
        String marketId,
        String userId,
        String txHash,
        BigDecimal amount
) {
}
