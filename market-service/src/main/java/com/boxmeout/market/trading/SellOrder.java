package com.boxmeout.market.trading;

import java.math.BigDecimal;

/**
 * @param minPayout      slippage floor; null means {@code shares} times the configured slippage factor
 * @param signedEnvelope user-signed envelope (base64) in non-custodial mode, null in custodial mode
 */
public record SellOrder(
        String userId,
        String marketId,
        int outcome,
        BigDecimal shares,
        BigDecimal minPayout,
        String signedEnvelope
) {

    public static SellOrder custodial(String userId, String marketId, int outcome, BigDecimal shares) {
        return new SellOrder(userId, marketId, outcome, shares, null, null);
    }
}
