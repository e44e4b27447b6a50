package com.boxmeout.market.trading;

import java.math.BigDecimal;

/**
 * @param minShares      slippage floor; null means {@code amountUsdc} times the configured slippage factor
 * @param signedEnvelope user-signed envelope (base64) in non-custodial mode, null in custodial mode
 */
public record BuyOrder(
        String userId,
        String marketId,
        int outcome,
        BigDecimal amountUsdc,
        BigDecimal minShares,
        String signedEnvelope
) {

    public static BuyOrder custodial(String userId, String marketId, int outcome, BigDecimal amountUsdc) {
        return new BuyOrder(userId, marketId, outcome, amountUsdc, null, null);
    }
}
