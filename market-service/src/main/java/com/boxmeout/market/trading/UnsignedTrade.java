package com.boxmeout.market.trading;

import java.math.BigDecimal;

/**
 * Unsigned envelope for the user's wallet, with the slippage floor baked into it. The signed envelope must be
 * sent back with the same floor.
 */
public record UnsignedTrade(
        String unsignedEnvelope,
        BigDecimal slippageFloor
) {
}
