package com.boxmeout.ledger.contract;

import java.math.BigDecimal;

/**
 * Ledger-confirmed result of a buy or sell.
 *
 * @param shares       shares received (buy) or sold (sell)
 * @param usdcAmount   total cost including fee (buy) or payout net of fee (sell)
 * @param pricePerUnit usdcAmount / shares
 */
public record TradeExecution(
    String txHash,
    BigDecimal shares,
    BigDecimal usdcAmount,
    BigDecimal feeAmount,
    BigDecimal pricePerUnit
) {
}
