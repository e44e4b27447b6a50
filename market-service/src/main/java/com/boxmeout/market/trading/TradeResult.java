package com.boxmeout.market.trading;

import com.boxmeout.market.model.TradeType;

import java.math.BigDecimal;

/**
 * @param shares           shares bought or sold
 * @param usdcAmount       total cost of a buy, payout of a sell
 * @param positionQuantity shares held in this outcome after the trade
 * @param averagePrice     cost basis per held share after the trade; zero once the position is empty
 */
public record TradeResult(
        String tradeId,
        String txHash,
        TradeType type,
        int outcome,
        BigDecimal shares,
        BigDecimal usdcAmount,
        BigDecimal feeAmount,
        BigDecimal pricePerUnit,
        BigDecimal positionQuantity,
        BigDecimal averagePrice
) {
}
