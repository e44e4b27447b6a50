package com.boxmeout.market.lifecycle;

import com.boxmeout.market.model.Market;
import com.boxmeout.market.settlement.SettlementSummary;

/**
 * @param ledgerTxHash hash of the {@code resolve_market} call; null for markets without a contract
 */
public record Resolution(
        Market market,
        String ledgerTxHash,
        SettlementSummary settlement
) {
}
