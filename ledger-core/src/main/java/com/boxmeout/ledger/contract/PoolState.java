package com.boxmeout.ledger.contract;

import java.math.BigDecimal;

/**
 * Reserves and odds of a binary AMM pool. Odds are probabilities in [0, 1].
 */
public record PoolState(
    BigDecimal yesReserve,
    BigDecimal noReserve,
    double yesOdds,
    double noOdds
) {

  public BigDecimal totalLiquidity() {
    return yesReserve.add(noReserve);
  }
}
