package com.boxmeout.ledger.reliability;

import lombok.NonNull;

import java.util.Map;

/**
 * What a submitted transaction is doing, in business terms. Recorded with every dead letter.
 *
 * @param serviceName  contract client that issued the call, e.g. {@code amm}
 * @param functionName contract function, e.g. {@code buy_shares}
 * @param params       call parameters for triage; must be JSON-serialisable
 */
public record LedgerOperation(
    @NonNull String serviceName,
    @NonNull String functionName,
    Map<String, Object> params
) {

  public LedgerOperation {
    params = params == null ? Map.of() : Map.copyOf(params);
  }

  @Override
  public String toString() {
    return serviceName + "." + functionName;
  }
}
