package com.boxmeout.ledger.gateway;

import java.math.BigInteger;

/**
 * @param sequence last sequence number consumed by the account
 */
public record LedgerAccount(String accountId, BigInteger sequence) {

  public BigInteger nextSequence() {
    return sequence.add(BigInteger.ONE);
  }
}
