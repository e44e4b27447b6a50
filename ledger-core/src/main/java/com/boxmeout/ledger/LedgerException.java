package com.boxmeout.ledger;

/**
 * Root of every failure raised while talking to the ledger or handling its envelopes.
 */
public abstract class LedgerException extends RuntimeException {

  protected LedgerException(String message) {
    super(message);
  }

  protected LedgerException(String message, Throwable cause) {
    super(message, cause);
  }
}
