package com.boxmeout.ledger.gateway;

import com.boxmeout.ledger.LedgerException;

/**
 * Transport-level failure (connection refused, timeout, malformed HTTP). Safe to retry.
 */
public class LedgerNetworkException extends LedgerException {

  public LedgerNetworkException(String message, Throwable cause) {
    super(message, cause);
  }
}
