package com.boxmeout.ledger.config;

import com.boxmeout.ledger.LedgerException;

/**
 * A ledger operation needs a key or contract id that is not configured. Nothing was sent.
 */
public class LedgerConfigurationException extends LedgerException {

  public LedgerConfigurationException(String message) {
    super(message);
  }
}
