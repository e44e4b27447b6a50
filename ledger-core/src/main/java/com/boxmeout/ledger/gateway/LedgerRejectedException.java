package com.boxmeout.ledger.gateway;

import com.boxmeout.ledger.LedgerException;

/**
 * The node answered, but refused the request. Retrying the same request will not help.
 */
public class LedgerRejectedException extends LedgerException {

  public LedgerRejectedException(String message) {
    super(message);
  }

  public LedgerRejectedException(String message, Throwable cause) {
    super(message, cause);
  }
}
