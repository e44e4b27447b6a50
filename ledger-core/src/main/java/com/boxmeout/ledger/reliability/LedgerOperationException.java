package com.boxmeout.ledger.reliability;

import com.boxmeout.ledger.LedgerException;
import lombok.Getter;

/**
 * Permanent failure of a ledger operation. By the time this is thrown the operation has been dead-lettered.
 */
@Getter
public class LedgerOperationException extends LedgerException {

  public enum Reason {
    LEDGER_REJECTED,
    TIMEOUT,
    NETWORK_EXHAUSTED
  }

  private final Reason reason;
  private final String txHash;

  public LedgerOperationException(Reason reason, String txHash, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
    this.txHash = txHash;
  }
}
