package com.boxmeout.ledger.signature;

import com.boxmeout.ledger.LedgerException;

/**
 * The envelope is not authorised by the expected account. Always a rejection, never retried.
 */
public class InvalidSignatureException extends LedgerException {

  public InvalidSignatureException(String message) {
    super(message);
  }
}
