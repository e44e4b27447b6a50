package com.boxmeout.ledger.envelope;

import com.boxmeout.ledger.LedgerException;

public class MalformedEnvelopeException extends LedgerException {

  public MalformedEnvelopeException(String message) {
    super(message);
  }

  public MalformedEnvelopeException(String message, Throwable cause) {
    super(message, cause);
  }
}
