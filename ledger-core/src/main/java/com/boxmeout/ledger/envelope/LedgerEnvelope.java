package com.boxmeout.ledger.envelope;

import java.util.List;

/**
 * A signed (or not yet signed) unit of submission to the ledger.
 */
public interface LedgerEnvelope {

  int TYPE_TRANSACTION = 2;
  int TYPE_FEE_BUMP = 5;

  int envelopeType();

  List<DecoratedSignature> signatures();

  /**
   * Contract call carried by this envelope. A fee-bump envelope reports the call of the wrapped transaction.
   */
  ContractCall call();

  /**
   * Account whose signature authorises this envelope.
   */
  String signingAccount();

  LedgerEnvelope withSignature(DecoratedSignature signature);
}
