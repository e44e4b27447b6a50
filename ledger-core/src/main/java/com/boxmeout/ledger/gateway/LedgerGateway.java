package com.boxmeout.ledger.gateway;

import com.boxmeout.ledger.envelope.ContractCall;
import com.boxmeout.ledger.envelope.LedgerEnvelope;
import com.boxmeout.ledger.envelope.TransactionEnvelope;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Thin adapter over the ledger node. Every method performs one remote call and never retries;
 * retry policy lives in the reliability layer.
 *
 * <p>Transport failures surface as {@link LedgerNetworkException}, node-side refusals as
 * {@link LedgerRejectedException}.
 */
public interface LedgerGateway {

  LedgerAccount getAccount(String accountId);

  /**
   * Dry-runs {@code call} as {@code sourceAccount}. Never mutates ledger state.
   *
   * @return the contract's return value
   */
  JsonNode simulate(ContractCall call, String sourceAccount);

  SubmitResponse submit(LedgerEnvelope signedEnvelope);

  PollResponse poll(String txHash);

  /**
   * Builds an unsigned envelope for {@code call} with the source account's next sequence number.
   */
  TransactionEnvelope buildUnsigned(ContractCall call, String sourceAccount);
}
