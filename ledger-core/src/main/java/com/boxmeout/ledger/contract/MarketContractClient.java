package com.boxmeout.ledger.contract;

import com.boxmeout.ledger.envelope.ContractCall;
import com.boxmeout.ledger.envelope.LedgerArg;
import com.boxmeout.ledger.reliability.LedgerOperation;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.util.Map;

/**
 * Admin-signed calls against an individual market contract.
 */
@RequiredArgsConstructor
public class MarketContractClient {

  public static final String SERVICE = "market";

  private final @NonNull LedgerTransactionSubmitter submitter;

  /**
   * @return transaction hash
   */
  public String resolveMarket(@NonNull String marketContractAddress) {
    ContractCall call = ContractCall.of(marketContractAddress, "resolve_market");
    return submitter.execute(call, new LedgerOperation(SERVICE, "resolve_market",
        Map.of("contract", marketContractAddress))).txHash();
  }

  public String claimWinnings(@NonNull String marketContractAddress, @NonNull String userPublicKey) {
    ContractCall call = ContractCall.of(marketContractAddress, "claim_winnings", LedgerArg.address(userPublicKey));
    return submitter.execute(call, new LedgerOperation(SERVICE, "claim_winnings",
        Map.of("contract", marketContractAddress, "user", userPublicKey))).txHash();
  }
}
