package com.boxmeout.ledger.contract;

import com.boxmeout.ledger.envelope.ContractCall;
import com.boxmeout.ledger.envelope.LedgerArg;
import com.boxmeout.ledger.reliability.LedgerOperation;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@RequiredArgsConstructor
public class TreasuryContractClient {

  public static final String SERVICE = "treasury";

  private final @NonNull LedgerTransactionSubmitter submitter;
  private final @NonNull TokenAmounts amounts;
  private final String contractId;

  public record Balances(BigDecimal totalBalance, BigDecimal leaderboardPool, BigDecimal creatorPool, BigDecimal platformFees) {
  }

  public record Payout(String address, BigDecimal amount) {
  }

  public record Distribution(String txHash, int recipientCount, BigDecimal totalDistributed) {
  }

  public Balances getBalances() {
    JsonNode rv = submitter.read(ContractCall.of(contractId(), "get_balances"));
    return new Balances(
        amounts.fromJson(rv.path("total_balance")),
        amounts.fromJson(rv.path("leaderboard_pool")),
        amounts.fromJson(rv.path("creator_pool")),
        amounts.fromJson(rv.path("platform_fees")));
  }

  /**
   * Pays leaderboard winners from the leaderboard pool. Recipients are sent as alternating address / amount arguments.
   */
  public Distribution distributeLeaderboard(@NonNull List<Payout> recipients) {
    if (recipients.isEmpty()) {
      throw new IllegalArgumentException("no recipients");
    }
    List<LedgerArg> args = new ArrayList<>(recipients.size() * 2);
    BigDecimal total = BigDecimal.ZERO;
    for (Payout p : recipients) {
      args.add(LedgerArg.address(p.address()));
      args.add(LedgerArg.i128(amounts.toUnits(p.amount())));
      total = total.add(p.amount());
    }
    ContractCall call = new ContractCall(contractId(), "distribute_leaderboard", args);
    String txHash = submitter.execute(call, new LedgerOperation(SERVICE, "distribute_leaderboard",
        Map.of("recipientCount", recipients.size(), "total", total.toPlainString()))).txHash();
    return new Distribution(txHash, recipients.size(), total);
  }

  public String distributeCreator(@NonNull String marketId, @NonNull String creatorAddress, @NonNull BigDecimal amount) {
    ContractCall call = ContractCall.of(contractId(), "distribute_creator",
        LedgerArg.string(marketId),
        LedgerArg.address(creatorAddress),
        LedgerArg.i128(amounts.toUnits(amount)));
    return submitter.execute(call, new LedgerOperation(SERVICE, "distribute_creator",
        Map.of("marketId", marketId, "creator", creatorAddress, "amount", amount.toPlainString()))).txHash();
  }

  private String contractId() {
    return ContractIds.require(contractId, "treasury");
  }
}
