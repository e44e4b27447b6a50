package com.boxmeout.ledger.envelope;

import lombok.NonNull;

import java.util.List;

public record ContractCall(
    @NonNull String contractId,
    @NonNull String function,
    List<LedgerArg> args
) {

  public ContractCall {
    args = args == null ? List.of() : List.copyOf(args);
  }

  public static ContractCall of(String contractId, String function, LedgerArg... args) {
    return new ContractCall(contractId, function, List.of(args));
  }
}
