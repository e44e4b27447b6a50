package com.boxmeout.ledger.envelope;

import lombok.NonNull;

import java.util.ArrayList;
import java.util.List;

public record TransactionEnvelope(
    @NonNull LedgerTransaction transaction,
    List<DecoratedSignature> signatures
) implements LedgerEnvelope {

  public TransactionEnvelope {
    signatures = signatures == null ? List.of() : List.copyOf(signatures);
  }

  public static TransactionEnvelope unsigned(LedgerTransaction transaction) {
    return new TransactionEnvelope(transaction, List.of());
  }

  @Override
  public int envelopeType() {
    return TYPE_TRANSACTION;
  }

  @Override
  public ContractCall call() {
    return transaction.call();
  }

  @Override
  public String signingAccount() {
    return transaction.sourceAccount();
  }

  @Override
  public TransactionEnvelope withSignature(DecoratedSignature signature) {
    List<DecoratedSignature> next = new ArrayList<>(signatures);
    next.add(signature);
    return new TransactionEnvelope(transaction, next);
  }
}
