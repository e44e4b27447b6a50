package com.boxmeout.ledger.envelope;

import lombok.NonNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Wraps an already-signed transaction so a different account pays a higher fee.
 * The fee source signs the outer envelope; the user's authorisation lives in the inner one.
 */
public record FeeBumpEnvelope(
    @NonNull String feeSource,
    long maxFee,
    @NonNull TransactionEnvelope inner,
    List<DecoratedSignature> signatures
) implements LedgerEnvelope {

  public FeeBumpEnvelope {
    signatures = signatures == null ? List.of() : List.copyOf(signatures);
  }

  @Override
  public int envelopeType() {
    return TYPE_FEE_BUMP;
  }

  @Override
  public ContractCall call() {
    return inner.call();
  }

  @Override
  public String signingAccount() {
    return feeSource;
  }

  @Override
  public FeeBumpEnvelope withSignature(DecoratedSignature signature) {
    List<DecoratedSignature> next = new ArrayList<>(signatures);
    next.add(signature);
    return new FeeBumpEnvelope(feeSource, maxFee, inner, next);
  }
}
