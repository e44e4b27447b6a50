package com.boxmeout.ledger.envelope;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.web3j.crypto.ECKeyPair;

@RequiredArgsConstructor
public class EnvelopeSigner {

  private final @NonNull EnvelopeCodec codec;

  public TransactionEnvelope sign(TransactionEnvelope envelope, ECKeyPair keyPair) {
    return (TransactionEnvelope) signAny(envelope, keyPair);
  }

  public FeeBumpEnvelope sign(FeeBumpEnvelope envelope, ECKeyPair keyPair) {
    return (FeeBumpEnvelope) signAny(envelope, keyPair);
  }

  private LedgerEnvelope signAny(LedgerEnvelope envelope, ECKeyPair keyPair) {
    byte[] hash = codec.hash(envelope);
    byte[] signature = LedgerKeys.signHash(hash, keyPair);
    byte[] hint = LedgerKeys.hint(LedgerKeys.publicKeyHex(keyPair));
    return envelope.withSignature(new DecoratedSignature(hint, signature));
  }
}
