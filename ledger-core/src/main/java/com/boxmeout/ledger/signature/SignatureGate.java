package com.boxmeout.ledger.signature;

import com.boxmeout.ledger.envelope.DecoratedSignature;
import com.boxmeout.ledger.envelope.EnvelopeCodec;
import com.boxmeout.ledger.envelope.FeeBumpEnvelope;
import com.boxmeout.ledger.envelope.LedgerEnvelope;
import com.boxmeout.ledger.envelope.LedgerKeys;
import com.boxmeout.ledger.envelope.MalformedEnvelopeException;
import com.boxmeout.ledger.gateway.TransactionStatus;
import com.boxmeout.ledger.reliability.ConfirmedTransaction;
import com.boxmeout.ledger.reliability.LedgerOperation;
import com.boxmeout.ledger.reliability.TransactionReliabilityLayer;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Entry point for envelopes signed outside the platform. Nothing reaches the ledger unless it carries
 * a valid signature from the account the caller is authenticated as.
 *
 * <p>The expected public key must come from the authenticated identity, never from the request body.
 */
@Slf4j
@RequiredArgsConstructor
public class SignatureGate {

  private static final String USER_TX_SERVICE = "user-tx";

  private final @NonNull EnvelopeCodec codec;
  private final @NonNull TransactionReliabilityLayer reliability;

  /**
   * @throws MalformedEnvelopeException if the input is neither a transaction nor a fee-bump envelope
   */
  public LedgerEnvelope decode(String envelopeBase64) {
    return codec.decode(envelopeBase64);
  }

  /**
   * True iff one of the envelope's signatures carries the hint of {@code expectedPublicKey} and verifies
   * against the envelope hash under that key. Fee-bump envelopes are checked on the wrapped transaction,
   * which is where the user's authorisation lives.
   */
  public boolean verify(@NonNull LedgerEnvelope envelope, String expectedPublicKey) {
    String expected;
    try {
      expected = LedgerKeys.normalize(expectedPublicKey == null ? "" : expectedPublicKey);
    } catch (IllegalArgumentException e) {
      return false;
    }
    if (envelope instanceof FeeBumpEnvelope feeBump) {
      return verify(feeBump.inner(), expected);
    }

    byte[] hint = LedgerKeys.hint(expected);
    byte[] hash = codec.hash(envelope);
    for (DecoratedSignature signature : envelope.signatures()) {
      if (!signature.hintMatches(hint)) {
        continue;
      }
      Optional<String> signer = LedgerKeys.recover(hash, signature.signature());
      if (signer.isPresent() && signer.get().equals(expected)) {
        return true;
      }
    }
    return false;
  }

  public SubmitResult validateAndSubmit(String envelopeBase64, String expectedPublicKey, String opName) {
    return validateAndSubmit(envelopeBase64, expectedPublicKey, new LedgerOperation(USER_TX_SERVICE, opName, Map.of()));
  }

  /**
   * Decode, verify, submit and wait for finality.
   *
   * @throws MalformedEnvelopeException if the envelope cannot be decoded
   * @throws InvalidSignatureException  if the expected key did not sign it, or it invokes a different function
   * @throws com.boxmeout.ledger.reliability.LedgerOperationException if the ledger did not confirm it
   */
  public SubmitResult validateAndSubmit(String envelopeBase64, String expectedPublicKey, LedgerOperation operation) {
    return join(validateAndSubmitAsync(envelopeBase64, expectedPublicKey, operation));
  }

  /**
   * Asynchronous variant. Decoding and verification happen on the calling thread and throw directly.
   */
  public CompletableFuture<SubmitResult> validateAndSubmitAsync(String envelopeBase64, String expectedPublicKey,
                                                                @NonNull LedgerOperation operation) {
    return submitAuthorizedAsync(authorize(envelopeBase64, expectedPublicKey, operation), operation);
  }

  /**
   * Decode and verify without submitting, for callers that record the transaction hash first.
   * Pass the result to {@link #submitAuthorizedAsync}.
   *
   * @throws MalformedEnvelopeException if the envelope cannot be decoded
   * @throws InvalidSignatureException  if the expected key did not sign it, or it invokes a different function
   */
  public LedgerEnvelope authorize(String envelopeBase64, String expectedPublicKey, @NonNull LedgerOperation operation) {
    LedgerEnvelope envelope = decode(envelopeBase64);
    if (!verify(envelope, expectedPublicKey)) {
      log.warn("rejected envelope with invalid signature (op={}, expectedKey={})", operation, abbreviate(expectedPublicKey));
      throw new InvalidSignatureException("envelope is not signed by the authenticated account");
    }
    String invoked = envelope.call().function();
    if (!invoked.equals(operation.functionName())) {
      log.warn("rejected envelope invoking {} for authorised operation {} (expectedKey={})",
          invoked, operation, abbreviate(expectedPublicKey));
      throw new InvalidSignatureException("envelope invokes " + invoked + ", not " + operation.functionName());
    }
    return envelope;
  }

  public CompletableFuture<SubmitResult> submitAuthorizedAsync(@NonNull LedgerEnvelope envelope, @NonNull LedgerOperation operation) {
    return reliability.submitAsync(envelope, operation)
        .thenApply(SignatureGate::toResult);
  }

  public SubmitResult submitAuthorized(LedgerEnvelope envelope, LedgerOperation operation) {
    return join(submitAuthorizedAsync(envelope, operation));
  }

  public String hashOf(LedgerEnvelope envelope) {
    return codec.hashHex(envelope);
  }

  private static SubmitResult toResult(ConfirmedTransaction confirmed) {
    return new SubmitResult(confirmed.txHash(), TransactionStatus.SUCCESS.name(), confirmed.returnValue());
  }

  private static SubmitResult join(CompletableFuture<SubmitResult> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException re) {
        throw re;
      }
      throw e;
    }
  }

  private static String abbreviate(String key) {
    if (key == null || key.length() <= 12) {
      return key;
    }
    return key.substring(0, 6) + "..." + key.substring(key.length() - 6);
  }
}
