package com.boxmeout.ledger.contract;

import com.boxmeout.ledger.config.LedgerConfigurationException;
import com.boxmeout.ledger.envelope.ContractCall;
import com.boxmeout.ledger.envelope.EnvelopeCodec;
import com.boxmeout.ledger.envelope.EnvelopeSigner;
import com.boxmeout.ledger.envelope.LedgerKeys;
import com.boxmeout.ledger.envelope.TransactionEnvelope;
import com.boxmeout.ledger.gateway.LedgerGateway;
import com.boxmeout.ledger.reliability.ConfirmedTransaction;
import com.boxmeout.ledger.reliability.LedgerOperation;
import com.boxmeout.ledger.reliability.TransactionReliabilityLayer;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.web3j.crypto.ECKeyPair;

import java.math.BigInteger;
import java.util.concurrent.CompletableFuture;

/**
 * Builds, signs and submits contract calls with platform-held keys (the admin account, oracle signers).
 * User-fund keys never pass through here.
 */
@Slf4j
public class LedgerTransactionSubmitter {

  // Secret 1 is a well-known throwaway key; read-only simulations only need some source account.
  private static final String ANONYMOUS_READER = LedgerKeys.publicKeyHex(ECKeyPair.create(BigInteger.ONE));

  private final LedgerGateway gateway;
  private final EnvelopeCodec codec;
  private final EnvelopeSigner signer;
  private final TransactionReliabilityLayer reliability;
  private final ECKeyPair adminKey;

  public LedgerTransactionSubmitter(
      @NonNull LedgerGateway gateway,
      @NonNull EnvelopeCodec codec,
      @NonNull EnvelopeSigner signer,
      @NonNull TransactionReliabilityLayer reliability,
      String adminSecretKey
  ) {
    this.gateway = gateway;
    this.codec = codec;
    this.signer = signer;
    this.reliability = reliability;
    if (adminSecretKey == null || adminSecretKey.isBlank()) {
      log.warn("ledger.admin-secret-key not configured; admin-signed contract calls will be refused");
      this.adminKey = null;
    } else {
      this.adminKey = LedgerKeys.keyPairFromSecret(adminSecretKey);
    }
  }

  public boolean hasAdminKey() {
    return adminKey != null;
  }

  public String adminAccount() {
    return LedgerKeys.publicKeyHex(requireAdminKey());
  }

  public PreparedTransaction prepare(ContractCall call, LedgerOperation operation) {
    return prepare(call, operation, requireAdminKey());
  }

  public PreparedTransaction prepare(@NonNull ContractCall call, @NonNull LedgerOperation operation, @NonNull ECKeyPair key) {
    TransactionEnvelope unsigned = gateway.buildUnsigned(call, LedgerKeys.publicKeyHex(key));
    TransactionEnvelope signed = signer.sign(unsigned, key);
    return new PreparedTransaction(signed, codec.hashHex(signed), operation);
  }

  public ConfirmedTransaction submit(PreparedTransaction prepared) {
    return reliability.submit(prepared.envelope(), prepared.operation());
  }

  public CompletableFuture<ConfirmedTransaction> submitAsync(PreparedTransaction prepared) {
    return reliability.submitAsync(prepared.envelope(), prepared.operation());
  }

  /**
   * Prepares with the admin key and blocks until the ledger confirms.
   */
  public ConfirmedTransaction execute(ContractCall call, LedgerOperation operation) {
    return submit(prepare(call, operation));
  }

  /**
   * Read-only contract call through simulation.
   */
  public JsonNode read(ContractCall call) {
    return gateway.simulate(call, adminKey == null ? ANONYMOUS_READER : LedgerKeys.publicKeyHex(adminKey));
  }

  /**
   * Unsigned envelope, base64, for the user's wallet to sign.
   */
  public String buildUnsigned(ContractCall call, String userPublicKey) {
    return codec.encode(gateway.buildUnsigned(call, LedgerKeys.normalize(userPublicKey)));
  }

  private ECKeyPair requireAdminKey() {
    if (adminKey == null) {
      throw new LedgerConfigurationException("ledger.admin-secret-key is not configured, cannot sign transactions");
    }
    return adminKey;
  }
}
