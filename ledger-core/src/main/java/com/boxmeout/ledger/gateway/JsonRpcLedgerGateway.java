package com.boxmeout.ledger.gateway;

import com.boxmeout.ledger.config.LedgerProperties;
import com.boxmeout.ledger.envelope.ContractCall;
import com.boxmeout.ledger.envelope.EnvelopeCodec;
import com.boxmeout.ledger.envelope.LedgerEnvelope;
import com.boxmeout.ledger.envelope.LedgerTransaction;
import com.boxmeout.ledger.envelope.TransactionEnvelope;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.web3j.protocol.Web3jService;
import org.web3j.protocol.core.Request;

import java.io.IOException;
import java.math.BigInteger;
import java.time.Clock;
import java.util.List;
import java.util.Locale;

/**
 * {@link LedgerGateway} speaking JSON-RPC 2.0 ({@code getAccount}, {@code simulateTransaction},
 * {@code sendTransaction}, {@code getTransaction}) through a web3j transport.
 */
@RequiredArgsConstructor
@Slf4j
public class JsonRpcLedgerGateway implements LedgerGateway {

  private final @NonNull Web3jService rpc;
  private final @NonNull EnvelopeCodec codec;
  private final @NonNull LedgerProperties properties;
  private final @NonNull Clock clock;

  @Override
  public LedgerAccount getAccount(@NonNull String accountId) {
    JsonNode result = call("getAccount", accountId);
    String sequence = result.path("sequence").asText(null);
    if (sequence == null || sequence.isBlank()) {
      throw new LedgerRejectedException("getAccount returned no sequence for " + accountId);
    }
    return new LedgerAccount(accountId, new BigInteger(sequence));
  }

  @Override
  public JsonNode simulate(@NonNull ContractCall call, @NonNull String sourceAccount) {
    // simulation never consumes a sequence number, so no account lookup
    long maxTime = clock.instant().getEpochSecond() + properties.txTimeoutSeconds();
    TransactionEnvelope envelope = TransactionEnvelope.unsigned(
        new LedgerTransaction(sourceAccount, BigInteger.ZERO, properties.baseFee(), maxTime, call));
    JsonNode result = call("simulateTransaction", codec.encode(envelope));
    JsonNode error = result.path("error");
    if (!error.isMissingNode() && !error.isNull()) {
      throw new LedgerRejectedException("simulation of " + call.function() + " failed: " + error.asText());
    }
    return result.path("returnValue");
  }

  @Override
  public SubmitResponse submit(@NonNull LedgerEnvelope signedEnvelope) {
    JsonNode result = call("sendTransaction", codec.encode(signedEnvelope));
    String hash = result.path("hash").asText(null);
    SubmitStatus status = parseEnum(SubmitStatus.class, result.path("status").asText(null));
    if (status == null) {
      throw new LedgerRejectedException("sendTransaction returned unknown status " + result.path("status"));
    }
    String errorResult = result.hasNonNull("errorResult") ? result.get("errorResult").asText() : null;
    log.debug("ledger sendTransaction (hash={}, status={})", hash, status);
    return new SubmitResponse(hash, status, errorResult);
  }

  @Override
  public PollResponse poll(@NonNull String txHash) {
    JsonNode result = call("getTransaction", txHash);
    TransactionStatus status = parseEnum(TransactionStatus.class, result.path("status").asText(null));
    if (status == null) {
      throw new LedgerRejectedException("getTransaction returned unknown status " + result.path("status"));
    }
    JsonNode returnValue = status == TransactionStatus.SUCCESS ? result.path("returnValue") : null;
    String resultCode = result.hasNonNull("resultCode") ? result.get("resultCode").asText() : null;
    return new PollResponse(status, returnValue, resultCode);
  }

  @Override
  public TransactionEnvelope buildUnsigned(@NonNull ContractCall call, @NonNull String sourceAccount) {
    LedgerAccount account = getAccount(sourceAccount);
    long maxTime = clock.instant().getEpochSecond() + properties.txTimeoutSeconds();
    LedgerTransaction tx = new LedgerTransaction(sourceAccount, account.nextSequence(), properties.baseFee(), maxTime, call);
    return TransactionEnvelope.unsigned(tx);
  }

  private JsonNode call(String method, String param) {
    LedgerRpcResponse response;
    try {
      response = new Request<>(method, List.of(param), rpc, LedgerRpcResponse.class).send();
    } catch (IOException e) {
      throw new LedgerNetworkException("ledger rpc " + method + " failed: " + e.getMessage(), e);
    }
    if (response == null) {
      throw new LedgerNetworkException("ledger rpc " + method + " returned no response", null);
    }
    if (response.hasError()) {
      throw new LedgerRejectedException("ledger rpc " + method + " error " + response.getError().getCode()
          + ": " + response.getError().getMessage());
    }
    JsonNode result = response.getResult();
    if (result == null || result.isNull()) {
      throw new LedgerRejectedException("ledger rpc " + method + " returned empty result");
    }
    return result;
  }

  private static <E extends Enum<E>> E parseEnum(Class<E> type, String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    try {
      return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return null;
    }
  }
}
