package com.boxmeout.ledger.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.net.URI;
import java.util.List;
import java.util.Objects;

@Validated
@ConfigurationProperties(prefix = "ledger")
public record LedgerProperties(
    /**
     * JSON-RPC endpoint of the ledger node.
     */
    URI rpcUrl,
    /**
     * Network passphrase mixed into every transaction hash so envelopes cannot be replayed across networks.
     */
    String networkPassphrase,
    /**
     * Hex private key of the platform admin account. Signs custodial and admin-only contract calls.
     * Never a user-fund key.
     */
    String adminSecretKey,
    /**
     * Hex private keys of the oracle signers. Attestations rotate through them by index.
     */
    List<String> oracleSecretKeys,
    /**
     * Whether user trades are signed by the admin account or by the user's own wallet.
     */
    ExecutionMode executionMode,
    /**
     * Decimals of the settlement token (USDC = 6).
     */
    @NotNull @Min(0) Integer usdcDecimals,
    /**
     * Base fee attached to every built transaction, in ledger stroops.
     */
    @NotNull @Min(1) Long baseFee,
    /**
     * Validity window of a built transaction.
     */
    @NotNull @Min(1) Long txTimeoutSeconds,
    @Valid Contracts contracts,
    @Valid Reliability reliability
) {

  public LedgerProperties {
    if (rpcUrl == null) {
      rpcUrl = URI.create("http://localhost:8000/rpc");
    }
    if (networkPassphrase == null || networkPassphrase.isBlank()) {
      networkPassphrase = "Test Ledger Network ; 2024";
    }
    oracleSecretKeys = oracleSecretKeys == null ? List.of() : oracleSecretKeys.stream()
        .filter(Objects::nonNull)
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .toList();
    if (executionMode == null) {
      executionMode = ExecutionMode.CUSTODIAL;
    }
    if (usdcDecimals == null) {
      usdcDecimals = 6;
    }
    if (baseFee == null) {
      baseFee = 100L;
    }
    if (txTimeoutSeconds == null) {
      txTimeoutSeconds = 30L;
    }
    if (contracts == null) {
      contracts = new Contracts(null, null, null, null);
    }
    if (reliability == null) {
      reliability = new Reliability(null, null, null, null, null, null, null);
    }
  }

  public record Contracts(
      String factory,
      String amm,
      String oracle,
      String treasury
  ) {
  }

  public record Reliability(
      /**
       * Confirmation polls before an operation is declared timed out.
       */
      @NotNull @Min(1) Integer maxPollingAttempts,
      /**
       * First wait between confirmation polls. Doubles after every NOT_FOUND.
       */
      @NotNull @Min(1) Long initialBackoffMillis,
      @NotNull @Min(1) Long maxBackoffMillis,
      /**
       * Transport failures tolerated per operation, counted separately from polls.
       */
      @NotNull @Min(1) Integer maxNetworkRetries,
      @NotNull @Min(0) Long networkRetryDelayMillis,
      /**
       * Timer threads for backoff delays. They never call the ledger.
       */
      @NotNull @Min(1) Integer schedulerThreads,
      /**
       * Threads making the blocking submit and poll calls.
       */
      @NotNull @Min(1) Integer ioThreads
  ) {
    public Reliability {
      if (maxPollingAttempts == null) {
        maxPollingAttempts = 10;
      }
      if (initialBackoffMillis == null) {
        initialBackoffMillis = 1_000L;
      }
      if (maxBackoffMillis == null) {
        maxBackoffMillis = 8_000L;
      }
      if (maxNetworkRetries == null) {
        maxNetworkRetries = 3;
      }
      if (networkRetryDelayMillis == null) {
        networkRetryDelayMillis = 2_000L;
      }
      if (schedulerThreads == null) {
        schedulerThreads = 2;
      }
      if (ioThreads == null) {
        ioThreads = 16;
      }
    }
  }
}
