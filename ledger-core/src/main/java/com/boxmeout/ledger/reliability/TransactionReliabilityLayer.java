package com.boxmeout.ledger.reliability;

import com.boxmeout.ledger.LedgerException;
import com.boxmeout.ledger.config.LedgerProperties;
import com.boxmeout.ledger.envelope.EnvelopeCodec;
import com.boxmeout.ledger.envelope.LedgerEnvelope;
import com.boxmeout.ledger.gateway.LedgerGateway;
import com.boxmeout.ledger.gateway.LedgerNetworkException;
import com.boxmeout.ledger.gateway.LedgerRejectedException;
import com.boxmeout.ledger.gateway.PollResponse;
import com.boxmeout.ledger.gateway.SubmitResponse;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Submits signed envelopes and drives them to finality.
 *
 * <p>Per operation: submission, then status polls with exponential backoff (initial delay doubling
 * on every NOT_FOUND up to a cap) for a bounded number of attempts. A FAILED status is final at once.
 * Transport errors draw on a separate, smaller budget with a fixed delay. Whatever ends an operation
 * without SUCCESS (ledger rejection, poll budget, network budget) writes one dead letter keyed by the
 * transaction hash, raises an alert and fails the returned future with {@link LedgerOperationException}.
 *
 * <p>The hash is computed locally before submission, so callers can persist it before the ledger has
 * seen the transaction. Re-sending the identical envelope after a transport error is safe: the
 * ledger refuses a second use of the same sequence number.
 */
@Slf4j
public class TransactionReliabilityLayer {

  private final LedgerGateway gateway;
  private final EnvelopeCodec codec;
  private final DeadLetterQueue deadLetterQueue;
  private final LedgerAlerter alerter;
  private final PollScheduler scheduler;
  private final LedgerProperties.Reliability config;

  private final Counter confirmed;
  private final Counter deadLettered;

  public TransactionReliabilityLayer(
      @NonNull LedgerGateway gateway,
      @NonNull EnvelopeCodec codec,
      @NonNull DeadLetterQueue deadLetterQueue,
      @NonNull LedgerAlerter alerter,
      @NonNull PollScheduler scheduler,
      @NonNull LedgerProperties.Reliability config,
      @NonNull MeterRegistry meterRegistry
  ) {
    this.gateway = gateway;
    this.codec = codec;
    this.deadLetterQueue = deadLetterQueue;
    this.alerter = alerter;
    this.scheduler = scheduler;
    this.config = config;
    this.confirmed = Counter.builder("ledger.operations").tag("outcome", "confirmed").register(meterRegistry);
    this.deadLettered = Counter.builder("ledger.operations").tag("outcome", "dead_lettered").register(meterRegistry);
  }

  public String hashOf(LedgerEnvelope envelope) {
    return codec.hashHex(envelope);
  }

  public CompletableFuture<ConfirmedTransaction> submitAsync(@NonNull LedgerEnvelope signedEnvelope, @NonNull LedgerOperation operation) {
    String txHash = codec.hashHex(signedEnvelope);
    return CompletableFuture.completedFuture(null)
        .thenCompose(v -> send(signedEnvelope, txHash, operation, 0))
        .thenCompose(networkFailures -> poll(txHash, operation, 0, config.initialBackoffMillis(), networkFailures));
  }

  /**
   * Blocking variant of {@link #submitAsync}.
   *
   * @throws LedgerOperationException when the operation failed permanently
   */
  public ConfirmedTransaction submit(LedgerEnvelope signedEnvelope, LedgerOperation operation) {
    return join(submitAsync(signedEnvelope, operation));
  }

  /**
   * Waits for a transaction that was submitted elsewhere (or by an earlier process) to reach finality.
   */
  public CompletableFuture<ConfirmedTransaction> awaitConfirmationAsync(@NonNull String txHash, @NonNull LedgerOperation operation) {
    return CompletableFuture.completedFuture(null)
        .thenCompose(v -> poll(txHash, operation, 0, config.initialBackoffMillis(), 0));
  }

  private CompletableFuture<Integer> send(LedgerEnvelope envelope, String txHash, LedgerOperation operation, int networkFailures) {
    SubmitResponse response;
    try {
      response = gateway.submit(envelope);
    } catch (LedgerNetworkException e) {
      return retrySend(envelope, txHash, operation, networkFailures, e);
    } catch (LedgerRejectedException e) {
      return CompletableFuture.failedFuture(deadLetter(LedgerOperationException.Reason.LEDGER_REJECTED, txHash, operation,
          "Submission rejected: " + e.getMessage(), e));
    }

    if (response.hash() != null && !response.hash().equalsIgnoreCase(txHash)) {
      log.warn("ledger reported hash {} for locally computed {} (op={})", response.hash(), txHash, operation);
    }

    return switch (response.status()) {
      case PENDING, DUPLICATE -> {
        log.info("ledger tx submitted (hash={}, op={}, status={})", txHash, operation, response.status());
        yield CompletableFuture.completedFuture(networkFailures);
      }
      case TRY_AGAIN_LATER -> retrySend(envelope, txHash, operation, networkFailures,
          new LedgerNetworkException("ledger asked to try again later", null));
      case ERROR -> CompletableFuture.failedFuture(deadLetter(LedgerOperationException.Reason.LEDGER_REJECTED, txHash,
          operation, "Submission rejected: " + response.errorResult(), null));
    };
  }

  private CompletableFuture<Integer> retrySend(LedgerEnvelope envelope, String txHash, LedgerOperation operation,
                                               int networkFailures, LedgerException error) {
    int failures = networkFailures + 1;
    log.warn("network error submitting {} (hash={}), retry {}/{}: {}",
        operation, txHash, failures, config.maxNetworkRetries(), error.getMessage());
    if (failures >= config.maxNetworkRetries()) {
      return CompletableFuture.failedFuture(deadLetter(LedgerOperationException.Reason.NETWORK_EXHAUSTED, txHash,
          operation, "Max network retries reached: " + error.getMessage(), error));
    }
    return scheduler.after(Duration.ofMillis(config.networkRetryDelayMillis()))
        .thenCompose(v -> send(envelope, txHash, operation, failures));
  }

  private CompletableFuture<ConfirmedTransaction> poll(String txHash, LedgerOperation operation, int attempt,
                                                       long backoffMillis, int networkFailures) {
    PollResponse response;
    try {
      response = gateway.poll(txHash);
    } catch (LedgerException e) {
      int failures = networkFailures + 1;
      log.warn("network error polling {} (hash={}), retry {}/{}: {}",
          operation, txHash, failures, config.maxNetworkRetries(), e.getMessage());
      if (failures >= config.maxNetworkRetries()) {
        return CompletableFuture.failedFuture(deadLetter(LedgerOperationException.Reason.NETWORK_EXHAUSTED, txHash,
            operation, "Max network retries reached: " + e.getMessage(), e));
      }
      return scheduler.after(Duration.ofMillis(config.networkRetryDelayMillis()))
          .thenCompose(v -> poll(txHash, operation, attempt, backoffMillis, failures));
    }

    int polls = attempt + 1;
    switch (response.status()) {
      case SUCCESS:
        confirmed.increment();
        log.info("ledger tx confirmed (hash={}, op={}, polls={})", txHash, operation, polls);
        return CompletableFuture.completedFuture(new ConfirmedTransaction(txHash, response.returnValue(), polls));
      case FAILED:
        String reason = response.resultCode() == null
            ? "Transaction failed on ledger"
            : "Transaction failed on ledger: " + response.resultCode();
        return CompletableFuture.failedFuture(deadLetter(LedgerOperationException.Reason.LEDGER_REJECTED, txHash,
            operation, reason, null));
      default:
        break;
    }

    if (polls >= config.maxPollingAttempts()) {
      return CompletableFuture.failedFuture(deadLetter(LedgerOperationException.Reason.TIMEOUT, txHash, operation,
          "Transaction confirmation timeout", null));
    }
    long nextBackoff = Math.min(backoffMillis * 2, config.maxBackoffMillis());
    return scheduler.after(Duration.ofMillis(backoffMillis))
        .thenCompose(v -> poll(txHash, operation, polls, nextBackoff, networkFailures));
  }

  private LedgerOperationException deadLetter(LedgerOperationException.Reason reason, String txHash,
                                              LedgerOperation operation, String error, Throwable cause) {
    log.error("dead-lettering ledger tx (hash={}, op={}, reason={}): {}", txHash, operation, reason, error);
    deadLettered.increment();
    try {
      deadLetterQueue.upsert(txHash, operation, error);
      alerter.operationFailed(txHash, operation, error);
    } catch (RuntimeException e) {
      log.error("failed to record dead letter (hash={}, op={})", txHash, operation, e);
    }
    return new LedgerOperationException(reason, txHash, error, cause);
  }

  static <T> T join(CompletableFuture<T> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException re) {
        throw re;
      }
      throw e;
    }
  }
}
