package com.boxmeout.ledger.reliability;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Delays on a {@link ScheduledExecutorService}, then resumes the waiting operation on the I/O executor.
 * Timer threads only hand off, so a slow ledger call never holds back another operation's delay.
 */
@RequiredArgsConstructor
public class ExecutorPollScheduler implements PollScheduler {

  private final @NonNull ScheduledExecutorService timer;
  private final @NonNull Executor io;

  @Override
  public CompletableFuture<Void> after(Duration delay) {
    CompletableFuture<Void> future = new CompletableFuture<>();
    timer.schedule(() -> resume(future), Math.max(0, delay.toMillis()), TimeUnit.MILLISECONDS);
    return future;
  }

  private void resume(CompletableFuture<Void> future) {
    try {
      io.execute(() -> future.complete(null));
    } catch (RejectedExecutionException e) {
      future.completeExceptionally(e);
    }
  }
}
