package com.boxmeout.ledger.reliability;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Source of delays for the confirmation loop. Completing the returned future resumes the loop.
 */
public interface PollScheduler {

  CompletableFuture<Void> after(Duration delay);
}
