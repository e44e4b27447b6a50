package com.boxmeout.ledger.reliability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Emits an ERROR log line tagged {@code [ALERT]} and counts alerts per contract service.
 * Log-based alert routing picks these up.
 */
@Slf4j
public class LoggingLedgerAlerter implements LedgerAlerter {

  private final MeterRegistry meterRegistry;

  public LoggingLedgerAlerter(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  @Override
  public void operationFailed(String txHash, LedgerOperation operation, String error) {
    log.error("[ALERT] ledger transaction failed permanently (hash={}, op={}, error={})", txHash, operation, error);
    Counter.builder("ledger.alerts")
        .tag("service", operation.serviceName())
        .tag("function", operation.functionName())
        .register(meterRegistry)
        .increment();
  }
}
