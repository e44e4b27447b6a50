package com.boxmeout.ledger.reliability;

import java.time.Instant;

/**
 * @param params call parameters as JSON text
 */
public record DeadLetterEntry(
    String txHash,
    String serviceName,
    String functionName,
    String params,
    String error,
    DeadLetterStatus status,
    Instant createdAt,
    Instant updatedAt
) {
}
