package com.boxmeout.ledger.reliability;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * @param pollAttempts status polls spent before the ledger reported SUCCESS
 */
public record ConfirmedTransaction(
    String txHash,
    JsonNode returnValue,
    int pollAttempts
) {
}
