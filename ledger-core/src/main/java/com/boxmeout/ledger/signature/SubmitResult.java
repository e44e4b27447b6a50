package com.boxmeout.ledger.signature;

import com.fasterxml.jackson.databind.JsonNode;

public record SubmitResult(
    String txHash,
    String status,
    JsonNode returnValue
) {
}
