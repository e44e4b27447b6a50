package com.boxmeout.ledger.gateway;

public record SubmitResponse(
    String hash,
    SubmitStatus status,
    String errorResult
) {
}
