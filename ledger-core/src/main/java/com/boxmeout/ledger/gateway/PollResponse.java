package com.boxmeout.ledger.gateway;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * @param returnValue contract return value, present only for SUCCESS
 * @param resultCode  ledger result code, useful for FAILED
 */
public record PollResponse(
    TransactionStatus status,
    JsonNode returnValue,
    String resultCode
) {

  public static PollResponse notFound() {
    return new PollResponse(TransactionStatus.NOT_FOUND, null, null);
  }
}
