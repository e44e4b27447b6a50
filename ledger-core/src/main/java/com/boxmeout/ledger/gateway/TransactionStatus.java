package com.boxmeout.ledger.gateway;

public enum TransactionStatus {
  SUCCESS,
  FAILED,
  NOT_FOUND
}
