package com.boxmeout.ledger.reliability;

public enum DeadLetterStatus {
  FAILED,
  RESOLVED
}
