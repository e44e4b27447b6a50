package com.boxmeout.ledger.gateway;

public enum SubmitStatus {
  PENDING,
  DUPLICATE,
  TRY_AGAIN_LATER,
  ERROR
}
