package com.boxmeout.ledger.config;

public enum ExecutionMode {
  /**
   * The admin account signs trades on behalf of the user.
   */
  CUSTODIAL,
  /**
   * The user's wallet signs an envelope built by the platform; the platform only verifies and relays it.
   */
  NON_CUSTODIAL
}
