package com.boxmeout.ledger.reliability;

/**
 * Hook for paging a human when a ledger operation is dead-lettered.
 */
public interface LedgerAlerter {

  void operationFailed(String txHash, LedgerOperation operation, String error);
}
