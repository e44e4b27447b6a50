package com.boxmeout.ledger.reliability;

import java.util.List;
import java.util.Optional;

/**
 * Durable record of ledger operations that failed permanently. At most one entry per transaction hash.
 */
public interface DeadLetterQueue {

  /**
   * Creates the entry for {@code txHash}, or overwrites error/status/updatedAt of the existing one.
   */
  void upsert(String txHash, LedgerOperation operation, String error);

  Optional<DeadLetterEntry> find(String txHash);

  List<DeadLetterEntry> listFailed(int limit);

  /**
   * Marks an entry as handled by an operator. Returns false when there is no such entry.
   */
  boolean markResolved(String txHash);
}
