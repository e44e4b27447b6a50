package com.boxmeout.ledger.contract;

import com.boxmeout.ledger.envelope.LedgerEnvelope;
import com.boxmeout.ledger.reliability.LedgerOperation;

/**
 * A signed envelope whose hash is known but which has not been submitted yet. Lets callers record
 * the hash before the ledger sees the transaction.
 */
public record PreparedTransaction(
    LedgerEnvelope envelope,
    String txHash,
    LedgerOperation operation
) {
}
