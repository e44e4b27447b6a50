package com.boxmeout.ledger.envelope;

import lombok.NonNull;

import java.math.BigInteger;

/**
 * An unsigned contract invocation.
 *
 * @param sourceAccount public key (hex) of the account that pays and whose sequence is consumed
 * @param sequence      next sequence number of the source account; the ledger rejects reuse
 * @param fee           fee offered, in stroops
 * @param maxTime       epoch second after which the ledger refuses the transaction
 */
public record LedgerTransaction(
    @NonNull String sourceAccount,
    @NonNull BigInteger sequence,
    long fee,
    long maxTime,
    @NonNull ContractCall call
) {
}
