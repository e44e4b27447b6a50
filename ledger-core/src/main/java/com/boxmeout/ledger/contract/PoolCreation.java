package com.boxmeout.ledger.contract;

public record PoolCreation(String txHash, PoolState pool) {
}
