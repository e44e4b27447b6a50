package com.boxmeout.ledger.contract;

/**
 * @param marketId        identifier the factory assigned to the new market
 * @param contractAddress contract that hosts the market
 */
public record MarketCreation(String marketId, String txHash, String contractAddress) {
}
