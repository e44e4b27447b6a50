package com.boxmeout.market.odds;

import com.boxmeout.market.trading.MarketOdds;

@FunctionalInterface
public interface OddsSource {

    MarketOdds currentOdds(String marketId);
}
