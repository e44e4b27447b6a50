package com.boxmeout.market.odds;

/**
 * Delivers odds changes to a market's subscribers.
 */
@FunctionalInterface
public interface OddsChangeSink {

    void publish(OddsChangedEvent event);
}
