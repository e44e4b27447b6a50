package com.boxmeout.market.odds;

import java.time.Instant;

/**
 * @param type always {@value #TYPE}; kept on the payload for subscribers that multiplex event kinds
 */
public record OddsChangedEvent(
        String type,
        String marketId,
        double yesOdds,
        double noOdds,
        OddsDirection direction,
        Instant timestamp
) {

    public static final String TYPE = "odds_changed";

    public static OddsChangedEvent of(String marketId, double yesOdds, double noOdds, OddsDirection direction, Instant timestamp) {
        return new OddsChangedEvent(TYPE, marketId, yesOdds, noOdds, direction, timestamp);
    }
}
