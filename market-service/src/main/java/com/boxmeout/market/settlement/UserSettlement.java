package com.boxmeout.market.settlement;

import java.math.BigDecimal;

/**
 * What one user's settlement transaction applied. All zero when every position was already settled.
 */
record UserSettlement(
        int positions,
        int winners,
        int losers,
        BigDecimal credited
) {

    static final UserSettlement NOTHING = new UserSettlement(0, 0, 0, BigDecimal.ZERO);
}
