package com.boxmeout.market.settlement;

import java.math.BigDecimal;
import java.util.List;

/**
 * @param failedUsers users whose settlement transaction rolled back; their positions stay unsettled
 */
public record SettlementSummary(
        String marketId,
        int winningOutcome,
        int usersSettled,
        int positionsSettled,
        int winners,
        int losers,
        BigDecimal totalCredited,
        List<String> failedUsers
) {

    public boolean complete() {
        return failedUsers.isEmpty();
    }
}
