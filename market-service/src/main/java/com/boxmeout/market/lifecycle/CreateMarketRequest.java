package com.boxmeout.market.lifecycle;

import java.time.Instant;

/**
 * @param resolutionTime optional; defaults to {@code closingAt} plus the configured resolution delay
 */
public record CreateMarketRequest(
        String title,
        String description,
        String category,
        String creatorId,
        String outcomeA,
        String outcomeB,
        Instant closingAt,
        Instant resolutionTime
) {
}
