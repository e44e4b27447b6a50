package com.boxmeout.market.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Market states. Transitions form a DAG: OPEN -> CLOSED -> RESOLVED, and OPEN/CLOSED -> CANCELLED.
 * OPEN -> RESOLVED is allowed as well (early resolution).
 */
public enum MarketStatus {
    OPEN,
    CLOSED,
    RESOLVED,
    CANCELLED;

    public Set<MarketStatus> successors() {
        return switch (this) {
            case OPEN -> EnumSet.of(CLOSED, RESOLVED, CANCELLED);
            case CLOSED -> EnumSet.of(RESOLVED, CANCELLED);
            case RESOLVED, CANCELLED -> EnumSet.noneOf(MarketStatus.class);
        };
    }

    public boolean canTransitionTo(MarketStatus next) {
        return successors().contains(next);
    }

    public boolean isTerminal() {
        return successors().isEmpty();
    }
}
