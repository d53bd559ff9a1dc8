package com.tradecontrol.ladder;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a safety order. Transitions are monotone:
 * PENDING -> TRIGGERED -> FILLED, or PENDING -> CANCELLED.
 */
public enum SafetyOrderStatus {
    PENDING,
    TRIGGERED,
    FILLED,
    CANCELLED;

    public boolean canTransitionTo(SafetyOrderStatus next) {
        return allowedNext().contains(next);
    }

    public boolean isTerminal() {
        return allowedNext().isEmpty();
    }

    private Set<SafetyOrderStatus> allowedNext() {
        switch (this) {
            case PENDING:
                return EnumSet.of(TRIGGERED, CANCELLED);
            case TRIGGERED:
                return EnumSet.of(FILLED);
            default:
                return EnumSet.noneOf(SafetyOrderStatus.class);
        }
    }
}
