package com.tradecontrol.risk;

/**
 * Machine-readable reason attached to a rejected {@link RiskDecision}.
 *
 * <p>For averaging orders the gatekeeper evaluates the rules in declaration order
 * (circuit breaker first, post-loss cooldown last) and reports only the first one
 * violated.
 */
public enum RiskRejectReason {
    CIRCUIT_BREAKER_ACTIVE,
    MAX_DEPTH_REACHED,
    ORDER_TOO_LARGE,
    ORDER_PERCENT_TOO_LARGE,
    AGGREGATE_CAP_EXCEEDED,
    AGGREGATE_PERCENT_EXCEEDED,
    INSUFFICIENT_BALANCE,
    COOLDOWN_ACTIVE,
    POST_LOSS_COOLDOWN_ACTIVE,
    MAX_DRAWDOWN_EXCEEDED,
    MAX_OPEN_POSITIONS_REACHED
}
