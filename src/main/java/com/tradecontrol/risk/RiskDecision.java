package com.tradecontrol.risk;

import java.time.Instant;
import lombok.Getter;

/**
 * Result of a gatekeeping check.
 *
 * <p>Either ALLOWED (optionally with an advisory warning) or REJECTED with exactly one
 * {@link RiskRejectReason} and a human-readable message. Time-boxed rejections (cooldowns,
 * circuit breaker) carry {@code retryAt}, the earliest instant the same call can pass
 * that rule.
 */
@Getter
public class RiskDecision {

    private static final RiskDecision ALLOWED = new RiskDecision(true, null, null, null, null);

    private final boolean allowed;
    private final RiskRejectReason reason;
    private final String message;
    private final String warning;
    private final Instant retryAt;

    private RiskDecision(
            boolean allowed, RiskRejectReason reason, String message, String warning, Instant retryAt) {
        this.allowed = allowed;
        this.reason = reason;
        this.message = message;
        this.warning = warning;
        this.retryAt = retryAt;
    }

    public static RiskDecision allowed() {
        return ALLOWED;
    }

    public static RiskDecision allowedWithWarning(String warning) {
        return new RiskDecision(true, null, null, warning, null);
    }

    public static RiskDecision rejected(RiskRejectReason reason, String message) {
        return new RiskDecision(false, reason, message, null, null);
    }

    public static RiskDecision rejected(RiskRejectReason reason, String message, Instant retryAt) {
        return new RiskDecision(false, reason, message, null, retryAt);
    }

    public boolean isRejected() {
        return !allowed;
    }

    public boolean hasWarning() {
        return warning != null;
    }

    @Override
    public String toString() {
        if (allowed) {
            return warning == null ? "ALLOWED" : "ALLOWED (" + warning + ")";
        }
        return reason + ": " + message;
    }
}
