package com.tradecontrol.risk;

import com.tradecontrol.exception.InvalidConfigurationException;
import java.math.BigDecimal;
import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/**
 * Limits enforced by the {@link RiskGatekeeper} for one bot instance.
 *
 * <p>Organized into three groups:
 * <ul>
 *   <li><b>Exposure:</b> open positions, ladder depth, per-order and aggregate caps
 *       (absolute and as a percentage of available balance)</li>
 *   <li><b>Loss:</b> unrealized drawdown cap, daily loss caps, consecutive-loss
 *       circuit breaker</li>
 *   <li><b>Pacing:</b> cooldown between orders and after a losing close</li>
 * </ul>
 *
 * <p>Amounts are in quote currency. Loss percentages are 0-100; the per-order and
 * aggregate caps may exceed 100 for leveraged accounts.
 */
@Value
@Builder(toBuilder = true)
public class RiskLimits {

    /** Circuit breaker window. Not configurable. */
    public static final Duration CIRCUIT_BREAKER_DURATION = Duration.ofHours(1);

    /** Fraction of {@link #maxDcaOrders} at which approvals start carrying a warning. */
    public static final BigDecimal DEPTH_WARNING_RATIO = new BigDecimal("0.8");

    // ==================== Exposure ====================

    @Builder.Default
    int maxOpenPositions = 5;

    /** Maximum ladder depth (averaging orders opened for the active position). */
    @Builder.Default
    int maxDcaOrders = 10;

    @Builder.Default
    BigDecimal maxOrderAmount = new BigDecimal("1000");

    @Builder.Default
    BigDecimal maxOrderPercent = new BigDecimal("20");

    @Builder.Default
    BigDecimal maxTotalInvested = new BigDecimal("5000");

    @Builder.Default
    BigDecimal maxTotalInvestedPercent = new BigDecimal("50");

    // ==================== Loss ====================

    @Builder.Default
    BigDecimal maxDrawdownPercent = new BigDecimal("30");

    @Builder.Default
    BigDecimal maxDailyLoss = new BigDecimal("500");

    @Builder.Default
    BigDecimal maxDailyLossPercent = new BigDecimal("10");

    @Builder.Default
    boolean circuitBreakerEnabled = true;

    /** Consecutive losing closes that arm the circuit breaker. */
    @Builder.Default
    int circuitBreakerLosses = 5;

    // ==================== Pacing ====================

    @Builder.Default
    Duration orderCooldown = Duration.ofMinutes(5);

    @Builder.Default
    Duration lossCooldown = Duration.ofMinutes(30);

    public static RiskLimits defaults() {
        return RiskLimits.builder().build();
    }

    /**
     * Rejects limits that could never be satisfied or would silently disable a check.
     *
     * @return this, for chaining
     * @throws InvalidConfigurationException on the first invalid field
     */
    public RiskLimits validate() {
        requirePositive("maxOpenPositions", maxOpenPositions);
        requirePositive("maxDcaOrders", maxDcaOrders);
        requireNonNegative("maxOrderAmount", maxOrderAmount);
        requireNonNegative("maxOrderPercent", maxOrderPercent);
        requireNonNegative("maxTotalInvested", maxTotalInvested);
        requireNonNegative("maxTotalInvestedPercent", maxTotalInvestedPercent);
        requirePercent("maxDrawdownPercent", maxDrawdownPercent);
        requireNonNegative("maxDailyLoss", maxDailyLoss);
        requirePercent("maxDailyLossPercent", maxDailyLossPercent);
        requirePositive("circuitBreakerLosses", circuitBreakerLosses);
        requireNonNegative("orderCooldown", orderCooldown);
        requireNonNegative("lossCooldown", lossCooldown);
        return this;
    }

    private static void requirePositive(String field, int value) {
        if (value <= 0) {
            throw new InvalidConfigurationException(field, value, "must be positive");
        }
    }

    private static void requireNonNegative(String field, BigDecimal value) {
        if (value == null || value.signum() < 0) {
            throw new InvalidConfigurationException(field, value, "must be zero or positive");
        }
    }

    private static void requirePercent(String field, BigDecimal value) {
        requireNonNegative(field, value);
        if (value.compareTo(BigDecimal.valueOf(100)) > 0) {
            throw new InvalidConfigurationException(field, value, "must not exceed 100");
        }
    }

    private static void requireNonNegative(String field, Duration value) {
        if (value == null || value.isNegative()) {
            throw new InvalidConfigurationException(field, value, "must be zero or positive");
        }
    }
}
