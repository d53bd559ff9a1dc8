package com.tradecontrol.ladder;

import com.tradecontrol.exception.InvalidConfigurationException;
import java.math.BigDecimal;
import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/**
 * Shape of a safety-order ladder.
 *
 * <p>Order 1 triggers {@code triggerDrawdownPercent} away from entry; each further
 * order triggers {@code priceDeviationPercent} beyond the previous one. Order 1
 * commits {@code safetyAmount}; each further order commits the previous amount times
 * {@code amountMultiplier}, which is at least 1 so amounts never shrink.
 */
@Value
@Builder(toBuilder = true)
public class SafetyOrderConfig {

    @Builder.Default
    boolean enabled = false;

    @Builder.Default
    BigDecimal triggerDrawdownPercent = new BigDecimal("5");

    /** Amount of the first safety order (quote currency). */
    @Builder.Default
    BigDecimal safetyAmount = new BigDecimal("50");

    @Builder.Default
    BigDecimal amountMultiplier = new BigDecimal("1.5");

    @Builder.Default
    int maxSafetyOrders = 5;

    /** Minimum time between two trigger batches. */
    @Builder.Default
    Duration safetyInterval = Duration.ofMinutes(30);

    @Builder.Default
    BigDecimal priceDeviationPercent = new BigDecimal("3");

    public static SafetyOrderConfig defaults() {
        return SafetyOrderConfig.builder().build();
    }

    public SafetyOrderConfig validate() {
        if (amountMultiplier == null || amountMultiplier.compareTo(BigDecimal.ONE) < 0) {
            throw new InvalidConfigurationException("amountMultiplier", amountMultiplier, "must be at least 1");
        }
        if (safetyAmount == null || safetyAmount.signum() <= 0) {
            throw new InvalidConfigurationException("safetyAmount", safetyAmount, "must be positive");
        }
        requirePercent("triggerDrawdownPercent", triggerDrawdownPercent);
        requirePercent("priceDeviationPercent", priceDeviationPercent);
        if (priceDeviationPercent.signum() == 0) {
            throw new InvalidConfigurationException(
                    "priceDeviationPercent", priceDeviationPercent, "must be positive so trigger prices stay distinct");
        }
        if (maxSafetyOrders < 0) {
            throw new InvalidConfigurationException("maxSafetyOrders", maxSafetyOrders, "must be zero or positive");
        }
        if (enabled && maxSafetyOrders == 0) {
            throw new InvalidConfigurationException(
                    "maxSafetyOrders", maxSafetyOrders, "must be positive when the ladder is enabled");
        }
        if (safetyInterval == null || safetyInterval.isNegative()) {
            throw new InvalidConfigurationException("safetyInterval", safetyInterval, "must be zero or positive");
        }
        return this;
    }

    private static void requirePercent(String field, BigDecimal value) {
        if (value == null || value.signum() < 0 || value.compareTo(BigDecimal.valueOf(100)) >= 0) {
            throw new InvalidConfigurationException(field, value, "must be in [0, 100)");
        }
    }
}
