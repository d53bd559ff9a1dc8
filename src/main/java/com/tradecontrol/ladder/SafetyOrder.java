package com.tradecontrol.ladder;

import com.tradecontrol.common.Decimals;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One pre-planned averaging order of a ladder.
 *
 * <p>{@code amount} is fixed at ladder construction (quote currency). {@code quantity}
 * stays zero while PENDING, becomes provisional (amount / trigger-time price) when
 * TRIGGERED and final (amount / fill price) when FILLED.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class SafetyOrder {

    /** 1-based position in the ladder. */
    int index;

    BigDecimal triggerPrice;
    BigDecimal amount;
    BigDecimal quantity;
    SafetyOrderStatus status;
    Instant triggeredAt;
    Instant filledAt;
    BigDecimal filledPrice;

    public static SafetyOrder pending(int index, BigDecimal triggerPrice, BigDecimal amount) {
        return SafetyOrder.builder()
                .index(index)
                .triggerPrice(triggerPrice)
                .amount(amount)
                .quantity(BigDecimal.ZERO)
                .status(SafetyOrderStatus.PENDING)
                .build();
    }

    public boolean is(SafetyOrderStatus expected) {
        return status == expected;
    }

    SafetyOrder trigger(BigDecimal currentPrice, Instant now) {
        return moveTo(SafetyOrderStatus.TRIGGERED).toBuilder()
                .triggeredAt(now)
                .quantity(amount.divide(currentPrice, Decimals.MC))
                .build();
    }

    SafetyOrder fill(BigDecimal fillPrice, Instant now) {
        return moveTo(SafetyOrderStatus.FILLED).toBuilder()
                .filledAt(now)
                .filledPrice(fillPrice)
                .quantity(amount.divide(fillPrice, Decimals.MC))
                .build();
    }

    SafetyOrder cancel() {
        return moveTo(SafetyOrderStatus.CANCELLED);
    }

    private SafetyOrder moveTo(SafetyOrderStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Safety order #" + index + " cannot move from " + status + " to " + next);
        }
        return toBuilder().status(next).build();
    }
}
