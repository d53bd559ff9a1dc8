package com.tradecontrol.ladder;

import com.tradecontrol.domain.enums.PositionSide;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Immutable state of one safety-order ladder. Orders are kept in index order.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class LadderState {

    PositionSide side;
    BigDecimal entryPrice;

    List<SafetyOrder> orders;

    int triggeredCount;
    BigDecimal totalSafetyInvested;
    Instant lastTriggerTime;

    public static LadderState empty(PositionSide side) {
        return LadderState.builder()
                .side(side)
                .entryPrice(BigDecimal.ZERO)
                .orders(List.of())
                .triggeredCount(0)
                .totalSafetyInvested(BigDecimal.ZERO)
                .build();
    }

    public Optional<SafetyOrder> findOrder(int index) {
        return orders.stream().filter(order -> order.getIndex() == index).findFirst();
    }

    public long count(SafetyOrderStatus status) {
        return orders.stream().filter(order -> order.is(status)).count();
    }
}
