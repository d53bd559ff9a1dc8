package com.tradecontrol.grid;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class TrailingGridState {

    BigDecimal originalCenter;
    BigDecimal currentCenter;
    int trailCount;
    Instant lastTrailTime;
    List<GridShift> trailHistory;

    /** Current resting level prices, in the order they were supplied. */
    List<BigDecimal> levels;

    public static TrailingGridState of(BigDecimal centerPrice, List<BigDecimal> levels) {
        return TrailingGridState.builder()
                .originalCenter(centerPrice)
                .currentCenter(centerPrice)
                .trailCount(0)
                .trailHistory(List.of())
                .levels(List.copyOf(levels))
                .build();
    }

    public static TrailingGridState empty() {
        return of(BigDecimal.ZERO, List.of());
    }
}
