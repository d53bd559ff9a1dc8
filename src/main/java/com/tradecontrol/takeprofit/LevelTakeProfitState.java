package com.tradecontrol.takeprofit;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * State of the per-level take-profit manager. {@code firedLevels} only ever grows
 * until the position is closed and the state reset.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class LevelTakeProfitState {

    /** Current ladder depth (filled safety orders). */
    int currentLevel;

    BigDecimal avgEntryPrice;

    Set<Integer> firedLevels;

    BigDecimal lastPrice;

    public static LevelTakeProfitState initial() {
        return LevelTakeProfitState.builder()
                .currentLevel(0)
                .avgEntryPrice(BigDecimal.ZERO)
                .firedLevels(Set.of())
                .lastPrice(BigDecimal.ZERO)
                .build();
    }

    public boolean hasFired(int dcaLevel) {
        return firedLevels.contains(dcaLevel);
    }

    LevelTakeProfitState withFired(int dcaLevel) {
        Set<Integer> fired = new TreeSet<>(firedLevels);
        fired.add(dcaLevel);
        return toBuilder().firedLevels(Collections.unmodifiableSet(fired)).build();
    }
}
