package com.tradecontrol.takeprofit;

import lombok.Value;

/**
 * Outcome of {@link LevelTakeProfitManager#checkTP}. {@code level} is set only on a hit.
 */
@Value
public class TakeProfitCheck {

    private static final TakeProfitCheck MISS = new TakeProfitCheck(false, null);

    boolean hit;
    LevelTakeProfit level;

    public static TakeProfitCheck miss() {
        return MISS;
    }

    public static TakeProfitCheck hit(LevelTakeProfit level) {
        return new TakeProfitCheck(true, level);
    }
}
