package com.tradecontrol.takeprofit;

import java.math.BigDecimal;
import lombok.Value;

@Value
public class TakeProfitTarget {

    int dcaLevel;
    BigDecimal tpPercent;
    BigDecimal closePercent;

    static TakeProfitTarget of(LevelTakeProfit level) {
        return new TakeProfitTarget(level.getDcaLevel(), level.getTpPercent(), level.getClosePercent());
    }
}
