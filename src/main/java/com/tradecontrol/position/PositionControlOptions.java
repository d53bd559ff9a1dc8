package com.tradecontrol.position;

import com.tradecontrol.grid.TrailingGridConfig;
import com.tradecontrol.ladder.SafetyOrderConfig;
import com.tradecontrol.risk.RiskLimits;
import com.tradecontrol.takeprofit.LevelTakeProfitConfig;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Per-session overrides. Any field left null falls back to the application defaults.
 */
@Value
@Builder
public class PositionControlOptions {

    BigDecimal initialBalance;
    RiskLimits riskLimits;
    SafetyOrderConfig safetyOrders;
    LevelTakeProfitConfig takeProfit;
    TrailingGridConfig trailingGrid;

    public static PositionControlOptions defaults() {
        return PositionControlOptions.builder().build();
    }
}
