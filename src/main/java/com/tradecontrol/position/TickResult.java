package com.tradecontrol.position;

import com.tradecontrol.grid.GridTrail;
import com.tradecontrol.ladder.SafetyOrder;
import com.tradecontrol.risk.RiskDecision;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.Value;

/**
 * Everything one tick asks the execution side to do.
 *
 * <ul>
 *   <li>{@code emergencyClose}: drawdown cap hit, close the whole position</li>
 *   <li>{@code safetyOrdersToPlace}: newly triggered and risk-approved averaging orders</li>
 *   <li>{@code safetyOrderBlockedBy}: risk decision that stopped the trigger batch, if any</li>
 *   <li>{@code takeProfit}: partial close for a fired level</li>
 *   <li>{@code gridTrail}: new grid level prices to re-post</li>
 * </ul>
 */
@Value
@Builder
public class TickResult {

    BigDecimal price;

    boolean emergencyClose;

    RiskDecision drawdownDecision;

    @Builder.Default
    List<SafetyOrder> safetyOrdersToPlace = List.of();

    RiskDecision safetyOrderBlockedBy;

    TakeProfitAction takeProfit;

    boolean trailingStopEnabled;

    GridTrail gridTrail;

    public Optional<TakeProfitAction> getTakeProfitAction() {
        return Optional.ofNullable(takeProfit);
    }

    public Optional<GridTrail> getGridTrailAction() {
        return Optional.ofNullable(gridTrail);
    }

    public boolean hasActions() {
        return emergencyClose || !safetyOrdersToPlace.isEmpty() || takeProfit != null || gridTrail != null;
    }
}
