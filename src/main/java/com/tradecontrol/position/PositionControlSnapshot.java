package com.tradecontrol.position;

import com.tradecontrol.grid.TrailingGridState;
import com.tradecontrol.ladder.LadderState;
import com.tradecontrol.risk.RiskState;
import com.tradecontrol.takeprofit.LevelTakeProfitState;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Complete persisted form of a {@link PositionControlSession}: the position book plus
 * the four machine states. Configuration is not part of the snapshot.
 */
@Value
@Builder
@Jacksonized
public class PositionControlSnapshot {

    String sessionId;
    PositionBook position;
    RiskState risk;
    LadderState ladder;
    LevelTakeProfitState takeProfit;
    TrailingGridState grid;
}
