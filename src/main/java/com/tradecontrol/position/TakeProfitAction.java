package com.tradecontrol.position;

import com.tradecontrol.takeprofit.LevelTakeProfit;
import java.math.BigDecimal;
import lombok.Value;

/**
 * Partial close to submit as a reduce order.
 */
@Value
public class TakeProfitAction {

    LevelTakeProfit level;
    BigDecimal closeQuantity;
}
