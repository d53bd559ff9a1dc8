package com.tradecontrol.takeprofit;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Take-profit rule for one DCA level.
 */
@Value
@Builder
@Jacksonized
public class LevelTakeProfit {

    /** DCA level the rule applies from (0 = no safety order filled yet). */
    int dcaLevel;

    /** Profit target relative to the average entry, in percent. */
    BigDecimal tpPercent;

    /** Share of the remaining position to close when the target is hit, in percent. */
    BigDecimal closePercent;

    /** Hand the rest of the position to a trailing stop once this level fires. */
    boolean trailingAfterHit;

    public static LevelTakeProfit of(int dcaLevel, String tpPercent, String closePercent, boolean trailingAfterHit) {
        return LevelTakeProfit.builder()
                .dcaLevel(dcaLevel)
                .tpPercent(new BigDecimal(tpPercent))
                .closePercent(new BigDecimal(closePercent))
                .trailingAfterHit(trailingAfterHit)
                .build();
    }
}
