package com.tradecontrol.grid;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * A completed buy/sell round trip on one grid level.
 */
@Value
@Builder
public class GridLevelProfit {

    int level;
    BigDecimal buyPrice;
    BigDecimal sellPrice;
    BigDecimal buyQuantity;
    BigDecimal sellQuantity;
    BigDecimal profit;
    BigDecimal profitPercent;
    Instant completedAt;
    Duration duration;
}
