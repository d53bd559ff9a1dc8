package com.tradecontrol.grid;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class GridProfitStats {

    BigDecimal totalProfit;
    int totalTrades;
    int winningTrades;

    /** Round trips with zero or negative profit. */
    int losingTrades;

    BigDecimal avgProfitPerTrade;
    Integer bestLevel;
    Integer worstLevel;
    Map<Integer, BigDecimal> profitByLevel;
    Duration avgDuration;

    public static GridProfitStats empty() {
        return GridProfitStats.builder()
                .totalProfit(BigDecimal.ZERO)
                .avgProfitPerTrade(BigDecimal.ZERO)
                .profitByLevel(Map.of())
                .avgDuration(Duration.ZERO)
                .build();
    }
}
