package com.tradecontrol.takeprofit;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Default take-profit ladder, properties prefix {@code tradecontrol.take-profit.*}.
 *
 * <p>Levels are bound as an indexed list:
 * {@code tradecontrol.take-profit.levels[0].dca-level=0},
 * {@code tradecontrol.take-profit.levels[0].tp-percent=5}, ... When no levels are
 * configured the built-in six-level ladder applies.
 */
@Data
@ConfigurationProperties(prefix = "tradecontrol.take-profit")
public class LevelTakeProfitProperties {

    private List<Level> levels = new ArrayList<>();

    public LevelTakeProfitConfig toConfig() {
        if (levels.isEmpty()) {
            return LevelTakeProfitConfig.defaults();
        }
        List<LevelTakeProfit> rules = new ArrayList<>();
        for (Level level : levels) {
            rules.add(LevelTakeProfit.builder()
                    .dcaLevel(level.getDcaLevel())
                    .tpPercent(level.getTpPercent())
                    .closePercent(level.getClosePercent())
                    .trailingAfterHit(level.isTrailingAfterHit())
                    .build());
        }
        return new LevelTakeProfitConfig(rules).validate();
    }

    @Data
    public static class Level {
        private int dcaLevel;
        private BigDecimal tpPercent;
        private BigDecimal closePercent;
        private boolean trailingAfterHit;
    }
}
