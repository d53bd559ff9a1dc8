package com.tradecontrol.takeprofit;

import com.tradecontrol.exception.InvalidConfigurationException;
import java.math.BigDecimal;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Value;

/**
 * Ordered set of per-level take-profit rules, sorted by DCA level.
 */
@Value
public class LevelTakeProfitConfig {

    List<LevelTakeProfit> levels;

    public LevelTakeProfitConfig(List<LevelTakeProfit> levels) {
        this.levels = levels == null
                ? List.of()
                : levels.stream()
                        .sorted(Comparator.comparingInt(LevelTakeProfit::getDcaLevel))
                        .collect(Collectors.toUnmodifiableList());
    }

    public static LevelTakeProfitConfig defaults() {
        return new LevelTakeProfitConfig(List.of(
                LevelTakeProfit.of(0, "5", "20", false),
                LevelTakeProfit.of(1, "7", "20", false),
                LevelTakeProfit.of(2, "10", "30", false),
                LevelTakeProfit.of(3, "15", "30", true),
                LevelTakeProfit.of(4, "20", "50", true),
                LevelTakeProfit.of(5, "30", "100", true)));
    }

    public LevelTakeProfitConfig validate() {
        Set<Integer> seen = new HashSet<>();
        for (LevelTakeProfit level : levels) {
            String field = "levels[" + level.getDcaLevel() + "]";
            if (level.getDcaLevel() < 0) {
                throw new InvalidConfigurationException(field + ".dcaLevel", level.getDcaLevel(), "must be zero or positive");
            }
            if (!seen.add(level.getDcaLevel())) {
                throw new InvalidConfigurationException(field + ".dcaLevel", level.getDcaLevel(), "must be unique");
            }
            if (level.getTpPercent() == null || level.getTpPercent().signum() <= 0) {
                throw new InvalidConfigurationException(field + ".tpPercent", level.getTpPercent(), "must be positive");
            }
            BigDecimal close = level.getClosePercent();
            if (close == null || close.signum() <= 0 || close.compareTo(BigDecimal.valueOf(100)) > 0) {
                throw new InvalidConfigurationException(field + ".closePercent", close, "must be in (0, 100]");
            }
        }
        return this;
    }
}
