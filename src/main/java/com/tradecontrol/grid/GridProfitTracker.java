package com.tradecontrol.grid;

import com.tradecontrol.common.Decimals;
import com.tradecontrol.exception.InvalidInputException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Realized profit per grid level. One instance per grid; not thread-safe, driven from
 * the same single-threaded tick as the {@link TrailingGridManager}.
 */
public class GridProfitTracker {

    private final Clock clock;
    private final List<GridLevelProfit> history = new ArrayList<>();

    public GridProfitTracker(Clock clock) {
        this.clock = clock;
    }

    /**
     * Records a round trip. Profit is {@code (sell - buy) * min(buyQty, sellQty)}.
     */
    public GridLevelProfit recordCompletedLevel(
            int level,
            BigDecimal buyPrice,
            BigDecimal sellPrice,
            BigDecimal buyQuantity,
            BigDecimal sellQuantity,
            Instant buyTime) {
        requirePositive("buyPrice", buyPrice);
        requirePositive("sellPrice", sellPrice);
        requirePositive("buyQuantity", buyQuantity);
        requirePositive("sellQuantity", sellQuantity);
        if (buyTime == null) {
            throw new InvalidInputException("buyTime must not be null");
        }
        Instant completedAt = clock.instant();
        BigDecimal matched = buyQuantity.min(sellQuantity);
        BigDecimal priceDiff = sellPrice.subtract(buyPrice);

        GridLevelProfit record = GridLevelProfit.builder()
                .level(level)
                .buyPrice(buyPrice)
                .sellPrice(sellPrice)
                .buyQuantity(buyQuantity)
                .sellQuantity(sellQuantity)
                .profit(priceDiff.multiply(matched, Decimals.MC))
                .profitPercent(Decimals.percentOf(priceDiff, buyPrice))
                .completedAt(completedAt)
                .duration(Duration.between(buyTime, completedAt))
                .build();
        history.add(record);
        return record;
    }

    public Map<Integer, BigDecimal> getProfitByLevel() {
        Map<Integer, BigDecimal> byLevel = new TreeMap<>();
        for (GridLevelProfit record : history) {
            byLevel.merge(record.getLevel(), record.getProfit(), BigDecimal::add);
        }
        return Collections.unmodifiableMap(byLevel);
    }

    public GridProfitStats getStats() {
        if (history.isEmpty()) {
            return GridProfitStats.empty();
        }

        BigDecimal total = history.stream().map(GridLevelProfit::getProfit).reduce(BigDecimal.ZERO, BigDecimal::add);
        int winning = (int) history.stream().filter(r -> r.getProfit().signum() > 0).count();
        Map<Integer, BigDecimal> byLevel = getProfitByLevel();

        Integer best = null;
        Integer worst = null;
        for (Map.Entry<Integer, BigDecimal> entry : byLevel.entrySet()) {
            if (best == null || entry.getValue().compareTo(byLevel.get(best)) > 0) {
                best = entry.getKey();
            }
            if (worst == null || entry.getValue().compareTo(byLevel.get(worst)) < 0) {
                worst = entry.getKey();
            }
        }

        Duration totalDuration =
                history.stream().map(GridLevelProfit::getDuration).reduce(Duration.ZERO, Duration::plus);

        return GridProfitStats.builder()
                .totalProfit(total)
                .totalTrades(history.size())
                .winningTrades(winning)
                .losingTrades(history.size() - winning)
                .avgProfitPerTrade(total.divide(BigDecimal.valueOf(history.size()), Decimals.MC))
                .bestLevel(best)
                .worstLevel(worst)
                .profitByLevel(byLevel)
                .avgDuration(totalDuration.dividedBy(history.size()))
                .build();
    }

    public List<GridLevelProfit> getHistory() {
        return List.copyOf(history);
    }

    public List<GridLevelProfit> getHistoryForLevel(int level) {
        return history.stream().filter(r -> r.getLevel() == level).collect(Collectors.toUnmodifiableList());
    }

    public void clear() {
        history.clear();
    }

    private static void requirePositive(String field, BigDecimal value) {
        if (value == null || value.signum() <= 0) {
            throw new InvalidInputException(field + " must be positive (was " + value + ")");
        }
    }
}
