package com.tradecontrol.unit.grid;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tradecontrol.grid.GridLevelProfit;
import com.tradecontrol.grid.GridProfitStats;
import com.tradecontrol.exception.InvalidInputException;
import com.tradecontrol.grid.GridProfitTracker;
import com.tradecontrol.support.MutableClock;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for GridProfitTracker round-trip accounting.
 */
class GridProfitTrackerTest {

    private static final Instant T0 = Instant.parse("2026-03-02T10:00:00Z");

    private GridProfitTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new GridProfitTracker(new MutableClock(T0));
    }

    private GridLevelProfit record(int level, String buy, String sell, String buyQty, String sellQty, int minutesAgo) {
        return tracker.recordCompletedLevel(
                level,
                new BigDecimal(buy),
                new BigDecimal(sell),
                new BigDecimal(buyQty),
                new BigDecimal(sellQty),
                T0.minus(Duration.ofMinutes(minutesAgo)));
    }

    @Test
    @DisplayName("Round trip profit uses the matched quantity")
    void profitUsesMatchedQuantity() {
        GridLevelProfit profit = record(1, "100", "105", "2", "2", 10);
        GridLevelProfit partial = record(2, "100", "98", "1", "3", 20);

        assertThat(profit.getProfit()).isEqualByComparingTo("10");
        assertThat(profit.getProfitPercent()).isEqualByComparingTo("5");
        assertThat(profit.getDuration()).isEqualTo(Duration.ofMinutes(10));
        assertThat(profit.getCompletedAt()).isEqualTo(T0);
        assertThat(partial.getProfit()).isEqualByComparingTo("-2");
    }

    @Test
    @DisplayName("Stats aggregate across levels")
    void stats() {
        record(1, "100", "105", "2", "2", 10);
        record(2, "100", "98", "1", "3", 20);
        record(1, "100", "103", "1", "1", 30);

        GridProfitStats stats = tracker.getStats();

        assertThat(stats.getTotalProfit()).isEqualByComparingTo("11");
        assertThat(stats.getTotalTrades()).isEqualTo(3);
        assertThat(stats.getWinningTrades()).isEqualTo(2);
        assertThat(stats.getLosingTrades()).isEqualTo(1);
        assertThat(stats.getBestLevel()).isEqualTo(1);
        assertThat(stats.getWorstLevel()).isEqualTo(2);
        assertThat(stats.getProfitByLevel()).containsOnlyKeys(1, 2);
        assertThat(stats.getProfitByLevel().get(1)).isEqualByComparingTo("13");
        assertThat(stats.getAvgDuration()).isEqualTo(Duration.ofMinutes(20));
        assertThat(tracker.getHistoryForLevel(1)).hasSize(2);
    }

    @Test
    @DisplayName("Empty tracker reports zeroed stats, clear empties it")
    void emptyAndClear() {
        assertThat(tracker.getStats().getTotalTrades()).isZero();

        record(1, "100", "105", "1", "1", 5);
        tracker.clear();

        assertThat(tracker.getHistory()).isEmpty();
        assertThat(tracker.getStats().getTotalProfit()).isEqualByComparingTo("0");
        assertThat(tracker.getStats().getBestLevel()).isNull();
    }

    @Test
    @DisplayName("Missing prices, quantities or buy time are rejected as invalid input")
    void invalidInput() {
        BigDecimal one = BigDecimal.ONE;

        assertThatThrownBy(() -> tracker.recordCompletedLevel(1, one, null, one, one, T0))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("sellPrice");
        assertThatThrownBy(() -> tracker.recordCompletedLevel(1, one, one, null, one, T0))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("buyQuantity");
        assertThatThrownBy(() -> tracker.recordCompletedLevel(1, one, one, one, BigDecimal.ZERO, T0))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("sellQuantity");
        assertThatThrownBy(() -> tracker.recordCompletedLevel(1, one, one, one, one, null))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("buyTime");
        assertThat(tracker.getHistory()).isEmpty();
    }
}
