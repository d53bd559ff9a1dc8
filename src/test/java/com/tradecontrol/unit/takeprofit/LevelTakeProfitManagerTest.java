package com.tradecontrol.unit.takeprofit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tradecontrol.common.Transition;
import com.tradecontrol.domain.enums.PositionSide;
import com.tradecontrol.exception.InvalidConfigurationException;
import com.tradecontrol.takeprofit.LevelTakeProfit;
import com.tradecontrol.takeprofit.LevelTakeProfitConfig;
import com.tradecontrol.takeprofit.LevelTakeProfitManager;
import com.tradecontrol.takeprofit.LevelTakeProfitState;
import com.tradecontrol.takeprofit.TakeProfitCheck;
import com.tradecontrol.takeprofit.TakeProfitTarget;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for LevelTakeProfitManager with the default six-level ladder.
 */
class LevelTakeProfitManagerTest {

    private LevelTakeProfitManager manager;
    private LevelTakeProfitState state;

    @BeforeEach
    void setUp() {
        manager = new LevelTakeProfitManager(LevelTakeProfitConfig.defaults());
        state = manager.updateAvgEntryPrice(manager.initialState(), new BigDecimal("100"));
    }

    private Transition<LevelTakeProfitState, TakeProfitCheck> checkLong(LevelTakeProfitState s, String price) {
        return manager.checkTP(s, new BigDecimal(price), PositionSide.LONG);
    }

    @Nested
    @DisplayName("Firing")
    class Firing {

        @Test
        @DisplayName("Level 0 fires at 5% profit and not below")
        void level0_firesAtTarget() {
            assertThat(checkLong(state, "104.99").getResult().isHit()).isFalse();

            Transition<LevelTakeProfitState, TakeProfitCheck> hit = checkLong(state, "105");

            assertThat(hit.getResult().isHit()).isTrue();
            assertThat(hit.getResult().getLevel().getDcaLevel()).isZero();
            assertThat(hit.getResult().getLevel().getClosePercent()).isEqualByComparingTo("20");
            assertThat(hit.getState().hasFired(0)).isTrue();
        }

        @Test
        @DisplayName("A fired level does not fire again, a deeper level fires exactly once")
        void idempotentPerLevel() {
            LevelTakeProfitState fired = checkLong(state, "105").getState();

            Transition<LevelTakeProfitState, TakeProfitCheck> again = checkLong(fired, "110");
            assertThat(again.getResult().isHit()).isFalse();

            LevelTakeProfitState deeper = manager.updateLevel(again.getState(), 1);
            Transition<LevelTakeProfitState, TakeProfitCheck> level1 = checkLong(deeper, "107");
            assertThat(level1.getResult().isHit()).isTrue();
            assertThat(level1.getResult().getLevel().getDcaLevel()).isEqualTo(1);

            assertThat(checkLong(level1.getState(), "120").getResult().isHit()).isFalse();
            assertThat(level1.getState().getFiredLevels()).containsExactlyInAnyOrder(0, 1);
        }

        @Test
        @DisplayName("Applicable level is the highest configured level within depth")
        void applicableLevel() {
            LevelTakeProfitState depth2 = manager.updateLevel(state, 2);

            assertThat(checkLong(depth2, "109").getResult().isHit()).isFalse();
            assertThat(checkLong(depth2, "110").getResult().getLevel().getDcaLevel()).isEqualTo(2);
        }

        @Test
        @DisplayName("Depth beyond the last configured level uses the last level")
        void depthBeyondConfig() {
            LevelTakeProfitState depth9 = manager.updateLevel(state, 9);

            assertThat(checkLong(depth9, "130").getResult().getLevel().getDcaLevel()).isEqualTo(5);
        }

        @Test
        @DisplayName("Short positions profit when price falls")
        void shortDirection() {
            Transition<LevelTakeProfitState, TakeProfitCheck> result =
                    manager.checkTP(state, new BigDecimal("95"), PositionSide.SHORT);

            assertThat(result.getResult().isHit()).isTrue();
            assertThat(manager.checkTP(state, new BigDecimal("105"), PositionSide.SHORT).getResult().isHit())
                    .isFalse();
        }

        @Test
        @DisplayName("No average entry means no hit")
        void noAverage_miss() {
            assertThat(checkLong(manager.initialState(), "1000").getResult().isHit()).isFalse();
        }

        @Test
        @DisplayName("Every check records the last price")
        void recordsLastPrice() {
            assertThat(checkLong(state, "101").getState().getLastPrice()).isEqualByComparingTo("101");
        }
    }

    @Nested
    @DisplayName("Close Quantity and Trailing")
    class CloseQuantityAndTrailing {

        @Test
        @DisplayName("Close quantity is the level's share of the remaining quantity")
        void closeQuantity() {
            LevelTakeProfit level0 = LevelTakeProfitConfig.defaults().getLevels().get(0);

            assertThat(manager.calculateCloseQuantity(level0, new BigDecimal("10"))).isEqualByComparingTo("2");
            assertThat(manager.calculateCloseQuantity(level0, new BigDecimal("8"))).isEqualByComparingTo("1.6");
        }

        @Test
        @DisplayName("Trailing turns on once a trailing level fires")
        void trailingAfterLevel3() {
            LevelTakeProfitState level0Fired = checkLong(state, "105").getState();
            assertThat(manager.shouldEnableTrailing(level0Fired)).isFalse();

            LevelTakeProfitState level3Fired = checkLong(manager.updateLevel(level0Fired, 3), "115").getState();
            assertThat(manager.shouldEnableTrailing(level3Fired)).isTrue();
        }
    }

    @Nested
    @DisplayName("Next Target")
    class NextTarget {

        @Test
        @DisplayName("Unfired applicable level is the next target")
        void unfiredApplicable() {
            Optional<TakeProfitTarget> target = manager.getNextTPTarget(state);

            assertThat(target).isPresent();
            assertThat(target.get().getDcaLevel()).isZero();
            assertThat(target.get().getTpPercent()).isEqualByComparingTo("5");
        }

        @Test
        @DisplayName("No target beyond current depth once the applicable level fired")
        void noLookahead() {
            LevelTakeProfitState fired = checkLong(manager.updateLevel(state, 2), "110").getState();

            assertThat(manager.getNextTPTarget(fired)).isEmpty();
            assertThat(manager.getNextTPTarget(manager.updateLevel(fired, 3)).orElseThrow().getDcaLevel())
                    .isEqualTo(3);
        }

        @Test
        @DisplayName("No configured level within depth means no target")
        void noLevels() {
            LevelTakeProfitManager sparse = new LevelTakeProfitManager(
                    new LevelTakeProfitConfig(List.of(LevelTakeProfit.of(2, "10", "50", false))));

            assertThat(sparse.getNextTPTarget(sparse.initialState())).isEmpty();
        }
    }

    @Nested
    @DisplayName("Configuration")
    class Configuration {

        @Test
        @DisplayName("Levels are sorted by DCA level")
        void sorted() {
            LevelTakeProfitConfig config = new LevelTakeProfitConfig(List.of(
                    LevelTakeProfit.of(3, "15", "30", true), LevelTakeProfit.of(0, "5", "20", false)));

            assertThat(config.getLevels()).extracting(LevelTakeProfit::getDcaLevel).containsExactly(0, 3);
        }

        @Test
        @DisplayName("Duplicate level fails fast")
        void duplicateLevel() {
            LevelTakeProfitConfig config = new LevelTakeProfitConfig(List.of(
                    LevelTakeProfit.of(1, "5", "20", false), LevelTakeProfit.of(1, "7", "20", false)));

            assertThatThrownBy(() -> new LevelTakeProfitManager(config))
                    .isInstanceOf(InvalidConfigurationException.class);
        }

        @Test
        @DisplayName("Close percent must be within (0, 100]")
        void closePercentRange() {
            LevelTakeProfitConfig config =
                    new LevelTakeProfitConfig(List.of(LevelTakeProfit.of(0, "5", "0", false)));

            assertThatThrownBy(config::validate).isInstanceOf(InvalidConfigurationException.class);
        }

        @Test
        @DisplayName("reset clears fired levels")
        void reset() {
            LevelTakeProfitState fired = checkLong(state, "105").getState();
            assertThat(fired.getFiredLevels()).isNotEmpty();

            assertThat(manager.reset().getFiredLevels()).isEmpty();
            assertThat(manager.reset().getCurrentLevel()).isZero();
        }
    }
}
