package com.tradecontrol.takeprofit;

import com.tradecontrol.common.Decimals;
import com.tradecontrol.common.Transition;
import com.tradecontrol.domain.enums.PositionSide;
import com.tradecontrol.exception.InvalidInputException;
import java.math.BigDecimal;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Partial take-profit per DCA level.
 *
 * <p>The applicable rule for a ladder depth is the configured level with the highest
 * {@code dcaLevel} that does not exceed the depth. Each level fires at most once per
 * position: after a hit, further checks at the same depth miss until a deeper level
 * becomes applicable.
 */
public class LevelTakeProfitManager {

    private static final Logger log = LoggerFactory.getLogger(LevelTakeProfitManager.class);

    private final LevelTakeProfitConfig config;

    public LevelTakeProfitManager(LevelTakeProfitConfig config) {
        this.config = config.validate();
    }

    public LevelTakeProfitConfig getConfig() {
        return config;
    }

    public LevelTakeProfitState initialState() {
        return LevelTakeProfitState.initial();
    }

    public LevelTakeProfitState updateLevel(LevelTakeProfitState state, int level) {
        return state.toBuilder().currentLevel(level).build();
    }

    public LevelTakeProfitState updateAvgEntryPrice(LevelTakeProfitState state, BigDecimal avgEntryPrice) {
        return state.toBuilder().avgEntryPrice(avgEntryPrice).build();
    }

    /**
     * Fires the applicable level when the signed profit against the average entry
     * reaches its target. A fired level is recorded in the returned state.
     */
    public Transition<LevelTakeProfitState, TakeProfitCheck> checkTP(
            LevelTakeProfitState state, BigDecimal currentPrice, PositionSide direction) {
        if (currentPrice == null || currentPrice.signum() <= 0) {
            throw new InvalidInputException("currentPrice must be positive (was " + currentPrice + ")");
        }
        LevelTakeProfitState observed = state.toBuilder().lastPrice(currentPrice).build();

        LevelTakeProfit applicable = findApplicable(observed.getCurrentLevel()).orElse(null);
        if (applicable == null || observed.hasFired(applicable.getDcaLevel())) {
            return Transition.of(observed, TakeProfitCheck.miss());
        }

        BigDecimal avg = observed.getAvgEntryPrice();
        if (!Decimals.isPositive(avg)) {
            return Transition.of(observed, TakeProfitCheck.miss());
        }

        BigDecimal move = currentPrice.subtract(avg);
        if (direction == PositionSide.SHORT) {
            move = move.negate();
        }
        BigDecimal profitPercent = Decimals.percentOf(move, avg);
        if (profitPercent.compareTo(applicable.getTpPercent()) < 0) {
            return Transition.of(observed, TakeProfitCheck.miss());
        }

        log.info(
                "Level {} take-profit hit at {} ({}% >= {}%), closing {}%",
                applicable.getDcaLevel(),
                currentPrice,
                profitPercent.stripTrailingZeros().toPlainString(),
                applicable.getTpPercent(),
                applicable.getClosePercent());
        return Transition.of(observed.withFired(applicable.getDcaLevel()), TakeProfitCheck.hit(applicable));
    }

    /**
     * {@code totalQuantity * closePercent / 100}. Pass the quantity still open, not
     * the original size.
     */
    public BigDecimal calculateCloseQuantity(LevelTakeProfit level, BigDecimal totalQuantity) {
        return Decimals.percentage(totalQuantity, level.getClosePercent());
    }

    /** True once any fired level asked for trailing. */
    public boolean shouldEnableTrailing(LevelTakeProfitState state) {
        return config.getLevels().stream()
                .anyMatch(level -> level.isTrailingAfterHit() && state.hasFired(level.getDcaLevel()));
    }

    /**
     * Target of the applicable level while unfired. Once it has fired, only a
     * configured level above it and within the current depth qualifies; levels beyond
     * the current depth are not looked ahead to.
     */
    public Optional<TakeProfitTarget> getNextTPTarget(LevelTakeProfitState state) {
        Optional<LevelTakeProfit> applicable = findApplicable(state.getCurrentLevel());
        if (applicable.isEmpty()) {
            return Optional.empty();
        }
        int applicableLevel = applicable.get().getDcaLevel();
        if (!state.hasFired(applicableLevel)) {
            return applicable.map(TakeProfitTarget::of);
        }
        return config.getLevels().stream()
                .filter(level -> level.getDcaLevel() > applicableLevel && level.getDcaLevel() <= state.getCurrentLevel())
                .findFirst()
                .map(TakeProfitTarget::of);
    }

    public LevelTakeProfitState reset() {
        return LevelTakeProfitState.initial();
    }

    private Optional<LevelTakeProfit> findApplicable(int currentLevel) {
        LevelTakeProfit applicable = null;
        for (LevelTakeProfit level : config.getLevels()) {
            if (level.getDcaLevel() <= currentLevel) {
                applicable = level;
            }
        }
        return Optional.ofNullable(applicable);
    }
}
