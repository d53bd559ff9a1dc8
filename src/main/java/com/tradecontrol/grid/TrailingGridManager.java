package com.tradecontrol.grid;

import com.tradecontrol.common.Decimals;
import com.tradecontrol.common.Transition;
import com.tradecontrol.exception.InvalidInputException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves a grid of resting order prices after the market.
 *
 * <p>When price drifts more than {@code trailPercent} from the grid center, the whole
 * grid (every level and the center) is translated by the same amount: half the drift,
 * but never less than {@code minTrailDistance}. Level spacing is therefore preserved.
 * At most {@code maxTrails} translations are performed per grid.
 */
public class TrailingGridManager {

    private static final Logger log = LoggerFactory.getLogger(TrailingGridManager.class);

    private static final BigDecimal HALF = new BigDecimal("0.5");

    private final TrailingGridConfig config;
    private final Clock clock;

    public TrailingGridManager(TrailingGridConfig config, Clock clock) {
        this.config = config.validate();
        this.clock = clock;
    }

    public TrailingGridConfig getConfig() {
        return config;
    }

    public boolean shouldTrail(TrailingGridState state, BigDecimal currentPrice) {
        if (!config.isEnabled() || state.getTrailCount() >= config.getMaxTrails()) {
            return false;
        }
        BigDecimal center = state.getCurrentCenter();
        if (!Decimals.isPositive(center)) {
            return false;
        }
        BigDecimal distancePercent = Decimals.percentOf(currentPrice.subtract(center).abs(), center);
        return distancePercent.compareTo(config.getTrailPercent()) > 0;
    }

    /**
     * Translates the grid if {@link #shouldTrail} holds.
     *
     * @return next state and the trail descriptor, or the unchanged state and empty
     */
    public Transition<TrailingGridState, Optional<GridTrail>> executeTrail(
            TrailingGridState state, BigDecimal currentPrice) {
        if (currentPrice == null || currentPrice.signum() <= 0) {
            throw new InvalidInputException("currentPrice must be positive (was " + currentPrice + ")");
        }
        if (!shouldTrail(state, currentPrice)) {
            return Transition.of(state, Optional.empty());
        }

        BigDecimal distance = currentPrice.subtract(state.getCurrentCenter());
        TrailDirection direction = distance.signum() > 0 ? TrailDirection.UP : TrailDirection.DOWN;

        BigDecimal shift = distance.multiply(HALF);
        if (shift.abs().compareTo(config.getMinTrailDistance()) < 0) {
            shift = direction == TrailDirection.UP
                    ? config.getMinTrailDistance()
                    : config.getMinTrailDistance().negate();
        }

        Instant now = clock.instant();
        BigDecimal delta = shift;
        List<BigDecimal> newLevels = state.getLevels().stream()
                .map(level -> level.add(delta))
                .collect(Collectors.toUnmodifiableList());
        BigDecimal newCenter = state.getCurrentCenter().add(shift);

        List<GridShift> history = new ArrayList<>(state.getTrailHistory());
        history.add(GridShift.builder()
                .from(state.getCurrentCenter())
                .to(newCenter)
                .price(currentPrice)
                .time(now)
                .build());

        TrailingGridState next = state.toBuilder()
                .currentCenter(newCenter)
                .trailCount(state.getTrailCount() + 1)
                .lastTrailTime(now)
                .trailHistory(List.copyOf(history))
                .levels(newLevels)
                .build();

        log.info(
                "Grid trailed {} by {}: center {} -> {} (price {}, trail {}/{})",
                direction,
                shift,
                state.getCurrentCenter(),
                newCenter,
                currentPrice,
                next.getTrailCount(),
                config.getMaxTrails());
        return Transition.of(next, Optional.of(new GridTrail(newLevels, shift, direction)));
    }

    /** Replaces state and levels wholesale, e.g. when the grid is recreated. */
    public TrailingGridState reset(BigDecimal centerPrice, List<BigDecimal> levels) {
        if (centerPrice == null || centerPrice.signum() <= 0) {
            throw new InvalidInputException("centerPrice must be positive (was " + centerPrice + ")");
        }
        return TrailingGridState.of(centerPrice, levels);
    }

    public List<BigDecimal> getLevels(TrailingGridState state) {
        return state.getLevels();
    }
}
