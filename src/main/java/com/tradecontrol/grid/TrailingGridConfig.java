package com.tradecontrol.grid;

import com.tradecontrol.exception.InvalidConfigurationException;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class TrailingGridConfig {

    @Builder.Default
    boolean enabled = false;

    /** Trail once price is more than this many percent away from the grid center. */
    @Builder.Default
    BigDecimal trailPercent = new BigDecimal("5");

    /** Smallest shift applied, in price units. */
    @Builder.Default
    BigDecimal minTrailDistance = new BigDecimal("100");

    /** Maximum number of trails per grid. */
    @Builder.Default
    int maxTrails = 10;

    public static TrailingGridConfig defaults() {
        return TrailingGridConfig.builder().build();
    }

    public TrailingGridConfig validate() {
        if (trailPercent == null || trailPercent.signum() <= 0) {
            throw new InvalidConfigurationException("trailPercent", trailPercent, "must be positive");
        }
        if (minTrailDistance == null || minTrailDistance.signum() < 0) {
            throw new InvalidConfigurationException("minTrailDistance", minTrailDistance, "must be zero or positive");
        }
        if (maxTrails < 0) {
            throw new InvalidConfigurationException("maxTrails", maxTrails, "must be zero or positive");
        }
        return this;
    }
}
