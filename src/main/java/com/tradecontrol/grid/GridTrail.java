package com.tradecontrol.grid;

import java.math.BigDecimal;
import java.util.List;
import lombok.Value;

/**
 * Descriptor of an executed trail: the level prices to re-post and the applied shift.
 */
@Value
public class GridTrail {

    List<BigDecimal> newLevels;
    BigDecimal shift;
    TrailDirection direction;
}
