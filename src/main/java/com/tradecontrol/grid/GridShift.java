package com.tradecontrol.grid;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One recorded grid translation: center moved {@code from -> to} because price was
 * observed at {@code price}.
 */
@Value
@Builder
@Jacksonized
public class GridShift {

    BigDecimal from;
    BigDecimal to;
    BigDecimal price;
    Instant time;
}
