package com.tradecontrol.position;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.tradecontrol.domain.enums.PositionSide;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * The shared numeric picture of a position: base fill, current average entry and the
 * quantity still open after partial take-profits.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PositionBook {

    boolean open;
    String symbol;
    PositionSide side;
    BigDecimal baseEntryPrice;
    BigDecimal baseQuantity;
    BigDecimal avgEntryPrice;

    /** Base plus filled safety orders, before partial closes. */
    BigDecimal filledQuantity;

    /** Quantity already closed by partial take-profits. */
    BigDecimal closedQuantity;

    BigDecimal totalInvested;

    public static PositionBook flat() {
        return PositionBook.builder()
                .open(false)
                .side(PositionSide.LONG)
                .baseEntryPrice(BigDecimal.ZERO)
                .baseQuantity(BigDecimal.ZERO)
                .avgEntryPrice(BigDecimal.ZERO)
                .filledQuantity(BigDecimal.ZERO)
                .closedQuantity(BigDecimal.ZERO)
                .totalInvested(BigDecimal.ZERO)
                .build();
    }

    /** Quantity still held. */
    @JsonIgnore
    public BigDecimal getOpenQuantity() {
        return filledQuantity.subtract(closedQuantity).max(BigDecimal.ZERO);
    }
}
