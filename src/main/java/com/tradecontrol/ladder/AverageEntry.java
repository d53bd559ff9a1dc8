package com.tradecontrol.ladder;

import java.math.BigDecimal;
import lombok.Value;

/**
 * Quantity-weighted entry of a position: the base fill plus every filled safety order.
 */
@Value
public class AverageEntry {

    BigDecimal avgEntryPrice;
    BigDecimal totalQuantity;
    BigDecimal totalInvested;
}
