package com.tradecontrol.domain.enums;

public enum PositionSide {
    LONG,
    SHORT;

    /** +1 for LONG, -1 for SHORT. Profit is {@code sign * (price - entry)}. */
    public int sign() {
        return this == LONG ? 1 : -1;
    }
}
