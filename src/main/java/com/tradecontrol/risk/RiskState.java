package com.tradecontrol.risk;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Immutable snapshot of everything the {@link RiskGatekeeper} remembers between calls.
 *
 * <p>{@code circuitBreakerUntil}, once set, is authoritative until the clock passes it.
 * Nothing fires at expiry; the next gatekeeper call notices and clears the flag.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class RiskState {

    int openPositions;

    /** Averaging orders opened for the active ladder. */
    int currentDcaOrders;

    /** Quote currency committed to the active ladder. */
    BigDecimal totalInvested;

    BigDecimal currentDrawdown;

    BigDecimal dailyPnl;

    /** Sum of absolute losses realized today. */
    BigDecimal dailyLoss;

    int consecutiveLosses;

    Instant lastOrderTime;

    Instant lastLossTime;

    boolean circuitBreakerActive;

    Instant circuitBreakerUntil;

    /** Balance reported by the caller; the base for every percentage cap. */
    BigDecimal availableBalance;

    /** UTC date the daily counters belong to. */
    LocalDate tradingDay;

    public static RiskState initial(BigDecimal availableBalance, LocalDate tradingDay) {
        return RiskState.builder()
                .openPositions(0)
                .currentDcaOrders(0)
                .totalInvested(BigDecimal.ZERO)
                .currentDrawdown(BigDecimal.ZERO)
                .dailyPnl(BigDecimal.ZERO)
                .dailyLoss(BigDecimal.ZERO)
                .consecutiveLosses(0)
                .circuitBreakerActive(false)
                .availableBalance(availableBalance)
                .tradingDay(tradingDay)
                .build();
    }
}
