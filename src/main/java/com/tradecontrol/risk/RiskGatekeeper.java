package com.tradecontrol.risk;

import com.tradecontrol.common.Decimals;
import com.tradecontrol.common.Transition;
import com.tradecontrol.exception.InvalidInputException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Collection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pre-commitment risk gate for a single bot: exposure limits, cooldowns and the
 * loss circuit breaker.
 *
 * <p>The gatekeeper holds no state of its own. Every operation takes the current
 * {@link RiskState} and returns the next one, so the owner decides when a transition
 * is committed and the state can be persisted as-is.
 *
 * <p>Averaging-order checks run in a fixed priority order and stop at the first
 * violated rule:
 * <ol>
 *   <li>Circuit breaker (cleared lazily once the clock passes its expiry)</li>
 *   <li>Ladder depth</li>
 *   <li>Per-order cap, then per-order percent of balance</li>
 *   <li>Aggregate cap, then aggregate percent of balance</li>
 *   <li>Available balance</li>
 *   <li>Inter-order cooldown, then post-loss cooldown</li>
 * </ol>
 *
 * <p>Time is read from the injected {@link Clock} only; cooldowns are stored
 * timestamps compared on the next call, never timers.
 */
public class RiskGatekeeper {

    private static final Logger log = LoggerFactory.getLogger(RiskGatekeeper.class);

    private final RiskLimits limits;
    private final Clock clock;

    public RiskGatekeeper(RiskLimits limits, Clock clock) {
        this.limits = limits.validate();
        this.clock = clock;
    }

    public RiskLimits getLimits() {
        return limits;
    }

    public RiskState initialState(BigDecimal availableBalance) {
        requireNonNegative("availableBalance", availableBalance);
        return RiskState.initial(availableBalance, today());
    }

    // ========================
    // GATEKEEPING
    // ========================

    /**
     * Decides whether another averaging order of {@code amount} may be placed.
     *
     * <p>The returned state differs from the input only when the circuit breaker has
     * expired and is cleared, or when the daily counters roll over to a new day.
     *
     * @param symbol           symbol the order is for (informational)
     * @param otherOpenSymbols symbols with open positions elsewhere (informational)
     */
    public Transition<RiskState, RiskDecision> canOpenAveragingOrder(
            RiskState state, BigDecimal amount, String symbol, Collection<String> otherOpenSymbols) {
        requireNonNegative("amount", amount);
        Instant now = clock.instant();
        RiskState current = clearExpiredCircuitBreaker(rollDailyCounters(state), now);

        RiskDecision decision = evaluateAveragingOrder(current, amount, now);
        if (decision.isRejected()) {
            log.debug("Averaging order {} for {} rejected: {}", amount, symbol, decision);
        }
        return Transition.of(current, decision);
    }

    /**
     * Checks only the circuit breaker. Used before opening a fresh position.
     */
    public Transition<RiskState, RiskDecision> checkCircuitBreaker(RiskState state) {
        Instant now = clock.instant();
        RiskState current = clearExpiredCircuitBreaker(rollDailyCounters(state), now);
        if (current.isCircuitBreakerActive()) {
            return Transition.of(current, circuitBreakerRejection(current));
        }
        return Transition.of(current, RiskDecision.allowed());
    }

    /**
     * Adding to a symbol that already has a position is never a new position.
     */
    public RiskDecision canOpenNewPosition(RiskState state, String symbol, Collection<String> existingSymbols) {
        return canOpenNewPosition(state, symbol, existingSymbols, 0);
    }

    /**
     * Same check when {@code state} only counts part of the account: positions held
     * outside it are passed as {@code openElsewhere} and count toward the limit.
     */
    public RiskDecision canOpenNewPosition(
            RiskState state, String symbol, Collection<String> existingSymbols, int openElsewhere) {
        if (existingSymbols != null && existingSymbols.contains(symbol)) {
            return RiskDecision.allowed();
        }
        if (state.getOpenPositions() + openElsewhere >= limits.getMaxOpenPositions()) {
            return RiskDecision.rejected(
                    RiskRejectReason.MAX_OPEN_POSITIONS_REACHED,
                    "Maximum open positions reached (" + limits.getMaxOpenPositions() + ")");
        }
        return RiskDecision.allowed();
    }

    /**
     * Returns not-allowed once unrealized drawdown meets the cap. The caller is
     * expected to force a close; nothing is closed here.
     */
    public Transition<RiskState, RiskDecision> updateDrawdown(RiskState state, BigDecimal drawdownPercent) {
        RiskState next = state.toBuilder().currentDrawdown(drawdownPercent).build();
        if (drawdownPercent.compareTo(limits.getMaxDrawdownPercent()) >= 0) {
            return Transition.of(
                    next,
                    RiskDecision.rejected(
                            RiskRejectReason.MAX_DRAWDOWN_EXCEEDED,
                            "Max drawdown reached (" + drawdownPercent.setScale(2, RoundingMode.HALF_UP) + "% >= "
                                    + limits.getMaxDrawdownPercent() + "%)"));
        }
        return Transition.of(next, RiskDecision.allowed());
    }

    // ========================
    // RECORDING
    // ========================

    public RiskState recordPositionOpened(RiskState state) {
        return state.toBuilder().openPositions(state.getOpenPositions() + 1).build();
    }

    public RiskState recordOrderOpened(RiskState state, BigDecimal amount) {
        requireNonNegative("amount", amount);
        return state.toBuilder()
                .currentDcaOrders(state.getCurrentDcaOrders() + 1)
                .totalInvested(state.getTotalInvested().add(amount))
                .lastOrderTime(clock.instant())
                .build();
    }

    /**
     * Records a closed position. Ladder depth and invested amount reset to zero; the
     * realized P&L joins the daily total. A loss extends the losing streak and may arm
     * the circuit breaker; a win resets the streak.
     */
    public RiskState recordPositionClosed(RiskState state, BigDecimal pnl, boolean wasLoss) {
        Instant now = clock.instant();
        RiskState current = rollDailyCounters(state);

        RiskState.RiskStateBuilder next = current.toBuilder()
                .openPositions(Math.max(0, current.getOpenPositions() - 1))
                .currentDcaOrders(0)
                .totalInvested(BigDecimal.ZERO)
                .dailyPnl(current.getDailyPnl().add(pnl));

        if (!wasLoss) {
            return next.consecutiveLosses(0).build();
        }

        RiskState afterLoss = next.dailyLoss(current.getDailyLoss().add(pnl.abs()))
                .consecutiveLosses(current.getConsecutiveLosses() + 1)
                .lastLossTime(now)
                .build();

        if (limits.isCircuitBreakerEnabled() && afterLoss.getConsecutiveLosses() >= limits.getCircuitBreakerLosses()) {
            afterLoss = armCircuitBreaker(afterLoss, now, afterLoss.getConsecutiveLosses() + " consecutive losses");
        }
        if (afterLoss.getDailyLoss().compareTo(limits.getMaxDailyLoss()) >= 0) {
            afterLoss = armCircuitBreaker(afterLoss, now, "daily loss " + afterLoss.getDailyLoss());
        }
        if (Decimals.isPositive(afterLoss.getAvailableBalance())) {
            BigDecimal dailyLossPercent = Decimals.percentOf(afterLoss.getDailyLoss(), afterLoss.getAvailableBalance());
            if (dailyLossPercent.compareTo(limits.getMaxDailyLossPercent()) >= 0) {
                afterLoss = armCircuitBreaker(
                        afterLoss, now, "daily loss " + dailyLossPercent.setScale(2, RoundingMode.HALF_UP) + "%");
            }
        }
        return afterLoss;
    }

    public RiskState updateBalance(RiskState state, BigDecimal balance) {
        requireNonNegative("balance", balance);
        return state.toBuilder().availableBalance(balance).build();
    }

    public RiskState resetDaily(RiskState state) {
        return state.toBuilder()
                .dailyPnl(BigDecimal.ZERO)
                .dailyLoss(BigDecimal.ZERO)
                .tradingDay(today())
                .build();
    }

    /** Forgets everything except the available balance. */
    public RiskState reset(RiskState state) {
        return RiskState.initial(state.getAvailableBalance(), today());
    }

    // ========================
    // INTERNALS
    // ========================

    private RiskDecision evaluateAveragingOrder(RiskState state, BigDecimal amount, Instant now) {
        if (state.isCircuitBreakerActive()) {
            return circuitBreakerRejection(state);
        }

        if (state.getCurrentDcaOrders() >= limits.getMaxDcaOrders()) {
            return RiskDecision.rejected(
                    RiskRejectReason.MAX_DEPTH_REACHED, "Maximum DCA orders reached (" + limits.getMaxDcaOrders() + ")");
        }

        if (amount.compareTo(limits.getMaxOrderAmount()) > 0) {
            return RiskDecision.rejected(
                    RiskRejectReason.ORDER_TOO_LARGE,
                    "Order amount exceeds max order size (" + limits.getMaxOrderAmount() + ")");
        }

        BigDecimal balance = state.getAvailableBalance();
        if (exceedsPercentOfBalance(amount, balance, limits.getMaxOrderPercent())) {
            return RiskDecision.rejected(
                    RiskRejectReason.ORDER_PERCENT_TOO_LARGE,
                    "Order amount exceeds " + limits.getMaxOrderPercent() + "% of balance");
        }

        BigDecimal newTotal = state.getTotalInvested().add(amount);
        if (newTotal.compareTo(limits.getMaxTotalInvested()) > 0) {
            return RiskDecision.rejected(
                    RiskRejectReason.AGGREGATE_CAP_EXCEEDED,
                    "Total invested would exceed limit (" + limits.getMaxTotalInvested() + ")");
        }

        if (exceedsPercentOfBalance(newTotal, balance, limits.getMaxTotalInvestedPercent())) {
            return RiskDecision.rejected(
                    RiskRejectReason.AGGREGATE_PERCENT_EXCEEDED,
                    "Total invested would exceed " + limits.getMaxTotalInvestedPercent() + "% of balance");
        }

        if (amount.compareTo(balance) > 0) {
            return RiskDecision.rejected(RiskRejectReason.INSUFFICIENT_BALANCE, "Insufficient balance");
        }

        if (state.getLastOrderTime() != null) {
            Instant readyAt = state.getLastOrderTime().plus(limits.getOrderCooldown());
            if (now.isBefore(readyAt)) {
                return RiskDecision.rejected(
                        RiskRejectReason.COOLDOWN_ACTIVE,
                        "Cooldown active. Wait " + minutesUntil(now, readyAt) + " minutes",
                        readyAt);
            }
        }

        if (state.getLastLossTime() != null && state.getConsecutiveLosses() > 0) {
            Instant readyAt = state.getLastLossTime().plus(limits.getLossCooldown());
            if (now.isBefore(readyAt)) {
                return RiskDecision.rejected(
                        RiskRejectReason.POST_LOSS_COOLDOWN_ACTIVE,
                        "Post-loss cooldown active. Wait " + minutesUntil(now, readyAt) + " minutes",
                        readyAt);
            }
        }

        BigDecimal warnAt = BigDecimal.valueOf(limits.getMaxDcaOrders()).multiply(RiskLimits.DEPTH_WARNING_RATIO);
        if (BigDecimal.valueOf(state.getCurrentDcaOrders()).compareTo(warnAt) >= 0) {
            return RiskDecision.allowedWithWarning("Approaching max DCA orders (" + state.getCurrentDcaOrders() + "/"
                    + limits.getMaxDcaOrders() + ")");
        }
        return RiskDecision.allowed();
    }

    private RiskDecision circuitBreakerRejection(RiskState state) {
        return RiskDecision.rejected(
                RiskRejectReason.CIRCUIT_BREAKER_ACTIVE,
                "Circuit breaker active until " + state.getCircuitBreakerUntil(),
                state.getCircuitBreakerUntil());
    }

    /** Non-positive balance makes every percentage cap fail. */
    private static boolean exceedsPercentOfBalance(BigDecimal value, BigDecimal balance, BigDecimal maxPercent) {
        if (!Decimals.isPositive(balance)) {
            return value.signum() > 0;
        }
        return Decimals.percentOf(value, balance).compareTo(maxPercent) > 0;
    }

    /** Arming an already-active breaker keeps the original expiry. */
    private RiskState armCircuitBreaker(RiskState state, Instant now, String cause) {
        if (state.isCircuitBreakerActive()
                && state.getCircuitBreakerUntil() != null
                && now.isBefore(state.getCircuitBreakerUntil())) {
            return state;
        }
        Instant until = now.plus(RiskLimits.CIRCUIT_BREAKER_DURATION);
        log.warn("Circuit breaker armed until {} ({})", until, cause);
        return state.toBuilder()
                .circuitBreakerActive(true)
                .circuitBreakerUntil(until)
                .build();
    }

    private RiskState clearExpiredCircuitBreaker(RiskState state, Instant now) {
        if (!state.isCircuitBreakerActive()) {
            return state;
        }
        if (state.getCircuitBreakerUntil() != null && now.isBefore(state.getCircuitBreakerUntil())) {
            return state;
        }
        log.info("Circuit breaker expired at {}, cleared", state.getCircuitBreakerUntil());
        return state.toBuilder()
                .circuitBreakerActive(false)
                .circuitBreakerUntil(null)
                .build();
    }

    private RiskState rollDailyCounters(RiskState state) {
        LocalDate today = today();
        if (today.equals(state.getTradingDay())) {
            return state;
        }
        log.info("Daily risk counters reset for {}", today);
        return state.toBuilder()
                .dailyPnl(BigDecimal.ZERO)
                .dailyLoss(BigDecimal.ZERO)
                .tradingDay(today)
                .build();
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
    }

    private static long minutesUntil(Instant now, Instant readyAt) {
        long seconds = Duration.between(now, readyAt).getSeconds();
        return Math.max(1, (seconds + 59) / 60);
    }

    private static void requireNonNegative(String field, BigDecimal value) {
        if (value == null || value.signum() < 0) {
            throw new InvalidInputException(field + " must be zero or positive (was " + value + ")");
        }
    }
}
