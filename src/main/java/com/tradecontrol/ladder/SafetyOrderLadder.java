package com.tradecontrol.ladder;

import com.tradecontrol.common.Decimals;
import com.tradecontrol.common.Transition;
import com.tradecontrol.domain.enums.PositionSide;
import com.tradecontrol.exception.InvalidInputException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds and advances a ladder of drawdown-triggered averaging ("safety") orders.
 *
 * <p>The ladder is fully pre-computed from the entry price by {@link #initialize}.
 * On every price observation {@link #checkTriggers} moves breached PENDING orders to
 * TRIGGERED and hands them back for submission. Fills arrive through
 * {@link #markFilled}; duplicate or out-of-order fill notifications are ignored.
 *
 * <p><b>Burst semantics:</b> the {@code safetyInterval} cooldown is compared against
 * {@code lastTriggerTime} once per {@code checkTriggers} call. When it has elapsed,
 * every breached order triggers in that same call, and {@code lastTriggerTime} is
 * stamped once for the whole batch.
 *
 * <p>Stateless apart from configuration: all operations take a {@link LadderState}
 * and return the next one.
 */
public class SafetyOrderLadder {

    private static final Logger log = LoggerFactory.getLogger(SafetyOrderLadder.class);

    private final SafetyOrderConfig config;
    private final Clock clock;

    public SafetyOrderLadder(SafetyOrderConfig config, Clock clock) {
        this.config = config.validate();
        this.clock = clock;
    }

    public SafetyOrderConfig getConfig() {
        return config;
    }

    // ========================
    // CONSTRUCTION
    // ========================

    public LadderState initialize(BigDecimal entryPrice) {
        return initialize(entryPrice, PositionSide.LONG);
    }

    /**
     * Discards any prior ladder and builds {@code maxSafetyOrders} PENDING orders.
     * A disabled ladder yields a state with no orders.
     *
     * <p>Long ladders step trigger prices down from entry; short ladders step them up.
     */
    public LadderState initialize(BigDecimal entryPrice, PositionSide side) {
        requirePositive("entryPrice", entryPrice);
        if (!config.isEnabled()) {
            return LadderState.empty(side).toBuilder().entryPrice(entryPrice).build();
        }

        List<SafetyOrder> orders = new ArrayList<>(config.getMaxSafetyOrders());
        BigDecimal triggerPrice = step(entryPrice, config.getTriggerDrawdownPercent(), side);
        BigDecimal amount = config.getSafetyAmount();
        for (int index = 1; index <= config.getMaxSafetyOrders(); index++) {
            orders.add(SafetyOrder.pending(index, triggerPrice, amount));
            triggerPrice = step(triggerPrice, config.getPriceDeviationPercent(), side);
            amount = amount.multiply(config.getAmountMultiplier(), Decimals.MC);
        }

        log.info(
                "Safety ladder initialized: {} {} orders from entry {}, first trigger {}",
                orders.size(),
                side,
                entryPrice,
                orders.get(0).getTriggerPrice());
        return LadderState.empty(side).toBuilder()
                .entryPrice(entryPrice)
                .orders(List.copyOf(orders))
                .build();
    }

    // ========================
    // TRIGGERING
    // ========================

    public Transition<LadderState, List<SafetyOrder>> checkTriggers(LadderState state, BigDecimal currentPrice) {
        return checkTriggers(state, currentPrice, order -> true);
    }

    /**
     * Triggers every PENDING order whose trigger price {@code currentPrice} has reached,
     * provided the inter-batch cooldown has elapsed.
     *
     * <p>{@code admission} is consulted for each breached order in index order. The first
     * refusal ends the batch; that order and all deeper ones stay PENDING.
     *
     * @return next state and the orders newly moved to TRIGGERED (empty if none)
     */
    public Transition<LadderState, List<SafetyOrder>> checkTriggers(
            LadderState state, BigDecimal currentPrice, Predicate<SafetyOrder> admission) {
        requirePositive("currentPrice", currentPrice);
        if (!config.isEnabled() || state.getOrders().isEmpty()) {
            return Transition.of(state, List.of());
        }

        Instant now = clock.instant();
        if (state.getLastTriggerTime() != null
                && now.isBefore(state.getLastTriggerTime().plus(config.getSafetyInterval()))) {
            return Transition.of(state, List.of());
        }

        List<SafetyOrder> updated = new ArrayList<>(state.getOrders().size());
        List<SafetyOrder> triggered = new ArrayList<>();
        BigDecimal invested = state.getTotalSafetyInvested();
        boolean admitting = true;

        for (SafetyOrder order : state.getOrders()) {
            if (admitting && order.is(SafetyOrderStatus.PENDING) && isBreached(order, currentPrice, state.getSide())) {
                if (admission.test(order)) {
                    SafetyOrder fired = order.trigger(currentPrice, now);
                    triggered.add(fired);
                    invested = invested.add(fired.getAmount());
                    updated.add(fired);
                    continue;
                }
                admitting = false;
            }
            updated.add(order);
        }

        if (triggered.isEmpty()) {
            return Transition.of(state, List.of());
        }

        log.info(
                "Safety orders triggered at {}: {}",
                currentPrice,
                triggered.stream().map(o -> "#" + o.getIndex()).collect(Collectors.joining(", ")));
        LadderState next = state.toBuilder()
                .orders(List.copyOf(updated))
                .triggeredCount(state.getTriggeredCount() + triggered.size())
                .totalSafetyInvested(invested)
                .lastTriggerTime(now)
                .build();
        return Transition.of(next, List.copyOf(triggered));
    }

    /**
     * TRIGGERED -> FILLED with quantity recomputed at the fill price. Any other status
     * or an unknown index leaves the state untouched.
     */
    public LadderState markFilled(LadderState state, int index, BigDecimal filledPrice) {
        requirePositive("filledPrice", filledPrice);
        SafetyOrder order = state.findOrder(index).orElse(null);
        if (order == null || !order.is(SafetyOrderStatus.TRIGGERED)) {
            log.debug(
                    "Ignoring fill for safety order #{} (status {})",
                    index,
                    order == null ? "unknown" : order.getStatus());
            return state;
        }
        SafetyOrder filled = order.fill(filledPrice, clock.instant());
        return replace(state, filled);
    }

    /** PENDING -> CANCELLED for every remaining order. TRIGGERED and FILLED are kept. */
    public LadderState cancelAll(LadderState state) {
        List<SafetyOrder> updated = state.getOrders().stream()
                .map(order -> order.is(SafetyOrderStatus.PENDING) ? order.cancel() : order)
                .collect(Collectors.toUnmodifiableList());
        return state.toBuilder().orders(updated).build();
    }

    public LadderState reset(LadderState state) {
        return LadderState.empty(state.getSide());
    }

    // ========================
    // QUERIES
    // ========================

    public List<SafetyOrder> getFilledOrders(LadderState state) {
        return state.getOrders().stream()
                .filter(order -> order.is(SafetyOrderStatus.FILLED))
                .collect(Collectors.toUnmodifiableList());
    }

    public BigDecimal getTotalInvested(LadderState state) {
        return state.getTotalSafetyInvested();
    }

    /**
     * Quantity-weighted average over the base fill and every FILLED safety order.
     * With no filled safety orders the base fill is returned unchanged.
     */
    public AverageEntry calculateAverageEntry(LadderState state, BigDecimal baseEntryPrice, BigDecimal baseQuantity) {
        BigDecimal totalValue = baseEntryPrice.multiply(baseQuantity);
        BigDecimal totalQuantity = baseQuantity;

        List<SafetyOrder> filled = getFilledOrders(state);
        if (filled.isEmpty()) {
            return new AverageEntry(baseEntryPrice, baseQuantity, totalValue);
        }

        for (SafetyOrder order : filled) {
            totalValue = totalValue.add(order.getFilledPrice().multiply(order.getQuantity(), Decimals.MC));
            totalQuantity = totalQuantity.add(order.getQuantity());
        }
        if (totalQuantity.signum() == 0) {
            return new AverageEntry(baseEntryPrice, totalQuantity, totalValue);
        }
        return new AverageEntry(totalValue.divide(totalQuantity, Decimals.MC), totalQuantity, totalValue);
    }

    // ========================
    // INTERNALS
    // ========================

    private static boolean isBreached(SafetyOrder order, BigDecimal price, PositionSide side) {
        int cmp = price.compareTo(order.getTriggerPrice());
        return side == PositionSide.LONG ? cmp <= 0 : cmp >= 0;
    }

    private static BigDecimal step(BigDecimal price, BigDecimal percent, PositionSide side) {
        return side == PositionSide.LONG
                ? Decimals.reduceByPercent(price, percent)
                : Decimals.increaseByPercent(price, percent);
    }

    private static LadderState replace(LadderState state, SafetyOrder replacement) {
        List<SafetyOrder> updated = state.getOrders().stream()
                .map(order -> order.getIndex() == replacement.getIndex() ? replacement : order)
                .collect(Collectors.toUnmodifiableList());
        return state.toBuilder().orders(updated).build();
    }

    private static void requirePositive(String field, BigDecimal value) {
        if (value == null || value.signum() <= 0) {
            throw new InvalidInputException(field + " must be positive (was " + value + ")");
        }
    }
}
