package com.tradecontrol.unit.ladder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tradecontrol.common.Transition;
import com.tradecontrol.domain.enums.PositionSide;
import com.tradecontrol.exception.InvalidConfigurationException;
import com.tradecontrol.exception.InvalidInputException;
import com.tradecontrol.ladder.AverageEntry;
import com.tradecontrol.ladder.LadderState;
import com.tradecontrol.ladder.SafetyOrder;
import com.tradecontrol.ladder.SafetyOrderConfig;
import com.tradecontrol.ladder.SafetyOrderLadder;
import com.tradecontrol.ladder.SafetyOrderStatus;
import com.tradecontrol.support.MutableClock;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for SafetyOrderLadder: deterministic construction, burst triggering,
 * cooldown between batches, fill handling and average entry.
 */
class SafetyOrderLadderTest {

    private static final Instant T0 = Instant.parse("2026-03-02T10:00:00Z");
    private static final BigDecimal ENTRY = new BigDecimal("100");

    private MutableClock clock;
    private SafetyOrderLadder ladder;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        ladder = new SafetyOrderLadder(threeOrderConfig().build(), clock);
    }

    private static SafetyOrderConfig.SafetyOrderConfigBuilder threeOrderConfig() {
        return SafetyOrderConfig.builder()
                .enabled(true)
                .triggerDrawdownPercent(new BigDecimal("5"))
                .priceDeviationPercent(new BigDecimal("3"))
                .safetyAmount(new BigDecimal("50"))
                .amountMultiplier(new BigDecimal("1.5"))
                .maxSafetyOrders(3);
    }

    private static BigDecimal price(String value) {
        return new BigDecimal(value);
    }

    // ==============================
    // CONSTRUCTION
    // ==============================

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("Trigger prices step down and amounts scale geometrically")
        void deterministicLadder() {
            LadderState state = ladder.initialize(ENTRY);

            List<SafetyOrder> orders = state.getOrders();
            assertThat(orders).hasSize(3);
            assertThat(orders.get(0).getTriggerPrice()).isEqualByComparingTo("95");
            assertThat(orders.get(1).getTriggerPrice()).isEqualByComparingTo("92.15");
            assertThat(orders.get(2).getTriggerPrice()).isEqualByComparingTo("89.3855");
            assertThat(orders.get(0).getAmount()).isEqualByComparingTo("50");
            assertThat(orders.get(1).getAmount()).isEqualByComparingTo("75");
            assertThat(orders.get(2).getAmount()).isEqualByComparingTo("112.5");
            assertThat(orders).allMatch(order -> order.is(SafetyOrderStatus.PENDING));
            assertThat(orders).extracting(SafetyOrder::getIndex).containsExactly(1, 2, 3);
        }

        @Test
        @DisplayName("Re-initializing discards the previous ladder")
        void reinitialize_discardsPrevious() {
            LadderState first = ladder.initialize(ENTRY);
            first = ladder.checkTriggers(first, price("95")).getState();

            LadderState second = ladder.initialize(price("200"));

            assertThat(second.getTriggeredCount()).isZero();
            assertThat(second.getOrders().get(0).getTriggerPrice()).isEqualByComparingTo("190");
            assertThat(second.getOrders()).allMatch(order -> order.is(SafetyOrderStatus.PENDING));
        }

        @Test
        @DisplayName("Short ladders step trigger prices up")
        void shortLadder() {
            LadderState state = ladder.initialize(ENTRY, PositionSide.SHORT);

            assertThat(state.getOrders().get(0).getTriggerPrice()).isEqualByComparingTo("105");
            assertThat(state.getOrders().get(1).getTriggerPrice()).isEqualByComparingTo("108.15");
        }

        @Test
        @DisplayName("Disabled ladder has no orders and never triggers")
        void disabled_noOrders() {
            SafetyOrderLadder disabled = new SafetyOrderLadder(threeOrderConfig().enabled(false).build(), clock);

            LadderState state = disabled.initialize(ENTRY);

            assertThat(state.getOrders()).isEmpty();
            assertThat(disabled.checkTriggers(state, price("50")).getResult()).isEmpty();
        }

        @Test
        @DisplayName("Non-positive entry price is an input error")
        void invalidEntry() {
            assertThatThrownBy(() -> ladder.initialize(BigDecimal.ZERO)).isInstanceOf(InvalidInputException.class);
        }
    }

    // ==============================
    // TRIGGERING
    // ==============================

    @Nested
    @DisplayName("Triggering")
    class Triggering {

        @Test
        @DisplayName("Nothing triggers above the first trigger price")
        void aboveTrigger_nothing() {
            LadderState state = ladder.initialize(ENTRY);

            Transition<LadderState, List<SafetyOrder>> result = ladder.checkTriggers(state, price("95.01"));

            assertThat(result.getResult()).isEmpty();
            assertThat(result.getState()).isSameAs(state);
        }

        @Test
        @DisplayName("Reaching the trigger price triggers with provisional quantity")
        void atTrigger_triggers() {
            LadderState state = ladder.initialize(ENTRY);

            Transition<LadderState, List<SafetyOrder>> result = ladder.checkTriggers(state, price("95"));

            assertThat(result.getResult()).hasSize(1);
            SafetyOrder triggered = result.getResult().get(0);
            assertThat(triggered.getIndex()).isEqualTo(1);
            assertThat(triggered.getStatus()).isEqualTo(SafetyOrderStatus.TRIGGERED);
            assertThat(triggered.getTriggeredAt()).isEqualTo(T0);
            assertThat(triggered.getQuantity())
                    .isEqualByComparingTo(price("50").divide(price("95"), MathContext.DECIMAL64));
            assertThat(result.getState().getTriggeredCount()).isEqualTo(1);
            assertThat(result.getState().getTotalSafetyInvested()).isEqualByComparingTo("50");
            assertThat(result.getState().getLastTriggerTime()).isEqualTo(T0);
        }

        @Test
        @DisplayName("A gap through several trigger prices fires them all in one call")
        void burst_triggersAllBreached() {
            LadderState state = ladder.initialize(ENTRY);

            Transition<LadderState, List<SafetyOrder>> result = ladder.checkTriggers(state, price("89"));

            assertThat(result.getResult()).extracting(SafetyOrder::getIndex).containsExactly(1, 2, 3);
            assertThat(result.getState().getTriggeredCount()).isEqualTo(3);
            assertThat(result.getState().getTotalSafetyInvested()).isEqualByComparingTo("237.5");
            assertThat(result.getState().getLastTriggerTime()).isEqualTo(T0);
        }

        @Test
        @DisplayName("The interval gates the next batch")
        void interval_gatesNextBatch() {
            LadderState state = ladder.checkTriggers(ladder.initialize(ENTRY), price("95")).getState();

            clock.advance(Duration.ofMinutes(10));
            assertThat(ladder.checkTriggers(state, price("92")).getResult()).isEmpty();

            clock.advance(Duration.ofMinutes(20));
            Transition<LadderState, List<SafetyOrder>> later = ladder.checkTriggers(state, price("92"));
            assertThat(later.getResult()).extracting(SafetyOrder::getIndex).containsExactly(2);
            assertThat(later.getState().getLastTriggerTime()).isEqualTo(T0.plus(Duration.ofMinutes(30)));
        }

        @Test
        @DisplayName("First admission refusal ends the batch and leaves deeper orders pending")
        void admissionRefusal_stopsBatch() {
            LadderState state = ladder.initialize(ENTRY);

            Transition<LadderState, List<SafetyOrder>> result =
                    ladder.checkTriggers(state, price("89"), order -> order.getIndex() < 2);

            assertThat(result.getResult()).extracting(SafetyOrder::getIndex).containsExactly(1);
            assertThat(result.getState().findOrder(2).orElseThrow().getStatus()).isEqualTo(SafetyOrderStatus.PENDING);
            assertThat(result.getState().findOrder(3).orElseThrow().getStatus()).isEqualTo(SafetyOrderStatus.PENDING);
        }

        @Test
        @DisplayName("Refusing the first order leaves the ladder unchanged")
        void admissionRefusal_first() {
            LadderState state = ladder.initialize(ENTRY);

            Transition<LadderState, List<SafetyOrder>> result = ladder.checkTriggers(state, price("89"), order -> false);

            assertThat(result.getResult()).isEmpty();
            assertThat(result.getState().getLastTriggerTime()).isNull();
        }

        @Test
        @DisplayName("Short ladders trigger when price rises to the trigger")
        void shortLadder_triggersOnRise() {
            LadderState state = ladder.initialize(ENTRY, PositionSide.SHORT);

            assertThat(ladder.checkTriggers(state, price("104.99")).getResult()).isEmpty();
            assertThat(ladder.checkTriggers(state, price("105")).getResult()).hasSize(1);
        }
    }

    // ==============================
    // FILLS AND CANCELLATION
    // ==============================

    @Nested
    @DisplayName("Fills and Cancellation")
    class FillsAndCancellation {

        @Test
        @DisplayName("Triggered order fills with quantity at the fill price")
        void markFilled_fromTriggered() {
            LadderState state = ladder.checkTriggers(ladder.initialize(ENTRY), price("95")).getState();

            LadderState filled = ladder.markFilled(state, 1, price("94"));

            SafetyOrder order = filled.findOrder(1).orElseThrow();
            assertThat(order.getStatus()).isEqualTo(SafetyOrderStatus.FILLED);
            assertThat(order.getFilledPrice()).isEqualByComparingTo("94");
            assertThat(order.getFilledAt()).isEqualTo(T0);
            assertThat(order.getQuantity()).isEqualByComparingTo(price("50").divide(price("94"), MathContext.DECIMAL64));
            assertThat(ladder.getFilledOrders(filled)).hasSize(1);
        }

        @Test
        @DisplayName("Fill on a pending, filled or unknown order is a no-op")
        void markFilled_noOp() {
            LadderState state = ladder.checkTriggers(ladder.initialize(ENTRY), price("95")).getState();
            LadderState filled = ladder.markFilled(state, 1, price("95"));

            assertThat(ladder.markFilled(filled, 1, price("90"))).isSameAs(filled);
            assertThat(ladder.markFilled(filled, 2, price("90"))).isSameAs(filled);
            assertThat(ladder.markFilled(filled, 9, price("90"))).isSameAs(filled);
        }

        @Test
        @DisplayName("cancelAll cancels only pending orders")
        void cancelAll_onlyPending() {
            LadderState state = ladder.checkTriggers(ladder.initialize(ENTRY), price("95")).getState();

            LadderState cancelled = ladder.cancelAll(state);

            assertThat(cancelled.findOrder(1).orElseThrow().getStatus()).isEqualTo(SafetyOrderStatus.TRIGGERED);
            assertThat(cancelled.count(SafetyOrderStatus.CANCELLED)).isEqualTo(2);
            assertThat(ladder.checkTriggers(cancelled, price("80")).getResult()).isEmpty();
        }

        @Test
        @DisplayName("reset leaves an empty ladder")
        void reset_empty() {
            LadderState state = ladder.checkTriggers(ladder.initialize(ENTRY), price("95")).getState();

            LadderState reset = ladder.reset(state);

            assertThat(reset.getOrders()).isEmpty();
            assertThat(ladder.getTotalInvested(reset)).isEqualByComparingTo("0");
        }
    }

    // ==============================
    // AVERAGE ENTRY
    // ==============================

    @Nested
    @DisplayName("Average Entry")
    class AverageEntryCalculation {

        @Test
        @DisplayName("1 @ 100 plus 1 @ 90 averages to 95")
        void oneSafetyOrderFilled() {
            SafetyOrderLadder tenPercent = new SafetyOrderLadder(
                    threeOrderConfig()
                            .triggerDrawdownPercent(new BigDecimal("10"))
                            .safetyAmount(new BigDecimal("90"))
                            .build(),
                    clock);
            LadderState state = tenPercent.checkTriggers(tenPercent.initialize(ENTRY), price("90")).getState();
            state = tenPercent.markFilled(state, 1, price("90"));

            AverageEntry average = tenPercent.calculateAverageEntry(state, ENTRY, BigDecimal.ONE);

            assertThat(average.getAvgEntryPrice()).isEqualByComparingTo("95");
            assertThat(average.getTotalQuantity()).isEqualByComparingTo("2");
            assertThat(average.getTotalInvested()).isEqualByComparingTo("190");
        }

        @Test
        @DisplayName("Triggered but unfilled orders are not averaged in")
        void unfilledIgnored() {
            LadderState state = ladder.checkTriggers(ladder.initialize(ENTRY), price("95")).getState();

            AverageEntry average = ladder.calculateAverageEntry(state, ENTRY, price("2"));

            assertThat(average.getAvgEntryPrice()).isEqualByComparingTo("100");
            assertThat(average.getTotalQuantity()).isEqualByComparingTo("2");
            assertThat(average.getTotalInvested()).isEqualByComparingTo("200");
        }
    }

    // ==============================
    // CONFIGURATION
    // ==============================

    @Nested
    @DisplayName("Configuration")
    class Configuration {

        @Test
        @DisplayName("Non-positive multiplier fails fast")
        void zeroMultiplier() {
            SafetyOrderConfig config = threeOrderConfig().amountMultiplier(BigDecimal.ZERO).build();

            assertThatThrownBy(() -> new SafetyOrderLadder(config, clock))
                    .isInstanceOf(InvalidConfigurationException.class)
                    .hasMessageContaining("amountMultiplier");
        }

        @Test
        @DisplayName("Multiplier below 1 would shrink the ladder and fails fast")
        void shrinkingMultiplier() {
            SafetyOrderConfig config = threeOrderConfig().amountMultiplier(new BigDecimal("0.5")).build();

            assertThatThrownBy(config::validate)
                    .isInstanceOf(InvalidConfigurationException.class)
                    .hasMessageContaining("amountMultiplier");
            assertThat(threeOrderConfig().amountMultiplier(BigDecimal.ONE).build().validate()).isNotNull();
        }

        @Test
        @DisplayName("Zero price deviation would stack triggers on one price and fails fast")
        void zeroPriceDeviation() {
            SafetyOrderConfig config = threeOrderConfig().priceDeviationPercent(BigDecimal.ZERO).build();

            assertThatThrownBy(() -> new SafetyOrderLadder(config, clock))
                    .isInstanceOf(InvalidConfigurationException.class)
                    .hasMessageContaining("priceDeviationPercent")
                    .satisfies(e -> assertThat(((InvalidConfigurationException) e).getDetail("field"))
                            .contains("priceDeviationPercent"));
        }

        @Test
        @DisplayName("Enabled ladder with zero orders fails fast")
        void enabledWithoutOrders() {
            SafetyOrderConfig config = threeOrderConfig().maxSafetyOrders(0).build();

            assertThatThrownBy(config::validate).isInstanceOf(InvalidConfigurationException.class);
        }

        @Test
        @DisplayName("Status transitions are monotone")
        void statusTransitions() {
            assertThat(SafetyOrderStatus.PENDING.canTransitionTo(SafetyOrderStatus.TRIGGERED)).isTrue();
            assertThat(SafetyOrderStatus.PENDING.canTransitionTo(SafetyOrderStatus.FILLED)).isFalse();
            assertThat(SafetyOrderStatus.TRIGGERED.canTransitionTo(SafetyOrderStatus.CANCELLED)).isFalse();
            assertThat(SafetyOrderStatus.FILLED.isTerminal()).isTrue();
            assertThat(SafetyOrderStatus.CANCELLED.isTerminal()).isTrue();
        }
    }
}
