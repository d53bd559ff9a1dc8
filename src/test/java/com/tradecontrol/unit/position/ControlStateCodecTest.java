package com.tradecontrol.unit.position;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tradecontrol.domain.enums.PositionSide;
import com.tradecontrol.exception.ErrorCode;
import com.tradecontrol.exception.StateCodecException;
import com.tradecontrol.grid.TrailingGridConfig;
import com.tradecontrol.ladder.SafetyOrderConfig;
import com.tradecontrol.ladder.SafetyOrderStatus;
import com.tradecontrol.position.ControlStateCodec;
import com.tradecontrol.position.PositionControlSession;
import com.tradecontrol.position.PositionControlSnapshot;
import com.tradecontrol.risk.RiskLimits;
import com.tradecontrol.support.MutableClock;
import com.tradecontrol.takeprofit.LevelTakeProfitConfig;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for ControlStateCodec JSON persistence of session snapshots.
 */
class ControlStateCodecTest {

    private static final Instant T0 = Instant.parse("2026-03-02T10:00:00Z");

    private PositionControlSnapshot activeSnapshot() {
        PositionControlSession session = new PositionControlSession(
                "bot-7",
                RiskLimits.defaults(),
                SafetyOrderConfig.builder().enabled(true).maxSafetyOrders(3).build(),
                LevelTakeProfitConfig.defaults(),
                TrailingGridConfig.builder().enabled(true).build(),
                new BigDecimal("10000"),
                new MutableClock(T0));
        session.openPosition("BTCUSDT", List.of(), PositionSide.LONG, new BigDecimal("100"), BigDecimal.ONE);
        session.tick(new BigDecimal("95"));
        session.onSafetyOrderFilled(1, new BigDecimal("95"));
        session.openGrid(new BigDecimal("10000"), List.of(new BigDecimal("9900"), new BigDecimal("10100")));
        session.tick(new BigDecimal("11000"));
        return session.snapshot();
    }

    @Test
    @DisplayName("Snapshot survives a JSON round trip")
    void roundTrip() {
        PositionControlSnapshot snapshot = activeSnapshot();

        String json = ControlStateCodec.toJson(snapshot);
        PositionControlSnapshot decoded = ControlStateCodec.fromJson(json);

        assertThat(decoded)
                .usingRecursiveComparison()
                .ignoringCollectionOrder()
                .withComparatorForType(BigDecimal::compareTo, BigDecimal.class)
                .isEqualTo(snapshot);
        assertThat(decoded.getLadder().findOrder(1).orElseThrow().getStatus()).isEqualTo(SafetyOrderStatus.FILLED);
        assertThat(decoded.getGrid().getTrailHistory()).hasSize(1);
    }

    @Test
    @DisplayName("Instants are written as ISO-8601 text")
    void isoInstants() {
        String json = ControlStateCodec.toJson(activeSnapshot());

        assertThat(json).contains("\"2026-03-02T10:00:00Z\"");
        assertThat(json).contains("\"tradingDay\":\"2026-03-02\"");
        assertThat(json).doesNotContain("openQuantity");
    }

    @Test
    @DisplayName("Malformed JSON raises a codec error")
    void malformed() {
        assertThatThrownBy(() -> ControlStateCodec.fromJson("{not json"))
                .isInstanceOf(StateCodecException.class)
                .satisfies(e -> assertThat(((StateCodecException) e).getErrorCode())
                        .isEqualTo(ErrorCode.STATE_CODEC_ERROR));
    }

    @Test
    @DisplayName("Blank input raises a codec error")
    void blank() {
        assertThatThrownBy(() -> ControlStateCodec.fromJson(" ")).isInstanceOf(StateCodecException.class);
    }
}
