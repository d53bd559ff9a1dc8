package com.tradecontrol.observability;

import com.tradecontrol.position.TickResult;
import com.tradecontrol.risk.RiskDecision;
import com.tradecontrol.risk.RiskRejectReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for the position control core.
 * <ul>
 *   <li><b>risk.rejections</b> (counter, tag {@code reason}): every rejected risk decision</li>
 *   <li><b>safety.orders.triggered</b> (counter): safety orders handed out for placement</li>
 *   <li><b>take.profit.fired</b> (counter): level take-profits that fired</li>
 *   <li><b>grid.trails</b> (counter): grid translations</li>
 *   <li><b>emergency.closes</b> (counter): drawdown-forced closes</li>
 *   <li><b>control.tick.latency</b> (timer): time spent evaluating one tick</li>
 * </ul>
 */
@Service
public class ControlMetricsService {

    private final Map<RiskRejectReason, Counter> rejectionCounters = new EnumMap<>(RiskRejectReason.class);
    private final Counter safetyOrdersTriggeredCounter;
    private final Counter takeProfitFiredCounter;
    private final Counter gridTrailCounter;
    private final Counter emergencyCloseCounter;
    private final Timer tickLatencyTimer;

    public ControlMetricsService(MeterRegistry meterRegistry) {
        for (RiskRejectReason reason : RiskRejectReason.values()) {
            rejectionCounters.put(
                    reason,
                    Counter.builder("risk.rejections")
                            .description("Risk gate rejections by reason")
                            .tag("reason", reason.name())
                            .register(meterRegistry));
        }

        this.safetyOrdersTriggeredCounter = Counter.builder("safety.orders.triggered")
                .description("Safety orders triggered and approved for placement")
                .register(meterRegistry);

        this.takeProfitFiredCounter = Counter.builder("take.profit.fired")
                .description("Per-level take-profits fired")
                .register(meterRegistry);

        this.gridTrailCounter = Counter.builder("grid.trails")
                .description("Grid translations performed")
                .register(meterRegistry);

        this.emergencyCloseCounter = Counter.builder("emergency.closes")
                .description("Positions force-closed on max drawdown")
                .register(meterRegistry);

        this.tickLatencyTimer = Timer.builder("control.tick.latency")
                .description("Time spent evaluating one price tick")
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofMillis(100))
                .register(meterRegistry);
    }

    public void recordDecision(RiskDecision decision) {
        if (decision != null && decision.isRejected() && decision.getReason() != null) {
            rejectionCounters.get(decision.getReason()).increment();
        }
    }

    public void recordTick(TickResult result, long elapsedNanos) {
        tickLatencyTimer.record(elapsedNanos, TimeUnit.NANOSECONDS);
        if (result.isEmergencyClose()) {
            emergencyCloseCounter.increment();
            recordDecision(result.getDrawdownDecision());
        }
        if (!result.getSafetyOrdersToPlace().isEmpty()) {
            safetyOrdersTriggeredCounter.increment(result.getSafetyOrdersToPlace().size());
        }
        recordDecision(result.getSafetyOrderBlockedBy());
        if (result.getTakeProfit() != null) {
            takeProfitFiredCounter.increment();
        }
        if (result.getGridTrail() != null) {
            gridTrailCounter.increment();
        }
    }
}
