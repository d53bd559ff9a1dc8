package com.tradecontrol.risk;

import java.math.BigDecimal;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Application-wide default risk limits, loaded from application.properties.
 *
 * <p>Properties prefix: {@code tradecontrol.risk.*}. Sessions start from these values
 * and may override any of them through {@code PositionControlOptions}.
 */
@Data
@ConfigurationProperties(prefix = "tradecontrol.risk")
public class RiskGatekeeperConfig {

    private BigDecimal initialBalance = new BigDecimal("10000");
    private int maxOpenPositions = 5;
    private int maxDcaOrders = 10;
    private BigDecimal maxOrderAmount = new BigDecimal("1000");
    private BigDecimal maxOrderPercent = new BigDecimal("20");
    private BigDecimal maxTotalInvested = new BigDecimal("5000");
    private BigDecimal maxTotalInvestedPercent = new BigDecimal("50");
    private BigDecimal maxDrawdownPercent = new BigDecimal("30");
    private BigDecimal maxDailyLoss = new BigDecimal("500");
    private BigDecimal maxDailyLossPercent = new BigDecimal("10");
    private boolean circuitBreakerEnabled = true;
    private int circuitBreakerLosses = 5;
    private Duration orderCooldown = Duration.ofMinutes(5);
    private Duration lossCooldown = Duration.ofMinutes(30);

    public RiskLimits toLimits() {
        return RiskLimits.builder()
                .maxOpenPositions(maxOpenPositions)
                .maxDcaOrders(maxDcaOrders)
                .maxOrderAmount(maxOrderAmount)
                .maxOrderPercent(maxOrderPercent)
                .maxTotalInvested(maxTotalInvested)
                .maxTotalInvestedPercent(maxTotalInvestedPercent)
                .maxDrawdownPercent(maxDrawdownPercent)
                .maxDailyLoss(maxDailyLoss)
                .maxDailyLossPercent(maxDailyLossPercent)
                .circuitBreakerEnabled(circuitBreakerEnabled)
                .circuitBreakerLosses(circuitBreakerLosses)
                .orderCooldown(orderCooldown)
                .lossCooldown(lossCooldown)
                .build()
                .validate();
    }
}
