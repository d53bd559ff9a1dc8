package com.tradecontrol.ladder;

import java.math.BigDecimal;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Default ladder shape, properties prefix {@code tradecontrol.safety-orders.*}.
 */
@Data
@ConfigurationProperties(prefix = "tradecontrol.safety-orders")
public class SafetyOrderProperties {

    private boolean enabled = false;
    private BigDecimal triggerDrawdownPercent = new BigDecimal("5");
    private BigDecimal safetyAmount = new BigDecimal("50");
    private BigDecimal amountMultiplier = new BigDecimal("1.5");
    private int maxSafetyOrders = 5;
    private Duration safetyInterval = Duration.ofMinutes(30);
    private BigDecimal priceDeviationPercent = new BigDecimal("3");

    public SafetyOrderConfig toConfig() {
        return SafetyOrderConfig.builder()
                .enabled(enabled)
                .triggerDrawdownPercent(triggerDrawdownPercent)
                .safetyAmount(safetyAmount)
                .amountMultiplier(amountMultiplier)
                .maxSafetyOrders(maxSafetyOrders)
                .safetyInterval(safetyInterval)
                .priceDeviationPercent(priceDeviationPercent)
                .build()
                .validate();
    }
}
