package com.tradecontrol.grid;

import java.math.BigDecimal;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Default trailing-grid settings, properties prefix {@code tradecontrol.trailing-grid.*}.
 */
@Data
@ConfigurationProperties(prefix = "tradecontrol.trailing-grid")
public class TrailingGridProperties {

    private boolean enabled = false;
    private BigDecimal trailPercent = new BigDecimal("5");
    private BigDecimal minTrailDistance = new BigDecimal("100");
    private int maxTrails = 10;

    public TrailingGridConfig toConfig() {
        return TrailingGridConfig.builder()
                .enabled(enabled)
                .trailPercent(trailPercent)
                .minTrailDistance(minTrailDistance)
                .maxTrails(maxTrails)
                .build()
                .validate();
    }
}
