package com.tradecontrol.config;

import com.tradecontrol.risk.RiskRejectReason;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registry-wide setup for the control metrics defined in
 * {@link com.tradecontrol.observability.ControlMetricsService}.
 *
 * <p>Every meter is tagged with the application name. Rejection counters are tagged
 * by {@link RiskRejectReason} only; a reason tag outside that enum is denied so a
 * caller cannot grow the {@code risk.rejections} series without bound. Applied as a
 * customizer so the filters are in place before the first meter registers.
 */
@Configuration
public class MetricsConfig {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> controlMetricsCustomizer(
            @Value("${spring.application.name:tradecontrol}") String applicationName) {
        return registry -> registry.config()
                .commonTags("application", applicationName)
                .meterFilter(MeterFilter.maximumAllowableTags(
                        "risk.rejections", "reason", RiskRejectReason.values().length, MeterFilter.deny()));
    }
}
