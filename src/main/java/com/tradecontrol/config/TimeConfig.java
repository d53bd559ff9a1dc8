package com.tradecontrol.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the wall clock used for cooldowns, circuit-breaker windows and daily resets.
 *
 * <p>Every engine reads time through this bean, never through {@code Instant.now()},
 * so tests can substitute a fixed or manually advanced clock.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
