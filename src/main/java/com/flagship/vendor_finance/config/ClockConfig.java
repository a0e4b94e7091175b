package com.flagship.vendor_finance.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Current-time provider. Components take a {@link Clock} instead of calling
 * {@code Instant.now()} so escrow eligibility and entry timestamps are deterministic in tests.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
