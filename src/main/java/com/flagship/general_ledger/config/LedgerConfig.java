package com.flagship.general_ledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class LedgerConfig {

    /**
     * Source of every timestamp the ledger writes. Tests replace it with a
     * fixed clock.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
