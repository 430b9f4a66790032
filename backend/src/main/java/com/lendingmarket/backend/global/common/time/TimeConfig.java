package com.lendingmarket.backend.global.common.time;

import java.time.Clock;
import java.time.ZoneOffset;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Single UTC clock shared by the ledger services. Tests replace it with {@link Clock#fixed}.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock ledgerClock() {
        return Clock.system(ZoneOffset.UTC);
    }
}
