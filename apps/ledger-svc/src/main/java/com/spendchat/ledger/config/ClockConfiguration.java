package com.spendchat.ledger.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClockConfiguration {

    /**
     * Clock in the ledger's zone; "today" and "yesterday" in messages resolve against it.
     */
    @Bean
    Clock clock(SpendchatProperties properties) {
        return Clock.system(ZoneId.of(properties.format().zone()));
    }
}
