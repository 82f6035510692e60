package com.verifymyprovider.api.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class TrustCoreConfiguration {

    /**
     * Time source for scoring, expiration and sybil windows. Tests replace it with a fixed clock.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
