package com.rebill.api.config;

import lombok.NonNull;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring Beans shared by all packages.
 */
@Configuration
class GlobalBeans {

    /**
     * All services read the current time from this clock so that tests can substitute a fixed one.
     */
    @NonNull
    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
