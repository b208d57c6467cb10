package com.apex.analytics.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Core beans shared by the analytics services.
 */
@Configuration
public class ApplicationConfig {

    @Bean
    public Clock analyticsClock() {
        return Clock.systemUTC();
    }
}
