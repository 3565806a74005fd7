package com.di.epistream.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfiguration {

    /** "Today" for date checks; replaced with a fixed clock in tests. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
