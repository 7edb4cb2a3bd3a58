package com.eyelevel.pdftoolkit.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Provides the clock used to age download artifacts, so that expiry can be driven from tests.
 */
@Configuration
public class StorageConfig {

    @Bean
    public Clock artifactClock() {
        return Clock.systemUTC();
    }
}
