package com.refinery.orchestrator.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(RefineryProperties.class)
public class RefineryConfig {

    /** Wall clock for every timestamp the stores write; swapped for a fixed clock in tests. */
    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
