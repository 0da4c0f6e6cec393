package com.adlanda.dailytoon.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class PipelineConfig {

    /**
     * Source of episode creation timestamps.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
